package com.ryuqq.commons.testkit.contract;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.exc.InvalidFormatException;
import com.fasterxml.jackson.databind.exc.MismatchedInputException;
import com.fasterxml.jackson.databind.exc.UnrecognizedPropertyException;
import com.ryuqq.commons.core.api.InvalidStatusCodeException;
import com.ryuqq.commons.core.api.PayloadApiResponse;
import com.ryuqq.commons.core.measurement.Distance;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * PayloadApiResponse JSON Contract Test.
 *
 * <p>The payload type comes from the requested generic type, so nested quantity codecs apply.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
class PayloadApiResponseJsonContractTest extends AbstractJsonContractTest {

    private static final TypeReference<PayloadApiResponse<Distance>> DISTANCE_RESPONSE = new TypeReference<>() {
    };

    @Test
    void serialize_Success_WritesStatusCodeAndPayload() throws Exception {
        // When
        JsonNode node = tree(PayloadApiResponse.success(Distance.ofKilometers(2), 201));

        // Then
        assertThat(node.get("statusCode").asInt()).isEqualTo(201);
        assertThat(node.get("payload").get("value").asDouble()).isEqualTo(2000.0);
        assertThat(node.get("payload").get("unit").asText()).isEqualTo("m");
        assertThat(node.has("errorMessage")).isFalse();
    }

    @Test
    void serialize_Error_NeverWritesPayload() throws Exception {
        assertThat(toJson(PayloadApiResponse.error(404, "missing")))
            .isEqualTo("{\"statusCode\":404,\"errorMessage\":\"missing\"}");
    }

    @Test
    void deserialize_Success_ReadsTypedPayload() throws Exception {
        // When
        PayloadApiResponse<Distance> response = fromJson(
            json("{'payload': {'value': 1.5, 'unit': 'km'}, 'statusCode': 200}"), DISTANCE_RESPONSE);

        // Then
        assertThat(response.unwrap()).isEqualTo(Distance.ofMeters(1500));
        assertThat(response.statusCode()).isEqualTo(200);
    }

    @Test
    void roundTrip_PreservesSuccessAndError() throws Exception {
        // Given
        PayloadApiResponse<Distance> success = PayloadApiResponse.success(Distance.ofMeters(42), 202);
        PayloadApiResponse<Distance> error = PayloadApiResponse.error(409, "conflict");

        // Then
        assertThat(fromJson(toJson(success), DISTANCE_RESPONSE)).isEqualTo(success);
        assertThat(fromJson(toJson(error), DISTANCE_RESPONSE)).isEqualTo(error);
    }

    @Test
    void deserialize_ElementsOfList_UseElementPayloadType() throws Exception {
        // When
        List<PayloadApiResponse<Distance>> responses = fromJson(
            json("[{'statusCode': 200, 'payload': {'value': 3}}, {'statusCode': 500}]"),
            new TypeReference<List<PayloadApiResponse<Distance>>>() {
            });

        // Then
        assertThat(responses).containsExactly(
            PayloadApiResponse.success(Distance.ofMeters(3)),
            PayloadApiResponse.error(500, (String) null)
        );
    }

    @Test
    void deserialize_GenericListPayload() throws Exception {
        // When
        PayloadApiResponse<List<String>> response = fromJson(
            json("{'statusCode': 200, 'payload': ['a', 'b']}"),
            new TypeReference<PayloadApiResponse<List<String>>>() {
            });

        // Then
        assertThat(response.unwrap()).containsExactly("a", "b");
    }

    @Test
    void deserialize_SuccessWithoutPayload_Fails() {
        assertThatThrownBy(() -> fromJson(json("{'statusCode': 200}"), DISTANCE_RESPONSE))
            .isInstanceOf(MismatchedInputException.class)
            .hasMessageContaining("Missing payload");
        assertThatThrownBy(() -> fromJson(json("{'statusCode': 200, 'payload': null}"), DISTANCE_RESPONSE))
            .isInstanceOf(MismatchedInputException.class);
    }

    @Test
    void deserialize_ErrorWithoutPayload_Succeeds() throws Exception {
        // When
        PayloadApiResponse<Distance> response = fromJson(json("{'statusCode': 404}"), DISTANCE_RESPONSE);

        // Then
        assertThat(response.isError()).isTrue();
        assertThat(response.statusCode()).isEqualTo(404);
    }

    @Test
    void deserialize_InvalidStatusCode_FailsWithStatusCause() {
        assertThatThrownBy(() -> fromJson(json("{'statusCode': 42, 'payload': {}}"), DISTANCE_RESPONSE))
            .isInstanceOf(InvalidFormatException.class)
            .hasCauseInstanceOf(InvalidStatusCodeException.class);
    }

    @Test
    void deserialize_UnknownProperty_Fails() {
        assertThatThrownBy(() -> fromJson(json("{'statusCode': 200, 'data': {}}"), DISTANCE_RESPONSE))
            .isInstanceOf(UnrecognizedPropertyException.class);
    }

    @Test
    void deserialize_InvalidPayloadUnit_Fails() {
        assertThatThrownBy(() -> fromJson(
            json("{'statusCode': 200, 'payload': {'value': 1, 'unit': 'lightyear'}}"), DISTANCE_RESPONSE))
            .isInstanceOf(InvalidFormatException.class);
    }
}
