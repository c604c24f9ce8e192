package com.ryuqq.commons.jackson;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.MapperFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.exc.UnrecognizedPropertyException;
import com.fasterxml.jackson.databind.json.JsonMapper;
import com.ryuqq.commons.core.api.ApiResponse;
import com.ryuqq.commons.core.geo.Address;
import com.ryuqq.commons.core.geo.GeoCoordinate;
import com.ryuqq.commons.core.measurement.Distance;
import com.ryuqq.commons.core.measurement.Temperature;
import com.ryuqq.commons.core.measurement.TemperatureRange;
import com.ryuqq.commons.core.measurement.Weight;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * CommonsModule 등록 및 ObjectMapper 설정 연동 테스트.
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
class CommonsModuleTest {

    private final ObjectMapper mapper = JsonMapper.builder()
        .addModule(new CommonsModule())
        .build();

    @Test
    void findAndRegisterModules_DiscoversModuleThroughServiceLoader() throws Exception {
        // given
        ObjectMapper discovered = new ObjectMapper().findAndRegisterModules();

        // when
        JsonNode node = discovered.readTree(discovered.writeValueAsString(Distance.ofKilometers(2)));

        // then
        assertThat(node.get("value").asDouble()).isEqualTo(2000.0);
        assertThat(node.get("unit").asText()).isEqualTo("m");
    }

    @Test
    void serialize_Quantity_WritesValueThenUnit() throws Exception {
        // when
        JsonNode node = mapper.readTree(mapper.writeValueAsString(Weight.ofKilograms(1.25)));

        // then
        List<String> names = new ArrayList<>();
        node.fieldNames().forEachRemaining(names::add);
        assertThat(names).containsExactly("value", "unit");
        assertThat(node.get("value").asDouble()).isEqualTo(1250.0);
        assertThat(node.get("unit").asText()).isEqualTo("g");
    }

    @Test
    void namingStrategy_UpperCamelCase_AppliesToQuantityAndResponse() throws Exception {
        // given
        ObjectMapper upperCamel = JsonMapper.builder()
            .addModule(new CommonsModule())
            .propertyNamingStrategy(PropertyNamingStrategies.UPPER_CAMEL_CASE)
            .build();

        // when
        String response = upperCamel.writeValueAsString(ApiResponse.error(404, "gone"));
        Distance distance = upperCamel.readValue("{\"Value\":3,\"Unit\":\"km\"}", Distance.class);

        // then
        assertThat(response).isEqualTo("{\"StatusCode\":404,\"ErrorMessage\":\"gone\"}");
        assertThat(distance).isEqualTo(Distance.ofMeters(3000));
    }

    @Test
    void namingStrategy_SnakeCase_TranslatesStatusCode() throws Exception {
        // given
        ObjectMapper snake = JsonMapper.builder()
            .addModule(new CommonsModule())
            .propertyNamingStrategy(PropertyNamingStrategies.SNAKE_CASE)
            .build();

        // when
        ApiResponse response = snake.readValue("{\"status_code\":401,\"error_message\":\"login\"}", ApiResponse.class);

        // then
        assertThat(snake.writeValueAsString(ApiResponse.success(201))).isEqualTo("{\"status_code\":201}");
        assertThat(response).isEqualTo(ApiResponse.error(401, "login"));
    }

    @Test
    void caseInsensitive_Enabled_AcceptsAnyCase() throws Exception {
        // given
        ObjectMapper lenient = JsonMapper.builder()
            .addModule(new CommonsModule())
            .enable(MapperFeature.ACCEPT_CASE_INSENSITIVE_PROPERTIES)
            .build();

        // when
        Distance distance = lenient.readValue("{\"VALUE\":5,\"Unit\":\"M\"}", Distance.class);

        // then
        assertThat(distance).isEqualTo(Distance.ofMeters(5));
    }

    @Test
    void caseInsensitive_Disabled_RejectsDifferentCase() {
        assertThatThrownBy(() -> mapper.readValue("{\"VALUE\":5}", Distance.class))
            .isInstanceOf(UnrecognizedPropertyException.class)
            .hasMessageContaining("VALUE");
    }

    @Test
    void temperatureRange_RoundTripsThroughRecordMapping() throws Exception {
        // given
        TemperatureRange chilled = new TemperatureRange(Temperature.ofKelvin(275), Temperature.ofKelvin(281));

        // when
        String json = mapper.writeValueAsString(chilled);
        TemperatureRange restored = mapper.readValue(json, TemperatureRange.class);

        // then
        JsonNode node = mapper.readTree(json);
        assertThat(node.has("singleTemperature")).isFalse();
        assertThat(node.get("min").get("unit").asText()).isEqualTo("k");
        assertThat(restored).isEqualTo(chilled);
    }

    @Test
    void geoCoordinateAndAddress_OmitDerivedFlags() throws Exception {
        // when
        JsonNode coordinate = mapper.readTree(mapper.writeValueAsString(GeoCoordinate.of(52.52, 13.405)));
        JsonNode address = mapper.readTree(mapper.writeValueAsString(Address.EMPTY.withCity("Berlin")));

        // then
        assertThat(coordinate.has("unknown")).isFalse();
        assertThat(coordinate.get("latitude").asDouble()).isEqualTo(52.52);
        assertThat(address.has("empty")).isFalse();
        assertThat(address.get("city").asText()).isEqualTo("Berlin");
    }
}
