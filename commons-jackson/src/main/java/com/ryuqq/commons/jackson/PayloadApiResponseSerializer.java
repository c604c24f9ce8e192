package com.ryuqq.commons.jackson;

import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.databind.SerializationConfig;
import com.fasterxml.jackson.databind.SerializerProvider;
import com.fasterxml.jackson.databind.ser.std.StdSerializer;
import com.ryuqq.commons.core.api.PayloadApiResponse;

import java.io.IOException;

/**
 * PayloadApiResponse 직렬화.
 *
 * <p>성공은 {@code {"statusCode": 200, "payload": ...}}, 오류는 ApiResponse와 같은 형태입니다.
 * payload는 ObjectMapper에 등록된 해당 타입의 직렬화기로 씁니다.</p>
 */
final class PayloadApiResponseSerializer extends StdSerializer<PayloadApiResponse<?>> {

    PayloadApiResponseSerializer() {
        super(PayloadApiResponse.class, false);
    }

    @Override
    public void serialize(PayloadApiResponse<?> response, JsonGenerator gen, SerializerProvider provider)
        throws IOException {
        SerializationConfig config = provider.getConfig();
        gen.writeStartObject(response);
        gen.writeNumberField(PropertyNames.translate(config, ApiResponseSerializer.STATUS_CODE), response.statusCode());
        if (response instanceof PayloadApiResponse.Success<?> success) {
            provider.defaultSerializeField(
                PropertyNames.translate(config, ApiResponseSerializer.PAYLOAD), success.payload(), gen);
        } else {
            PayloadApiResponse.Error<?> error = (PayloadApiResponse.Error<?>) response;
            if (error.errorMessage() != null) {
                gen.writeStringField(
                    PropertyNames.translate(config, ApiResponseSerializer.ERROR_MESSAGE), error.errorMessage());
            }
        }
        gen.writeEndObject();
    }
}
