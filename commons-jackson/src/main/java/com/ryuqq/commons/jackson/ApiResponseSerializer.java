package com.ryuqq.commons.jackson;

import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.databind.SerializationConfig;
import com.fasterxml.jackson.databind.SerializerProvider;
import com.fasterxml.jackson.databind.ser.std.StdSerializer;
import com.ryuqq.commons.core.api.ApiResponse;

import java.io.IOException;

/**
 * ApiResponse 직렬화.
 *
 * <p>{@code {"statusCode": 200}} 또는 {@code {"statusCode": 404, "errorMessage": "..."}}.
 * errorMessage는 값이 있을 때만 씁니다.</p>
 */
final class ApiResponseSerializer extends StdSerializer<ApiResponse> {

    static final String STATUS_CODE = "statusCode";
    static final String ERROR_MESSAGE = "errorMessage";
    static final String PAYLOAD = "payload";

    ApiResponseSerializer() {
        super(ApiResponse.class);
    }

    @Override
    public void serialize(ApiResponse response, JsonGenerator gen, SerializerProvider provider) throws IOException {
        SerializationConfig config = provider.getConfig();
        gen.writeStartObject(response);
        gen.writeNumberField(PropertyNames.translate(config, STATUS_CODE), response.statusCode());
        if (response instanceof ApiResponse.Error error && error.errorMessage() != null) {
            gen.writeStringField(PropertyNames.translate(config, ERROR_MESSAGE), error.errorMessage());
        }
        gen.writeEndObject();
    }
}
