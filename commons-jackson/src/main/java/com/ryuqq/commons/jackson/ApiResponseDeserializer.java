package com.ryuqq.commons.jackson;

import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.core.JsonToken;
import com.fasterxml.jackson.databind.DeserializationContext;
import com.fasterxml.jackson.databind.deser.std.StdDeserializer;
import com.fasterxml.jackson.databind.exc.UnrecognizedPropertyException;
import com.ryuqq.commons.core.api.ApiResponse;
import com.ryuqq.commons.core.api.HttpStatusCodes;
import com.ryuqq.commons.core.api.InvalidStatusCodeException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.util.List;

/**
 * ApiResponse 역직렬화.
 *
 * <p>statusCode가 2xx면 Success, 아니면 Error를 만듭니다. statusCode가 없으면 0으로 간주되어
 * 상태 코드 오류가 됩니다.</p>
 */
final class ApiResponseDeserializer extends StdDeserializer<ApiResponse> {

    private static final Logger log = LoggerFactory.getLogger(ApiResponseDeserializer.class);

    ApiResponseDeserializer() {
        super(ApiResponse.class);
    }

    @Override
    public ApiResponse deserialize(JsonParser p, DeserializationContext ctxt) throws IOException {
        if (!p.isExpectedStartObjectToken()) {
            return ctxt.reportInputMismatch(this, "Expected START_OBJECT for ApiResponse but was %s", p.currentToken());
        }

        int statusCode = 0;
        String errorMessage = null;

        JsonToken token;
        while ((token = p.nextToken()) != JsonToken.END_OBJECT) {
            if (token == null) {
                return ctxt.reportInputMismatch(this, "Unexpected end of JSON while reading ApiResponse");
            }
            String name = p.currentName();
            p.nextToken();

            if (PropertyNames.matches(ctxt, name, ApiResponseSerializer.STATUS_CODE)) {
                statusCode = StatusCodes.read(p, ctxt, this);
            } else if (PropertyNames.matches(ctxt, name, ApiResponseSerializer.ERROR_MESSAGE)) {
                errorMessage = StatusCodes.readErrorMessage(p, ctxt, this);
            } else {
                log.debug("Rejected unknown property '{}' for ApiResponse", name);
                throw UnrecognizedPropertyException.from(p, ApiResponse.class, name,
                    List.<Object>of(ApiResponseSerializer.STATUS_CODE, ApiResponseSerializer.ERROR_MESSAGE));
            }
        }

        try {
            return HttpStatusCodes.isSuccess(statusCode)
                ? ApiResponse.success(statusCode)
                : ApiResponse.error(statusCode, errorMessage);
        } catch (InvalidStatusCodeException e) {
            throw StatusCodes.rejected(ctxt, ApiResponse.class, e);
        }
    }
}
