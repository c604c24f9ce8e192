package com.ryuqq.commons.jackson;

import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.core.JsonToken;
import com.fasterxml.jackson.databind.DeserializationContext;
import com.fasterxml.jackson.databind.JsonDeserializer;
import com.fasterxml.jackson.databind.JsonMappingException;
import com.ryuqq.commons.core.api.InvalidStatusCodeException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;

/**
 * 응답 역직렬화기가 공유하는 statusCode/errorMessage 읽기.
 */
final class StatusCodes {

    private static final Logger log = LoggerFactory.getLogger(StatusCodes.class);

    private StatusCodes() {
    }

    static int read(JsonParser p, DeserializationContext ctxt, JsonDeserializer<?> src) throws IOException {
        if (p.currentToken() != JsonToken.VALUE_NUMBER_INT) {
            return ctxt.reportInputMismatch(src, "Expected integer statusCode but was %s", p.currentToken());
        }
        return p.getIntValue();
    }

    static String readErrorMessage(JsonParser p, DeserializationContext ctxt, JsonDeserializer<?> src)
        throws IOException {
        JsonToken token = p.currentToken();
        if (token == JsonToken.VALUE_NULL) {
            return null;
        }
        if (token != JsonToken.VALUE_STRING) {
            return ctxt.reportInputMismatch(src, "Expected string errorMessage but was %s", token);
        }
        return p.getText();
    }

    /**
     * 거부된 상태 코드를 cause로 가진 매핑 예외 생성.
     */
    static JsonMappingException rejected(
        DeserializationContext ctxt,
        Class<?> responseType,
        InvalidStatusCodeException cause
    ) {
        log.debug("Rejected status code {} for {}", cause.getStatusCode(), responseType.getSimpleName());
        JsonMappingException failure = ctxt.weirdNumberException(cause.getStatusCode(), responseType, cause.getMessage());
        failure.initCause(cause);
        return failure;
    }
}
