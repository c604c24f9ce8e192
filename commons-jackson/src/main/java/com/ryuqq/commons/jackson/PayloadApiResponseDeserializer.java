package com.ryuqq.commons.jackson;

import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.core.JsonToken;
import com.fasterxml.jackson.databind.BeanProperty;
import com.fasterxml.jackson.databind.DeserializationContext;
import com.fasterxml.jackson.databind.JavaType;
import com.fasterxml.jackson.databind.JsonDeserializer;
import com.fasterxml.jackson.databind.deser.ContextualDeserializer;
import com.fasterxml.jackson.databind.deser.std.StdDeserializer;
import com.fasterxml.jackson.databind.exc.UnrecognizedPropertyException;
import com.ryuqq.commons.core.api.HttpStatusCodes;
import com.ryuqq.commons.core.api.InvalidStatusCodeException;
import com.ryuqq.commons.core.api.PayloadApiResponse;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.util.List;

/**
 * PayloadApiResponse 역직렬화.
 *
 * <p>payload 타입은 요청된 타입의 첫 번째 타입 인자에서 얻습니다
 * (예: {@code new TypeReference<PayloadApiResponse<Distance>>() {}} → Distance).
 * 타입 인자가 없으면 payload는 {@code Object}로 읽습니다.</p>
 *
 * <p><strong>검증:</strong></p>
 * <ul>
 *   <li>2xx statusCode에 payload가 없거나 null이면 오류</li>
 *   <li>오류 statusCode의 payload는 무시</li>
 * </ul>
 */
final class PayloadApiResponseDeserializer extends StdDeserializer<PayloadApiResponse<?>>
    implements ContextualDeserializer {

    private static final Logger log = LoggerFactory.getLogger(PayloadApiResponseDeserializer.class);

    private final JavaType payloadType;

    PayloadApiResponseDeserializer() {
        this(null);
    }

    private PayloadApiResponseDeserializer(JavaType payloadType) {
        super(PayloadApiResponse.class);
        this.payloadType = payloadType;
    }

    @Override
    public JsonDeserializer<?> createContextual(DeserializationContext ctxt, BeanProperty property) {
        JavaType responseType = ctxt.getContextualType();
        if (responseType == null && property != null) {
            responseType = property.getType();
        }
        JavaType resolved = responseType == null
            ? ctxt.constructType(Object.class)
            : responseType.containedTypeOrUnknown(0);
        return new PayloadApiResponseDeserializer(resolved);
    }

    @Override
    public PayloadApiResponse<?> deserialize(JsonParser p, DeserializationContext ctxt) throws IOException {
        if (!p.isExpectedStartObjectToken()) {
            return ctxt.reportInputMismatch(this,
                "Expected START_OBJECT for PayloadApiResponse but was %s", p.currentToken());
        }

        JavaType targetType = payloadType == null ? ctxt.constructType(Object.class) : payloadType;
        int statusCode = 0;
        String errorMessage = null;
        Object payload = null;

        JsonToken token;
        while ((token = p.nextToken()) != JsonToken.END_OBJECT) {
            if (token == null) {
                return ctxt.reportInputMismatch(this, "Unexpected end of JSON while reading PayloadApiResponse");
            }
            String name = p.currentName();
            JsonToken valueToken = p.nextToken();

            if (PropertyNames.matches(ctxt, name, ApiResponseSerializer.STATUS_CODE)) {
                statusCode = StatusCodes.read(p, ctxt, this);
            } else if (PropertyNames.matches(ctxt, name, ApiResponseSerializer.ERROR_MESSAGE)) {
                errorMessage = StatusCodes.readErrorMessage(p, ctxt, this);
            } else if (PropertyNames.matches(ctxt, name, ApiResponseSerializer.PAYLOAD)) {
                payload = valueToken == JsonToken.VALUE_NULL ? null : ctxt.readValue(p, targetType);
            } else {
                log.debug("Rejected unknown property '{}' for PayloadApiResponse", name);
                throw UnrecognizedPropertyException.from(p, PayloadApiResponse.class, name,
                    List.<Object>of(
                        ApiResponseSerializer.STATUS_CODE,
                        ApiResponseSerializer.ERROR_MESSAGE,
                        ApiResponseSerializer.PAYLOAD
                    ));
            }
        }

        try {
            if (!HttpStatusCodes.isSuccess(statusCode)) {
                return PayloadApiResponse.error(statusCode, errorMessage);
            }
        } catch (InvalidStatusCodeException e) {
            throw StatusCodes.rejected(ctxt, PayloadApiResponse.class, e);
        }
        if (payload == null) {
            log.debug("Rejected success response {} without payload", statusCode);
            return ctxt.reportInputMismatch(this, "Missing payload for success status code %d", statusCode);
        }
        return PayloadApiResponse.success(payload, statusCode);
    }
}
