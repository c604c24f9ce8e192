package com.ryuqq.commons.jackson;

import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.core.JsonToken;
import com.fasterxml.jackson.databind.DeserializationContext;
import com.fasterxml.jackson.databind.JsonMappingException;
import com.fasterxml.jackson.databind.deser.std.StdDeserializer;
import com.fasterxml.jackson.databind.exc.UnrecognizedPropertyException;
import com.ryuqq.commons.core.measurement.InvalidUnitException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.util.List;
import java.util.function.Function;

/**
 * 물리량 역직렬화.
 *
 * <p><strong>읽기 규칙:</strong></p>
 * <ul>
 *   <li>{@code value}: 숫자, 없으면 0</li>
 *   <li>{@code unit}: 단위 문자열 (별칭, 대소문자, 공백 허용), 없으면 정규 단위</li>
 *   <li>그 밖의 속성은 {@link UnrecognizedPropertyException}</li>
 *   <li>알 수 없는 단위는 {@link InvalidUnitException}을 cause로 가진
 *       {@link com.fasterxml.jackson.databind.exc.InvalidFormatException}</li>
 * </ul>
 *
 * @param <Q> 물리량 타입
 * @param <U> 단위 타입
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
final class QuantityDeserializer<Q, U> extends StdDeserializer<Q> {

    private static final Logger log = LoggerFactory.getLogger(QuantityDeserializer.class);

    /**
     * 값과 단위로 물리량을 만드는 팩토리.
     */
    @FunctionalInterface
    interface QuantityFactory<Q, U> {
        Q create(double value, U unit);
    }

    private final Class<U> unitType;
    private final Function<String, U> unitParser;
    private final U canonicalUnit;
    private final QuantityFactory<Q, U> factory;

    QuantityDeserializer(
        Class<Q> type,
        Class<U> unitType,
        Function<String, U> unitParser,
        U canonicalUnit,
        QuantityFactory<Q, U> factory
    ) {
        super(type);
        this.unitType = unitType;
        this.unitParser = unitParser;
        this.canonicalUnit = canonicalUnit;
        this.factory = factory;
    }

    @Override
    public Q deserialize(JsonParser p, DeserializationContext ctxt) throws IOException {
        if (!p.isExpectedStartObjectToken()) {
            return ctxt.reportInputMismatch(this,
                "Expected START_OBJECT for %s but was %s", handledType().getSimpleName(), p.currentToken());
        }

        double value = 0.0;
        U unit = canonicalUnit;

        JsonToken token;
        while ((token = p.nextToken()) != JsonToken.END_OBJECT) {
            if (token == null) {
                return ctxt.reportInputMismatch(this,
                    "Unexpected end of JSON while reading %s", handledType().getSimpleName());
            }
            String name = p.currentName();
            p.nextToken();

            if (PropertyNames.matches(ctxt, name, QuantitySerializer.VALUE)) {
                value = readValue(p, ctxt);
            } else if (PropertyNames.matches(ctxt, name, QuantitySerializer.UNIT)) {
                unit = readUnit(p, ctxt);
            } else {
                log.debug("Rejected unknown property '{}' for {}", name, handledType().getSimpleName());
                throw UnrecognizedPropertyException.from(p, handledType(), name,
                    List.<Object>of(QuantitySerializer.VALUE, QuantitySerializer.UNIT));
            }
        }

        return factory.create(value, unit);
    }

    private double readValue(JsonParser p, DeserializationContext ctxt) throws IOException {
        if (!p.currentToken().isNumeric()) {
            return ctxt.reportInputMismatch(this,
                "Expected number for %s value but was %s", handledType().getSimpleName(), p.currentToken());
        }
        return p.getDoubleValue();
    }

    private U readUnit(JsonParser p, DeserializationContext ctxt) throws IOException {
        if (p.currentToken() != JsonToken.VALUE_STRING) {
            return ctxt.reportInputMismatch(this,
                "Expected string for %s unit but was %s", handledType().getSimpleName(), p.currentToken());
        }
        String text = p.getText();
        try {
            return unitParser.apply(text);
        } catch (InvalidUnitException e) {
            log.debug("Rejected unit '{}' for {}", text, handledType().getSimpleName());
            JsonMappingException failure = ctxt.weirdStringException(text, unitType, e.getMessage());
            failure.initCause(e);
            throw failure;
        }
    }
}
