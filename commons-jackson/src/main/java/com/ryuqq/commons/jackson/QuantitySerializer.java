package com.ryuqq.commons.jackson;

import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.databind.SerializationConfig;
import com.fasterxml.jackson.databind.SerializerProvider;
import com.fasterxml.jackson.databind.ser.std.StdSerializer;

import java.io.IOException;
import java.util.function.ToDoubleFunction;

/**
 * 물리량 직렬화.
 *
 * <p>항상 정규 단위 값과 고정 단위 기호를 씁니다: {@code {"value": 1500.0, "unit": "m"}}.
 * 생성 시 사용한 단위는 출력에 영향을 주지 않습니다.</p>
 *
 * @param <Q> 물리량 타입
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
final class QuantitySerializer<Q> extends StdSerializer<Q> {

    static final String VALUE = "value";
    static final String UNIT = "unit";

    private final ToDoubleFunction<Q> canonicalValue;
    private final String wireSymbol;

    QuantitySerializer(Class<Q> type, ToDoubleFunction<Q> canonicalValue, String wireSymbol) {
        super(type);
        this.canonicalValue = canonicalValue;
        this.wireSymbol = wireSymbol;
    }

    @Override
    public void serialize(Q quantity, JsonGenerator gen, SerializerProvider provider) throws IOException {
        SerializationConfig config = provider.getConfig();
        gen.writeStartObject(quantity);
        gen.writeNumberField(PropertyNames.translate(config, VALUE), canonicalValue.applyAsDouble(quantity));
        gen.writeStringField(PropertyNames.translate(config, UNIT), wireSymbol);
        gen.writeEndObject();
    }
}
