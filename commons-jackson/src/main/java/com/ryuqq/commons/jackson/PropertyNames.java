package com.ryuqq.commons.jackson;

import com.fasterxml.jackson.databind.DeserializationContext;
import com.fasterxml.jackson.databind.MapperFeature;
import com.fasterxml.jackson.databind.PropertyNamingStrategy;
import com.fasterxml.jackson.databind.cfg.MapperConfig;

/**
 * 논리 속성 이름을 ObjectMapper 설정에 맞춰 해석.
 *
 * <p>{@link PropertyNamingStrategy}가 설정되어 있으면 변환된 이름을, 없으면 논리 이름을 그대로 씁니다.
 * 읽기 시 {@link MapperFeature#ACCEPT_CASE_INSENSITIVE_PROPERTIES}가 켜져 있으면 대소문자를 무시합니다.</p>
 */
final class PropertyNames {

    private PropertyNames() {
    }

    static String translate(MapperConfig<?> config, String logicalName) {
        PropertyNamingStrategy strategy = config.getPropertyNamingStrategy();
        if (strategy == null) {
            return logicalName;
        }
        return strategy.nameForField(config, null, logicalName);
    }

    static boolean matches(DeserializationContext ctxt, String actual, String logicalName) {
        String expected = translate(ctxt.getConfig(), logicalName);
        if (ctxt.isEnabled(MapperFeature.ACCEPT_CASE_INSENSITIVE_PROPERTIES)) {
            return expected.equalsIgnoreCase(actual);
        }
        return expected.equals(actual);
    }
}
