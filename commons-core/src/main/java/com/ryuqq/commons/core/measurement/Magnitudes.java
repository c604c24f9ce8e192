package com.ryuqq.commons.core.measurement;

import java.math.BigDecimal;
import java.util.Locale;

/**
 * 측정값 공통 연산 (clamp, 숫자 포맷팅).
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
final class Magnitudes {

    private Magnitudes() {
    }

    /**
     * 값을 [0, Double.MAX_VALUE] 범위로 제한.
     *
     * <p>음수와 -0.0, NaN은 0.0, +Infinity는 Double.MAX_VALUE가 됩니다.</p>
     *
     * @param value 원본 값
     * @return 제한된 값
     */
    static double clamp(double value) {
        if (Double.isNaN(value) || value <= 0) {
            return 0.0;
        }
        return Math.min(value, Double.MAX_VALUE);
    }

    /**
     * 로케일 독립적인 숫자 문자열 생성.
     *
     * <p>정수 값은 소수점 없이 출력합니다 (1.0 → "1", 0.3048 → "0.3048").</p>
     *
     * @param value 값
     * @return 숫자 문자열
     */
    static String format(double value) {
        if (Double.isNaN(value) || Double.isInfinite(value)) {
            return Double.toString(value);
        }
        if (value == 0) {
            return "0";
        }
        return BigDecimal.valueOf(value).stripTrailingZeros().toPlainString();
    }

    /**
     * 단위 문자열 정규화 (소문자, 공백 제거, trim).
     *
     * @param unit 단위 문자열
     * @return 정규화된 문자열, null 입력이면 null
     */
    static String normalizeSpaced(String unit) {
        if (unit == null) {
            return null;
        }
        return unit.toLowerCase(Locale.ROOT).replace(" ", "").trim();
    }
}
