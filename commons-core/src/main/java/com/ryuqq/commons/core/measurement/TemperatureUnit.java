package com.ryuqq.commons.core.measurement;

import java.util.Locale;

/**
 * 온도 단위.
 *
 * <p>파싱 규칙은 거리/무게/부피와 다릅니다: 도 기호(°)를 제거하고 소문자로 변환한 뒤
 * 앞뒤 공백만 제거합니다 (내부 공백은 유지). 한 글자 약어 "c", "f", "k"를 허용합니다.</p>
 *
 * <p>표시 기호는 "°C", "°F", "K"이며, JSON 전송 시에는 {@link #WIRE_SYMBOL}("k")을 사용합니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public enum TemperatureUnit {

    CELSIUS("°C", "c", "celsius"),
    FAHRENHEIT("°F", "f", "fahrenheit"),
    KELVIN("K", "k", "kelvin");

    /**
     * JSON 전송용 켈빈 기호 (소문자).
     */
    public static final String WIRE_SYMBOL = "k";

    private static final String QUANTITY = "temperature";

    private final String symbol;
    private final String shorthand;
    private final String word;

    TemperatureUnit(String symbol, String shorthand, String word) {
        this.symbol = symbol;
        this.shorthand = shorthand;
        this.word = word;
    }

    /**
     * 단위 문자열을 TemperatureUnit으로 변환.
     *
     * @param unit 단위 문자열 (예: "°C", "celsius", "K")
     * @return TemperatureUnit
     * @throws InvalidUnitException 알 수 없는 단위이거나 null인 경우
     */
    public static TemperatureUnit fromString(String unit) {
        String normalized = normalize(unit);
        for (TemperatureUnit candidate : values()) {
            if (candidate.shorthand.equals(normalized) || candidate.word.equals(normalized)) {
                return candidate;
            }
        }
        throw new InvalidUnitException(QUANTITY, unit);
    }

    public static boolean isValidUnitString(String unit) {
        String normalized = normalize(unit);
        for (TemperatureUnit candidate : values()) {
            if (candidate.shorthand.equals(normalized) || candidate.word.equals(normalized)) {
                return true;
            }
        }
        return false;
    }

    /**
     * 단위의 표시 기호 조회 (null 검증 포함).
     *
     * @param unit 단위
     * @return 표시 기호
     * @throws InvalidUnitException unit이 null인 경우
     */
    public static String format(TemperatureUnit unit) {
        return require(unit).symbol;
    }

    static TemperatureUnit require(TemperatureUnit unit) {
        if (unit == null) {
            throw new InvalidUnitException(QUANTITY, null);
        }
        return unit;
    }

    private static String normalize(String unit) {
        if (unit == null) {
            return null;
        }
        return unit.replace("°", "").toLowerCase(Locale.ROOT).trim();
    }

    /**
     * 표시 기호 조회 ("°C", "°F", "K").
     *
     * @return 표시 기호
     */
    public String toUnitString() {
        return symbol;
    }
}
