package com.ryuqq.commons.core.measurement;

import java.util.Collections;
import java.util.HashMap;
import java.util.Map;
import java.util.Set;

/**
 * 무게 단위.
 *
 * <p>파싱은 소문자 변환 후 모든 공백을 제거하고 별칭 표와 비교합니다
 * ("Long Ton" → {@link #LONG_TON}).</p>
 *
 * <p><strong>주의:</strong> "st."는 {@link #STONE}, "st"는 {@link #SHORT_TON}입니다.</p>
 *
 * <p><strong>환산 계수 (그램 기준):</strong></p>
 * <ul>
 *   <li>µg: ÷1,000,000, mg: ÷1000, kg: ×1000, t: ×1,000,000</li>
 *   <li>lb: ×453.59237, oz: ×28.349523125, st.: ×6350.29318</li>
 *   <li>ct: ÷5, lt: ×1,016,046.9088, st: ×907,184.74</li>
 * </ul>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public enum WeightUnit {

    MICROGRAM("µg", 1, 1_000_000, "microgram", "micrograms"),
    MILLIGRAM("mg", 1, 1000, "milligram", "milligrams"),
    GRAM("g", 1, 1, "gram", "grams"),
    KILOGRAM("kg", 1000, 1, "kilogram", "kilograms"),
    TON("t", 1_000_000, 1, "ton", "tons"),
    POUND("lb", 453.59237, 1, "pound", "pounds"),
    OUNCE("oz", 28.349523125, 1, "ounce", "ounces"),
    STONE("st.", 6350.29318, 1, "stone", "stones"),
    CARAT("ct", 1, 5, "carat", "carats"),
    LONG_TON("lt", 1_016_046.9088, 1, "longton", "longtons"),
    SHORT_TON("st", 907_184.74, 1, "shortton", "shorttons");

    private static final String QUANTITY = "weight";
    private static final Map<String, WeightUnit> ALIASES;

    static {
        Map<String, WeightUnit> map = new HashMap<>();
        for (WeightUnit unit : values()) {
            map.put(unit.symbol, unit);
            for (String alias : unit.aliases) {
                map.put(alias, unit);
            }
        }
        ALIASES = Collections.unmodifiableMap(map);
    }

    private final String symbol;
    private final double multiplier;
    private final double divisor;
    private final Set<String> aliases;

    WeightUnit(String symbol, double multiplier, double divisor, String... aliases) {
        this.symbol = symbol;
        this.multiplier = multiplier;
        this.divisor = divisor;
        this.aliases = Set.of(aliases);
    }

    /**
     * 단위 문자열을 WeightUnit으로 변환.
     *
     * @param unit 단위 문자열 (대소문자, 공백 무시)
     * @return WeightUnit
     * @throws InvalidUnitException 알 수 없는 단위이거나 null인 경우
     */
    public static WeightUnit fromString(String unit) {
        WeightUnit resolved = unit == null ? null : ALIASES.get(Magnitudes.normalizeSpaced(unit));
        if (resolved == null) {
            throw new InvalidUnitException(QUANTITY, unit);
        }
        return resolved;
    }

    public static boolean isValidUnitString(String unit) {
        return unit != null && ALIASES.containsKey(Magnitudes.normalizeSpaced(unit));
    }

    /**
     * 단위의 정규 기호 조회 (null 검증 포함).
     *
     * @param unit 단위
     * @return 정규 기호
     * @throws InvalidUnitException unit이 null인 경우
     */
    public static String format(WeightUnit unit) {
        return require(unit).symbol;
    }

    static WeightUnit require(WeightUnit unit) {
        if (unit == null) {
            throw new InvalidUnitException(QUANTITY, null);
        }
        return unit;
    }

    public String toUnitString() {
        return symbol;
    }

    double toGrams(double value) {
        return value * multiplier / divisor;
    }

    double fromGrams(double grams) {
        return grams * divisor / multiplier;
    }
}
