package com.ryuqq.commons.core.measurement;

import java.util.Collections;
import java.util.HashMap;
import java.util.Map;
import java.util.Set;

/**
 * 부피 단위.
 *
 * <p>정규 기호는 위첨자 표기("m³")이며, 파싱은 ASCII 표기("m3")와
 * 단어 형태("cubic meters")도 허용합니다. JSON 전송 시에는 ASCII 표기
 * {@link #WIRE_SYMBOL}을 사용합니다.</p>
 *
 * <p><strong>환산 계수 (세제곱미터 기준):</strong></p>
 * <ul>
 *   <li>cm³, ml: ×0.000001</li>
 *   <li>ft³: ×0.0283168</li>
 *   <li>l: ×0.001</li>
 *   <li>gal: ×0.00378541</li>
 * </ul>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public enum VolumeUnit {

    CUBIC_CENTIMETER("cm³", 0.000001, "cm3", "cubiccentimeter", "cubiccentimeters"),
    CUBIC_METER("m³", 1, "m3", "cubicmeter", "cubicmeters"),
    CUBIC_FEET("ft³", 0.0283168, "ft3", "cubicfoot", "cubicfoots", "cubicfeet", "cubicfeets"),
    LITER("l", 0.001, "liter", "liters"),
    MILLILITER("ml", 0.000001, "milliliter", "milliliters"),
    GALLON("gal", 0.00378541, "gallon", "gallons");

    /**
     * JSON 전송용 세제곱미터 기호 (ASCII).
     */
    public static final String WIRE_SYMBOL = "m3";

    private static final String QUANTITY = "volume";
    private static final Map<String, VolumeUnit> ALIASES;

    static {
        Map<String, VolumeUnit> map = new HashMap<>();
        for (VolumeUnit unit : values()) {
            map.put(unit.symbol, unit);
            for (String alias : unit.aliases) {
                map.put(alias, unit);
            }
        }
        ALIASES = Collections.unmodifiableMap(map);
    }

    private final String symbol;
    private final double factor;
    private final Set<String> aliases;

    VolumeUnit(String symbol, double factor, String... aliases) {
        this.symbol = symbol;
        this.factor = factor;
        this.aliases = Set.of(aliases);
    }

    /**
     * 단위 문자열을 VolumeUnit으로 변환.
     *
     * @param unit 단위 문자열 (대소문자, 공백 무시)
     * @return VolumeUnit
     * @throws InvalidUnitException 알 수 없는 단위이거나 null인 경우
     */
    public static VolumeUnit fromString(String unit) {
        VolumeUnit resolved = unit == null ? null : ALIASES.get(Magnitudes.normalizeSpaced(unit));
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
    public static String format(VolumeUnit unit) {
        return require(unit).symbol;
    }

    static VolumeUnit require(VolumeUnit unit) {
        if (unit == null) {
            throw new InvalidUnitException(QUANTITY, null);
        }
        return unit;
    }

    public String toUnitString() {
        return symbol;
    }

    double toCubicMeters(double value) {
        return value * factor;
    }

    double fromCubicMeters(double cubicMeters) {
        return cubicMeters / factor;
    }
}
