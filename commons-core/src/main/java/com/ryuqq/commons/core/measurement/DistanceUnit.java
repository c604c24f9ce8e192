package com.ryuqq.commons.core.measurement;

import java.util.Collections;
import java.util.HashMap;
import java.util.Map;
import java.util.Set;

/**
 * 거리 단위.
 *
 * <p>각 단위는 정규 기호와 미터 환산 계수, 파싱 시 허용하는 별칭 집합을 가집니다.</p>
 *
 * <p><strong>파싱 규칙:</strong> 소문자 변환 후 모든 공백을 제거하고 별칭 표와 비교합니다.
 * 따라서 "Nautical Mile", "nmi", "NAUTICAL MILES"는 모두 {@link #NAUTICAL_MILE}입니다.</p>
 *
 * <p><strong>환산 계수 (미터 기준):</strong></p>
 * <ul>
 *   <li>mm: ÷1000, cm: ÷100, km: ×1000</li>
 *   <li>in: ×0.0254, ft: ×0.3048, yd: ×0.9144</li>
 *   <li>mi: ×1609.34, nmi: ×1852</li>
 * </ul>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public enum DistanceUnit {

    MILLIMETER("mm", 1, 1000, "millimeter", "millimeters"),
    CENTIMETER("cm", 1, 100, "centimeter", "centimeters"),
    METER("m", 1, 1, "meter", "meters"),
    KILOMETER("km", 1000, 1, "kilometer", "kilometers"),
    INCH("in", 0.0254, 1, "inch", "inches"),
    FOOT("ft", 0.3048, 1, "foot", "feet"),
    YARD("yd", 0.9144, 1, "yard", "yards"),
    MILE("mi", 1609.34, 1, "mile", "miles"),
    NAUTICAL_MILE("nmi", 1852, 1, "nauticalmile", "nauticalmiles");

    private static final String QUANTITY = "distance";
    private static final Map<String, DistanceUnit> ALIASES;

    static {
        Map<String, DistanceUnit> map = new HashMap<>();
        for (DistanceUnit unit : values()) {
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

    DistanceUnit(String symbol, double multiplier, double divisor, String... aliases) {
        this.symbol = symbol;
        this.multiplier = multiplier;
        this.divisor = divisor;
        this.aliases = Set.of(aliases);
    }

    /**
     * 단위 문자열을 DistanceUnit으로 변환.
     *
     * @param unit 단위 문자열 (대소문자, 공백 무시)
     * @return DistanceUnit
     * @throws InvalidUnitException 알 수 없는 단위이거나 null인 경우
     */
    public static DistanceUnit fromString(String unit) {
        DistanceUnit resolved = unit == null ? null : ALIASES.get(Magnitudes.normalizeSpaced(unit));
        if (resolved == null) {
            throw new InvalidUnitException(QUANTITY, unit);
        }
        return resolved;
    }

    /**
     * 유효한 단위 문자열인지 확인.
     *
     * @param unit 단위 문자열
     * @return 별칭 표에 있으면 true
     */
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
    public static String format(DistanceUnit unit) {
        return require(unit).symbol;
    }

    static DistanceUnit require(DistanceUnit unit) {
        if (unit == null) {
            throw new InvalidUnitException(QUANTITY, null);
        }
        return unit;
    }

    /**
     * 정규 기호 조회 (예: "m", "nmi").
     *
     * @return 정규 기호
     */
    public String toUnitString() {
        return symbol;
    }

    double toMeters(double value) {
        return value * multiplier / divisor;
    }

    double fromMeters(double meters) {
        return meters * divisor / multiplier;
    }
}
