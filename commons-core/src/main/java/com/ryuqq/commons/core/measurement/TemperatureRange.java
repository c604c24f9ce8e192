package com.ryuqq.commons.core.measurement;

/**
 * 온도 범위 (최저/최고).
 *
 * <p>보관 조건처럼 허용 온도 구간을 표현합니다. 양 끝을 포함합니다.</p>
 *
 * @param min 최저 온도
 * @param max 최고 온도 (min 이상)
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public record TemperatureRange(
    Temperature min,
    Temperature max
) {

    /**
     * 절대영도부터 최대값까지의 전체 범위.
     */
    public static final TemperatureRange DEFAULT = new TemperatureRange(Temperature.MIN_VALUE, Temperature.MAX_VALUE);

    /**
     * Compact Constructor.
     *
     * @throws IllegalArgumentException min 또는 max가 null이거나 min이 max보다 큰 경우
     */
    public TemperatureRange {
        if (min == null) {
            throw new IllegalArgumentException("min cannot be null");
        }
        if (max == null) {
            throw new IllegalArgumentException("max cannot be null");
        }
        if (min.isGreaterThan(max)) {
            throw new IllegalArgumentException(
                "min must be less than or equal to max (min: " + min + ", max: " + max + ")"
            );
        }
    }

    /**
     * 최저와 최고가 같은 단일 온도 범위인지 확인.
     *
     * @return min == max이면 true
     */
    public boolean isSingleTemperature() {
        return min.equals(max);
    }

    /**
     * 온도가 범위 안에 있는지 확인 (양 끝 포함).
     *
     * @param temperature 확인할 온도
     * @return 범위 안이면 true
     * @throws IllegalArgumentException temperature가 null인 경우
     */
    public boolean contains(Temperature temperature) {
        if (temperature == null) {
            throw new IllegalArgumentException("temperature cannot be null");
        }
        return !temperature.isLessThan(min) && !temperature.isGreaterThan(max);
    }
}
