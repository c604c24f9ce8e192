package com.ryuqq.commons.core.measurement;

/**
 * 온도 측정값.
 *
 * <p>값은 항상 켈빈(정규 단위)으로 저장되며, 절대영도(0 K) 미만은 0 K로 clamp됩니다.
 * 섭씨/화씨 입력은 음수를 허용하므로 환산 후에만 clamp합니다.</p>
 *
 * <p><strong>환산식:</strong></p>
 * <pre>
 * K = °C + 273.15
 * K = (°F + 459.67) × 5 / 9
 * °C = K - 273.15
 * °F = K × 9 / 5 - 459.67
 * </pre>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public final class Temperature implements Comparable<Temperature> {

    public static final Temperature ABSOLUTE_ZERO = new Temperature(0);
    public static final Temperature MIN_VALUE = ABSOLUTE_ZERO;
    public static final Temperature MAX_VALUE = new Temperature(Double.MAX_VALUE);

    private static final String DEFAULT_FORMAT = "C";
    private static final double CELSIUS_OFFSET = 273.15;
    private static final double FAHRENHEIT_OFFSET = 459.67;

    private final double kelvin;

    private Temperature(double kelvin) {
        this.kelvin = Magnitudes.clamp(kelvin);
    }

    /**
     * Temperature 생성.
     *
     * @param value 값
     * @param unit 단위
     * @return Temperature 인스턴스 (0 K 미만은 0 K)
     * @throws InvalidUnitException unit이 null인 경우
     */
    public static Temperature of(double value, TemperatureUnit unit) {
        switch (TemperatureUnit.require(unit)) {
            case CELSIUS:
                return new Temperature(value + CELSIUS_OFFSET);
            case FAHRENHEIT:
                return new Temperature((value + FAHRENHEIT_OFFSET) * 5 / 9);
            default:
                return new Temperature(value);
        }
    }

    public static Temperature ofCelsius(double value) {
        return of(value, TemperatureUnit.CELSIUS);
    }

    public static Temperature ofFahrenheit(double value) {
        return of(value, TemperatureUnit.FAHRENHEIT);
    }

    public static Temperature ofKelvin(double value) {
        return of(value, TemperatureUnit.KELVIN);
    }

    /**
     * 지정한 단위로 환산한 값 조회.
     *
     * @param unit 단위
     * @return 환산 값
     * @throws InvalidUnitException unit이 null인 경우
     */
    public double to(TemperatureUnit unit) {
        switch (TemperatureUnit.require(unit)) {
            case CELSIUS:
                return kelvin - CELSIUS_OFFSET;
            case FAHRENHEIT:
                return kelvin * 9 / 5 - FAHRENHEIT_OFFSET;
            default:
                return kelvin;
        }
    }

    public Temperature with(double value, TemperatureUnit unit) {
        return of(value, unit);
    }

    public double getCelsius() {
        return to(TemperatureUnit.CELSIUS);
    }

    public Temperature withCelsius(double value) {
        return with(value, TemperatureUnit.CELSIUS);
    }

    public double getFahrenheit() {
        return to(TemperatureUnit.FAHRENHEIT);
    }

    public Temperature withFahrenheit(double value) {
        return with(value, TemperatureUnit.FAHRENHEIT);
    }

    /**
     * 켈빈 값 조회 (정규 단위, 환산 없음).
     *
     * @return 켈빈 값 (0 이상)
     */
    public double getKelvin() {
        return kelvin;
    }

    public Temperature withKelvin(double value) {
        return with(value, TemperatureUnit.KELVIN);
    }

    public boolean isGreaterThan(Temperature other) {
        return compareTo(other) > 0;
    }

    public boolean isLessThan(Temperature other) {
        return compareTo(other) < 0;
    }

    /**
     * {@inheritDoc}
     *
     * @throws IllegalArgumentException other가 null인 경우
     */
    @Override
    public int compareTo(Temperature other) {
        if (other == null) {
            throw new IllegalArgumentException("other cannot be null");
        }
        return Double.compare(kelvin, other.kelvin);
    }

    /**
     * 지정한 단위로 포맷팅.
     *
     * <p>섭씨/화씨는 "°" 접두 기호를 붙입니다 ("21.5 °C"), 켈빈은 붙이지 않습니다 ("273.15 K").</p>
     *
     * @param format 단위 문자열 (null 또는 빈 문자열이면 "C")
     * @return "{값} {기호}" 형식 문자열
     * @throws UnitFormatException 알 수 없는 단위 문자열인 경우
     */
    public String toString(String format) {
        String resolved = format == null || format.isEmpty() ? DEFAULT_FORMAT : format;
        if (!TemperatureUnit.isValidUnitString(resolved)) {
            throw new UnitFormatException(resolved);
        }
        TemperatureUnit unit = TemperatureUnit.fromString(resolved);
        return Magnitudes.format(to(unit)) + " " + unit.toUnitString();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        Temperature that = (Temperature) o;
        return Double.compare(kelvin, that.kelvin) == 0;
    }

    @Override
    public int hashCode() {
        return Double.hashCode(kelvin);
    }

    @Override
    public String toString() {
        return toString(DEFAULT_FORMAT);
    }
}
