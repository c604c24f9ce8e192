package com.ryuqq.commons.core.measurement;

/**
 * 거리 측정값.
 *
 * <p>Distance는 값을 항상 미터(정규 단위)로 저장하며, 다른 단위 값은 조회 시점에 환산합니다.</p>
 *
 * <p><strong>불변성:</strong> 생성 후 값 변경 불가. {@code withX} 메서드는 새 인스턴스를 반환합니다.</p>
 * <p><strong>음수 처리:</strong> 음수 입력은 예외 없이 0으로 clamp됩니다.</p>
 * <p><strong>동등성:</strong> 미터 값의 정확한 일치로만 판단합니다. 단위 환산을 거친 값은
 * 부동소수점 오차로 인해 같지 않을 수 있습니다 (예: 1 ft와 0.3048 m).</p>
 *
 * <p><strong>예시:</strong></p>
 * <pre>
 * Distance route = Distance.ofKilometers(1).subtract(Distance.ofMeters(2)); // 998 m
 * double miles = route.getMiles();
 * String text = route.toString("km"); // "0.998 km"
 * </pre>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public final class Distance implements Comparable<Distance> {

    public static final Distance ZERO = new Distance(0);
    public static final Distance MIN_VALUE = new Distance(0);
    public static final Distance MAX_VALUE = new Distance(Double.MAX_VALUE);

    private static final String DEFAULT_FORMAT = "m";

    private final double meters;

    private Distance(double meters) {
        this.meters = Magnitudes.clamp(meters);
    }

    /**
     * Distance 생성.
     *
     * @param value 값 (음수는 0으로 clamp)
     * @param unit 단위
     * @return Distance 인스턴스
     * @throws InvalidUnitException unit이 null인 경우
     */
    public static Distance of(double value, DistanceUnit unit) {
        return new Distance(DistanceUnit.require(unit).toMeters(Magnitudes.clamp(value)));
    }

    public static Distance ofMillimeters(double value) {
        return of(value, DistanceUnit.MILLIMETER);
    }

    public static Distance ofCentimeters(double value) {
        return of(value, DistanceUnit.CENTIMETER);
    }

    public static Distance ofMeters(double value) {
        return of(value, DistanceUnit.METER);
    }

    public static Distance ofKilometers(double value) {
        return of(value, DistanceUnit.KILOMETER);
    }

    public static Distance ofInches(double value) {
        return of(value, DistanceUnit.INCH);
    }

    public static Distance ofFeet(double value) {
        return of(value, DistanceUnit.FOOT);
    }

    public static Distance ofYards(double value) {
        return of(value, DistanceUnit.YARD);
    }

    public static Distance ofMiles(double value) {
        return of(value, DistanceUnit.MILE);
    }

    public static Distance ofNauticalMiles(double value) {
        return of(value, DistanceUnit.NAUTICAL_MILE);
    }

    /**
     * 지정한 단위로 환산한 값 조회.
     *
     * @param unit 단위
     * @return 환산 값
     * @throws InvalidUnitException unit이 null인 경우
     */
    public double to(DistanceUnit unit) {
        return DistanceUnit.require(unit).fromMeters(meters);
    }

    /**
     * 지정한 단위의 값으로 교체한 새 인스턴스 생성.
     *
     * @param value 값 (음수는 0으로 clamp)
     * @param unit 단위
     * @return 새 Distance 인스턴스
     */
    public Distance with(double value, DistanceUnit unit) {
        return of(value, unit);
    }

    public double getMillimeters() {
        return to(DistanceUnit.MILLIMETER);
    }

    public Distance withMillimeters(double value) {
        return with(value, DistanceUnit.MILLIMETER);
    }

    public double getCentimeters() {
        return to(DistanceUnit.CENTIMETER);
    }

    public Distance withCentimeters(double value) {
        return with(value, DistanceUnit.CENTIMETER);
    }

    /**
     * 미터 값 조회 (정규 단위, 환산 없음).
     *
     * @return 미터 값 (0 이상)
     */
    public double getMeters() {
        return meters;
    }

    public Distance withMeters(double value) {
        return with(value, DistanceUnit.METER);
    }

    public double getKilometers() {
        return to(DistanceUnit.KILOMETER);
    }

    public Distance withKilometers(double value) {
        return with(value, DistanceUnit.KILOMETER);
    }

    public double getInches() {
        return to(DistanceUnit.INCH);
    }

    public Distance withInches(double value) {
        return with(value, DistanceUnit.INCH);
    }

    public double getFeet() {
        return to(DistanceUnit.FOOT);
    }

    public Distance withFeet(double value) {
        return with(value, DistanceUnit.FOOT);
    }

    public double getYards() {
        return to(DistanceUnit.YARD);
    }

    public Distance withYards(double value) {
        return with(value, DistanceUnit.YARD);
    }

    public double getMiles() {
        return to(DistanceUnit.MILE);
    }

    public Distance withMiles(double value) {
        return with(value, DistanceUnit.MILE);
    }

    public double getNauticalMiles() {
        return to(DistanceUnit.NAUTICAL_MILE);
    }

    public Distance withNauticalMiles(double value) {
        return with(value, DistanceUnit.NAUTICAL_MILE);
    }

    /**
     * 두 거리의 합.
     *
     * @param other 더할 거리
     * @return 미터 기준 합계
     * @throws IllegalArgumentException other가 null인 경우
     */
    public Distance add(Distance other) {
        return ofMeters(meters + requireOther(other).meters);
    }

    /**
     * 두 거리의 차.
     *
     * <p>결과가 음수이면 0이 됩니다 (2 m - 5 m = 0 m).</p>
     *
     * @param other 뺄 거리
     * @return 미터 기준 차이 (0 이상)
     * @throws IllegalArgumentException other가 null인 경우
     */
    public Distance subtract(Distance other) {
        return ofMeters(meters - requireOther(other).meters);
    }

    public boolean isGreaterThan(Distance other) {
        return compareTo(other) > 0;
    }

    public boolean isLessThan(Distance other) {
        return compareTo(other) < 0;
    }

    /**
     * {@inheritDoc}
     *
     * @throws IllegalArgumentException other가 null인 경우
     */
    @Override
    public int compareTo(Distance other) {
        return Double.compare(meters, requireOther(other).meters);
    }

    /**
     * 지정한 단위로 포맷팅.
     *
     * @param format 단위 문자열 (null 또는 빈 문자열이면 "m")
     * @return "{값} {기호}" 형식 문자열 (예: "1.5 km")
     * @throws UnitFormatException 알 수 없는 단위 문자열인 경우
     */
    public String toString(String format) {
        String resolved = format == null || format.isEmpty() ? DEFAULT_FORMAT : format;
        if (!DistanceUnit.isValidUnitString(resolved)) {
            throw new UnitFormatException(resolved);
        }
        DistanceUnit unit = DistanceUnit.fromString(resolved);
        return Magnitudes.format(to(unit)) + " " + unit.toUnitString();
    }

    private static Distance requireOther(Distance other) {
        if (other == null) {
            throw new IllegalArgumentException("other cannot be null");
        }
        return other;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        Distance distance = (Distance) o;
        return Double.compare(meters, distance.meters) == 0;
    }

    @Override
    public int hashCode() {
        return Double.hashCode(meters);
    }

    @Override
    public String toString() {
        return toString(DEFAULT_FORMAT);
    }
}
