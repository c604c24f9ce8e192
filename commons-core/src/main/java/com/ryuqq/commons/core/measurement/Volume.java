package com.ryuqq.commons.core.measurement;

/**
 * 부피 측정값.
 *
 * <p>값은 항상 세제곱미터(정규 단위)로 저장됩니다. 음수 입력은 0으로 clamp됩니다.</p>
 *
 * <p><strong>예시:</strong></p>
 * <pre>
 * Volume box = Volume.of(Distance.ofCentimeters(40), Distance.ofCentimeters(30), Distance.ofCentimeters(20));
 * double liters = box.getLiters();
 * </pre>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public final class Volume implements Comparable<Volume> {

    public static final Volume ZERO = new Volume(0);
    public static final Volume MIN_VALUE = new Volume(0);
    public static final Volume MAX_VALUE = new Volume(Double.MAX_VALUE);

    private static final String DEFAULT_FORMAT = VolumeUnit.WIRE_SYMBOL;

    private final double cubicMeters;

    private Volume(double cubicMeters) {
        this.cubicMeters = Magnitudes.clamp(cubicMeters);
    }

    /**
     * Volume 생성.
     *
     * @param value 값 (음수는 0으로 clamp)
     * @param unit 단위
     * @return Volume 인스턴스
     * @throws InvalidUnitException unit이 null인 경우
     */
    public static Volume of(double value, VolumeUnit unit) {
        return new Volume(VolumeUnit.require(unit).toCubicMeters(Magnitudes.clamp(value)));
    }

    /**
     * 가로, 세로, 깊이로 부피 생성.
     *
     * @param width 가로
     * @param height 세로
     * @param depth 깊이
     * @return 세 변의 미터 값을 곱한 부피
     * @throws IllegalArgumentException 인자 중 하나라도 null인 경우
     */
    public static Volume of(Distance width, Distance height, Distance depth) {
        if (width == null || height == null || depth == null) {
            throw new IllegalArgumentException("width, height and depth cannot be null");
        }
        return new Volume(width.getMeters() * height.getMeters() * depth.getMeters());
    }

    public static Volume ofCubicCentimeters(double value) {
        return of(value, VolumeUnit.CUBIC_CENTIMETER);
    }

    public static Volume ofCubicMeters(double value) {
        return of(value, VolumeUnit.CUBIC_METER);
    }

    public static Volume ofCubicFeet(double value) {
        return of(value, VolumeUnit.CUBIC_FEET);
    }

    public static Volume ofLiters(double value) {
        return of(value, VolumeUnit.LITER);
    }

    public static Volume ofMilliliters(double value) {
        return of(value, VolumeUnit.MILLILITER);
    }

    public static Volume ofGallons(double value) {
        return of(value, VolumeUnit.GALLON);
    }

    /**
     * 지정한 단위로 환산한 값 조회.
     *
     * @param unit 단위
     * @return 환산 값
     * @throws InvalidUnitException unit이 null인 경우
     */
    public double to(VolumeUnit unit) {
        return VolumeUnit.require(unit).fromCubicMeters(cubicMeters);
    }

    public Volume with(double value, VolumeUnit unit) {
        return of(value, unit);
    }

    public double getCubicCentimeters() {
        return to(VolumeUnit.CUBIC_CENTIMETER);
    }

    public Volume withCubicCentimeters(double value) {
        return with(value, VolumeUnit.CUBIC_CENTIMETER);
    }

    /**
     * 세제곱미터 값 조회 (정규 단위, 환산 없음).
     *
     * @return 세제곱미터 값 (0 이상)
     */
    public double getCubicMeters() {
        return cubicMeters;
    }

    public Volume withCubicMeters(double value) {
        return with(value, VolumeUnit.CUBIC_METER);
    }

    public double getCubicFeet() {
        return to(VolumeUnit.CUBIC_FEET);
    }

    public Volume withCubicFeet(double value) {
        return with(value, VolumeUnit.CUBIC_FEET);
    }

    public double getLiters() {
        return to(VolumeUnit.LITER);
    }

    public Volume withLiters(double value) {
        return with(value, VolumeUnit.LITER);
    }

    public double getMilliliters() {
        return to(VolumeUnit.MILLILITER);
    }

    public Volume withMilliliters(double value) {
        return with(value, VolumeUnit.MILLILITER);
    }

    public double getGallons() {
        return to(VolumeUnit.GALLON);
    }

    public Volume withGallons(double value) {
        return with(value, VolumeUnit.GALLON);
    }

    /**
     * 두 부피의 합 (세제곱미터 기준).
     *
     * @param other 더할 부피
     * @return 합계
     * @throws IllegalArgumentException other가 null인 경우
     */
    public Volume add(Volume other) {
        return ofCubicMeters(cubicMeters + requireOther(other).cubicMeters);
    }

    /**
     * 두 부피의 차 (음수면 0).
     *
     * @param other 뺄 부피
     * @return 차이 (0 이상)
     * @throws IllegalArgumentException other가 null인 경우
     */
    public Volume subtract(Volume other) {
        return ofCubicMeters(cubicMeters - requireOther(other).cubicMeters);
    }

    public boolean isGreaterThan(Volume other) {
        return compareTo(other) > 0;
    }

    public boolean isLessThan(Volume other) {
        return compareTo(other) < 0;
    }

    @Override
    public int compareTo(Volume other) {
        return Double.compare(cubicMeters, requireOther(other).cubicMeters);
    }

    /**
     * 지정한 단위로 포맷팅.
     *
     * @param format 단위 문자열 (null 또는 빈 문자열이면 "m3")
     * @return "{값} {기호}" 형식 문자열 (예: "1 m³")
     * @throws UnitFormatException 알 수 없는 단위 문자열인 경우
     */
    public String toString(String format) {
        String resolved = format == null || format.isEmpty() ? DEFAULT_FORMAT : format;
        if (!VolumeUnit.isValidUnitString(resolved)) {
            throw new UnitFormatException(resolved);
        }
        VolumeUnit unit = VolumeUnit.fromString(resolved);
        return Magnitudes.format(to(unit)) + " " + unit.toUnitString();
    }

    private static Volume requireOther(Volume other) {
        if (other == null) {
            throw new IllegalArgumentException("other cannot be null");
        }
        return other;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        Volume volume = (Volume) o;
        return Double.compare(cubicMeters, volume.cubicMeters) == 0;
    }

    @Override
    public int hashCode() {
        return Double.hashCode(cubicMeters);
    }

    @Override
    public String toString() {
        return toString(DEFAULT_FORMAT);
    }
}
