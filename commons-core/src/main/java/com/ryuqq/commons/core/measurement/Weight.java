package com.ryuqq.commons.core.measurement;

/**
 * 무게 측정값.
 *
 * <p>값은 항상 그램(정규 단위)으로 저장됩니다. 음수 입력은 0으로 clamp되며,
 * 동등성과 정렬은 그램 값만으로 판단합니다.</p>
 *
 * <p><strong>예시:</strong></p>
 * <pre>
 * Weight parcel = Weight.ofPounds(1).add(Weight.ofKilograms(2)); // 2453.59237 g
 * parcel.isGreaterThan(Weight.ofKilograms(2)); // true
 * </pre>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public final class Weight implements Comparable<Weight> {

    public static final Weight ZERO = new Weight(0);
    public static final Weight MIN_VALUE = new Weight(0);
    public static final Weight MAX_VALUE = new Weight(Double.MAX_VALUE);

    private static final String DEFAULT_FORMAT = "g";

    private final double grams;

    private Weight(double grams) {
        this.grams = Magnitudes.clamp(grams);
    }

    /**
     * Weight 생성.
     *
     * @param value 값 (음수는 0으로 clamp)
     * @param unit 단위
     * @return Weight 인스턴스
     * @throws InvalidUnitException unit이 null인 경우
     */
    public static Weight of(double value, WeightUnit unit) {
        return new Weight(WeightUnit.require(unit).toGrams(Magnitudes.clamp(value)));
    }

    public static Weight ofMicrograms(double value) {
        return of(value, WeightUnit.MICROGRAM);
    }

    public static Weight ofMilligrams(double value) {
        return of(value, WeightUnit.MILLIGRAM);
    }

    public static Weight ofGrams(double value) {
        return of(value, WeightUnit.GRAM);
    }

    public static Weight ofKilograms(double value) {
        return of(value, WeightUnit.KILOGRAM);
    }

    public static Weight ofTons(double value) {
        return of(value, WeightUnit.TON);
    }

    public static Weight ofPounds(double value) {
        return of(value, WeightUnit.POUND);
    }

    public static Weight ofOunces(double value) {
        return of(value, WeightUnit.OUNCE);
    }

    public static Weight ofStones(double value) {
        return of(value, WeightUnit.STONE);
    }

    public static Weight ofCarats(double value) {
        return of(value, WeightUnit.CARAT);
    }

    public static Weight ofLongTons(double value) {
        return of(value, WeightUnit.LONG_TON);
    }

    public static Weight ofShortTons(double value) {
        return of(value, WeightUnit.SHORT_TON);
    }

    /**
     * 지정한 단위로 환산한 값 조회.
     *
     * @param unit 단위
     * @return 환산 값
     * @throws InvalidUnitException unit이 null인 경우
     */
    public double to(WeightUnit unit) {
        return WeightUnit.require(unit).fromGrams(grams);
    }

    public Weight with(double value, WeightUnit unit) {
        return of(value, unit);
    }

    public double getMicrograms() {
        return to(WeightUnit.MICROGRAM);
    }

    public Weight withMicrograms(double value) {
        return with(value, WeightUnit.MICROGRAM);
    }

    public double getMilligrams() {
        return to(WeightUnit.MILLIGRAM);
    }

    public Weight withMilligrams(double value) {
        return with(value, WeightUnit.MILLIGRAM);
    }

    /**
     * 그램 값 조회 (정규 단위, 환산 없음).
     *
     * @return 그램 값 (0 이상)
     */
    public double getGrams() {
        return grams;
    }

    public Weight withGrams(double value) {
        return with(value, WeightUnit.GRAM);
    }

    public double getKilograms() {
        return to(WeightUnit.KILOGRAM);
    }

    public Weight withKilograms(double value) {
        return with(value, WeightUnit.KILOGRAM);
    }

    public double getTons() {
        return to(WeightUnit.TON);
    }

    public Weight withTons(double value) {
        return with(value, WeightUnit.TON);
    }

    public double getPounds() {
        return to(WeightUnit.POUND);
    }

    public Weight withPounds(double value) {
        return with(value, WeightUnit.POUND);
    }

    public double getOunces() {
        return to(WeightUnit.OUNCE);
    }

    public Weight withOunces(double value) {
        return with(value, WeightUnit.OUNCE);
    }

    public double getStones() {
        return to(WeightUnit.STONE);
    }

    public Weight withStones(double value) {
        return with(value, WeightUnit.STONE);
    }

    public double getCarats() {
        return to(WeightUnit.CARAT);
    }

    public Weight withCarats(double value) {
        return with(value, WeightUnit.CARAT);
    }

    public double getLongTons() {
        return to(WeightUnit.LONG_TON);
    }

    public Weight withLongTons(double value) {
        return with(value, WeightUnit.LONG_TON);
    }

    public double getShortTons() {
        return to(WeightUnit.SHORT_TON);
    }

    public Weight withShortTons(double value) {
        return with(value, WeightUnit.SHORT_TON);
    }

    /**
     * 두 무게의 합 (그램 기준).
     *
     * @param other 더할 무게
     * @return 합계
     * @throws IllegalArgumentException other가 null인 경우
     */
    public Weight add(Weight other) {
        return ofGrams(grams + requireOther(other).grams);
    }

    /**
     * 두 무게의 차 (그램 기준, 음수면 0).
     *
     * @param other 뺄 무게
     * @return 차이 (0 이상)
     * @throws IllegalArgumentException other가 null인 경우
     */
    public Weight subtract(Weight other) {
        return ofGrams(grams - requireOther(other).grams);
    }

    public boolean isGreaterThan(Weight other) {
        return compareTo(other) > 0;
    }

    public boolean isLessThan(Weight other) {
        return compareTo(other) < 0;
    }

    /**
     * {@inheritDoc}
     *
     * @throws IllegalArgumentException other가 null인 경우
     */
    @Override
    public int compareTo(Weight other) {
        return Double.compare(grams, requireOther(other).grams);
    }

    /**
     * 지정한 단위로 포맷팅.
     *
     * @param format 단위 문자열 (null 또는 빈 문자열이면 "g")
     * @return "{값} {기호}" 형식 문자열
     * @throws UnitFormatException 알 수 없는 단위 문자열인 경우
     */
    public String toString(String format) {
        String resolved = format == null || format.isEmpty() ? DEFAULT_FORMAT : format;
        if (!WeightUnit.isValidUnitString(resolved)) {
            throw new UnitFormatException(resolved);
        }
        WeightUnit unit = WeightUnit.fromString(resolved);
        return Magnitudes.format(to(unit)) + " " + unit.toUnitString();
    }

    private static Weight requireOther(Weight other) {
        if (other == null) {
            throw new IllegalArgumentException("other cannot be null");
        }
        return other;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        Weight weight = (Weight) o;
        return Double.compare(grams, weight.grams) == 0;
    }

    @Override
    public int hashCode() {
        return Double.hashCode(grams);
    }

    @Override
    public String toString() {
        return toString(DEFAULT_FORMAT);
    }
}
