package com.ryuqq.commons.core.measurement;

/**
 * 인식할 수 없는 단위 문자열 또는 단위 enum 값.
 *
 * <p>단위 파싱({@code fromString}), 단위 포맷팅, 단위를 받는 팩토리에서 발생합니다.
 * 입력 오류이므로 복구 대상이 아니며, 확실하지 않은 입력은 호출 전에
 * {@code isValidUnitString}으로 검증해야 합니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public class InvalidUnitException extends IllegalArgumentException {

    private final String unit;

    /**
     * InvalidUnitException 생성.
     *
     * @param quantity 단위 계열 이름 (예: "distance")
     * @param unit 거부된 단위 문자열 (null 가능)
     */
    public InvalidUnitException(String quantity, String unit) {
        super("Invalid " + quantity + " unit: " + unit);
        this.unit = unit;
    }

    /**
     * 거부된 단위 문자열 조회.
     *
     * @return 단위 문자열 (null 가능)
     */
    public String getUnit() {
        return unit;
    }
}
