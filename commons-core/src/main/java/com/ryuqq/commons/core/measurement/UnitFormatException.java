package com.ryuqq.commons.core.measurement;

/**
 * {@code toString(format)}에 전달된 포맷 문자열이 단위 문자열이 아닌 경우.
 *
 * <p>{@link InvalidUnitException}과 원인은 같지만, 포맷팅 경로의 오류를
 * 하나의 타입으로 잡을 수 있도록 별도 타입으로 보고합니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public class UnitFormatException extends IllegalArgumentException {

    private final String format;

    /**
     * UnitFormatException 생성.
     *
     * @param format 거부된 포맷 문자열
     */
    public UnitFormatException(String format) {
        super("Invalid format string: " + format);
        this.format = format;
    }

    /**
     * 거부된 포맷 문자열 조회.
     *
     * @return 포맷 문자열
     */
    public String getFormat() {
        return format;
    }
}
