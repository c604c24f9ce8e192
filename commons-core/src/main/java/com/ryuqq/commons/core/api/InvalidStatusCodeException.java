package com.ryuqq.commons.core.api;

/**
 * 응답 종류에 맞지 않는 HTTP 상태 코드.
 *
 * <p>100~599 범위 밖의 코드, 2xx가 아닌 성공 응답, 2xx인 오류 응답에서 발생합니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public class InvalidStatusCodeException extends IllegalArgumentException {

    private final int statusCode;

    /**
     * InvalidStatusCodeException 생성.
     *
     * @param statusCode 거부된 상태 코드
     * @param reason 거부 사유
     */
    public InvalidStatusCodeException(int statusCode, String reason) {
        super("The status code " + reason + " (current: " + statusCode + ")");
        this.statusCode = statusCode;
    }

    public int getStatusCode() {
        return statusCode;
    }
}
