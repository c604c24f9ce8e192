package com.ryuqq.commons.core.api;

/**
 * HTTP 상태 코드 분류 유틸리티.
 *
 * <p>유효 범위는 100~599이며, 2xx만 성공으로 간주합니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public final class HttpStatusCodes {

    public static final int OK = 200;
    public static final int UNAUTHORIZED = 401;
    public static final int FORBIDDEN = 403;
    public static final int NOT_FOUND = 404;
    public static final int INTERNAL_SERVER_ERROR = 500;

    private HttpStatusCodes() {
    }

    public static boolean isValid(int statusCode) {
        return statusCode >= 100 && statusCode < 600;
    }

    public static boolean isInformational(int statusCode) {
        return statusCode >= 100 && statusCode < 200;
    }

    public static boolean isSuccess(int statusCode) {
        return statusCode >= 200 && statusCode < 300;
    }

    public static boolean isRedirect(int statusCode) {
        return statusCode >= 300 && statusCode < 400;
    }

    public static boolean isClientError(int statusCode) {
        return statusCode >= 400 && statusCode < 500;
    }

    public static boolean isServerError(int statusCode) {
        return statusCode >= 500 && statusCode < 600;
    }

    public static boolean isNotFound(int statusCode) {
        return statusCode == NOT_FOUND;
    }

    public static boolean isUnauthorized(int statusCode) {
        return statusCode == UNAUTHORIZED;
    }

    public static boolean isForbidden(int statusCode) {
        return statusCode == FORBIDDEN;
    }

    public static boolean isInternalServerError(int statusCode) {
        return statusCode == INTERNAL_SERVER_ERROR;
    }

    /**
     * 성공 응답용 상태 코드 검증.
     *
     * @param statusCode 상태 코드
     * @throws InvalidStatusCodeException 100~599 범위 밖이거나 2xx가 아닌 경우
     */
    static void requireSuccess(int statusCode) {
        requireValid(statusCode);
        if (!isSuccess(statusCode)) {
            throw new InvalidStatusCodeException(statusCode, "does not indicate success");
        }
    }

    /**
     * 오류 응답용 상태 코드 검증.
     *
     * @param statusCode 상태 코드
     * @throws InvalidStatusCodeException 100~599 범위 밖이거나 2xx인 경우
     */
    static void requireError(int statusCode) {
        requireValid(statusCode);
        if (isSuccess(statusCode)) {
            throw new InvalidStatusCodeException(statusCode, "indicates success");
        }
    }

    private static void requireValid(int statusCode) {
        if (!isValid(statusCode)) {
            throw new InvalidStatusCodeException(statusCode, "is not a valid HTTP status code");
        }
    }
}
