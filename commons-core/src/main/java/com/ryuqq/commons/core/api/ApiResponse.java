package com.ryuqq.commons.core.api;

import java.util.function.BiConsumer;
import java.util.function.BiFunction;
import java.util.function.IntConsumer;
import java.util.function.IntFunction;

/**
 * 페이로드 없는 API 응답.
 *
 * <p>ApiResponse는 두 가지 가능한 결과를 나타냅니다:</p>
 * <ul>
 *   <li>{@link Success}: 2xx 상태 코드</li>
 *   <li>{@link Error}: 2xx가 아닌 상태 코드와 선택적 오류 메시지</li>
 * </ul>
 *
 * <p>100~599 범위 밖의 상태 코드로는 어떤 인스턴스도 생성되지 않습니다.</p>
 *
 * <p><strong>예시:</strong></p>
 * <pre>
 * ApiResponse response = ApiResponse.error(404, "order not found");
 * String text = response.match(
 *     code -> "OK " + code,
 *     (code, message) -> "FAILED " + code + ": " + message
 * );
 * </pre>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public sealed interface ApiResponse permits ApiResponse.Success, ApiResponse.Error {

    /**
     * 200 성공 응답 생성.
     *
     * @return Success 인스턴스
     */
    static ApiResponse success() {
        return new Success(HttpStatusCodes.OK);
    }

    /**
     * 성공 응답 생성.
     *
     * @param statusCode 2xx 상태 코드
     * @return Success 인스턴스
     * @throws InvalidStatusCodeException 100~599 범위 밖이거나 2xx가 아닌 경우
     */
    static ApiResponse success(int statusCode) {
        return new Success(statusCode);
    }

    /**
     * 오류 응답 생성.
     *
     * @param statusCode 2xx가 아닌 상태 코드
     * @param errorMessage 오류 메시지 (null 허용)
     * @return Error 인스턴스
     * @throws InvalidStatusCodeException 100~599 범위 밖이거나 2xx인 경우
     */
    static ApiResponse error(int statusCode, String errorMessage) {
        return new Error(statusCode, errorMessage);
    }

    /**
     * 예외로부터 500 오류 응답 생성.
     *
     * @param cause 원인 예외
     * @return 예외 메시지를 담은 Error 인스턴스
     * @throws IllegalArgumentException cause가 null인 경우
     */
    static ApiResponse error(Throwable cause) {
        return error(HttpStatusCodes.INTERNAL_SERVER_ERROR, cause);
    }

    static ApiResponse error(int statusCode, Throwable cause) {
        if (cause == null) {
            throw new IllegalArgumentException("cause cannot be null");
        }
        return new Error(statusCode, cause.getMessage());
    }

    /**
     * HTTP 상태 코드.
     *
     * @return 100~599 범위의 상태 코드
     */
    int statusCode();

    default boolean isSuccess() {
        return this instanceof Success;
    }

    default boolean isError() {
        return this instanceof Error;
    }

    /**
     * 결과에 따라 핸들러 하나를 실행하고 그 값을 반환.
     *
     * <p>두 핸들러 모두 실행 전에 검증되므로, null 핸들러가 있으면 어느 쪽도 실행되지 않습니다.
     * 오류 메시지가 없으면 onError에는 빈 문자열이 전달됩니다.</p>
     *
     * @param onSuccess 성공 핸들러 (상태 코드)
     * @param onError 오류 핸들러 (상태 코드, 오류 메시지)
     * @param <R> 반환 타입
     * @return 실행된 핸들러의 반환값
     * @throws IllegalArgumentException 핸들러가 null인 경우
     */
    default <R> R match(IntFunction<? extends R> onSuccess, BiFunction<Integer, String, ? extends R> onError) {
        if (onSuccess == null) {
            throw new IllegalArgumentException("onSuccess cannot be null");
        }
        if (onError == null) {
            throw new IllegalArgumentException("onError cannot be null");
        }
        if (this instanceof Error error) {
            return onError.apply(error.statusCode(), error.errorMessageOrEmpty());
        }
        return onSuccess.apply(statusCode());
    }

    /**
     * 반환값 없는 {@link #match}.
     *
     * @param onSuccess 성공 핸들러 (상태 코드)
     * @param onError 오류 핸들러 (상태 코드, 오류 메시지)
     * @throws IllegalArgumentException 핸들러가 null인 경우
     */
    default void consume(IntConsumer onSuccess, BiConsumer<Integer, String> onError) {
        if (onSuccess == null) {
            throw new IllegalArgumentException("onSuccess cannot be null");
        }
        if (onError == null) {
            throw new IllegalArgumentException("onError cannot be null");
        }
        if (this instanceof Error error) {
            onError.accept(error.statusCode(), error.errorMessageOrEmpty());
        } else {
            onSuccess.accept(statusCode());
        }
    }

    /**
     * 성공 응답.
     *
     * @param statusCode 2xx 상태 코드
     */
    record Success(int statusCode) implements ApiResponse {

        /**
         * Compact Constructor.
         *
         * @throws InvalidStatusCodeException 100~599 범위 밖이거나 2xx가 아닌 경우
         */
        public Success {
            HttpStatusCodes.requireSuccess(statusCode);
        }
    }

    /**
     * 오류 응답.
     *
     * @param statusCode 2xx가 아닌 상태 코드
     * @param errorMessage 오류 메시지 (null 가능)
     */
    record Error(int statusCode, String errorMessage) implements ApiResponse {

        /**
         * Compact Constructor.
         *
         * @throws InvalidStatusCodeException 100~599 범위 밖이거나 2xx인 경우
         */
        public Error {
            HttpStatusCodes.requireError(statusCode);
        }

        String errorMessageOrEmpty() {
            return errorMessage == null ? "" : errorMessage;
        }
    }
}
