package com.ryuqq.commons.core.api;

import java.util.Optional;
import java.util.function.BiConsumer;
import java.util.function.BiFunction;
import java.util.function.Function;

/**
 * 페이로드를 담는 API 응답.
 *
 * <p>{@link Success}는 null이 아닌 페이로드와 2xx 상태 코드를, {@link Error}는 2xx가 아닌
 * 상태 코드와 선택적 오류 메시지를 가집니다. 두 경우가 동시에 성립하는 인스턴스는 없습니다.</p>
 *
 * <p><strong>예시:</strong></p>
 * <pre>
 * PayloadApiResponse&lt;Order&gt; response = client.fetchOrder(id);
 * PayloadApiResponse&lt;OrderView&gt; view = response.into(OrderView::from);
 * </pre>
 *
 * @param <T> 페이로드 타입
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public sealed interface PayloadApiResponse<T> permits PayloadApiResponse.Success, PayloadApiResponse.Error {

    /**
     * 200 성공 응답 생성.
     *
     * @param payload 페이로드
     * @param <T> 페이로드 타입
     * @return Success 인스턴스
     * @throws IllegalArgumentException payload가 null인 경우
     */
    static <T> PayloadApiResponse<T> success(T payload) {
        return new Success<>(payload, HttpStatusCodes.OK);
    }

    /**
     * 성공 응답 생성.
     *
     * @param payload 페이로드
     * @param statusCode 2xx 상태 코드
     * @param <T> 페이로드 타입
     * @return Success 인스턴스
     * @throws InvalidStatusCodeException 100~599 범위 밖이거나 2xx가 아닌 경우
     * @throws IllegalArgumentException payload가 null인 경우
     */
    static <T> PayloadApiResponse<T> success(T payload, int statusCode) {
        return new Success<>(payload, statusCode);
    }

    static <T> PayloadApiResponse<T> error(int statusCode, String errorMessage) {
        return new Error<>(statusCode, errorMessage);
    }

    static <T> PayloadApiResponse<T> error(Throwable cause) {
        return error(HttpStatusCodes.INTERNAL_SERVER_ERROR, cause);
    }

    static <T> PayloadApiResponse<T> error(int statusCode, Throwable cause) {
        if (cause == null) {
            throw new IllegalArgumentException("cause cannot be null");
        }
        return new Error<>(statusCode, cause.getMessage());
    }

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
     * @param onSuccess 성공 핸들러 (페이로드, 상태 코드)
     * @param onError 오류 핸들러 (상태 코드, 오류 메시지 또는 빈 문자열)
     * @param <R> 반환 타입
     * @return 실행된 핸들러의 반환값
     * @throws IllegalArgumentException 핸들러가 null인 경우 (어느 핸들러도 실행되지 않음)
     */
    default <R> R match(
        BiFunction<? super T, Integer, ? extends R> onSuccess,
        BiFunction<Integer, String, ? extends R> onError
    ) {
        if (onSuccess == null) {
            throw new IllegalArgumentException("onSuccess cannot be null");
        }
        if (onError == null) {
            throw new IllegalArgumentException("onError cannot be null");
        }
        if (this instanceof Success<T> success) {
            return onSuccess.apply(success.payload(), success.statusCode());
        }
        Error<T> error = (Error<T>) this;
        return onError.apply(error.statusCode(), error.errorMessageOrEmpty());
    }

    default void consume(BiConsumer<? super T, Integer> onSuccess, BiConsumer<Integer, String> onError) {
        if (onSuccess == null) {
            throw new IllegalArgumentException("onSuccess cannot be null");
        }
        if (onError == null) {
            throw new IllegalArgumentException("onError cannot be null");
        }
        if (this instanceof Success<T> success) {
            onSuccess.accept(success.payload(), success.statusCode());
        } else {
            Error<T> error = (Error<T>) this;
            onError.accept(error.statusCode(), error.errorMessageOrEmpty());
        }
    }

    /**
     * 성공 페이로드를 변환한 새 응답 생성.
     *
     * <p>오류 응답은 상태 코드와 메시지를 그대로 유지하며 converter를 호출하지 않습니다.</p>
     *
     * @param converter 페이로드 변환 함수 (null 반환 불가)
     * @param <R> 변환된 페이로드 타입
     * @return 변환된 응답
     * @throws IllegalArgumentException converter가 null이거나 null을 반환한 경우
     */
    default <R> PayloadApiResponse<R> into(Function<? super T, ? extends R> converter) {
        if (converter == null) {
            throw new IllegalArgumentException("converter cannot be null");
        }
        if (this instanceof Success<T> success) {
            return new Success<>(converter.apply(success.payload()), success.statusCode());
        }
        Error<T> error = (Error<T>) this;
        return new Error<>(error.statusCode(), error.errorMessage());
    }

    /**
     * 성공 페이로드 조회.
     *
     * @return 페이로드
     * @throws IllegalStateException 오류 응답인 경우
     */
    default T unwrap() {
        if (this instanceof Success<T> success) {
            return success.payload();
        }
        throw new IllegalStateException(
            "Cannot unwrap payload of an error response (status: " + statusCode() + ")"
        );
    }

    /**
     * 성공 페이로드를 Optional로 조회.
     *
     * @return 성공이면 페이로드, 오류면 empty
     */
    default Optional<T> toOptional() {
        if (this instanceof Success<T> success) {
            return Optional.of(success.payload());
        }
        return Optional.empty();
    }

    /**
     * 성공 응답.
     *
     * @param payload 페이로드 (null 불가)
     * @param statusCode 2xx 상태 코드
     * @param <T> 페이로드 타입
     */
    record Success<T>(T payload, int statusCode) implements PayloadApiResponse<T> {

        /**
         * Compact Constructor.
         *
         * @throws InvalidStatusCodeException 100~599 범위 밖이거나 2xx가 아닌 경우
         * @throws IllegalArgumentException payload가 null인 경우
         */
        public Success {
            HttpStatusCodes.requireSuccess(statusCode);
            if (payload == null) {
                throw new IllegalArgumentException("payload cannot be null");
            }
        }
    }

    /**
     * 오류 응답.
     *
     * @param statusCode 2xx가 아닌 상태 코드
     * @param errorMessage 오류 메시지 (null 가능)
     * @param <T> 페이로드 타입
     */
    record Error<T>(int statusCode, String errorMessage) implements PayloadApiResponse<T> {

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
