/**
 * 성공/오류 API 응답 타입.
 *
 * <p>{@link com.ryuqq.commons.core.api.ApiResponse}와
 * {@link com.ryuqq.commons.core.api.PayloadApiResponse}는 sealed interface로,
 * 상태 코드 범위가 응답 종류와 항상 일치합니다.</p>
 */
package com.ryuqq.commons.core.api;
