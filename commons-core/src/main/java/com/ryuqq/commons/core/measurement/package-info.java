/**
 * 물리량 값 객체.
 *
 * <p>{@link com.ryuqq.commons.core.measurement.Distance},
 * {@link com.ryuqq.commons.core.measurement.Weight},
 * {@link com.ryuqq.commons.core.measurement.Volume},
 * {@link com.ryuqq.commons.core.measurement.Temperature}는 값을 각자의 정규 단위
 * (미터, 그램, 세제곱미터, 켈빈)로 저장하며, 음수와 NaN은 0으로 clamp됩니다.</p>
 *
 * <p>단위 문자열은 대소문자와 공백을 무시하고 별칭까지 해석합니다
 * (예: {@code "Kilo Meters"}, {@code "KM"} → {@link com.ryuqq.commons.core.measurement.DistanceUnit#KILOMETER}).</p>
 */
package com.ryuqq.commons.core.measurement;
