/**
 * Commons 값 타입의 Jackson 매핑.
 *
 * <p>진입점은 {@link com.ryuqq.commons.jackson.CommonsModule} 하나이며, 나머지 codec 클래스는
 * 패키지 내부 구현입니다.</p>
 */
package com.ryuqq.commons.jackson;
