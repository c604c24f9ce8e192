/**
 * 날짜/시간 구간 타입.
 */
package com.ryuqq.commons.core.time;
