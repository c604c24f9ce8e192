/**
 * 지리 좌표와 주소.
 */
package com.ryuqq.commons.core.geo;
