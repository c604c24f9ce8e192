package com.ryuqq.commons.core.measurement;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

/**
 * TemperatureRange 테스트.
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
@DisplayName("TemperatureRange 테스트")
class TemperatureRangeTest {

    @Test
    @DisplayName("냉장 범위는 양 끝을 포함한다")
    void contains_냉장_범위_양_끝_포함() {
        // given
        TemperatureRange chilled = new TemperatureRange(Temperature.ofCelsius(2), Temperature.ofCelsius(8));

        // then
        assertTrue(chilled.contains(Temperature.ofCelsius(2)));
        assertTrue(chilled.contains(Temperature.ofCelsius(5)));
        assertTrue(chilled.contains(Temperature.ofCelsius(8)));
        assertFalse(chilled.contains(Temperature.ofCelsius(9)));
    }

    @Test
    @DisplayName("min이 max보다 크면 예외가 발생한다")
    void 생성_min이_max보다_크면_예외() {
        // when & then
        IllegalArgumentException exception = assertThrows(
            IllegalArgumentException.class,
            () -> new TemperatureRange(Temperature.ofCelsius(8), Temperature.ofCelsius(2))
        );
        assertTrue(exception.getMessage().contains("less than or equal"));
    }

    @Test
    @DisplayName("null 경계는 허용하지 않는다")
    void 생성_null_경계_예외() {
        assertThrows(IllegalArgumentException.class, () -> new TemperatureRange(null, Temperature.MAX_VALUE));
        assertThrows(IllegalArgumentException.class, () -> new TemperatureRange(Temperature.MIN_VALUE, null));
    }

    @Test
    @DisplayName("DEFAULT는 절대영도부터 최대값까지다")
    void default_전체_범위() {
        assertEquals(Temperature.ABSOLUTE_ZERO, TemperatureRange.DEFAULT.min());
        assertEquals(Temperature.MAX_VALUE, TemperatureRange.DEFAULT.max());
        assertFalse(TemperatureRange.DEFAULT.isSingleTemperature());
    }

    @Test
    @DisplayName("min과 max가 같으면 단일 온도 범위다")
    void isSingleTemperature_같은_경계() {
        TemperatureRange range = new TemperatureRange(Temperature.ofKelvin(250), Temperature.ofKelvin(250));
        assertTrue(range.isSingleTemperature());
    }
}
