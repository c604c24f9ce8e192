package com.ryuqq.commons.core.measurement;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Temperature Value Object 테스트.
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
class TemperatureTest {

    private static final double DELTA = 1e-9;

    @Test
    void ofCelsius_Zero_Is27315Kelvin() {
        assertEquals(273.15, Temperature.ofCelsius(0).getKelvin());
    }

    @Test
    void ofFahrenheit_Freezing_IsZeroCelsius() {
        assertEquals(0.0, Temperature.ofFahrenheit(32).getCelsius(), DELTA);
    }

    @Test
    void getFahrenheit_Boiling_Is212() {
        assertEquals(212.0, Temperature.ofCelsius(100).getFahrenheit(), DELTA);
    }

    @Test
    void of_BelowAbsoluteZero_ClampsToAbsoluteZero() {
        // When
        Temperature temperature = Temperature.ofCelsius(-300);

        // Then
        assertEquals(Temperature.ABSOLUTE_ZERO, temperature);
        assertEquals(0.0, temperature.getKelvin());
        assertEquals(Temperature.MIN_VALUE, Temperature.ofKelvin(-1));
    }

    @Test
    void of_NullUnit_ThrowsInvalidUnitException() {
        assertThrows(InvalidUnitException.class, () -> Temperature.of(10, null));
    }

    @Test
    void toString_CelsiusFormat_EndsWithDegreeSymbol() {
        // When
        String text = Temperature.ofKelvin(0).toString("C");

        // Then
        assertEquals("-273.15 °C", text);
        assertTrue(text.endsWith("°C"));
    }

    @Test
    void toString_KelvinFormat_UsesPlainK() {
        assertEquals("300 K", Temperature.ofKelvin(300).toString("kelvin"));
    }

    @Test
    void toString_UnknownFormat_ThrowsUnitFormatException() {
        assertThrows(UnitFormatException.class, () -> Temperature.ofKelvin(1).toString("rankine"));
    }

    @Test
    void compareTo_OrdersByKelvin() {
        // Given
        Temperature cold = Temperature.ofFahrenheit(0);
        Temperature warm = Temperature.ofCelsius(20);

        // Then
        assertTrue(warm.isGreaterThan(cold));
        assertTrue(cold.isLessThan(warm));
        assertThrows(IllegalArgumentException.class, () -> warm.compareTo(null));
    }

    @Test
    void withCelsius_ReturnsNewInstance() {
        // Given
        Temperature original = Temperature.ofKelvin(10);

        // When
        Temperature replaced = original.withCelsius(0);

        // Then
        assertEquals(10.0, original.getKelvin());
        assertEquals(273.15, replaced.getKelvin());
    }

    @ParameterizedTest
    @CsvSource({
        "°C, CELSIUS",
        "c, CELSIUS",
        "Celsius, CELSIUS",
        "' °F ', FAHRENHEIT",
        "fahrenheit, FAHRENHEIT",
        "K, KELVIN",
        "KELVIN, KELVIN"
    })
    void fromString_Aliases_ResolveUnit(String text, TemperatureUnit expected) {
        assertEquals(expected, TemperatureUnit.fromString(text));
    }

    @Test
    void fromString_InternalSpace_IsRejected() {
        assertFalse(TemperatureUnit.isValidUnitString("kel vin"));
        assertThrows(InvalidUnitException.class, () -> TemperatureUnit.fromString("kel vin"));
    }

    @Test
    void format_ReturnsDisplaySymbol() {
        assertEquals("°F", TemperatureUnit.format(TemperatureUnit.FAHRENHEIT));
        assertEquals("K", TemperatureUnit.KELVIN.toUnitString());
    }
}
