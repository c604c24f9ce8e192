package com.ryuqq.commons.core.geo;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Address 테스트.
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
class AddressTest {

    @Test
    void constructor_NullFields_NormalizedToEmpty() {
        // When
        Address address = new Address(null, null, null, null, null, null);

        // Then
        assertEquals("", address.city());
        assertEquals(Address.EMPTY, address);
        assertTrue(address.isEmpty());
    }

    @Test
    void withCity_ReturnsNewInstance() {
        // Given
        Address address = Address.EMPTY.withCountry("DE");

        // When
        Address withCity = address.withCity("Berlin");

        // Then
        assertEquals("", address.city());
        assertEquals("Berlin", withCity.city());
        assertEquals("DE", withCity.country());
        assertFalse(withCity.isEmpty());
    }

    @Test
    void equals_AllFieldsCompared() {
        Address a = new Address("Main St 1", "", "Springfield", "12345", "IL", "US");
        Address b = new Address("Main St 1", null, "Springfield", "12345", "IL", "US");

        assertEquals(a, b);
        assertNotEquals(a, b.withPostalCode("54321"));
    }
}
