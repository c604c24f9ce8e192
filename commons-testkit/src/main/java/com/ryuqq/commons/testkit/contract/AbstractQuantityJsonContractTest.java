package com.ryuqq.commons.testkit.contract;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.exc.InvalidFormatException;
import com.fasterxml.jackson.databind.exc.MismatchedInputException;
import com.fasterxml.jackson.databind.exc.UnrecognizedPropertyException;
import com.ryuqq.commons.core.measurement.InvalidUnitException;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Quantity JSON Contract Test.
 *
 * <p>Every quantity codec must satisfy:</p>
 * <ul>
 *   <li>Writes exactly {@code value} then {@code unit}, value in the canonical unit</li>
 *   <li>The written unit is the fixed wire symbol regardless of the construction unit</li>
 *   <li>Reads any unit alias; a missing unit means the canonical unit, a missing value means 0</li>
 *   <li>Rejects unknown properties, unknown units and non-object input</li>
 * </ul>
 *
 * @param <Q> quantity type
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public abstract class AbstractQuantityJsonContractTest<Q> extends AbstractJsonContractTest {

    protected abstract Class<Q> quantityType();

    /**
     * A non-zero quantity built from a non-canonical unit.
     */
    protected abstract Q sample();

    protected abstract double canonicalValue(Q quantity);

    protected abstract String wireUnit();

    /**
     * A unit alias other than the wire symbol, e.g. "Kilo Meters".
     */
    protected abstract String aliasUnit();

    /**
     * The quantity expected when reading {@code value} in {@link #aliasUnit()}.
     */
    protected abstract Q fromAlias(double value);

    protected abstract Q zero();

    @Test
    void serialize_WritesCanonicalValueAndWireUnit() throws Exception {
        // Given
        Q quantity = sample();

        // When
        JsonNode node = tree(quantity);

        // Then
        List<String> names = new ArrayList<>();
        node.fieldNames().forEachRemaining(names::add);
        assertThat(names).containsExactly("value", "unit");
        assertThat(node.get("value").asDouble()).isEqualTo(canonicalValue(quantity));
        assertThat(node.get("unit").asText()).isEqualTo(wireUnit());
    }

    @Test
    void roundTrip_PreservesQuantity() throws Exception {
        // Given
        Q quantity = sample();

        // When
        Q restored = fromJson(toJson(quantity), quantityType());

        // Then
        assertThat(restored).isEqualTo(quantity);
    }

    @Test
    void deserialize_AliasUnit_Converts() throws Exception {
        // When
        Q quantity = fromJson(json("{'value': 2, 'unit': '" + aliasUnit() + "'}"), quantityType());

        // Then
        assertThat(quantity).isEqualTo(fromAlias(2));
    }

    @Test
    void deserialize_PropertiesInAnyOrder() throws Exception {
        Q quantity = fromJson(json("{'unit': '" + aliasUnit() + "', 'value': 2}"), quantityType());

        assertThat(quantity).isEqualTo(fromAlias(2));
    }

    @Test
    void deserialize_MissingUnit_UsesCanonicalUnit() throws Exception {
        // When
        Q quantity = fromJson(json("{'value': 3}"), quantityType());

        // Then
        assertThat(canonicalValue(quantity)).isEqualTo(3.0);
    }

    @Test
    void deserialize_MissingValue_IsZero() throws Exception {
        assertThat(fromJson(json("{'unit': '" + wireUnit() + "'}"), quantityType())).isEqualTo(zero());
        assertThat(fromJson("{}", quantityType())).isEqualTo(zero());
    }

    @Test
    void deserialize_NegativeValue_ClampsToZero() throws Exception {
        assertThat(fromJson(json("{'value': -10, 'unit': '" + wireUnit() + "'}"), quantityType())).isEqualTo(zero());
    }

    @Test
    void deserialize_UnknownProperty_Fails() {
        assertThatThrownBy(() -> fromJson(json("{'value': 1, 'precision': 2}"), quantityType()))
            .isInstanceOf(UnrecognizedPropertyException.class)
            .hasMessageContaining("precision");
    }

    @Test
    void deserialize_UnknownUnit_FailsWithInvalidUnitCause() {
        assertThatThrownBy(() -> fromJson(json("{'value': 1, 'unit': 'bogus'}"), quantityType()))
            .isInstanceOf(InvalidFormatException.class)
            .hasCauseInstanceOf(InvalidUnitException.class)
            .hasMessageContaining("bogus");
    }

    @Test
    void deserialize_NonNumericValue_Fails() {
        assertThatThrownBy(() -> fromJson(json("{'value': 'ten'}"), quantityType()))
            .isInstanceOf(MismatchedInputException.class);
    }

    @Test
    void deserialize_NonStringUnit_Fails() {
        assertThatThrownBy(() -> fromJson(json("{'unit': 5}"), quantityType()))
            .isInstanceOf(MismatchedInputException.class);
    }

    @Test
    void deserialize_NonObject_Fails() {
        assertThatThrownBy(() -> fromJson("[1, 2]", quantityType()))
            .isInstanceOf(MismatchedInputException.class);
    }

    @Test
    void deserialize_TruncatedInput_Fails() {
        assertThatThrownBy(() -> fromJson(json("{'value': 1"), quantityType()))
            .isInstanceOf(JsonProcessingException.class);
    }
}
