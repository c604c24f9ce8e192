package com.ryuqq.commons.core.geo;

/**
 * 우편 주소.
 *
 * <p>모든 필드는 null 대신 빈 문자열로 정규화됩니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public record Address(
    String addressLine1,
    String addressLine2,
    String city,
    String postalCode,
    String stateOrProvince,
    String country
) {

    public static final Address EMPTY = new Address("", "", "", "", "", "");

    public Address {
        addressLine1 = nullToEmpty(addressLine1);
        addressLine2 = nullToEmpty(addressLine2);
        city = nullToEmpty(city);
        postalCode = nullToEmpty(postalCode);
        stateOrProvince = nullToEmpty(stateOrProvince);
        country = nullToEmpty(country);
    }

    public boolean isEmpty() {
        return equals(EMPTY);
    }

    public Address withAddressLine1(String value) {
        return new Address(value, addressLine2, city, postalCode, stateOrProvince, country);
    }

    public Address withAddressLine2(String value) {
        return new Address(addressLine1, value, city, postalCode, stateOrProvince, country);
    }

    public Address withCity(String value) {
        return new Address(addressLine1, addressLine2, value, postalCode, stateOrProvince, country);
    }

    public Address withPostalCode(String value) {
        return new Address(addressLine1, addressLine2, city, value, stateOrProvince, country);
    }

    public Address withStateOrProvince(String value) {
        return new Address(addressLine1, addressLine2, city, postalCode, value, country);
    }

    public Address withCountry(String value) {
        return new Address(addressLine1, addressLine2, city, postalCode, stateOrProvince, value);
    }

    private static String nullToEmpty(String value) {
        return value == null ? "" : value;
    }
}
