package com.vrwx.core.domain;

import java.util.Locale;
import java.util.Objects;
import java.util.regex.Pattern;

/**
 * 20-byte account address in lowercase 0x-prefixed hex form.
 * Equality is case-insensitive because the value is normalized on construction.
 */
public record Address(String value) {

    private static final Pattern HEX_ADDRESS = Pattern.compile("^0x[0-9a-f]{40}$");

    public static final Address ZERO = new Address("0x0000000000000000000000000000000000000000");

    public Address {
        Objects.requireNonNull(value, "Address cannot be null");
        value = value.trim().toLowerCase(Locale.ROOT);
        if (!value.startsWith("0x")) {
            value = "0x" + value;
        }
        if (!HEX_ADDRESS.matcher(value).matches()) {
            throw new IllegalArgumentException("Not a 20-byte hex address: " + value);
        }
    }

    public static Address of(String value) {
        return new Address(value);
    }

    public boolean isZero() {
        return ZERO.equals(this);
    }

    @Override
    public String toString() {
        return value;
    }
}
