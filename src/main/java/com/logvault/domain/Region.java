package com.logvault.domain;

import java.util.Locale;

/**
 * Rapid7 data storage regions. The code is the host prefix of the regional REST endpoint.
 */
public enum Region {
    US("us"),
    EU("eu"),
    CA("ca"),
    AP("ap"),
    AU("au");

    private final String code;

    Region(String code) {
        this.code = code;
    }

    public String getCode() {
        return code;
    }

    public static Region fromCode(String code) {
        if (code == null || code.isBlank()) {
            throw new IllegalArgumentException("Region code must not be blank");
        }
        String normalized = code.trim().toLowerCase(Locale.ROOT);
        for (Region region : values()) {
            if (region.code.equals(normalized)) {
                return region;
            }
        }
        throw new IllegalArgumentException(
            "Unknown data storage region '" + code + "'; expected one of us, eu, ca, ap, au");
    }
}
