package com.solis.model;

import java.util.Locale;

public enum SignalFamily {
    REPOS("repos"),
    ONCHAIN("onchain"),
    DEX("dex"),
    TOKENS("tokens");

    private final String id;

    SignalFamily(String id) {
        this.id = id;
    }

    /** Short id used in config keys, cache namespaces and JSON. */
    public String id() {
        return id;
    }

    public static SignalFamily fromId(String raw) {
        String token = raw == null ? "" : raw.trim().toLowerCase(Locale.ROOT);
        for (SignalFamily family : values()) {
            if (family.id.equals(token)) {
                return family;
            }
        }
        throw new IllegalArgumentException("unknown signal family: " + raw);
    }
}
