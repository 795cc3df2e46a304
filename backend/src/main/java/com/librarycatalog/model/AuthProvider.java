package com.librarycatalog.model;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Where a user's credentials live.
 */
public enum AuthProvider {

    GOOGLE("google"),
    LOCAL("local");

    private final String tag;

    AuthProvider(String tag) {
        this.tag = tag;
    }

    @JsonValue
    public String tag() {
        return tag;
    }
}
