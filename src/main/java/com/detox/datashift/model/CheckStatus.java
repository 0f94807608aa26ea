package com.detox.datashift.model;

import com.fasterxml.jackson.annotation.JsonValue;

public enum CheckStatus {
    SUCCESS("success"),
    NO_DATA("no_data"),
    ERROR("error");

    private final String wireName;

    CheckStatus(String wireName) {
        this.wireName = wireName;
    }

    @JsonValue
    public String wireName() {
        return wireName;
    }
}
