package com.fastchat.memory.api.dto;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

public enum BranchAction {
    CREATE, SWITCH, MERGE, ARCHIVE, DELETE, EDIT;

    @JsonValue
    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }

    @JsonCreator
    public static BranchAction fromWire(String value) {
        return BranchAction.valueOf(value.trim().toUpperCase(Locale.ROOT));
    }
}
