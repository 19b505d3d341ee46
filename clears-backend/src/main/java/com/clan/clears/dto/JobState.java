package com.clan.clears.dto;

import com.fasterxml.jackson.annotation.JsonValue;

public enum JobState {
    PENDING,
    RUNNING,
    DONE;

    @JsonValue
    public String jsonValue() {
        return name().toLowerCase();
    }
}
