package com.example.cnab.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Arrays;

public enum NotificationType {
    PROCESSING_COMPLETED("ProcessingCompleted"),
    PROCESSING_FAILED("ProcessingFailed");

    private final String wireName;

    NotificationType(String wireName) {
        this.wireName = wireName;
    }

    @JsonValue
    public String getWireName() {
        return wireName;
    }

    @JsonCreator
    public static NotificationType fromWireName(String wireName) {
        return Arrays.stream(values())
                .filter(type -> type.wireName.equals(wireName) || type.name().equals(wireName))
                .findFirst()
                .orElseThrow(() -> new IllegalArgumentException("Tipo de notificação desconhecido: " + wireName));
    }
}
