package com.example.cnab.model;

import java.util.Arrays;

/**
 * Ciclo de vida de um arquivo CNAB: Uploaded → Processing → Processed | Rejected.
 */
public enum FileStatus {
    UPLOADED("Uploaded"),
    PROCESSING("Processing"),
    PROCESSED("Processed"),
    REJECTED("Rejected");

    private final String externalName;

    FileStatus(String externalName) {
        this.externalName = externalName;
    }

    public String getExternalName() {
        return externalName;
    }

    public boolean isTerminal() {
        return this == PROCESSED || this == REJECTED;
    }

    public static FileStatus fromExternalName(String externalName) {
        return Arrays.stream(values())
                .filter(status -> status.externalName.equalsIgnoreCase(externalName))
                .findFirst()
                .orElseThrow(() -> new IllegalArgumentException("Status de arquivo desconhecido: " + externalName));
    }
}
