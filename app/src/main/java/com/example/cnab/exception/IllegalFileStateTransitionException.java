package com.example.cnab.exception;

import com.example.cnab.model.FileStatus;

import java.util.UUID;

public class IllegalFileStateTransitionException extends IllegalStateException {

    private final UUID fileId;
    private final FileStatus from;
    private final FileStatus to;

    public IllegalFileStateTransitionException(UUID fileId, FileStatus from, FileStatus to) {
        super(String.format("Transição de status inválida para o arquivo %s: %s -> %s",
                fileId, from.getExternalName(), to.getExternalName()));
        this.fileId = fileId;
        this.from = from;
        this.to = to;
    }

    public UUID getFileId() {
        return fileId;
    }

    public FileStatus getFrom() {
        return from;
    }

    public FileStatus getTo() {
        return to;
    }
}
