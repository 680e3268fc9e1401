package com.example.cnab.model;

import com.example.cnab.exception.IllegalFileStateTransitionException;
import jakarta.persistence.Column;
import jakarta.persistence.Convert;
import jakarta.persistence.Entity;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.UUID;

/**
 * Arquivo CNAB registrado pelo upload. O status só muda pelos métodos de transição abaixo.
 */
@Entity
@Table(name = "files")
@Getter
@Builder
@NoArgsConstructor(access = AccessLevel.PROTECTED)
@AllArgsConstructor
public class CnabFile {

    public static final int MAX_ERROR_MESSAGE_LENGTH = 1000;

    @Id
    private UUID id;

    @Column(name = "file_name", nullable = false)
    private String fileName;

    @Column(name = "size_bytes", nullable = false)
    private long sizeBytes;

    @Column(name = "object_key", nullable = false)
    private String objectKey;

    @Convert(converter = FileStatusConverter.class)
    @Column(name = "status", nullable = false, length = 20)
    private FileStatus status;

    @Column(name = "error_message", length = MAX_ERROR_MESSAGE_LENGTH)
    private String errorMessage;

    @Column(name = "uploaded_at", nullable = false)
    private Instant uploadedAt;

    @Column(name = "processed_at")
    private Instant processedAt;

    public void startProcessing() {
        requireStatus(FileStatus.UPLOADED, FileStatus.PROCESSING);
        this.status = FileStatus.PROCESSING;
    }

    public void markProcessed(Instant now) {
        requireStatus(FileStatus.PROCESSING, FileStatus.PROCESSED);
        this.status = FileStatus.PROCESSED;
        this.errorMessage = null;
        this.processedAt = now;
    }

    public void markRejected(String reason, Instant now) {
        requireStatus(FileStatus.PROCESSING, FileStatus.REJECTED);
        this.status = FileStatus.REJECTED;
        this.errorMessage = truncate(reason);
        this.processedAt = now;
    }

    private void requireStatus(FileStatus expected, FileStatus target) {
        if (status != expected) {
            throw new IllegalFileStateTransitionException(id, status, target);
        }
    }

    static String truncate(String reason) {
        if (reason == null || reason.length() <= MAX_ERROR_MESSAGE_LENGTH) {
            return reason;
        }
        return reason.substring(0, MAX_ERROR_MESSAGE_LENGTH);
    }
}
