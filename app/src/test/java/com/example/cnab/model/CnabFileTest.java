package com.example.cnab.model;

import com.example.cnab.exception.IllegalFileStateTransitionException;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class CnabFileTest {

    private static final Instant NOW = Instant.parse("2024-03-10T15:00:00Z");

    private static CnabFile file(FileStatus status) {
        return CnabFile.builder()
                .id(UUID.randomUUID())
                .fileName("CNAB.txt")
                .sizeBytes(81)
                .objectKey("uploads/CNAB.txt")
                .status(status)
                .uploadedAt(NOW.minusSeconds(60))
                .build();
    }

    @Test
    void lifecycle_uploadedToProcessed() {
        CnabFile file = file(FileStatus.UPLOADED);

        file.startProcessing();
        assertThat(file.getStatus()).isEqualTo(FileStatus.PROCESSING);
        assertThat(file.getProcessedAt()).isNull();

        file.markProcessed(NOW);
        assertThat(file.getStatus()).isEqualTo(FileStatus.PROCESSED);
        assertThat(file.getProcessedAt()).isEqualTo(NOW);
        assertThat(file.getStatus().isTerminal()).isTrue();
    }

    @Test
    void markRejected_truncatesErrorMessage() {
        CnabFile file = file(FileStatus.PROCESSING);

        file.markRejected("x".repeat(1500), NOW);

        assertThat(file.getStatus()).isEqualTo(FileStatus.REJECTED);
        assertThat(file.getErrorMessage()).hasSize(CnabFile.MAX_ERROR_MESSAGE_LENGTH);
        assertThat(file.getProcessedAt()).isEqualTo(NOW);
    }

    @Test
    void terminalStatesCannotTransition() {
        CnabFile processed = file(FileStatus.PROCESSED);
        CnabFile rejected = file(FileStatus.REJECTED);

        assertThatThrownBy(processed::startProcessing)
                .isInstanceOf(IllegalFileStateTransitionException.class)
                .hasMessageContaining("Processed -> Processing");
        assertThatThrownBy(() -> rejected.markProcessed(NOW))
                .isInstanceOf(IllegalFileStateTransitionException.class);
        assertThatThrownBy(() -> processed.markRejected("erro", NOW))
                .isInstanceOf(IllegalFileStateTransitionException.class);
    }

    @Test
    void uploadedFileCannotSkipProcessing() {
        CnabFile file = file(FileStatus.UPLOADED);

        assertThatThrownBy(() -> file.markProcessed(NOW))
                .isInstanceOf(IllegalFileStateTransitionException.class)
                .satisfies(e -> {
                    IllegalFileStateTransitionException transition = (IllegalFileStateTransitionException) e;
                    assertThat(transition.getFrom()).isEqualTo(FileStatus.UPLOADED);
                    assertThat(transition.getTo()).isEqualTo(FileStatus.PROCESSED);
                });
        assertThat(file.getStatus()).isEqualTo(FileStatus.UPLOADED);
    }

    @Test
    void statusConverterUsesExternalVocabulary() {
        FileStatusConverter converter = new FileStatusConverter();

        assertThat(converter.convertToDatabaseColumn(FileStatus.PROCESSING)).isEqualTo("Processing");
        assertThat(converter.convertToEntityAttribute("Rejected")).isEqualTo(FileStatus.REJECTED);
    }
}
