package com.example.cnab.model;

import com.fasterxml.jackson.annotation.JsonAlias;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.UUID;

/**
 * Mensagem publicada pelo upload na fila de processamento.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class FileProcessingMessage {
    private UUID fileId;
    @JsonAlias("s3Key")
    private String objectKey;
    private String fileName;
    private Instant uploadedAt;
    private String correlationId;
}
