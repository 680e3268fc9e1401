package com.example.cnab.config;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Positive;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;
import org.springframework.validation.annotation.Validated;

@Data
@Component
@Validated
@ConfigurationProperties(prefix = "app.ingestion")
public class IngestionProperties {

    @NotBlank(message = "O nome do bucket S3 dos arquivos CNAB não pode estar em branco.")
    private String bucketName;

    @Positive(message = "O tamanho máximo do arquivo deve ser positivo.")
    private long maxFileSizeBytes = 10L * 1024 * 1024;

    @NotBlank(message = "O fuso horário de referência não pode estar em branco.")
    private String zoneId = "America/Sao_Paulo";
}
