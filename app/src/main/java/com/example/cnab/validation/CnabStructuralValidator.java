package com.example.cnab.validation;

import com.example.cnab.config.IngestionProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Validação estrutural de um arquivo CNAB, feita em uma única passada sobre os bytes:
 * tamanho total, linhas de exatamente 80 bytes, apenas ASCII e ao menos uma linha.
 * Linhas terminam em {@code \n}; um {@code \r} imediatamente antes é descartado e a quebra
 * de linha final não cria uma linha extra.
 */
@Component
public class CnabStructuralValidator {

    private static final Logger log = LoggerFactory.getLogger(CnabStructuralValidator.class);

    public static final int LINE_LENGTH = 80;
    private static final int BUFFER_SIZE = 8192;

    private final long maxFileSizeBytes;

    @Autowired
    public CnabStructuralValidator(IngestionProperties properties) {
        this(properties.getMaxFileSizeBytes());
    }

    public CnabStructuralValidator(long maxFileSizeBytes) {
        this.maxFileSizeBytes = maxFileSizeBytes;
    }

    public ValidationResult validate(byte[] content) {
        Objects.requireNonNull(content, "content");
        if (content.length > maxFileSizeBytes) {
            return ValidationResult.failure(IngestionError.structural(null, String.format(
                    "Tamanho do arquivo %d bytes excede o máximo de %d bytes", content.length, maxFileSizeBytes)));
        }
        try {
            return validate(new ByteArrayInputStream(content));
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }

    /**
     * Lê o fluxo até o fim, ou até ultrapassar o tamanho máximo, quando a leitura é interrompida.
     */
    public ValidationResult validate(InputStream input) throws IOException {
        Objects.requireNonNull(input, "input");
        List<IngestionError> errors = new ArrayList<>();
        LineState line = new LineState();
        byte[] buffer = new byte[BUFFER_SIZE];
        long totalBytes = 0;
        int lineNumber = 0;
        int read;

        while ((read = input.read(buffer)) != -1) {
            totalBytes += read;
            if (totalBytes > maxFileSizeBytes) {
                log.warn("Leitura interrompida: arquivo ultrapassou {} bytes.", maxFileSizeBytes);
                return ValidationResult.failure(IngestionError.structural(null, String.format(
                        "Arquivo excede o tamanho máximo de %d bytes", maxFileSizeBytes)));
            }
            for (int i = 0; i < read; i++) {
                byte b = buffer[i];
                if (b == '\n') {
                    lineNumber++;
                    line.finish(lineNumber, errors);
                } else {
                    line.accept(b);
                }
            }
        }

        if (line.hasBytes()) {
            lineNumber++;
            line.finish(lineNumber, errors);
        }
        if (lineNumber == 0) {
            errors.add(IngestionError.structural(null, "Arquivo não contém linhas de transação"));
        }

        if (errors.isEmpty()) {
            log.debug("Validação estrutural concluída: {} linhas, {} bytes.", lineNumber, totalBytes);
            return ValidationResult.success();
        }
        log.info("Validação estrutural encontrou {} erro(s) em {} linhas.", errors.size(), lineNumber);
        return ValidationResult.failure(errors);
    }

    private static final class LineState {
        private int length;
        private boolean lastWasCarriageReturn;
        private int nonAsciiPosition = -1;
        private int nonAsciiCode;

        void accept(byte b) {
            length++;
            lastWasCarriageReturn = b == '\r';
            int code = b & 0xFF;
            if (code > 127 && nonAsciiPosition < 0) {
                nonAsciiPosition = length;
                nonAsciiCode = code;
            }
        }

        boolean hasBytes() {
            return length > 0;
        }

        void finish(int lineNumber, List<IngestionError> errors) {
            int effectiveLength = lastWasCarriageReturn ? length - 1 : length;
            if (effectiveLength != LINE_LENGTH) {
                errors.add(IngestionError.structural(lineNumber, String.format(
                        "esperado %d bytes, encontrado %d bytes", LINE_LENGTH, effectiveLength)));
            }
            if (nonAsciiPosition > 0) {
                errors.add(IngestionError.structural(lineNumber, String.format(
                        "caractere não ASCII (código %d) na posição %d", nonAsciiCode, nonAsciiPosition)));
            }
            length = 0;
            lastWasCarriageReturn = false;
            nonAsciiPosition = -1;
            nonAsciiCode = 0;
        }
    }
}
