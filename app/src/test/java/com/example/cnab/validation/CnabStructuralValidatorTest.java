package com.example.cnab.validation;

import com.example.cnab.support.CnabLines;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;

import static org.assertj.core.api.Assertions.assertThat;

class CnabStructuralValidatorTest {

    private static final String VALID_LINE = CnabLines.line(3, "20190301", 14200, "153453", "JOAO MACEDO", "BAR DO JOAO");

    private final CnabStructuralValidator validator = new CnabStructuralValidator(10L * 1024 * 1024);

    @Test
    void validate_acceptsWellFormedFile() {
        ValidationResult result = validator.validate(CnabLines.acmeExample());

        assertThat(result.isValid()).isTrue();
        assertThat(result.getErrors()).isEmpty();
    }

    @Test
    void validate_acceptsCrLfAndMissingFinalNewline() {
        byte[] content = (VALID_LINE + "\r\n" + VALID_LINE).getBytes(StandardCharsets.US_ASCII);

        assertThat(validator.validate(content).isValid()).isTrue();
    }

    @Test
    void validate_reportsShortLineWithLineNumber() {
        byte[] content = CnabLines.file(VALID_LINE, VALID_LINE.substring(0, 79), VALID_LINE);

        ValidationResult result = validator.validate(content);

        assertThat(result.isValid()).isFalse();
        assertThat(result.getErrors()).hasSize(1);
        IngestionError error = result.getErrors().get(0);
        assertThat(error.getCategory()).isEqualTo(ErrorCategory.STRUCTURAL);
        assertThat(error.getLineNumber()).isEqualTo(2);
        assertThat(result.describe()).isEqualTo("Linha 2: esperado 80 bytes, encontrado 79 bytes");
    }

    @Test
    void validate_accumulatesErrorsFromEveryLine() {
        byte[] content = CnabLines.file(VALID_LINE + "X", VALID_LINE, "", VALID_LINE.substring(0, 40));

        ValidationResult result = validator.validate(content);

        assertThat(result.getErrors())
                .extracting(IngestionError::getLineNumber)
                .containsExactly(1, 3, 4);
        assertThat(result.describe()).contains("Linha 1: esperado 80 bytes, encontrado 81 bytes")
                .contains("Linha 3: esperado 80 bytes, encontrado 0 bytes")
                .contains("Linha 4: esperado 80 bytes, encontrado 40 bytes");
    }

    @Test
    void validate_reportsFirstNonAsciiByteOfEachLine() {
        byte[] content = CnabLines.file(VALID_LINE, VALID_LINE);
        content[10] = (byte) 0xE9;
        content[12] = (byte) 0xFF;
        content[81 + 50] = (byte) 0xC3;

        ValidationResult result = validator.validate(content);

        assertThat(result.getErrors()).hasSize(2);
        assertThat(result.getErrors().get(0).describe())
                .isEqualTo("Linha 1: caractere não ASCII (código 233) na posição 11");
        assertThat(result.getErrors().get(1).describe())
                .isEqualTo("Linha 2: caractere não ASCII (código 195) na posição 51");
    }

    @Test
    void validate_rejectsEmptyFile() {
        ValidationResult result = validator.validate(new byte[0]);

        assertThat(result.isValid()).isFalse();
        assertThat(result.getErrors()).singleElement()
                .satisfies(error -> {
                    assertThat(error.getLineNumber()).isNull();
                    assertThat(error.getMessage()).isEqualTo("Arquivo não contém linhas de transação");
                });
    }

    @Test
    void validate_rejectsOversizedContentWithoutCheckingLines() {
        CnabStructuralValidator small = new CnabStructuralValidator(100);

        ValidationResult result = small.validate(CnabLines.file(VALID_LINE, VALID_LINE));

        assertThat(result.getErrors()).singleElement()
                .satisfies(error -> assertThat(error.getMessage())
                        .isEqualTo("Tamanho do arquivo 162 bytes excede o máximo de 100 bytes"));
    }

    @Test
    void validate_stopsReadingStreamOnceLimitIsExceeded() throws IOException {
        CnabStructuralValidator small = new CnabStructuralValidator(1000);
        EndlessInputStream input = new EndlessInputStream();

        ValidationResult result = small.validate(input);

        assertThat(result.isValid()).isFalse();
        assertThat(result.describe()).isEqualTo("Arquivo excede o tamanho máximo de 1000 bytes");
        assertThat(input.bytesServed).isLessThan(1000 + 8192 + 1);
    }

    private static final class EndlessInputStream extends InputStream {
        private long bytesServed;

        @Override
        public int read() {
            bytesServed++;
            return 'A';
        }

        @Override
        public int read(byte[] buffer, int offset, int length) {
            for (int i = 0; i < length; i++) {
                buffer[offset + i] = 'A';
            }
            bytesServed += length;
            return length;
        }
    }
}
