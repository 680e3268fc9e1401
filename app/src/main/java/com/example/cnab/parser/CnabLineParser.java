package com.example.cnab.parser;

import com.example.cnab.validation.CnabStructuralValidator;
import com.example.cnab.validation.IngestionError;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.StringReader;
import java.io.UncheckedIOException;
import java.math.BigDecimal;
import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.LocalDate;
import java.time.LocalTime;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.time.format.ResolverStyle;
import java.util.ArrayList;
import java.util.List;

/**
 * Converte linhas CNAB de 80 bytes em transações. Layout (posições 1-based, inclusivas):
 * <pre>
 *  1      tipo (1-9)
 *  2-9    data AAAAMMDD
 *  10-19  valor em centavos
 *  20-30  CPF
 *  31-42  cartão
 *  43-48  hora HHMMSS
 *  49-62  dono da loja
 *  63-80  nome da loja
 * </pre>
 * Cada regra de campo violada vira um erro de conteúdo da linha; nenhuma linha é descartada em silêncio.
 */
@Component
public class CnabLineParser {

    private static final Logger log = LoggerFactory.getLogger(CnabLineParser.class);

    private static final DateTimeFormatter DATE_FORMAT =
            DateTimeFormatter.ofPattern("uuuuMMdd").withResolverStyle(ResolverStyle.STRICT);
    private static final DateTimeFormatter TIME_FORMAT =
            DateTimeFormatter.ofPattern("HHmmss").withResolverStyle(ResolverStyle.STRICT);

    private final Clock clock;

    public CnabLineParser(Clock clock) {
        this.clock = clock;
    }

    public ParseResult parse(byte[] content) {
        List<ParsedTransaction> transactions = new ArrayList<>();
        List<IngestionError> errors = new ArrayList<>();
        LocalDate today = LocalDate.now(clock);

        try (BufferedReader reader = new BufferedReader(
                new StringReader(new String(content, StandardCharsets.US_ASCII)))) {
            String line;
            int lineNumber = 0;
            while ((line = reader.readLine()) != null) {
                lineNumber++;
                List<IngestionError> lineErrors = new ArrayList<>();
                ParsedTransaction transaction = parseLine(line, lineNumber, today, lineErrors);
                if (lineErrors.isEmpty()) {
                    transactions.add(transaction);
                } else {
                    errors.addAll(lineErrors);
                }
            }
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }

        log.debug("Parsing concluído: {} transações válidas, {} erros de conteúdo.", transactions.size(), errors.size());
        return new ParseResult(transactions, errors);
    }

    ParsedTransaction parseLine(String line, int lineNumber, LocalDate today, List<IngestionError> errors) {
        if (line.length() != CnabStructuralValidator.LINE_LENGTH) {
            errors.add(IngestionError.structural(lineNumber, String.format("esperado %d bytes, encontrado %d bytes",
                    CnabStructuralValidator.LINE_LENGTH, line.length())));
            return null;
        }

        Integer typeCode = parseType(line.charAt(0), lineNumber, errors);
        LocalDate date = parseDate(field(line, 2, 9), today, lineNumber, errors);
        BigDecimal amount = parseAmount(field(line, 10, 19), lineNumber, errors);
        String customerId = parseCustomerId(field(line, 20, 30), lineNumber, errors);
        String cardNumber = parseCardNumber(field(line, 31, 42), lineNumber, errors);
        LocalTime time = parseTime(field(line, 43, 48), lineNumber, errors);
        String ownerName = requireText(field(line, 49, 62).trim(), "nome do dono da loja", lineNumber, errors);
        String storeName = requireText(field(line, 63, 80).trim(), "nome da loja", lineNumber, errors);

        if (!errors.isEmpty()) {
            return null;
        }
        return ParsedTransaction.builder()
                .lineNumber(lineNumber)
                .typeCode(typeCode)
                .occurrenceDate(date)
                .occurrenceTime(time)
                .amount(amount)
                .customerId(customerId)
                .cardNumber(cardNumber)
                .store(new StoreIdentity(storeName, ownerName))
                .build();
    }

    private static String field(String line, int start, int end) {
        return line.substring(start - 1, end);
    }

    private static Integer parseType(char raw, int lineNumber, List<IngestionError> errors) {
        if (!isDigit(raw) || raw == '0') {
            errors.add(IngestionError.content(lineNumber,
                    "tipo de transação '" + raw + "' inválido, deve estar entre 1 e 9"));
            return null;
        }
        return raw - '0';
    }

    private static LocalDate parseDate(String raw, LocalDate today, int lineNumber, List<IngestionError> errors) {
        try {
            LocalDate date = LocalDate.parse(raw, DATE_FORMAT);
            if (date.isAfter(today)) {
                errors.add(IngestionError.content(lineNumber, "data '" + raw + "' está no futuro"));
                return null;
            }
            return date;
        } catch (DateTimeParseException e) {
            errors.add(IngestionError.content(lineNumber, "data '" + raw + "' inválida, esperado AAAAMMDD"));
            return null;
        }
    }

    private static BigDecimal parseAmount(String raw, int lineNumber, List<IngestionError> errors) {
        if (!allDigits(raw)) {
            errors.add(IngestionError.content(lineNumber, "valor '" + raw + "' não é numérico"));
            return null;
        }
        BigDecimal cents = new BigDecimal(raw);
        if (cents.signum() == 0) {
            errors.add(IngestionError.content(lineNumber, "valor deve ser maior que zero"));
            return null;
        }
        return cents.movePointLeft(2).setScale(2);
    }

    private static String parseCustomerId(String raw, int lineNumber, List<IngestionError> errors) {
        if (!allDigits(raw)) {
            errors.add(IngestionError.content(lineNumber, "CPF '" + raw + "' deve ter 11 dígitos"));
            return null;
        }
        return raw;
    }

    private static String parseCardNumber(String raw, int lineNumber, List<IngestionError> errors) {
        if (raw.isBlank()) {
            errors.add(IngestionError.content(lineNumber, "cartão não informado"));
            return null;
        }
        for (int i = 0; i < raw.length(); i++) {
            char c = raw.charAt(i);
            if (!isDigit(c) && !isAsciiLetter(c) && c != '*') {
                errors.add(IngestionError.content(lineNumber,
                        "cartão '" + raw + "' deve conter apenas letras, dígitos ou '*'"));
                return null;
            }
        }
        return raw;
    }

    private static LocalTime parseTime(String raw, int lineNumber, List<IngestionError> errors) {
        try {
            return LocalTime.parse(raw, TIME_FORMAT);
        } catch (DateTimeParseException e) {
            errors.add(IngestionError.content(lineNumber, "hora '" + raw + "' inválida, esperado HHMMSS"));
            return null;
        }
    }

    private static String requireText(String value, String fieldName, int lineNumber, List<IngestionError> errors) {
        if (value.isEmpty()) {
            errors.add(IngestionError.content(lineNumber, fieldName + " não informado"));
            return null;
        }
        return value;
    }

    private static boolean allDigits(String raw) {
        for (int i = 0; i < raw.length(); i++) {
            if (!isDigit(raw.charAt(i))) {
                return false;
            }
        }
        return !raw.isEmpty();
    }

    private static boolean isDigit(char c) {
        return c >= '0' && c <= '9';
    }

    private static boolean isAsciiLetter(char c) {
        return (c >= 'a' && c <= 'z') || (c >= 'A' && c <= 'Z');
    }
}
