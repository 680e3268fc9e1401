package com.example.cnab.parser;

import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.time.LocalTime;

@Value
@Builder
public class ParsedTransaction {
    int lineNumber;
    int typeCode;
    LocalDate occurrenceDate;
    LocalTime occurrenceTime;
    BigDecimal amount;
    String customerId;
    String cardNumber;
    StoreIdentity store;
}
