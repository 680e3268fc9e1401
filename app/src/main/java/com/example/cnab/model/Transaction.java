package com.example.cnab.model;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Index;
import jakarta.persistence.SequenceGenerator;
import jakarta.persistence.Table;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalTime;
import java.util.UUID;

/**
 * Transação financeira extraída de uma linha CNAB. Imutável depois de persistida.
 * O id vem de uma sequência para que o Hibernate agrupe os inserts em lote.
 */
@Entity
@Table(name = "transactions", indexes = {
        @Index(name = "ix_transactions_file_id", columnList = "file_id"),
        @Index(name = "ix_transactions_store_id", columnList = "store_id")
})
@Getter
@Builder
@NoArgsConstructor(access = AccessLevel.PROTECTED)
@AllArgsConstructor
public class Transaction {

    @Id
    @GeneratedValue(strategy = GenerationType.SEQUENCE, generator = "transactions_seq")
    @SequenceGenerator(name = "transactions_seq", sequenceName = "transactions_id_seq", allocationSize = 50)
    private Long id;

    @Column(name = "file_id", nullable = false, updatable = false)
    private UUID fileId;

    @Column(name = "store_id", nullable = false, updatable = false)
    private UUID storeId;

    @Column(name = "type_code", nullable = false, updatable = false)
    private int typeCode;

    @Column(name = "amount", nullable = false, precision = 12, scale = 2, updatable = false)
    private BigDecimal amount;

    @Column(name = "occurrence_date", nullable = false, updatable = false)
    private LocalDate occurrenceDate;

    @Column(name = "occurrence_time", nullable = false, updatable = false)
    private LocalTime occurrenceTime;

    @Column(name = "customer_id", nullable = false, length = 11, updatable = false)
    private String customerId;

    @Column(name = "card_number", nullable = false, length = 12, updatable = false)
    private String cardNumber;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;
}
