package com.example.cnab.processor;

import com.example.cnab.exception.FileNotRegisteredException;
import com.example.cnab.model.CnabFile;
import com.example.cnab.model.FileStatus;
import com.example.cnab.model.Transaction;
import com.example.cnab.parser.ParseResult;
import com.example.cnab.parser.ParsedTransaction;
import com.example.cnab.repository.CnabFileRepository;
import com.example.cnab.repository.TransactionRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.transaction.support.TransactionTemplate;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

/**
 * Escopo transacional único da persistência de um arquivo: lock da linha do arquivo,
 * resolução das lojas, insert em lote das transações e passagem para Processed.
 * Ou tudo é gravado, ou nada.
 */
class IngestionUnitOfWork {

    private static final Logger log = LoggerFactory.getLogger(IngestionUnitOfWork.class);

    private final TransactionTemplate transactionTemplate;
    private final CnabFileRepository fileRepository;
    private final StoreResolver storeResolver;
    private final TransactionRepository transactionRepository;
    private final Clock clock;

    IngestionUnitOfWork(TransactionTemplate transactionTemplate,
                        CnabFileRepository fileRepository,
                        StoreResolver storeResolver,
                        TransactionRepository transactionRepository,
                        Clock clock) {
        this.transactionTemplate = transactionTemplate;
        this.fileRepository = fileRepository;
        this.storeResolver = storeResolver;
        this.transactionRepository = transactionRepository;
        this.clock = clock;
    }

    /**
     * @return o resultado PROCESSED, ou SKIPPED se outro processamento já finalizou o arquivo
     */
    IngestionOutcome commit(UUID fileId, ParseResult parsed) {
        return transactionTemplate.execute(status -> {
            CnabFile file = fileRepository.findByIdForUpdate(fileId)
                    .orElseThrow(() -> new FileNotRegisteredException(fileId));
            if (file.getStatus() != FileStatus.PROCESSING || transactionRepository.existsByFileId(fileId)) {
                log.info("Arquivo {} está em {} e já foi finalizado por outro processamento. Nada será gravado.",
                        fileId, file.getStatus().getExternalName());
                return IngestionOutcome.skipped(fileId);
            }

            Instant now = clock.instant();
            StoreResolution stores = storeResolver.resolve(parsed.distinctStores(), now);

            List<Transaction> transactions = new ArrayList<>(parsed.getTransactions().size());
            for (ParsedTransaction parsedTransaction : parsed.getTransactions()) {
                transactions.add(Transaction.builder()
                        .fileId(fileId)
                        .storeId(stores.getStoreIds().get(parsedTransaction.getStore()))
                        .typeCode(parsedTransaction.getTypeCode())
                        .amount(parsedTransaction.getAmount())
                        .occurrenceDate(parsedTransaction.getOccurrenceDate())
                        .occurrenceTime(parsedTransaction.getOccurrenceTime())
                        .customerId(parsedTransaction.getCustomerId())
                        .cardNumber(parsedTransaction.getCardNumber())
                        .createdAt(now)
                        .build());
            }
            transactionRepository.saveAll(transactions);
            file.markProcessed(now);

            log.info("Arquivo {} persistido: {} transações, {} loja(s) nova(s).",
                    fileId, transactions.size(), stores.getCreatedCount());
            return IngestionOutcome.builder()
                    .fileId(fileId)
                    .status(IngestionOutcome.Status.PROCESSED)
                    .transactionsInserted(transactions.size())
                    .storesCreated(stores.getCreatedCount())
                    .build();
        });
    }
}
