package com.example.cnab.config;

import com.example.cnab.model.TransactionType;
import com.example.cnab.repository.TransactionTypeRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;

/**
 * Garante que o catálogo de tipos de transação exista no banco na inicialização.
 */
@Component
public class TransactionTypeCatalogInitializer implements ApplicationRunner {

    private static final Logger log = LoggerFactory.getLogger(TransactionTypeCatalogInitializer.class);

    static final List<TransactionType> CATALOG = List.of(
            type(1, "Débito", "Expense", "-"),
            type(2, "Boleto", "Expense", "-"),
            type(3, "Financiamento", "Expense", "-"),
            type(4, "Crédito", "Income", "+"),
            type(5, "Recebimento Empréstimo", "Income", "+"),
            type(6, "Vendas", "Income", "+"),
            type(7, "Recebimento TED", "Income", "+"),
            type(8, "Recebimento DOC", "Income", "+"),
            type(9, "Aluguel", "Expense", "-"));

    private final TransactionTypeRepository transactionTypeRepository;

    public TransactionTypeCatalogInitializer(TransactionTypeRepository transactionTypeRepository) {
        this.transactionTypeRepository = transactionTypeRepository;
    }

    @Override
    @Transactional
    public void run(ApplicationArguments args) {
        seedMissingTypes();
    }

    public int seedMissingTypes() {
        int created = 0;
        for (TransactionType type : CATALOG) {
            if (!transactionTypeRepository.existsById(type.getTypeCode())) {
                transactionTypeRepository.save(type);
                created++;
            }
        }
        if (created > 0) {
            log.info("Catálogo de tipos de transação inicializado: {} tipo(s) criado(s).", created);
        } else {
            log.debug("Catálogo de tipos de transação já está completo.");
        }
        return created;
    }

    private static TransactionType type(int code, String description, String nature, String sign) {
        return TransactionType.builder()
                .typeCode(code)
                .description(description)
                .nature(nature)
                .sign(sign)
                .build();
    }
}
