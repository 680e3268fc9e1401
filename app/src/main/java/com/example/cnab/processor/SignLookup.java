package com.example.cnab.processor;

import com.example.cnab.exception.UnknownTransactionTypeException;
import com.example.cnab.model.TransactionType;
import com.example.cnab.repository.TransactionTypeRepository;
import org.springframework.stereotype.Service;

/**
 * Resolve o sinal (+1 entrada, -1 saída) de um tipo de transação a partir de {@code transaction_types}.
 */
@Service
public class SignLookup {

    private final TransactionTypeRepository transactionTypeRepository;

    public SignLookup(TransactionTypeRepository transactionTypeRepository) {
        this.transactionTypeRepository = transactionTypeRepository;
    }

    public int sign(int typeCode) {
        TransactionType type = transactionTypeRepository.findById(typeCode)
                .orElseThrow(() -> new UnknownTransactionTypeException(typeCode));
        return type.signMultiplier();
    }
}
