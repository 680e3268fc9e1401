package com.example.cnab.processor;

import com.example.cnab.model.Transaction;
import com.example.cnab.repository.TransactionRepository;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.util.Collection;
import java.util.HashMap;
import java.util.Map;
import java.util.UUID;

/**
 * Saldo de uma loja: soma de valor × sinal de todas as suas transações. Nunca é persistido.
 */
@Service
public class StoreBalanceCalculator {

    private final SignLookup signLookup;
    private final TransactionRepository transactionRepository;

    public StoreBalanceCalculator(SignLookup signLookup, TransactionRepository transactionRepository) {
        this.signLookup = signLookup;
        this.transactionRepository = transactionRepository;
    }

    @Transactional(readOnly = true)
    public BigDecimal balanceOf(UUID storeId) {
        return calculate(transactionRepository.findByStoreId(storeId));
    }

    public BigDecimal calculate(Collection<Transaction> transactions) {
        Map<Integer, Integer> signs = new HashMap<>();
        BigDecimal balance = BigDecimal.ZERO.setScale(2);
        for (Transaction transaction : transactions) {
            int sign = signs.computeIfAbsent(transaction.getTypeCode(), signLookup::sign);
            BigDecimal signed = sign < 0 ? transaction.getAmount().negate() : transaction.getAmount();
            balance = balance.add(signed);
        }
        return balance;
    }
}
