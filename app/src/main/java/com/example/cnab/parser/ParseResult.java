package com.example.cnab.parser;

import com.example.cnab.validation.IngestionError;
import com.example.cnab.validation.ValidationResult;
import lombok.Getter;

import java.util.List;
import java.util.Set;
import java.util.TreeSet;

@Getter
public class ParseResult {

    private final List<ParsedTransaction> transactions;
    private final List<IngestionError> errors;

    public ParseResult(List<ParsedTransaction> transactions, List<IngestionError> errors) {
        this.transactions = List.copyOf(transactions);
        this.errors = List.copyOf(errors);
    }

    public boolean isValid() {
        return errors.isEmpty();
    }

    /**
     * Lojas distintas referenciadas pelas transações, em ordem determinística.
     */
    public Set<StoreIdentity> distinctStores() {
        Set<StoreIdentity> stores = new TreeSet<>();
        transactions.forEach(transaction -> stores.add(transaction.getStore()));
        return stores;
    }

    public String describeErrors() {
        return ValidationResult.describe(errors);
    }
}
