package com.example.cnab.repository;

import com.example.cnab.model.Transaction;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.List;
import java.util.UUID;

public interface TransactionRepository extends JpaRepository<Transaction, Long> {

    List<Transaction> findByStoreId(UUID storeId);

    List<Transaction> findByFileId(UUID fileId);

    long countByFileId(UUID fileId);

    boolean existsByFileId(UUID fileId);
}
