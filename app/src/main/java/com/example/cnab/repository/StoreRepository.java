package com.example.cnab.repository;

import com.example.cnab.model.Store;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.time.Instant;
import java.util.Optional;
import java.util.UUID;

public interface StoreRepository extends JpaRepository<Store, UUID> {

    Optional<Store> findByNameAndOwnerName(String name, String ownerName);

    @Modifying
    @Query("update Store s set s.updatedAt = :now where s.id = :id")
    int touch(@Param("id") UUID id, @Param("now") Instant now);
}
