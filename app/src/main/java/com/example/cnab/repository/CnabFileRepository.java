package com.example.cnab.repository;

import com.example.cnab.model.CnabFile;
import jakarta.persistence.LockModeType;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.util.Optional;
import java.util.UUID;

public interface CnabFileRepository extends JpaRepository<CnabFile, UUID> {

    /**
     * Carrega o arquivo com lock de escrita na linha; serializa entregas duplicadas do mesmo arquivo.
     */
    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("select f from CnabFile f where f.id = :id")
    Optional<CnabFile> findByIdForUpdate(@Param("id") UUID id);
}
