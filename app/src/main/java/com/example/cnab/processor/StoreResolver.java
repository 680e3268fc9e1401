package com.example.cnab.processor;

import com.example.cnab.model.Store;
import com.example.cnab.parser.StoreIdentity;
import com.example.cnab.repository.StoreRepository;
import jakarta.persistence.EntityManager;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.HashMap;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;
import java.util.UUID;

/**
 * Mapeia identidades (nome, dono) para ids de loja, criando as que ainda não existem.
 * Deve rodar dentro da transação do chamador. As identidades são tratadas em ordem fixa
 * para que arquivos concorrentes bloqueiem as mesmas linhas na mesma sequência.
 */
@Component
public class StoreResolver {

    private static final Logger log = LoggerFactory.getLogger(StoreResolver.class);

    static final String INSERT_IF_ABSENT = "INSERT INTO stores (id, name, owner_name, created_at, updated_at) "
            + "VALUES (:id, :name, :ownerName, :now, :now) ON CONFLICT DO NOTHING";

    private final StoreRepository storeRepository;
    private final EntityManager entityManager;

    public StoreResolver(StoreRepository storeRepository, EntityManager entityManager) {
        this.storeRepository = storeRepository;
        this.entityManager = entityManager;
    }

    public StoreResolution resolve(Set<StoreIdentity> identities, Instant now) {
        Map<StoreIdentity, UUID> storeIds = new HashMap<>();
        int created = 0;

        for (StoreIdentity identity : new TreeSet<>(identities)) {
            Optional<Store> existing = storeRepository.findByNameAndOwnerName(identity.getName(), identity.getOwnerName());
            if (existing.isPresent()) {
                storeRepository.touch(existing.get().getId(), now);
                storeIds.put(identity, existing.get().getId());
                continue;
            }

            int inserted = insertIfAbsent(identity, now);
            Store store = storeRepository.findByNameAndOwnerName(identity.getName(), identity.getOwnerName())
                    .orElseThrow(() -> new IllegalStateException(
                            "Loja não encontrada após inserção: " + identity.getName() + " / " + identity.getOwnerName()));
            if (inserted > 0) {
                created++;
                log.debug("Loja '{}' de '{}' criada com id {}.", identity.getName(), identity.getOwnerName(), store.getId());
            } else {
                log.info("Loja '{}' de '{}' foi criada por outro processamento; reutilizando id {}.",
                        identity.getName(), identity.getOwnerName(), store.getId());
            }
            storeIds.put(identity, store.getId());
        }

        return new StoreResolution(storeIds, created);
    }

    private int insertIfAbsent(StoreIdentity identity, Instant now) {
        return entityManager.createNativeQuery(INSERT_IF_ABSENT)
                .setParameter("id", UUID.randomUUID())
                .setParameter("name", identity.getName())
                .setParameter("ownerName", identity.getOwnerName())
                .setParameter("now", now)
                .executeUpdate();
    }
}
