package com.example.cnab.model;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import jakarta.persistence.UniqueConstraint;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.UUID;

@Entity
@Table(name = "stores", uniqueConstraints = @UniqueConstraint(
        name = "uk_stores_name_owner", columnNames = {"name", "owner_name"}))
@Getter
@Builder
@NoArgsConstructor(access = AccessLevel.PROTECTED)
@AllArgsConstructor
public class Store {

    public static final int MAX_NAME_LENGTH = 19;
    public static final int MAX_OWNER_NAME_LENGTH = 14;

    @Id
    private UUID id;

    @Column(name = "name", nullable = false, length = MAX_NAME_LENGTH)
    private String name;

    @Column(name = "owner_name", nullable = false, length = MAX_OWNER_NAME_LENGTH)
    private String ownerName;

    @Column(name = "created_at", nullable = false)
    private Instant createdAt;

    @Column(name = "updated_at", nullable = false)
    private Instant updatedAt;
}
