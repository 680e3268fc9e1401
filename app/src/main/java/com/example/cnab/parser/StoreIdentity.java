package com.example.cnab.parser;

import lombok.Value;

import java.util.Comparator;

/**
 * Identidade natural de uma loja: nome + dono, já sem espaços nas pontas.
 */
@Value
public class StoreIdentity implements Comparable<StoreIdentity> {

    private static final Comparator<StoreIdentity> ORDER = Comparator
            .comparing(StoreIdentity::getName)
            .thenComparing(StoreIdentity::getOwnerName);

    String name;
    String ownerName;

    @Override
    public int compareTo(StoreIdentity other) {
        return ORDER.compare(this, other);
    }
}
