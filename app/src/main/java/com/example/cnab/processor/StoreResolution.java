package com.example.cnab.processor;

import com.example.cnab.parser.StoreIdentity;
import lombok.Value;

import java.util.Map;
import java.util.UUID;

@Value
public class StoreResolution {
    Map<StoreIdentity, UUID> storeIds;
    int createdCount;
}
