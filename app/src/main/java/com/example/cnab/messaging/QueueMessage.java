package com.example.cnab.messaging;

import lombok.Builder;
import lombok.Value;

import java.util.Map;

@Value
@Builder
public class QueueMessage {
    String messageId;
    String receiptHandle;
    String body;
    @Builder.Default
    Map<String, String> attributes = Map.of();
}
