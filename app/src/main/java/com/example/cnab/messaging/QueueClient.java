package com.example.cnab.messaging;

import java.util.List;
import java.util.Map;

/**
 * Operações de fila usadas pelos workers. Falhas de transporte saem como
 * {@link com.example.cnab.exception.TransientInfrastructureException}.
 */
public interface QueueClient {

    List<QueueMessage> receive(String queueUrl, int maxMessages, int visibilityTimeoutSeconds, int waitTimeSeconds);

    void delete(String queueUrl, String receiptHandle);

    /**
     * @return o id da mensagem atribuído pela fila
     */
    String send(String queueUrl, String body, Map<String, String> attributes);
}
