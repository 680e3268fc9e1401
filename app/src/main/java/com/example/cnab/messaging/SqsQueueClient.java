package com.example.cnab.messaging;

import com.example.cnab.config.ResilienceConfig;
import com.example.cnab.exception.TransientInfrastructureException;
import io.github.resilience4j.retry.Retry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;
import software.amazon.awssdk.core.exception.SdkException;
import software.amazon.awssdk.services.sqs.SqsClient;
import software.amazon.awssdk.services.sqs.model.DeleteMessageRequest;
import software.amazon.awssdk.services.sqs.model.Message;
import software.amazon.awssdk.services.sqs.model.MessageAttributeValue;
import software.amazon.awssdk.services.sqs.model.ReceiveMessageRequest;
import software.amazon.awssdk.services.sqs.model.SendMessageRequest;
import software.amazon.awssdk.services.sqs.model.SqsException;

import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Supplier;
import java.util.stream.Collectors;

@Component
public class SqsQueueClient implements QueueClient {

    private static final Logger log = LoggerFactory.getLogger(SqsQueueClient.class);

    private final SqsClient sqsClient;
    private final Retry retry;

    public SqsQueueClient(SqsClient sqsClient, @Qualifier(ResilienceConfig.AWS_CLIENT_RETRY) Retry retry) {
        this.sqsClient = sqsClient;
        this.retry = retry;
    }

    @Override
    public List<QueueMessage> receive(String queueUrl, int maxMessages, int visibilityTimeoutSeconds, int waitTimeSeconds) {
        ReceiveMessageRequest request = ReceiveMessageRequest.builder()
                .queueUrl(queueUrl)
                .maxNumberOfMessages(maxMessages)
                .visibilityTimeout(visibilityTimeoutSeconds)
                .waitTimeSeconds(waitTimeSeconds)
                .messageAttributeNames("All")
                .build();
        List<Message> messages = call("receber mensagens", queueUrl, () -> sqsClient.receiveMessage(request).messages());
        return messages.stream()
                .map(SqsQueueClient::toQueueMessage)
                .collect(Collectors.toList());
    }

    @Override
    public void delete(String queueUrl, String receiptHandle) {
        DeleteMessageRequest request = DeleteMessageRequest.builder()
                .queueUrl(queueUrl)
                .receiptHandle(receiptHandle)
                .build();
        call("remover mensagem", queueUrl, () -> sqsClient.deleteMessage(request));
    }

    @Override
    public String send(String queueUrl, String body, Map<String, String> attributes) {
        Map<String, MessageAttributeValue> messageAttributes = new HashMap<>();
        attributes.forEach((name, value) -> messageAttributes.put(name, MessageAttributeValue.builder()
                .dataType("String")
                .stringValue(value)
                .build()));
        SendMessageRequest request = SendMessageRequest.builder()
                .queueUrl(queueUrl)
                .messageBody(body)
                .messageAttributes(messageAttributes)
                .build();
        String messageId = call("enviar mensagem", queueUrl, () -> sqsClient.sendMessage(request).messageId());
        log.debug("Mensagem {} enviada para a fila {}.", messageId, queueUrl);
        return messageId;
    }

    private <T> T call(String operation, String queueUrl, Supplier<T> action) {
        try {
            return Retry.decorateSupplier(retry, action).get();
        } catch (SqsException e) {
            log.error("Erro do SQS ao {} na fila {}: {}", operation, queueUrl, e.awsErrorDetails().errorMessage(), e);
            throw new TransientInfrastructureException("Falha ao " + operation + " na fila " + queueUrl, e);
        } catch (SdkException e) {
            log.error("Erro de comunicação com o SQS ao {} na fila {}: {}", operation, queueUrl, e.getMessage(), e);
            throw new TransientInfrastructureException("Falha ao " + operation + " na fila " + queueUrl, e);
        }
    }

    private static QueueMessage toQueueMessage(Message message) {
        Map<String, String> attributes = new HashMap<>();
        message.messageAttributes().forEach((name, value) -> {
            if (value.stringValue() != null) {
                attributes.put(name, value.stringValue());
            }
        });
        return QueueMessage.builder()
                .messageId(message.messageId())
                .receiptHandle(message.receiptHandle())
                .body(message.body())
                .attributes(attributes)
                .build();
    }
}
