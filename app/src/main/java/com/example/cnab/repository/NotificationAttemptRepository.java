package com.example.cnab.repository;

import com.example.cnab.model.NotificationAttempt;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Repository;
import software.amazon.awssdk.enhanced.dynamodb.DynamoDbEnhancedClient;
import software.amazon.awssdk.enhanced.dynamodb.DynamoDbTable;
import software.amazon.awssdk.enhanced.dynamodb.Key;
import software.amazon.awssdk.enhanced.dynamodb.TableSchema;

import java.util.Optional;

/**
 * Trilha de auditoria das notificações, na tabela DynamoDB de tentativas.
 */
@Repository
public class NotificationAttemptRepository {

    private static final Logger log = LoggerFactory.getLogger(NotificationAttemptRepository.class);

    private final DynamoDbTable<NotificationAttempt> attemptTable;

    @Autowired
    public NotificationAttemptRepository(DynamoDbEnhancedClient dynamoDbEnhancedClient,
                                         @Value("${app.dynamodb.notification-attempts-table-name}") String tableName) {
        this(dynamoDbEnhancedClient.table(tableName, TableSchema.fromBean(NotificationAttempt.class)));
        log.info("NotificationAttemptRepository inicializado para a tabela DynamoDB: {}", tableName);
    }

    NotificationAttemptRepository(DynamoDbTable<NotificationAttempt> attemptTable) {
        this.attemptTable = attemptTable;
    }

    /**
     * Grava (ou sobrescreve) o registro da notificação.
     *
     * @param attempt O registro de tentativa a ser salvo.
     */
    public void save(NotificationAttempt attempt) {
        log.debug("Salvando tentativa de notificação {} com status {}.", attempt.getNotificationId(), attempt.getStatus());
        attemptTable.putItem(attempt);
    }

    public Optional<NotificationAttempt> findById(String notificationId) {
        Key key = Key.builder().partitionValue(notificationId).build();
        return Optional.ofNullable(attemptTable.getItem(key));
    }
}
