package com.example.cnab.config;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import software.amazon.awssdk.awscore.client.builder.AwsClientBuilder;
import software.amazon.awssdk.enhanced.dynamodb.DynamoDbEnhancedClient;
import software.amazon.awssdk.regions.Region;
import software.amazon.awssdk.services.dynamodb.DynamoDbClient;
import software.amazon.awssdk.services.dynamodb.model.AttributeDefinition;
import software.amazon.awssdk.services.dynamodb.model.BillingMode;
import software.amazon.awssdk.services.dynamodb.model.CreateTableRequest;
import software.amazon.awssdk.services.dynamodb.model.DynamoDbException;
import software.amazon.awssdk.services.dynamodb.model.KeySchemaElement;
import software.amazon.awssdk.services.dynamodb.model.KeyType;
import software.amazon.awssdk.services.dynamodb.model.ListTablesRequest;
import software.amazon.awssdk.services.dynamodb.model.ListTablesResponse;
import software.amazon.awssdk.services.dynamodb.model.ResourceInUseException;
import software.amazon.awssdk.services.dynamodb.model.ScalarAttributeType;
import software.amazon.awssdk.services.s3.S3Client;
import software.amazon.awssdk.services.ses.SesClient;
import software.amazon.awssdk.services.sqs.SqsClient;

import java.net.URI;

@Configuration
public class AwsConfig {

    private static final Logger log = LoggerFactory.getLogger(AwsConfig.class);

    @Value("${app.aws.region:us-east-1}")
    private String region;

    @Value("${app.aws.localstack.enabled:false}")
    private boolean localstackEnabled;

    @Value("${app.aws.localstack.endpoint:http://localhost:4566}")
    private String localstackEndpoint;

    @Value("${app.dynamodb.notification-attempts-table-name}")
    private String notificationAttemptsTableName;

    /**
     * Configura qualquer builder de cliente AWS com a região e, se ativo, o endpoint do LocalStack.
     */
    private <T extends AwsClientBuilder<?, ?>> T configureClientBuilder(T builder) {
        Region awsRegion = Region.of(region);
        if (localstackEnabled) {
            log.info("Configurando cliente AWS para LocalStack em: {}", localstackEndpoint);
            return (T) builder.endpointOverride(URI.create(localstackEndpoint))
                    .region(awsRegion);
        }
        log.info("Configurando cliente AWS para AWS Cloud na região: {}", awsRegion);
        return (T) builder.region(awsRegion);
    }

    @Bean
    public SqsClient sqsClient() {
        return configureClientBuilder(SqsClient.builder()).build();
    }

    @Bean
    public S3Client s3Client() {
        // LocalStack só resolve buckets no estilo path
        return configureClientBuilder(S3Client.builder().forcePathStyle(localstackEnabled)).build();
    }

    @Bean
    public SesClient sesClient() {
        return configureClientBuilder(SesClient.builder()).build();
    }

    @Bean
    public DynamoDbClient dynamoDbClient() {
        DynamoDbClient client = configureClientBuilder(DynamoDbClient.builder()).build();
        if (localstackEnabled) {
            ensureDynamoDbTableExists(client, notificationAttemptsTableName);
        }
        return client;
    }

    @Bean
    public DynamoDbEnhancedClient dynamoDbEnhancedClient(DynamoDbClient dynamoDbClient) {
        return DynamoDbEnhancedClient.builder()
                .dynamoDbClient(dynamoDbClient)
                .build();
    }

    @Bean
    public ObjectMapper objectMapper() {
        ObjectMapper mapper = new ObjectMapper();
        mapper.setPropertyNamingStrategy(PropertyNamingStrategies.LOWER_CAMEL_CASE);
        mapper.registerModule(new JavaTimeModule());
        mapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
        mapper.disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);
        return mapper;
    }

    private void ensureDynamoDbTableExists(DynamoDbClient dynamoDbClient, String tableName) {
        try {
            log.info("Verificando se a tabela DynamoDB '{}' existe no LocalStack.", tableName);
            ListTablesResponse response = dynamoDbClient.listTables(ListTablesRequest.builder().build());
            if (response.tableNames().contains(tableName)) {
                log.info("Tabela DynamoDB '{}' já existe no LocalStack.", tableName);
                return;
            }
            log.warn("Tabela DynamoDB '{}' não encontrada no LocalStack. Criando...", tableName);
            CreateTableRequest request = CreateTableRequest.builder()
                    .tableName(tableName)
                    .keySchema(KeySchemaElement.builder().attributeName("notificationId").keyType(KeyType.HASH).build())
                    .attributeDefinitions(AttributeDefinition.builder()
                            .attributeName("notificationId").attributeType(ScalarAttributeType.S).build())
                    .billingMode(BillingMode.PAY_PER_REQUEST)
                    .build();
            dynamoDbClient.createTable(request);
            log.info("Tabela DynamoDB '{}' criada com sucesso no LocalStack.", tableName);
        } catch (ResourceInUseException e) {
            log.info("Tabela DynamoDB '{}' já está sendo criada ou já existe no LocalStack. Ignorando.", tableName);
        } catch (DynamoDbException e) {
            log.error("Erro ao verificar/criar tabela DynamoDB '{}' no LocalStack: {}", tableName, e.getMessage(), e);
        }
    }
}
