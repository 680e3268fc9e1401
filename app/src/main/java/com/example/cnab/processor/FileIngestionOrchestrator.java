package com.example.cnab.processor;

import com.example.cnab.config.IngestionProperties;
import com.example.cnab.exception.FileNotRegisteredException;
import com.example.cnab.exception.ObjectTooLargeException;
import com.example.cnab.exception.StorageObjectNotFoundException;
import com.example.cnab.exception.TransientInfrastructureException;
import com.example.cnab.metrics.IngestionMetrics;
import com.example.cnab.model.CnabFile;
import com.example.cnab.model.FileProcessingMessage;
import com.example.cnab.model.FileStatus;
import com.example.cnab.notification.NotificationChannel;
import com.example.cnab.parser.CnabLineParser;
import com.example.cnab.parser.ParseResult;
import com.example.cnab.repository.CnabFileRepository;
import com.example.cnab.repository.TransactionRepository;
import com.example.cnab.storage.ObjectStorage;
import com.example.cnab.validation.CnabStructuralValidator;
import com.example.cnab.validation.ErrorCategory;
import com.example.cnab.validation.IngestionError;
import com.example.cnab.validation.ValidationResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.RecoverableDataAccessException;
import org.springframework.dao.TransientDataAccessException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.CannotCreateTransactionException;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.support.TransactionTemplate;

import java.time.Clock;
import java.time.Duration;
import java.util.List;
import java.util.UUID;
import java.util.function.Supplier;

/**
 * Conduz um arquivo do recebimento da mensagem até o status terminal:
 * validação estrutural, parsing, persistência atômica e notificação.
 * <p>
 * Retornar um {@link IngestionOutcome} significa que a mensagem pode ser removida da fila.
 * Exceções (arquivo não registrado, falhas transitórias) mantêm a mensagem para nova entrega,
 * com o arquivo ainda em Processing.
 */
@Service
public class FileIngestionOrchestrator {

    private static final Logger log = LoggerFactory.getLogger(FileIngestionOrchestrator.class);

    private final CnabFileRepository fileRepository;
    private final ObjectStorage objectStorage;
    private final CnabStructuralValidator structuralValidator;
    private final CnabLineParser lineParser;
    private final NotificationChannel notificationChannel;
    private final IngestionMetrics metrics;
    private final Clock clock;
    private final long maxFileSizeBytes;
    private final TransactionTemplate transactionTemplate;
    private final IngestionUnitOfWork unitOfWork;

    public FileIngestionOrchestrator(CnabFileRepository fileRepository,
                                     ObjectStorage objectStorage,
                                     CnabStructuralValidator structuralValidator,
                                     CnabLineParser lineParser,
                                     StoreResolver storeResolver,
                                     TransactionRepository transactionRepository,
                                     PlatformTransactionManager transactionManager,
                                     NotificationChannel notificationChannel,
                                     IngestionMetrics metrics,
                                     IngestionProperties properties,
                                     Clock clock) {
        this.fileRepository = fileRepository;
        this.objectStorage = objectStorage;
        this.structuralValidator = structuralValidator;
        this.lineParser = lineParser;
        this.notificationChannel = notificationChannel;
        this.metrics = metrics;
        this.clock = clock;
        this.maxFileSizeBytes = properties.getMaxFileSizeBytes();
        this.transactionTemplate = new TransactionTemplate(transactionManager);
        this.unitOfWork = new IngestionUnitOfWork(
                transactionTemplate, fileRepository, storeResolver, transactionRepository, clock);
    }

    public IngestionOutcome process(FileProcessingMessage message) {
        UUID fileId = message.getFileId();
        if (fileId == null) {
            throw new IllegalArgumentException("Mensagem de processamento sem fileId");
        }
        long started = System.nanoTime();
        log.info("Iniciando processamento do arquivo {} ({}).", fileId, message.getFileName());

        CnabFile file = inTransaction(() -> beginProcessing(fileId));
        if (file == null) {
            return finish(IngestionOutcome.skipped(fileId), message, started);
        }

        String objectKey = file.getObjectKey() != null ? file.getObjectKey() : message.getObjectKey();
        byte[] content;
        try {
            content = objectStorage.read(objectKey, maxFileSizeBytes);
        } catch (ObjectTooLargeException e) {
            return reject(message, "Validação estrutural falhou",
                    List.of(IngestionError.structural(null, String.format(
                            "Tamanho do arquivo %d bytes excede o máximo de %d bytes", e.getSize(), e.getMaxSize()))),
                    started);
        } catch (StorageObjectNotFoundException e) {
            return reject(message, "Arquivo indisponível",
                    List.of(IngestionError.structural(null, "objeto '" + objectKey + "' não encontrado no armazenamento")),
                    started);
        }

        ValidationResult structural = structuralValidator.validate(content);
        if (!structural.isValid()) {
            return reject(message, "Validação estrutural falhou", structural.getErrors(), started);
        }

        ParseResult parsed = lineParser.parse(content);
        if (!parsed.isValid()) {
            return reject(message, "Validação de conteúdo falhou", parsed.getErrors(), started);
        }

        IngestionOutcome outcome;
        try {
            outcome = unitOfWork.commit(fileId, parsed);
        } catch (TransientDataAccessException | RecoverableDataAccessException | CannotCreateTransactionException e) {
            log.warn("Falha transitória de banco ao persistir o arquivo {}; mensagem será reprocessada: {}",
                    fileId, e.getMessage());
            throw new TransientInfrastructureException("Falha transitória ao persistir o arquivo " + fileId, e);
        } catch (FileNotRegisteredException e) {
            throw e;
        } catch (RuntimeException e) {
            log.error("Erro de persistência no arquivo {}: {}", fileId, e.getMessage(), e);
            return reject(message, "Erro de persistência: " + e.getMessage(), List.of(), started);
        }

        if (outcome.getStatus() == IngestionOutcome.Status.PROCESSED) {
            metrics.transactionsPersisted(outcome.getTransactionsInserted());
            notifySafely(() -> notificationChannel.notifyProcessingCompleted(
                    fileId, message.getFileName(), outcome.getTransactionsInserted(), message.getCorrelationId()));
        }
        return finish(outcome, message, started);
    }

    /**
     * @return o arquivo em Processing, ou {@code null} se ele já está em status terminal
     */
    private CnabFile beginProcessing(UUID fileId) {
        CnabFile file = fileRepository.findByIdForUpdate(fileId)
                .orElseThrow(() -> new FileNotRegisteredException(fileId));
        if (file.getStatus().isTerminal()) {
            log.info("Arquivo {} já está em {}. Ignorando mensagem duplicada.", fileId, file.getStatus().getExternalName());
            return null;
        }
        if (file.getStatus() == FileStatus.PROCESSING) {
            log.warn("Arquivo {} já estava em Processing; retomando após reentrega.", fileId);
        } else {
            file.startProcessing();
        }
        return file;
    }

    private IngestionOutcome reject(FileProcessingMessage message, String reason,
                                    List<IngestionError> errors, long started) {
        UUID fileId = message.getFileId();
        String errorMessage = errors.isEmpty() ? reason : reason + ": " + ValidationResult.describe(errors);
        recordValidationFailure(errors);

        Boolean applied = inTransaction(() -> fileRepository.findByIdForUpdate(fileId)
                .map(file -> {
                    if (file.getStatus() != FileStatus.PROCESSING) {
                        return false;
                    }
                    file.markRejected(errorMessage, clock.instant());
                    return true;
                })
                .orElseThrow(() -> new FileNotRegisteredException(fileId)));

        if (!Boolean.TRUE.equals(applied)) {
            log.info("Arquivo {} foi finalizado por outro processamento antes da rejeição.", fileId);
            return finish(IngestionOutcome.skipped(fileId), message, started);
        }

        log.warn("Arquivo {} rejeitado: {}", fileId, errorMessage);
        IngestionOutcome outcome = IngestionOutcome.builder()
                .fileId(fileId)
                .status(IngestionOutcome.Status.REJECTED)
                .errors(errors)
                .errorMessage(errorMessage)
                .build();
        notifySafely(() -> notificationChannel.notifyProcessingFailed(
                fileId, message.getFileName(), errorMessage, message.getCorrelationId()));
        return finish(outcome, message, started);
    }

    private void recordValidationFailure(List<IngestionError> errors) {
        if (errors.isEmpty()) {
            return;
        }
        ErrorCategory category = errors.get(0).getCategory();
        metrics.validationFailed(category, errors.size());
    }

    private void notifySafely(Runnable notification) {
        try {
            notification.run();
        } catch (RuntimeException e) {
            log.warn("Falha inesperada no envio da notificação; o resultado do arquivo não é afetado: {}",
                    e.getMessage(), e);
        }
    }

    private IngestionOutcome finish(IngestionOutcome outcome, FileProcessingMessage message, long started) {
        Duration elapsed = Duration.ofNanos(System.nanoTime() - started);
        metrics.fileCompleted(outcome.getStatus(), elapsed);
        log.info("Processamento do arquivo {} ({}) concluído com {} em {} ms.",
                outcome.getFileId(), message.getFileName(), outcome.getStatus(), elapsed.toMillis());
        return outcome;
    }

    private <T> T inTransaction(Supplier<T> action) {
        try {
            return transactionTemplate.execute(status -> action.get());
        } catch (TransientDataAccessException | RecoverableDataAccessException | CannotCreateTransactionException e) {
            throw new TransientInfrastructureException("Falha transitória de banco de dados", e);
        }
    }
}
