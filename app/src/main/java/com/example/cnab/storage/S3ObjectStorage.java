package com.example.cnab.storage;

import com.example.cnab.config.IngestionProperties;
import com.example.cnab.config.ResilienceConfig;
import com.example.cnab.exception.ObjectTooLargeException;
import com.example.cnab.exception.StorageObjectNotFoundException;
import com.example.cnab.exception.TransientInfrastructureException;
import io.github.resilience4j.retry.Retry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;
import software.amazon.awssdk.core.ResponseInputStream;
import software.amazon.awssdk.core.exception.SdkException;
import software.amazon.awssdk.services.s3.S3Client;
import software.amazon.awssdk.services.s3.model.GetObjectRequest;
import software.amazon.awssdk.services.s3.model.GetObjectResponse;
import software.amazon.awssdk.services.s3.model.NoSuchKeyException;

import java.io.IOException;
import java.io.UncheckedIOException;

@Component
public class S3ObjectStorage implements ObjectStorage {

    private static final Logger log = LoggerFactory.getLogger(S3ObjectStorage.class);

    private final S3Client s3Client;
    private final String bucketName;
    private final Retry retry;

    public S3ObjectStorage(S3Client s3Client,
                           IngestionProperties properties,
                           @Qualifier(ResilienceConfig.AWS_CLIENT_RETRY) Retry retry) {
        this.s3Client = s3Client;
        this.bucketName = properties.getBucketName();
        this.retry = retry;
    }

    @Override
    public byte[] read(String objectKey, long maxBytes) {
        try {
            byte[] content = Retry.decorateSupplier(retry, () -> fetch(objectKey, maxBytes)).get();
            log.info("Objeto s3://{}/{} lido com {} bytes.", bucketName, objectKey, content.length);
            return content;
        } catch (NoSuchKeyException e) {
            log.warn("Objeto s3://{}/{} não existe.", bucketName, objectKey);
            throw new StorageObjectNotFoundException(objectKey, e);
        } catch (SdkException | UncheckedIOException e) {
            log.error("Erro ao ler o objeto s3://{}/{}: {}", bucketName, objectKey, e.getMessage(), e);
            throw new TransientInfrastructureException("Falha ao ler o objeto " + objectKey + " do S3", e);
        }
    }

    private byte[] fetch(String objectKey, long maxBytes) {
        GetObjectRequest request = GetObjectRequest.builder()
                .bucket(bucketName)
                .key(objectKey)
                .build();
        ResponseInputStream<GetObjectResponse> stream = s3Client.getObject(request);
        try (stream) {
            Long declaredSize = stream.response().contentLength();
            if (declaredSize != null && declaredSize > maxBytes) {
                stream.abort();
                throw new ObjectTooLargeException(objectKey, declaredSize, maxBytes);
            }
            byte[] content = stream.readNBytes((int) Math.min(maxBytes + 1, Integer.MAX_VALUE - 8));
            if (content.length > maxBytes) {
                stream.abort();
                throw new ObjectTooLargeException(objectKey, content.length, maxBytes);
            }
            return content;
        } catch (IOException e) {
            throw new UncheckedIOException("Falha de leitura do objeto " + objectKey, e);
        }
    }
}
