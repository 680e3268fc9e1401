package com.example.cnab.storage;

/**
 * Leitura dos arquivos CNAB depositados pelo upload.
 */
@FunctionalInterface
public interface ObjectStorage {

    /**
     * Lê o objeto inteiro, recusando objetos maiores que {@code maxBytes} antes de carregá-los.
     *
     * @throws com.example.cnab.exception.ObjectTooLargeException se o objeto ultrapassar o limite
     * @throws com.example.cnab.exception.StorageObjectNotFoundException se o objeto não existir
     * @throws com.example.cnab.exception.TransientInfrastructureException em falha de transporte
     */
    byte[] read(String objectKey, long maxBytes);
}
