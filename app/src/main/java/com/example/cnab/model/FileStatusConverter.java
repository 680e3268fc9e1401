package com.example.cnab.model;

import jakarta.persistence.AttributeConverter;
import jakarta.persistence.Converter;

@Converter
public class FileStatusConverter implements AttributeConverter<FileStatus, String> {

    @Override
    public String convertToDatabaseColumn(FileStatus status) {
        return status == null ? null : status.getExternalName();
    }

    @Override
    public FileStatus convertToEntityAttribute(String value) {
        return value == null ? null : FileStatus.fromExternalName(value);
    }
}
