package com.example.poscore.ledger;

import jakarta.persistence.AttributeConverter;
import jakarta.persistence.Converter;

@Converter
public class LedgerEntryKindConverter implements AttributeConverter<LedgerEntryKind, String> {

    @Override
    public String convertToDatabaseColumn(LedgerEntryKind attribute) {
        return attribute == null ? null : attribute.getCode();
    }

    @Override
    public LedgerEntryKind convertToEntityAttribute(String dbData) {
        return dbData == null ? null : LedgerEntryKind.fromCode(dbData);
    }
}
