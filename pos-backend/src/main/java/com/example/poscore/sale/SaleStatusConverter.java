package com.example.poscore.sale;

import jakarta.persistence.AttributeConverter;
import jakarta.persistence.Converter;

@Converter
public class SaleStatusConverter implements AttributeConverter<SaleStatus, String> {

    @Override
    public String convertToDatabaseColumn(SaleStatus attribute) {
        return attribute == null ? null : attribute.getCode();
    }

    @Override
    public SaleStatus convertToEntityAttribute(String dbData) {
        return dbData == null ? null : SaleStatus.fromCode(dbData);
    }
}
