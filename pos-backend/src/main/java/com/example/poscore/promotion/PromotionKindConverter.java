package com.example.poscore.promotion;

import jakarta.persistence.AttributeConverter;
import jakarta.persistence.Converter;

@Converter
public class PromotionKindConverter implements AttributeConverter<PromotionKind, String> {

    @Override
    public String convertToDatabaseColumn(PromotionKind attribute) {
        return attribute == null ? null : attribute.getCode();
    }

    @Override
    public PromotionKind convertToEntityAttribute(String dbData) {
        return dbData == null ? null : PromotionKind.fromCode(dbData);
    }
}
