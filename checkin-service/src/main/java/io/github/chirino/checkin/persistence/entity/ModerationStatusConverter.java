package io.github.chirino.checkin.persistence.entity;

import io.github.chirino.checkin.model.ModerationStatus;
import jakarta.persistence.AttributeConverter;
import jakarta.persistence.Converter;

@Converter(autoApply = true)
public class ModerationStatusConverter implements AttributeConverter<ModerationStatus, String> {

    @Override
    public String convertToDatabaseColumn(ModerationStatus attribute) {
        return attribute == null ? null : attribute.value();
    }

    @Override
    public ModerationStatus convertToEntityAttribute(String dbData) {
        return dbData == null ? null : ModerationStatus.fromValue(dbData);
    }
}
