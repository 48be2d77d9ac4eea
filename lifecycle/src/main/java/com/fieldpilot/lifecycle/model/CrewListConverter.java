package com.fieldpilot.lifecycle.model;

import jakarta.persistence.AttributeConverter;
import jakarta.persistence.Converter;

import java.util.Arrays;
import java.util.List;

/**
 * Stores an ordered list of crew member ids as a comma-separated column.
 * Crew ids never contain commas (they are employee UUIDs or badge codes).
 */
@Converter
public class CrewListConverter implements AttributeConverter<List<String>, String> {

    @Override
    public String convertToDatabaseColumn(List<String> crew) {
        if (crew == null || crew.isEmpty()) return null;
        return String.join(",", crew);
    }

    @Override
    public List<String> convertToEntityAttribute(String column) {
        if (column == null || column.isBlank()) return List.of();
        return Arrays.stream(column.split(","))
                .map(String::strip)
                .filter(s -> !s.isEmpty())
                .toList();
    }
}
