package com.fleetledger.model;

import jakarta.persistence.AttributeConverter;
import jakarta.persistence.Converter;
import lombok.extern.slf4j.Slf4j;

/**
 * Stores toll as the code drivers pick in the app ("Geen", "BE", "BE/DE", ...).
 * A stored code this version does not know is read as {@link Toll#NONE}.
 */
@Slf4j
@Converter
public class TollConverter implements AttributeConverter<Toll, String> {

    @Override
    public String convertToDatabaseColumn(Toll toll) {
        return toll == null ? Toll.NONE.getCode() : toll.getCode();
    }

    @Override
    public Toll convertToEntityAttribute(String code) {
        try {
            return Toll.fromCode(code);
        } catch (IllegalArgumentException ex) {
            log.warn("Unknown toll code '{}' in daily log, billing no toll", code);
            return Toll.NONE;
        }
    }
}
