package com.fightsync.domain.model;

/**
 * One event field whose scraped value differs from the stored one.
 */
public record FieldChange(String field, Object oldValue, Object newValue) {

    @Override
    public String toString() {
        return field + ": " + oldValue + " -> " + newValue;
    }
}
