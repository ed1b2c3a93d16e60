package com.barthel.progcost.domain.exception;

import lombok.Getter;

/**
 * No reference row matches the requested key.
 */
@Getter
public class NotFoundException extends ReferenceDataException {

    private final String table;
    private final String key;

    public NotFoundException(String table, String key) {
        super("No row in " + table + " for key " + key);
        this.table = table;
        this.key = key;
    }
}
