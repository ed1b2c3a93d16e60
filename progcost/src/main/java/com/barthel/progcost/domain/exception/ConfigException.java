package com.barthel.progcost.domain.exception;

/**
 * The programme configuration is invalid.
 */
public class ConfigException extends CostingException {

    public ConfigException(String message) {
        super(message);
    }
}
