package com.openaasx.harvester.harvest.persistence;

public class CatalogFormatException extends RuntimeException {

    public CatalogFormatException(String message, Throwable cause) {
        super(message, cause);
    }
}
