package com.cnab.importer.exception;

/**
 * Base exception for all CNAB import failures.
 */
public class CnabImportException extends RuntimeException {

    public CnabImportException(String message) {
        super(message);
    }

    public CnabImportException(String message, Throwable cause) {
        super(message, cause);
    }
}
