package com.RK8.PriceChecker.Exception;

/**
 * The uploaded invoice cannot be reconciled at all, e.g. a required column is absent.
 */
public class InvoiceFormatException extends RuntimeException {

    public InvoiceFormatException(String message) {
        super(message);
    }

    public InvoiceFormatException(String message, Throwable cause) {
        super(message, cause);
    }
}
