package org.caureq.caureqspeedboard.service;

/** A report that passed JSON binding but cannot be recorded. */
public class ReportValidationException extends RuntimeException {
    private final String field;

    public ReportValidationException(String field, String message) {
        super(message);
        this.field = field;
    }

    public String field() { return field; }
}
