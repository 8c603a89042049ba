package org.caureq.caureqspeedboard.api.error;
public enum ErrorCode {
    BAD_REQUEST, VALIDATION_FAILED, NOT_FOUND, INTERNAL_ERROR
}
