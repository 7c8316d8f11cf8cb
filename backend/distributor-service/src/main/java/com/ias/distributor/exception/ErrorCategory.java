package com.ias.distributor.exception;

/**
 * Error classes reported to calling layers
 */
public enum ErrorCategory {
    AUTHORIZATION,
    STATE,
    RESOURCE,
    VALIDATION
}
