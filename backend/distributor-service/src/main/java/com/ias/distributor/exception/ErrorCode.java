package com.ias.distributor.exception;

/**
 * Machine-readable failure codes. Every code is terminal for the operation that raised it.
 */
public enum ErrorCode {
    UNAUTHORIZED(ErrorCategory.AUTHORIZATION),
    INVALID_SIGNATURE(ErrorCategory.AUTHORIZATION),
    ALREADY_CLAIMED(ErrorCategory.STATE),
    INVALID_BATCH(ErrorCategory.STATE),
    LEDGER_NOT_INITIALIZED(ErrorCategory.STATE),
    LEDGER_BUSY(ErrorCategory.STATE),
    INSUFFICIENT_BALANCE(ErrorCategory.RESOURCE),
    TRANSFER_FAILED(ErrorCategory.RESOURCE),
    ASSET_UNAVAILABLE(ErrorCategory.RESOURCE),
    INVALID_AMOUNT(ErrorCategory.VALIDATION),
    INVALID_EPOCH(ErrorCategory.VALIDATION),
    INVALID_ADDRESS(ErrorCategory.VALIDATION);

    private final ErrorCategory category;

    ErrorCode(ErrorCategory category) {
        this.category = category;
    }

    public ErrorCategory getCategory() {
        return category;
    }
}
