package com.ias.distributor.exception;

import lombok.Getter;

/**
 * Raised by settlement and administrative operations. Unchecked so that it rolls back
 * the surrounding transaction.
 */
@Getter
public class DistributionException extends RuntimeException {

    private final ErrorCode code;

    public DistributionException(ErrorCode code, String message) {
        super(message);
        this.code = code;
    }

    public DistributionException(ErrorCode code, String message, Throwable cause) {
        super(message, cause);
        this.code = code;
    }

    public ErrorCategory getCategory() {
        return code.getCategory();
    }
}
