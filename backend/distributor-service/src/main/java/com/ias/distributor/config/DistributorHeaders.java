package com.ias.distributor.config;

/**
 * Request headers set by the upstream wallet/session layer
 */
public final class DistributorHeaders {

    /** Address of the authenticated caller. */
    public static final String CALLER_ADDRESS = "X-Caller-Address";

    private DistributorHeaders() {
    }
}
