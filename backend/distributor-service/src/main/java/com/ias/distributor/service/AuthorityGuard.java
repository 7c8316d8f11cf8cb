package com.ias.distributor.service;

import com.ias.distributor.crypto.Addresses;
import com.ias.distributor.entity.DistributorState;
import com.ias.distributor.exception.DistributionException;
import com.ias.distributor.exception.ErrorCode;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Entry check for batch and administrative operations
 */
@Component
@Slf4j
public class AuthorityGuard {

    /**
     * @return the normalized caller identity, which equals the current authority
     */
    public String requireAuthority(String caller, DistributorState state) {
        if (!Addresses.isValid(caller) || !caller.equalsIgnoreCase(state.getAuthorityAddress())) {
            log.warn("Rejected privileged call from {}", caller);
            throw new DistributionException(ErrorCode.UNAUTHORIZED, "Caller is not the distributor authority");
        }
        return caller.toLowerCase();
    }
}
