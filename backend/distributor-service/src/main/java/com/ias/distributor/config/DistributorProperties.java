package com.ias.distributor.config;

import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

/**
 * Ledger identity and operating limits
 */
@Getter
@Setter
@Component
@ConfigurationProperties(prefix = "distributor")
public class DistributorProperties {

    /**
     * Identity of this distributor instance. Claim signatures are bound to it.
     */
    private String ledgerAddress;

    /**
     * Initial authority identity. Only used to seed the ledger; later rotations live in the database.
     */
    private String authorityAddress;

    /**
     * Initial asset gateway handle.
     */
    private String assetReference = "custody";

    private int maxBatchSize = 200;
}
