package com.ias.distributor.config;

import com.ias.distributor.crypto.Addresses;
import com.ias.distributor.entity.DistributorState;
import com.ias.distributor.repository.DistributorStateRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

/**
 * Seeds the singleton ledger row from configuration on first start and checks it on later starts
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class DistributorStateInitializer implements ApplicationRunner {

    private final DistributorStateRepository stateRepository;
    private final DistributorProperties properties;

    @Override
    @Transactional
    public void run(ApplicationArguments args) {
        stateRepository.findById(DistributorState.SINGLETON_ID).ifPresentOrElse(this::verify, this::seed);
    }

    /**
     * The persisted ledger identity is what signatures and custody are bound to, so configuration
     * must not silently disagree with it.
     */
    private void verify(DistributorState state) {
        String configured = Addresses.normalize(properties.getLedgerAddress());
        if (!configured.equals(state.getLedgerAddress())) {
            throw new IllegalStateException("Configured distributor.ledger-address " + configured
                    + " does not match persisted ledger " + state.getLedgerAddress());
        }
        log.info("Distributor ledger {} loaded (authority {}, asset {})",
                state.getLedgerAddress(), state.getAuthorityAddress(), state.getAssetReference());
    }

    private void seed() {
        DistributorState state = DistributorState.builder()
                .ledgerAddress(Addresses.normalize(properties.getLedgerAddress()))
                .authorityAddress(Addresses.normalize(properties.getAuthorityAddress()))
                .assetReference(properties.getAssetReference())
                .build();
        stateRepository.save(state);
        log.info("Initialized distributor ledger {} with authority {}",
                state.getLedgerAddress(), state.getAuthorityAddress());
    }
}
