package com.ias.distributor.config;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatNoException;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.BDDMockito.given;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;

import com.ias.distributor.entity.DistributorState;
import com.ias.distributor.repository.DistributorStateRepository;
import java.util.Optional;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.boot.DefaultApplicationArguments;

@ExtendWith(MockitoExtension.class)
class DistributorStateInitializerTest {

    private static final String LEDGER = "0x5FbDB2315678afecb367f032d93F642f64180aa3";
    private static final String OTHER_LEDGER = "0xe7f1725e7734ce288f8367e1bb143e90bb3f0512";
    private static final String AUTHORITY = "0xf39Fd6e51aad88F6F4ce6aB8827279cffFb92266";

    @Mock
    private DistributorStateRepository stateRepository;

    private DistributorProperties properties;

    private DistributorStateInitializer subject;

    @BeforeEach
    void setUp() {
        properties = new DistributorProperties();
        properties.setLedgerAddress(LEDGER);
        properties.setAuthorityAddress(AUTHORITY);
        subject = new DistributorStateInitializer(stateRepository, properties);
    }

    @Test
    void seedsNormalizedStateOnFirstStart() {
        given(stateRepository.findById(DistributorState.SINGLETON_ID)).willReturn(Optional.empty());

        subject.run(new DefaultApplicationArguments());

        ArgumentCaptor<DistributorState> saved = ArgumentCaptor.forClass(DistributorState.class);
        verify(stateRepository).save(saved.capture());
        assertThat(saved.getValue().getLedgerAddress()).isEqualTo(LEDGER.toLowerCase());
        assertThat(saved.getValue().getAuthorityAddress()).isEqualTo(AUTHORITY.toLowerCase());
        assertThat(saved.getValue().getAssetReference()).isEqualTo("custody");
    }

    @Test
    void acceptsPersistedLedgerMatchingConfiguration() {
        given(stateRepository.findById(DistributorState.SINGLETON_ID))
                .willReturn(Optional.of(persisted(LEDGER.toLowerCase())));

        assertThatNoException().isThrownBy(() -> subject.run(new DefaultApplicationArguments()));
        verify(stateRepository, never()).save(any());
    }

    @Test
    void refusesToStartWhenConfiguredLedgerDiffersFromPersisted() {
        given(stateRepository.findById(DistributorState.SINGLETON_ID))
                .willReturn(Optional.of(persisted(OTHER_LEDGER)));

        assertThatThrownBy(() -> subject.run(new DefaultApplicationArguments()))
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining(OTHER_LEDGER);
        verify(stateRepository, never()).save(any());
    }

    private static DistributorState persisted(String ledger) {
        return DistributorState.builder()
                .ledgerAddress(ledger)
                .authorityAddress(AUTHORITY.toLowerCase())
                .assetReference("custody")
                .build();
    }
}
