package com.ias.distributor.repository;

import com.ias.distributor.entity.SettlementEvent;
import com.ias.distributor.entity.SettlementEventType;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.UUID;

@Repository
public interface SettlementEventRepository extends JpaRepository<SettlementEvent, UUID> {

    List<SettlementEvent> findByAffiliateAddressOrderByCreatedAtDesc(String affiliateAddress);

    List<SettlementEvent> findTop100ByOrderByCreatedAtDesc();

    List<SettlementEvent> findByType(SettlementEventType type);
}
