package com.ias.distributor.repository;

import com.ias.distributor.entity.RewardClaim;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.UUID;

@Repository
public interface RewardClaimRepository extends JpaRepository<RewardClaim, UUID> {

    boolean existsByAffiliateAddressAndEpoch(String affiliateAddress, Long epoch);

    List<RewardClaim> findByAffiliateAddressOrderBySettledAtDesc(String affiliateAddress);
}
