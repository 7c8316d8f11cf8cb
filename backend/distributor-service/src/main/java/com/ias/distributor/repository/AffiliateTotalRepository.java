package com.ias.distributor.repository;

import com.ias.distributor.entity.AffiliateTotal;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

@Repository
public interface AffiliateTotalRepository extends JpaRepository<AffiliateTotal, String> {
}
