package com.ias.distributor.repository;

import com.ias.distributor.entity.DistributorState;
import jakarta.persistence.LockModeType;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.stereotype.Repository;

import java.util.Optional;

@Repository
public interface DistributorStateRepository extends JpaRepository<DistributorState, Long> {

    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("SELECT s FROM DistributorState s WHERE s.id = :id")
    Optional<DistributorState> findByIdForUpdate(Long id);
}
