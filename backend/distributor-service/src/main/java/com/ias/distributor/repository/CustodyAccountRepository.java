package com.ias.distributor.repository;

import com.ias.distributor.entity.CustodyAccount;
import jakarta.persistence.LockModeType;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.stereotype.Repository;

import java.util.Optional;

@Repository
public interface CustodyAccountRepository extends JpaRepository<CustodyAccount, String> {

    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("SELECT a FROM CustodyAccount a WHERE a.accountAddress = :accountAddress")
    Optional<CustodyAccount> findByIdForUpdate(String accountAddress);
}
