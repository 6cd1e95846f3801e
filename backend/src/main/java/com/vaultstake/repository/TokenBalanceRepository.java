package com.vaultstake.repository;

import com.vaultstake.model.TokenBalance;
import jakarta.persistence.LockModeType;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.Optional;

@Repository
public interface TokenBalanceRepository extends JpaRepository<TokenBalance, String> {

    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("select b from TokenBalance b where b.holder = :holder")
    Optional<TokenBalance> findByHolderForUpdate(@Param("holder") String holder);
}
