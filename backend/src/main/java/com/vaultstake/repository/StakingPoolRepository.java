package com.vaultstake.repository;

import com.vaultstake.model.StakingPool;
import jakarta.persistence.LockModeType;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.Optional;

@Repository
public interface StakingPoolRepository extends JpaRepository<StakingPool, Integer> {

    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("select p from StakingPool p where p.id = :id")
    Optional<StakingPool> findByIdForUpdate(@Param("id") Integer id);
}
