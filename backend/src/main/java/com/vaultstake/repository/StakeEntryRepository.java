package com.vaultstake.repository;

import com.vaultstake.model.StakeEntry;
import com.vaultstake.model.StakeState;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

@Repository
public interface StakeEntryRepository extends JpaRepository<StakeEntry, String> {
    long countByState(StakeState state);
}
