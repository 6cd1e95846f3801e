package com.vaultstake.repository;

import com.vaultstake.model.TrackedOwner;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

@Repository
public interface TrackedOwnerRepository extends JpaRepository<TrackedOwner, String> {
}
