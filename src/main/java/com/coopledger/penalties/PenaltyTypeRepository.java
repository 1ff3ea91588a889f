package com.coopledger.penalties;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.Optional;

@Repository
public interface PenaltyTypeRepository extends JpaRepository<PenaltyType, String> {

    Optional<PenaltyType> findByName(String name);
}
