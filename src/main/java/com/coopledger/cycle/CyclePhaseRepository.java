package com.coopledger.cycle;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;

@Repository
public interface CyclePhaseRepository extends JpaRepository<CyclePhase, String> {

    Optional<CyclePhase> findByCycleIdAndPhaseType(String cycleId, PhaseType phaseType);

    List<CyclePhase> findByCycleId(String cycleId);
}
