package com.coopledger.cycle;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;

@Repository
public interface CycleRepository extends JpaRepository<Cycle, String> {

    List<Cycle> findByStatus(CycleStatus status);

    Optional<Cycle> findFirstByStatusOrderByYearDesc(CycleStatus status);

    boolean existsByYear(int year);
}
