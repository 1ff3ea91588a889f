package com.coopledger.credit;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;

@Repository
public interface CreditRatingSchemeRepository extends JpaRepository<CreditRatingScheme, String> {

    List<CreditRatingScheme> findByActiveTrueOrderByEffectiveFromDesc();
}
