package com.coopledger.credit;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;

@Repository
public interface CreditRatingTierRepository extends JpaRepository<CreditRatingTier, String> {

    List<CreditRatingTier> findBySchemeIdOrderByTierOrderAsc(String schemeId);
}
