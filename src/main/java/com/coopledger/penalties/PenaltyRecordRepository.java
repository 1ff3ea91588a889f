package com.coopledger.penalties;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.Collection;
import java.util.List;

@Repository
public interface PenaltyRecordRepository extends JpaRepository<PenaltyRecord, String> {

    List<PenaltyRecord> findByMemberIdAndPenaltyTypeId(String memberId, String penaltyTypeId);

    List<PenaltyRecord> findByMemberIdAndStatusOrderByDateIssuedAscCreatedAtAsc(
        String memberId, PenaltyRecordStatus status);

    List<PenaltyRecord> findByMemberIdAndStatusInOrderByDateIssuedAsc(
        String memberId, Collection<PenaltyRecordStatus> statuses);
}
