package com.coopledger.penalties;

import com.coopledger.common.Amounts;
import com.coopledger.common.Months;
import com.coopledger.common.exception.NotFoundException;
import com.coopledger.common.exception.ValidationException;
import com.coopledger.ledger.FundKind;
import com.coopledger.ledger.JournalEntry;
import com.coopledger.ledger.JournalEntryRequest;
import com.coopledger.ledger.JournalLineRequest;
import com.coopledger.ledger.LedgerAccount;
import com.coopledger.ledger.LedgerService;
import com.coopledger.ledger.OrgAccount;
import com.coopledger.ledger.SourceType;
import com.coopledger.members.Member;
import com.coopledger.members.MemberService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.EnumSet;
import java.util.List;

/**
 * Service for penalty types and the penalty records charged to members.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class PenaltyService {

    private final PenaltyTypeRepository typeRepository;
    private final PenaltyRecordRepository recordRepository;
    private final MemberService memberService;
    private final LedgerService ledgerService;
    private final Clock clock;

    @Transactional
    public PenaltyType createPenaltyType(String name, String description, BigDecimal feeAmount) {
        if (!Amounts.isPositive(feeAmount)) {
            throw new ValidationException("Penalty fee must be positive: " + feeAmount);
        }
        if (typeRepository.findByName(name).isPresent()) {
            throw new ValidationException("A penalty type named '" + name + "' already exists");
        }
        PenaltyType type = typeRepository.save(new PenaltyType(name, description, Amounts.normalize(feeAmount)));
        log.info("Created penalty type {} ({}) with fee {}", type.getId(), name, type.getFeeAmount());
        return type;
    }

    @Transactional
    public PenaltyType setEnabled(String penaltyTypeId, boolean enabled) {
        PenaltyType type = getPenaltyType(penaltyTypeId);
        type.setEnabled(enabled);
        log.info("{} penalty type {}", enabled ? "Enabled" : "Disabled", penaltyTypeId);
        return typeRepository.save(type);
    }

    @Transactional(readOnly = true)
    public PenaltyType getPenaltyType(String penaltyTypeId) {
        return typeRepository.findById(penaltyTypeId)
            .orElseThrow(() -> new NotFoundException("Penalty type", penaltyTypeId));
    }

    @Transactional(readOnly = true)
    public PenaltyRecord getRecord(String recordId) {
        return recordRepository.findById(recordId)
            .orElseThrow(() -> new NotFoundException("Penalty record", recordId));
    }

    /**
     * Record a penalty raised by a treasurer. It is not charged until approved.
     */
    @Transactional
    public PenaltyRecord recordPenalty(String memberId, String penaltyTypeId, String cycleId,
                                       String notes, String actorId) {
        Member member = memberService.getMember(memberId);
        PenaltyType type = getPenaltyType(penaltyTypeId);
        LocalDate today = LocalDate.now(clock);
        PenaltyRecord record = recordRepository.save(new PenaltyRecord(member.getId(), type, cycleId,
            today, Months.firstDay(today), notes, actorId));
        log.info("Recorded penalty {}: member={}, type={}, fee={}, by={}",
            record.getId(), memberId, type.getName(), record.getFeeAmount(), actorId);
        return record;
    }

    @Transactional
    public PenaltyRecord approvePenalty(String recordId, String actorId) {
        PenaltyRecord record = getRecord(recordId);
        Member member = memberService.getMember(record.getMemberId());
        return charge(record, member, actorId);
    }

    /**
     * Post the penalty to the ledger and mark the record approved.
     * Debits the member's penalties payable and credits penalty income.
     */
    @Transactional
    public PenaltyRecord charge(PenaltyRecord record, Member member, String actorId) {
        LedgerAccount payable = ledgerService.getOrCreateMemberSubaccount(
            member.getId(), member.getDisplayName(), FundKind.PENALTIES_PAYABLE);
        LedgerAccount income = ledgerService.requireOrgAccount(OrgAccount.PENALTY_INCOME);
        PenaltyType type = getPenaltyType(record.getPenaltyTypeId());

        String description = "Penalty " + type.getName() + " for " + member.getDisplayName();
        JournalEntry entry = ledgerService.createJournalEntry(JournalEntryRequest.builder()
            .description(description)
            .cycleId(record.getCycleId())
            .sourceType(SourceType.PENALTY)
            .sourceRef(record.getId())
            .createdBy(actorId)
            .line(JournalLineRequest.debit(payable.getId(), record.getFeeAmount(), description))
            .line(JournalLineRequest.credit(income.getId(), record.getFeeAmount(), description))
            .build());

        record.approve(actorId, entry.getId());
        recordRepository.save(record);
        log.info("Approved penalty {}: member={}, fee={}, entry={}, by={}",
            record.getId(), member.getId(), record.getFeeAmount(), entry.getId(), actorId);
        return record;
    }

    @Transactional(readOnly = true)
    public ApplicablePenalties applicablePenalties(String memberId) {
        List<PenaltyRecord> outstanding = recordRepository.findByMemberIdAndStatusInOrderByDateIssuedAsc(
            memberId, EnumSet.of(PenaltyRecordStatus.PENDING, PenaltyRecordStatus.APPROVED));
        BigDecimal total = Amounts.sum(outstanding.stream()
            .map(PenaltyRecord::getFeeAmount).toArray(BigDecimal[]::new));
        return new ApplicablePenalties(outstanding, total);
    }

    @Transactional(readOnly = true)
    public boolean existsForMonth(String memberId, String penaltyTypeId, LocalDate effectiveMonth) {
        return recordRepository.findByMemberIdAndPenaltyTypeId(memberId, penaltyTypeId).stream()
            .anyMatch(record -> record.coversMonth(effectiveMonth));
    }

    /**
     * Mark approved penalties paid out of a declared penalty payment, oldest first.
     * A record is paid when its fee fits in what is left of the payment. Records are
     * matched by fee amount only.
     *
     * @return the records marked paid
     */
    @Transactional
    public List<PenaltyRecord> settleFromPayment(String memberId, BigDecimal declaredPenalties,
                                                 String depositEntryId) {
        BigDecimal remaining = Amounts.normalize(declaredPenalties);
        List<PenaltyRecord> paid = new ArrayList<>();
        if (remaining.signum() <= 0) {
            return paid;
        }
        for (PenaltyRecord record : recordRepository.findByMemberIdAndStatusOrderByDateIssuedAscCreatedAtAsc(
                memberId, PenaltyRecordStatus.APPROVED)) {
            if (record.getFeeAmount().compareTo(remaining) <= 0) {
                record.markPaid(depositEntryId);
                recordRepository.save(record);
                remaining = remaining.subtract(record.getFeeAmount());
                paid.add(record);
                log.info("Settled penalty {} for member {} from entry {}", record.getId(), memberId, depositEntryId);
            }
            if (remaining.signum() <= 0) {
                break;
            }
        }
        return paid;
    }
}
