package com.coopledger.penalties;

import com.coopledger.common.Amounts;
import com.coopledger.common.exception.InvalidStateException;
import com.coopledger.common.exception.ValidationException;
import com.coopledger.cycle.Cycle;
import com.coopledger.cycle.CycleService;
import com.coopledger.ledger.FundKind;
import com.coopledger.ledger.LedgerService;
import com.coopledger.ledger.OrgAccount;
import com.coopledger.members.Member;
import com.coopledger.members.MemberService;
import com.coopledger.support.CooperativeFixtures;
import com.coopledger.support.MutableClock;
import com.coopledger.support.TestClockConfig;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.context.annotation.Import;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.List;

import static com.coopledger.support.CooperativeFixtures.TREASURER;
import static org.junit.jupiter.api.Assertions.*;

/**
 * Integration tests for penalty types, manual penalties and settlement.
 */
@SpringBootTest
@ActiveProfiles("test")
@Transactional
@Import(TestClockConfig.class)
class PenaltyServiceTest {

    @Autowired
    private PenaltyService penaltyService;

    @Autowired
    private LedgerService ledgerService;

    @Autowired
    private MemberService memberService;

    @Autowired
    private CycleService cycleService;

    @Autowired
    private MutableClock clock;

    private Member member;
    private Cycle cycle;

    @BeforeEach
    void setUp() {
        clock.setDate(LocalDate.of(2025, 3, 1));
        CooperativeFixtures fixtures = new CooperativeFixtures(memberService, cycleService);
        member = fixtures.member("Barbara Member");
        cycle = fixtures.activeCycle(2025, null, null);
    }

    @Test
    void testPenaltyTypeNeedsPositiveFee() {
        assertThrows(ValidationException.class,
            () -> penaltyService.createPenaltyType("Free", null, Amounts.of("0.00")));
    }

    @Test
    void testPenaltyTypeNameIsUnique() {
        penaltyService.createPenaltyType("Absence", null, Amounts.of("5.00"));

        assertThrows(ValidationException.class,
            () -> penaltyService.createPenaltyType("Absence", null, Amounts.of("7.00")));
    }

    @Test
    void testRecordedPenaltyIsChargedOnApproval() {
        PenaltyType absence = penaltyService.createPenaltyType("Absence", "Missed a meeting", Amounts.of("15.00"));
        String incomeId = ledgerService.requireOrgAccount(OrgAccount.PENALTY_INCOME).getId();
        BigDecimal incomeBefore = ledgerService.getAccountBalance(incomeId);

        PenaltyRecord record = penaltyService.recordPenalty(member.getId(), absence.getId(), cycle.getId(),
            "Missed February meeting", TREASURER);
        assertEquals(PenaltyRecordStatus.PENDING, record.getStatus());
        assertNull(record.getJournalEntryId());

        PenaltyRecord approved = penaltyService.approvePenalty(record.getId(), TREASURER);

        assertEquals(PenaltyRecordStatus.APPROVED, approved.getStatus());
        assertNotNull(approved.getJournalEntryId());
        assertEquals(0, Amounts.of("15.00").compareTo(
            ledgerService.getMemberBalance(member.getId(), FundKind.PENALTIES_PAYABLE)));
        assertEquals(0, Amounts.of("15.00").compareTo(
            ledgerService.getAccountBalance(incomeId).subtract(incomeBefore)));
        assertThrows(InvalidStateException.class, () -> penaltyService.approvePenalty(record.getId(), TREASURER));
    }

    @Test
    void testFeeIsFixedWhenIssued() {
        PenaltyType absence = penaltyService.createPenaltyType("Absence", null, Amounts.of("15.00"));
        PenaltyRecord record = penaltyService.recordPenalty(member.getId(), absence.getId(), cycle.getId(),
            null, TREASURER);

        absence.setFeeAmount(Amounts.of("30.00"));

        assertEquals(0, Amounts.of("15.00").compareTo(penaltyService.getRecord(record.getId()).getFeeAmount()));
    }

    @Test
    void testSettlementPaysOldestRecordsThatFit() {
        // Given approved penalties of 10, 30 and 15, issued in that order
        PenaltyRecord ten = approvedPenalty("Late", "10.00", LocalDate.of(2025, 3, 1));
        PenaltyRecord thirty = approvedPenalty("Absent", "30.00", LocalDate.of(2025, 3, 2));
        PenaltyRecord fifteen = approvedPenalty("Noise", "15.00", LocalDate.of(2025, 3, 3));

        // When 25 is paid
        List<PenaltyRecord> paid = penaltyService.settleFromPayment(member.getId(), Amounts.of("25.00"), "entry-1");

        // Then the 10 and the 15 are paid and the 30 is left
        assertEquals(2, paid.size());
        assertEquals(PenaltyRecordStatus.PAID, penaltyService.getRecord(ten.getId()).getStatus());
        assertEquals(PenaltyRecordStatus.APPROVED, penaltyService.getRecord(thirty.getId()).getStatus());
        assertEquals(PenaltyRecordStatus.PAID, penaltyService.getRecord(fifteen.getId()).getStatus());
        assertEquals(0, Amounts.of("30.00").compareTo(penaltyService.applicablePenalties(member.getId()).getTotal()));
    }

    @Test
    void testPendingPenaltiesAreNotSettled() {
        PenaltyType late = penaltyService.createPenaltyType("Late", null, Amounts.of("10.00"));
        penaltyService.recordPenalty(member.getId(), late.getId(), cycle.getId(), null, TREASURER);

        List<PenaltyRecord> paid = penaltyService.settleFromPayment(member.getId(), Amounts.of("10.00"), "entry-1");

        assertTrue(paid.isEmpty());
        assertEquals(0, Amounts.of("10.00").compareTo(penaltyService.applicablePenalties(member.getId()).getTotal()));
    }

    private PenaltyRecord approvedPenalty(String name, String fee, LocalDate issued) {
        clock.setDate(issued);
        PenaltyType type = penaltyService.createPenaltyType(name, null, Amounts.of(fee));
        PenaltyRecord record = penaltyService.recordPenalty(member.getId(), type.getId(), cycle.getId(),
            null, TREASURER);
        return penaltyService.approvePenalty(record.getId(), TREASURER);
    }
}
