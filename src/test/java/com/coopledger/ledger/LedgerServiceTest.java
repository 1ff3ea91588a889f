package com.coopledger.ledger;

import com.coopledger.common.Amounts;
import com.coopledger.common.exception.ImbalancedEntryException;
import com.coopledger.common.exception.InvalidStateException;
import com.coopledger.common.exception.NotFoundException;
import com.coopledger.common.exception.ValidationException;
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
import java.util.UUID;

import static com.coopledger.ledger.JournalLineRequest.credit;
import static com.coopledger.ledger.JournalLineRequest.debit;
import static org.junit.jupiter.api.Assertions.*;

/**
 * Integration tests for posting, reversing and querying journal entries.
 */
@SpringBootTest
@ActiveProfiles("test")
@Transactional
@Import(TestClockConfig.class)
class LedgerServiceTest {

    @Autowired
    private LedgerService ledgerService;

    @Autowired
    private MutableClock clock;

    private LedgerAccount cash;
    private LedgerAccount savings;
    private String memberId;

    @BeforeEach
    void setUp() {
        clock.setDate(LocalDate.of(2025, 3, 10));
        memberId = UUID.randomUUID().toString();
        cash = ledgerService.requireOrgAccount(OrgAccount.BANK_CASH);
        savings = ledgerService.getOrCreateMemberSubaccount(memberId, "Ada Member", FundKind.SAVINGS);
    }

    @Test
    void testBalancedEntryIsPosted() {
        BigDecimal cashBefore = ledgerService.getAccountBalance(cash.getId());

        JournalEntry entry = postDeposit("100.00", "manual-1");

        List<JournalLine> lines = ledgerService.getLines(entry.getId());
        assertEquals(2, lines.size());
        assertEquals(1, lines.get(0).getLineNumber());
        assertEquals(2, lines.get(1).getLineNumber());
        assertEquals(LocalDate.of(2025, 3, 10), lines.get(0).getEntryDate());
        assertEquals(SourceType.MANUAL, entry.getSourceType());
        assertEquals(0, Amounts.of("100.00").compareTo(
            ledgerService.getAccountBalance(cash.getId()).subtract(cashBefore)));
    }

    @Test
    void testImbalancedEntryIsRejected() {
        JournalEntryRequest request = JournalEntryRequest.builder()
            .description("Broken deposit")
            .sourceRef("imbalanced-1")
            .createdBy("treasurer-1")
            .line(debit(cash.getId(), Amounts.of("100.00"), "Cash"))
            .line(credit(savings.getId(), Amounts.of("99.98"), "Savings"))
            .build();

        ImbalancedEntryException e = assertThrows(ImbalancedEntryException.class,
            () -> ledgerService.createJournalEntry(request));

        assertEquals(0, Amounts.of("100.00").compareTo(e.getTotalDebits()));
        assertTrue(ledgerService.findEntriesBySource(SourceType.MANUAL, "imbalanced-1").isEmpty());
        assertEquals(0, BigDecimal.ZERO.compareTo(ledgerService.getAccountBalance(savings.getId())));
    }

    @Test
    void testOneCentDifferenceIsRejected() {
        JournalEntryRequest request = JournalEntryRequest.builder()
            .description("Rounded deposit")
            .sourceRef("imbalanced-2")
            .createdBy("treasurer-1")
            .line(debit(cash.getId(), Amounts.of("100.00"), "Cash"))
            .line(credit(savings.getId(), Amounts.of("99.99"), "Savings"))
            .build();

        ImbalancedEntryException e = assertThrows(ImbalancedEntryException.class,
            () -> ledgerService.createJournalEntry(request));

        assertEquals(0, Amounts.of("99.99").compareTo(e.getTotalCredits()));
        assertTrue(ledgerService.findEntriesBySource(SourceType.MANUAL, "imbalanced-2").isEmpty());
    }

    @Test
    void testAmountsOfDifferentScaleBalance() {
        JournalEntry entry = ledgerService.createJournalEntry(JournalEntryRequest.builder()
            .description("Whole amount")
            .createdBy("treasurer-1")
            .line(debit(cash.getId(), new BigDecimal("100"), "Cash"))
            .line(credit(savings.getId(), Amounts.of("100.00"), "Savings"))
            .build());

        assertNotNull(entry.getId());
    }

    @Test
    void testEntryWithoutLinesIsRejected() {
        JournalEntryRequest request = JournalEntryRequest.builder()
            .description("Empty")
            .createdBy("treasurer-1")
            .build();

        assertThrows(ValidationException.class, () -> ledgerService.createJournalEntry(request));
    }

    @Test
    void testNegativeLineIsRejected() {
        JournalEntryRequest request = JournalEntryRequest.builder()
            .description("Negative")
            .createdBy("treasurer-1")
            .line(debit(cash.getId(), Amounts.of("-10.00"), "Cash"))
            .line(credit(savings.getId(), Amounts.of("-10.00"), "Savings"))
            .build();

        assertThrows(ValidationException.class, () -> ledgerService.createJournalEntry(request));
    }

    @Test
    void testUnknownAccountIsRejected() {
        JournalEntryRequest request = JournalEntryRequest.builder()
            .description("Unknown account")
            .createdBy("treasurer-1")
            .line(debit(cash.getId(), Amounts.of("10.00"), "Cash"))
            .line(credit("no-such-account", Amounts.of("10.00"), "Nowhere"))
            .build();

        assertThrows(NotFoundException.class, () -> ledgerService.createJournalEntry(request));
    }

    @Test
    void testBalanceFollowsAccountType() {
        // Given
        BigDecimal cashBefore = ledgerService.getAccountBalance(cash.getId());

        // When: cash (asset) is debited, savings (liability) is credited
        postDeposit("250.00", "manual-2");

        // Then both balances grow
        assertEquals(0, Amounts.of("250.00").compareTo(
            ledgerService.getAccountBalance(cash.getId()).subtract(cashBefore)));
        assertEquals(0, Amounts.of("250.00").compareTo(ledgerService.getAccountBalance(savings.getId())));
        assertEquals(0, Amounts.of("250.00").compareTo(ledgerService.getMemberBalance(memberId, FundKind.SAVINGS)));
    }

    @Test
    void testReversalRestoresBalances() {
        JournalEntry original = postDeposit("80.00", "manual-3");

        JournalEntry reversal = ledgerService.reverseEntry(original.getId(), "treasurer-1", "Posted twice");

        assertEquals(SourceType.REVERSAL, reversal.getSourceType());
        assertEquals(original.getId(), reversal.getSourceRef());
        JournalEntry reloaded = ledgerService.getEntry(original.getId());
        assertTrue(reloaded.isReversed());
        assertEquals(reversal.getId(), reloaded.getReversalEntryId());
        assertEquals("Posted twice", reloaded.getReversalReason());
        assertEquals(0, BigDecimal.ZERO.compareTo(ledgerService.getAccountBalance(savings.getId())));

        List<JournalLine> mirrored = ledgerService.getLines(reversal.getId());
        assertEquals(0, Amounts.of("80.00").compareTo(mirrored.get(0).getCreditAmount()));
        assertEquals(0, Amounts.of("80.00").compareTo(mirrored.get(1).getDebitAmount()));
    }

    @Test
    void testEntryCannotBeReversedTwice() {
        JournalEntry original = postDeposit("40.00", "manual-4");
        JournalEntry reversal = ledgerService.reverseEntry(original.getId(), "treasurer-1", "Wrong member");

        assertThrows(InvalidStateException.class,
            () -> ledgerService.reverseEntry(original.getId(), "treasurer-1", "Again"));
        assertThrows(InvalidStateException.class,
            () -> ledgerService.reverseEntry(reversal.getId(), "treasurer-1", "Undo the undo"));
    }

    @Test
    void testReversedEntryIsNotLive() {
        JournalEntry original = postDeposit("40.00", "manual-5");
        assertTrue(ledgerService.hasLiveEntry(SourceType.MANUAL, "manual-5"));

        ledgerService.reverseEntry(original.getId(), "treasurer-1", null);

        assertFalse(ledgerService.hasLiveEntry(SourceType.MANUAL, "manual-5"));
    }

    @Test
    void testBalanceAsOfDate() {
        clock.setDate(LocalDate.of(2025, 3, 10));
        postDeposit("100.00", "manual-6");
        clock.setDate(LocalDate.of(2025, 3, 20));
        postDeposit("50.00", "manual-7");

        assertEquals(0, Amounts.of("100.00").compareTo(
            ledgerService.getAccountBalance(savings.getId(), LocalDate.of(2025, 3, 15))));
        assertEquals(0, BigDecimal.ZERO.compareTo(
            ledgerService.getAccountBalance(savings.getId(), LocalDate.of(2025, 3, 9))));
        assertEquals(0, Amounts.of("150.00").compareTo(ledgerService.getAccountBalance(savings.getId())));
    }

    @Test
    void testStatementCarriesRunningBalance() {
        postDeposit("100.00", "manual-8");
        clock.setDate(LocalDate.of(2025, 3, 11));
        postDeposit("25.50", "manual-9");

        List<StatementLine> statement = ledgerService.getAccountStatement(savings.getId());

        assertEquals(2, statement.size());
        assertEquals(0, Amounts.of("100.00").compareTo(statement.get(0).getRunningBalance()));
        assertEquals(0, Amounts.of("125.50").compareTo(statement.get(1).getRunningBalance()));
    }

    @Test
    void testMemberSubaccountIsCreatedOnce() {
        LedgerAccount again = ledgerService.getOrCreateMemberSubaccount(memberId, "Ada Member", FundKind.SAVINGS);

        assertEquals(savings.getId(), again.getId());
        assertEquals(AccountType.LIABILITY, savings.getAccountType());
        String fragment = memberId.replace("-", "").toUpperCase().substring(0, 8);
        assertEquals("MEM_SAV_" + fragment, savings.getCode());
        assertEquals(1, ledgerService.getMemberAccounts(memberId).size());
    }

    @Test
    void testSubaccountCodeCollisionGetsSuffix() {
        LedgerAccount first = ledgerService.getOrCreateMemberSubaccount(
            "abcdef12-0000-0000-0000-000000000001", "First", FundKind.PENALTIES_PAYABLE);
        LedgerAccount second = ledgerService.getOrCreateMemberSubaccount(
            "abcdef12-0000-0000-0000-000000000002", "Second", FundKind.PENALTIES_PAYABLE);

        assertEquals("PEN_PAY_ABCDEF12", first.getCode());
        assertEquals("PEN_PAY_ABCDEF12_2", second.getCode());
        assertEquals(AccountType.ASSET, second.getAccountType());
    }

    @Test
    void testPostingLock() {
        String cycleId = UUID.randomUUID().toString();
        assertFalse(ledgerService.isCycleLocked(cycleId));

        ledgerService.lockCycle(cycleId, "treasurer-1", "Year end audit");
        ledgerService.lockCycle(cycleId, "treasurer-1", "Locked again");

        assertTrue(ledgerService.isCycleLocked(cycleId));
        assertThrows(InvalidStateException.class, () -> ledgerService.assertCycleUnlocked(cycleId));

        ledgerService.unlockCycle(cycleId, "treasurer-1");
        assertFalse(ledgerService.isCycleLocked(cycleId));
    }

    private JournalEntry postDeposit(String amount, String sourceRef) {
        return ledgerService.createJournalEntry(JournalEntryRequest.builder()
            .description("Deposit " + sourceRef)
            .sourceRef(sourceRef)
            .createdBy("treasurer-1")
            .line(debit(cash.getId(), Amounts.of(amount), "Cash"))
            .line(credit(savings.getId(), Amounts.of(amount), "Savings"))
            .build());
    }
}
