package com.coopledger.ledger;

import com.coopledger.common.Amounts;
import com.coopledger.common.exception.ConfigurationException;
import com.coopledger.common.exception.ImbalancedEntryException;
import com.coopledger.common.exception.InvalidStateException;
import com.coopledger.common.exception.NotFoundException;
import com.coopledger.common.exception.ValidationException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Optional;

/**
 * Service for the double-entry ledger.
 *
 * Every financial effect in the cooperative is recorded here as a balanced
 * journal entry. Entries are never updated or deleted; corrections are posted
 * as reversing entries.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class LedgerService {

    private final LedgerAccountRepository accountRepository;
    private final JournalEntryRepository entryRepository;
    private final JournalLineRepository lineRepository;
    private final PostingLockRepository postingLockRepository;
    private final SubaccountRegistry subaccountRegistry;
    private final Clock clock;

    /**
     * Post a journal entry. Either the header and all lines are persisted, or nothing is.
     *
     * @throws ValidationException if there are no lines or a line amount is negative
     * @throws ImbalancedEntryException if debits and credits differ
     * @throws NotFoundException if a line references an unknown account
     */
    @Transactional
    public JournalEntry createJournalEntry(JournalEntryRequest request) {
        if (request.getLines() == null || request.getLines().isEmpty()) {
            throw new ValidationException("Journal entry must have at least one line");
        }
        if (request.getCreatedBy() == null || request.getCreatedBy().isBlank()) {
            throw new ValidationException("Journal entry must record who created it");
        }

        BigDecimal totalDebits = BigDecimal.ZERO;
        BigDecimal totalCredits = BigDecimal.ZERO;
        for (JournalLineRequest line : request.getLines()) {
            BigDecimal debit = Amounts.requireNonNegative(line.getDebitAmount(), "Debit amount");
            BigDecimal credit = Amounts.requireNonNegative(line.getCreditAmount(), "Credit amount");
            totalDebits = totalDebits.add(debit);
            totalCredits = totalCredits.add(credit);
        }
        if (totalDebits.compareTo(totalCredits) != 0) {
            for (JournalLineRequest line : request.getLines()) {
                log.error("Imbalanced entry '{}' line: account={}, debit={}, credit={}",
                    request.getDescription(), line.getAccountId(), line.getDebitAmount(), line.getCreditAmount());
            }
            throw new ImbalancedEntryException(totalDebits, totalCredits);
        }

        JournalEntry entry = new JournalEntry(LocalDate.now(clock), request.getDescription(),
            request.getCycleId(), request.getSourceType(), request.getSourceRef(), request.getCreatedBy());
        entryRepository.save(entry);

        int lineNumber = 1;
        for (JournalLineRequest line : request.getLines()) {
            if (!accountRepository.existsById(line.getAccountId())) {
                throw new NotFoundException("Ledger account", line.getAccountId());
            }
            lineRepository.save(new JournalLine(entry, lineNumber++, line.getAccountId(),
                Amounts.normalize(line.getDebitAmount()), Amounts.normalize(line.getCreditAmount()),
                line.getDescription()));
        }

        log.info("Recorded {}: entry={}, ref={}, cycle={}, amount={}",
            entry.getSourceType(), entry.getId(), entry.getSourceRef(), entry.getCycleId(), totalDebits);

        return entry;
    }

    /**
     * Post a mirror entry that swaps every line's debit and credit, and stamp the original as reversed.
     */
    @Transactional
    public JournalEntry reverseEntry(String entryId, String actorId, String reason) {
        JournalEntry original = getEntry(entryId);
        if (original.isReversed()) {
            throw new InvalidStateException("Journal entry", entryId, "REVERSED", "reverse");
        }
        if (original.getSourceType() == SourceType.REVERSAL) {
            throw new InvalidStateException("Reversing entries cannot themselves be reversed: " + entryId);
        }

        JournalEntryRequest.JournalEntryRequestBuilder mirror = JournalEntryRequest.builder()
            .description("Reversal of " + original.getDescription()
                + (reason != null && !reason.isBlank() ? ": " + reason : ""))
            .cycleId(original.getCycleId())
            .sourceType(SourceType.REVERSAL)
            .sourceRef(original.getId())
            .createdBy(actorId);
        for (JournalLine line : getLines(entryId)) {
            mirror.line(new JournalLineRequest(line.getAccountId(), line.getCreditAmount(),
                line.getDebitAmount(), line.getDescription()));
        }

        JournalEntry reversal = createJournalEntry(mirror.build());
        original.markReversed(actorId, reason, reversal.getId());
        entryRepository.save(original);

        log.info("Reversed journal entry {} with {} by {}", entryId, reversal.getId(), actorId);
        return reversal;
    }

    @Transactional(readOnly = true)
    public JournalEntry getEntry(String entryId) {
        return entryRepository.findById(entryId)
            .orElseThrow(() -> new NotFoundException("Journal entry", entryId));
    }

    @Transactional(readOnly = true)
    public List<JournalLine> getLines(String entryId) {
        return lineRepository.findByEntryIdOrderByLineNumberAsc(entryId);
    }

    @Transactional(readOnly = true)
    public List<JournalEntry> findEntriesBySource(SourceType sourceType, String sourceRef) {
        return entryRepository.findBySourceTypeAndSourceRef(sourceType, sourceRef);
    }

    @Transactional(readOnly = true)
    public boolean hasLiveEntry(SourceType sourceType, String sourceRef) {
        return entryRepository.existsBySourceTypeAndSourceRefAndReversedAtIsNull(sourceType, sourceRef);
    }

    @Transactional(readOnly = true)
    public LedgerAccount getAccount(String accountId) {
        return accountRepository.findById(accountId)
            .orElseThrow(() -> new NotFoundException("Ledger account", accountId));
    }

    /**
     * Balance in the account's natural sign: debits minus credits for assets and
     * expenses, credits minus debits for everything else.
     *
     * @param asOf include only lines dated on or before this day, or everything when null
     */
    @Transactional(readOnly = true)
    public BigDecimal getAccountBalance(String accountId, LocalDate asOf) {
        LedgerAccount account = getAccount(accountId);
        LineTotals totals = asOf == null
            ? lineRepository.totalsFor(accountId)
            : lineRepository.totalsAsOf(accountId, asOf);
        return totals == null ? Amounts.normalize(null) : totals.balanceFor(account.getAccountType());
    }

    @Transactional(readOnly = true)
    public BigDecimal getAccountBalance(String accountId) {
        return getAccountBalance(accountId, null);
    }

    @Transactional(readOnly = true)
    public List<StatementLine> getAccountStatement(String accountId) {
        LedgerAccount account = getAccount(accountId);
        BigDecimal running = BigDecimal.ZERO;
        List<StatementLine> statement = new ArrayList<>();
        for (JournalLine line : lineRepository.findByAccountIdOrderByEntryDateAscLineNumberAsc(accountId)) {
            BigDecimal movement = account.getAccountType().isDebitNormal()
                ? line.getDebitAmount().subtract(line.getCreditAmount())
                : line.getCreditAmount().subtract(line.getDebitAmount());
            running = running.add(movement);
            statement.add(new StatementLine(line.getEntryDate(), line.getEntryId(), line.getDescription(),
                line.getDebitAmount(), line.getCreditAmount(), Amounts.normalize(running)));
        }
        return statement;
    }

    /**
     * Debit and credit totals on an account from live entries of one source in one cycle.
     */
    @Transactional(readOnly = true)
    public LineTotals getLiveTotals(String accountId, SourceType sourceType, String cycleId) {
        LineTotals totals = lineRepository.liveTotalsBySource(accountId, sourceType, cycleId);
        return totals == null ? new LineTotals(null, null) : totals;
    }

    /**
     * @throws ConfigurationException when the chart of accounts has not been bootstrapped
     */
    @Transactional(readOnly = true)
    public LedgerAccount requireOrgAccount(OrgAccount orgAccount) {
        return accountRepository.findByCode(orgAccount.getCode())
            .orElseThrow(() -> new ConfigurationException(
                "Organization ledger account " + orgAccount.getCode() + " is not configured"));
    }

    @Transactional
    public LedgerAccount getOrCreateMemberSubaccount(String memberId, String memberName, FundKind fundKind) {
        return subaccountRegistry.resolve(memberId, fundKind, () ->
            accountRepository.findByMemberIdAndFundKind(memberId, fundKind)
                .orElseGet(() -> createMemberSubaccount(memberId, memberName, fundKind)));
    }

    @Transactional(readOnly = true)
    public Optional<LedgerAccount> findMemberSubaccount(String memberId, FundKind fundKind) {
        return accountRepository.findByMemberIdAndFundKind(memberId, fundKind);
    }

    /**
     * Balance of a member sub-account, zero when it has never been used.
     */
    @Transactional(readOnly = true)
    public BigDecimal getMemberBalance(String memberId, FundKind fundKind) {
        return findMemberSubaccount(memberId, fundKind)
            .map(account -> getAccountBalance(account.getId()))
            .orElse(Amounts.normalize(null));
    }

    /**
     * What the member still owes on a fund receivable, never negative.
     */
    @Transactional(readOnly = true)
    public BigDecimal getMemberFundDue(String memberId, FundKind fundKind) {
        BigDecimal balance = getMemberBalance(memberId, fundKind);
        return balance.signum() > 0 ? balance : Amounts.normalize(null);
    }

    /**
     * Payments the member made into a fund through live deposit approvals in the cycle.
     */
    @Transactional(readOnly = true)
    public BigDecimal getMemberFundPayments(String memberId, FundKind fundKind, String cycleId) {
        return findMemberSubaccount(memberId, fundKind)
            .map(account -> getLiveTotals(account.getId(), SourceType.DEPOSIT_APPROVAL, cycleId).getCredits())
            .orElse(Amounts.normalize(null));
    }

    @Transactional(readOnly = true)
    public List<LedgerAccount> getMemberAccounts(String memberId) {
        return accountRepository.findByMemberId(memberId);
    }

    @Transactional
    public PostingLock lockCycle(String cycleId, String actorId, String reason) {
        Optional<PostingLock> existing = postingLockRepository.findByCycleId(cycleId);
        if (existing.isPresent()) {
            log.info("Cycle {} is already locked for posting", cycleId);
            return existing.get();
        }
        PostingLock lock = postingLockRepository.save(new PostingLock(cycleId, actorId, reason));
        log.info("Locked posting for cycle {} by {}", cycleId, actorId);
        return lock;
    }

    @Transactional
    public void unlockCycle(String cycleId, String actorId) {
        postingLockRepository.findByCycleId(cycleId).ifPresent(lock -> {
            postingLockRepository.delete(lock);
            log.info("Unlocked posting for cycle {} by {}", cycleId, actorId);
        });
    }

    @Transactional(readOnly = true)
    public boolean isCycleLocked(String cycleId) {
        return cycleId != null && postingLockRepository.existsByCycleId(cycleId);
    }

    /**
     * @throws InvalidStateException if a posting lock is held for the cycle
     */
    @Transactional(readOnly = true)
    public void assertCycleUnlocked(String cycleId) {
        if (isCycleLocked(cycleId)) {
            throw new InvalidStateException("Posting is locked for cycle " + cycleId);
        }
    }

    private LedgerAccount createMemberSubaccount(String memberId, String memberName, FundKind fundKind) {
        String base = fundKind.getCodePrefix() + "_" + memberCodeFragment(memberId);
        String code = base;
        int suffix = 2;
        while (accountRepository.existsByCode(code)) {
            code = base + "_" + suffix++;
        }
        LedgerAccount account = accountRepository.save(
            LedgerAccount.forMember(code, memberName, memberId, fundKind));
        log.info("Created {} sub-account {} for member {}", fundKind, code, memberId);
        return account;
    }

    private static String memberCodeFragment(String memberId) {
        String compact = memberId.replace("-", "").toUpperCase(Locale.ROOT);
        return compact.length() > 8 ? compact.substring(0, 8) : compact;
    }
}
