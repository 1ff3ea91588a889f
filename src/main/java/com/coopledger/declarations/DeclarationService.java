package com.coopledger.declarations;

import com.coopledger.common.Amounts;
import com.coopledger.common.Months;
import com.coopledger.common.exception.InvalidStateException;
import com.coopledger.common.exception.NotFoundException;
import com.coopledger.common.exception.ValidationException;
import com.coopledger.cycle.Cycle;
import com.coopledger.cycle.CyclePhase;
import com.coopledger.cycle.CycleService;
import com.coopledger.cycle.PhaseType;
import com.coopledger.funds.InitialRequirementPoster;
import com.coopledger.members.Member;
import com.coopledger.members.MemberService;
import com.coopledger.penalties.PenaltyAutoApplier;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.LocalDate;
import java.time.YearMonth;
import java.util.List;
import java.util.Optional;

/**
 * Service for member declarations and the proofs uploaded against them.
 * Approval of a proof is handled by the deposit approval poster.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class DeclarationService {

    private final DeclarationRepository declarationRepository;
    private final DepositProofRepository proofRepository;
    private final MemberService memberService;
    private final CycleService cycleService;
    private final InitialRequirementPoster initialRequirementPoster;
    private final PenaltyAutoApplier penaltyAutoApplier;
    private final Clock clock;

    @Value("${cooperative.declarations.edit-cutoff-day:20}")
    private int editCutoffDay;

    /**
     * Create the member's declaration for a month. The first declaration in a cycle
     * also charges the cycle's fund requirement, and a late declaration is penalized.
     *
     * @param effectiveMonth any day of the month being declared
     */
    @Transactional
    public Declaration createDeclaration(String memberId, String cycleId, LocalDate effectiveMonth,
                                         DeclaredAmounts amounts, String actorId) {
        Member member = memberService.getActiveMember(memberId);
        Cycle cycle = cycleService.getCycle(cycleId);
        if (cycle.isClosed()) {
            throw new InvalidStateException("Cycle", cycleId, cycle.getStatus().name(), "declare");
        }

        LocalDate month = Months.firstDay(effectiveMonth);
        if (month.isBefore(Months.firstDay(cycle.getStartDate())) || month.isAfter(cycle.getEndDate())) {
            throw new ValidationException(String.format("%s is outside cycle %d (%s to %s)",
                Months.label(month), cycle.getYear(), cycle.getStartDate(), cycle.getEndDate()));
        }
        if (declarationRepository.existsByMemberIdAndCycleIdAndEffectiveMonth(memberId, cycleId, month)) {
            throw new ValidationException(String.format("Member %s already has a declaration for %s",
                memberId, Months.label(month)));
        }

        Declaration declaration = declarationRepository.save(new Declaration(memberId, cycleId, month, amounts));
        log.info("Created declaration {}: member={}, cycle={}, month={}, total={}, by={}",
            declaration.getId(), memberId, cycleId, Months.label(month), declaration.total(), actorId);

        initialRequirementPoster.postIfFirst(member, cycle, actorId);
        penaltyAutoApplier.applyForDeclaration(member, cycleId, month);

        return declaration;
    }

    /**
     * Replace the declared amounts. Allowed while pending in the effective month up to
     * the declaration phase's end day, or at any time after a proof was rejected.
     */
    @Transactional
    public Declaration updateDeclaration(String declarationId, DeclaredAmounts amounts, String actorId) {
        Declaration declaration = getDeclaration(declarationId);
        if (declaration.getStatus() != DeclarationStatus.PENDING) {
            throw new InvalidStateException("Declaration", declarationId, declaration.getStatus().name(), "edit");
        }
        if (!declaration.isReopenedByRejection()) {
            LocalDate today = LocalDate.now(clock);
            LocalDate lastEditDay = lastEditDay(declaration);
            if (!YearMonth.from(today).equals(YearMonth.from(declaration.getEffectiveMonth()))
                    || today.isAfter(lastEditDay)) {
                throw new ValidationException(String.format(
                    "Declaration for %s can no longer be edited (editable until %s)",
                    Months.label(declaration.getEffectiveMonth()), lastEditDay));
            }
        }

        declaration.updateAmounts(amounts);
        declarationRepository.save(declaration);
        log.info("Updated declaration {}: total={}, by={}", declarationId, declaration.total(), actorId);
        return declaration;
    }

    @Transactional
    public Declaration rejectDeclaration(String declarationId, String actorId, String reason) {
        Declaration declaration = getDeclaration(declarationId);
        declaration.reject(actorId, reason);
        declarationRepository.save(declaration);
        log.info("Rejected declaration {} by {}: {}", declarationId, actorId, reason);
        return declaration;
    }

    /**
     * Upload proof of payment. A previously rejected proof is resubmitted in place.
     */
    @Transactional
    public DepositProof submitProof(String declarationId, BigDecimal amount, String reference,
                                    String uploadPath, String actorId) {
        if (!Amounts.isPositive(amount)) {
            throw new ValidationException("Proof amount must be positive: " + amount);
        }
        Declaration declaration = getDeclaration(declarationId);
        Member member = memberService.getActiveMember(declaration.getMemberId());

        Optional<DepositProof> existing = proofRepository.findByDeclarationId(declarationId);
        DepositProof proof;
        if (existing.isPresent()) {
            proof = existing.get();
            proof.resubmit(Amounts.normalize(amount), reference, uploadPath);
        } else {
            proof = new DepositProof(declaration, Amounts.normalize(amount), reference, uploadPath);
        }
        declaration.proofSubmitted();

        proofRepository.save(proof);
        declarationRepository.save(declaration);
        log.info("Submitted proof {} for declaration {}: amount={}, submission={}, by={}",
            proof.getId(), declarationId, proof.getAmount(), proof.getSubmissionCount(), actorId);

        penaltyAutoApplier.applyForDepositProof(member, declaration.getCycleId(), declaration.getEffectiveMonth());
        return proof;
    }

    /**
     * Reject a proof with a comment. The declaration goes back to pending so the member can fix it.
     */
    @Transactional
    public DepositProof rejectProof(String proofId, String comment, String actorId) {
        if (comment == null || comment.isBlank()) {
            throw new ValidationException("A comment is required when rejecting a proof");
        }
        DepositProof proof = getProof(proofId);
        Declaration declaration = getDeclaration(proof.getDeclarationId());

        proof.reject(comment, actorId);
        declaration.proofRejected();
        proofRepository.save(proof);
        declarationRepository.save(declaration);

        log.info("Rejected proof {} for declaration {} by {}", proofId, declaration.getId(), actorId);
        return proof;
    }

    @Transactional
    public DepositProof respondToRejection(String proofId, String response, String actorId) {
        DepositProof proof = getProof(proofId);
        proof.respond(response);
        proofRepository.save(proof);
        log.info("Member {} responded to rejection of proof {}", actorId, proofId);
        return proof;
    }

    @Transactional(readOnly = true)
    public Declaration getDeclaration(String declarationId) {
        return declarationRepository.findById(declarationId)
            .orElseThrow(() -> new NotFoundException("Declaration", declarationId));
    }

    @Transactional(readOnly = true)
    public DepositProof getProof(String proofId) {
        return proofRepository.findById(proofId)
            .orElseThrow(() -> new NotFoundException("Deposit proof", proofId));
    }

    @Transactional(readOnly = true)
    public Optional<DepositProof> findProofForDeclaration(String declarationId) {
        return proofRepository.findByDeclarationId(declarationId);
    }

    @Transactional(readOnly = true)
    public List<Declaration> getMemberDeclarations(String memberId, String cycleId) {
        return declarationRepository.findByMemberIdAndCycleIdOrderByEffectiveMonthAsc(memberId, cycleId);
    }

    @Transactional(readOnly = true)
    public List<DepositProof> getProofsAwaitingReview(String cycleId) {
        return proofRepository.findByCycleIdAndStatus(cycleId, DepositProofStatus.SUBMITTED);
    }

    private LocalDate lastEditDay(Declaration declaration) {
        YearMonth month = YearMonth.from(declaration.getEffectiveMonth());
        Integer endDay = cycleService.findPhase(declaration.getCycleId(), PhaseType.DECLARATION)
            .map(CyclePhase::getEndDay)
            .orElse(null);
        return Months.dayOf(month, endDay != null ? endDay : editCutoffDay);
    }
}
