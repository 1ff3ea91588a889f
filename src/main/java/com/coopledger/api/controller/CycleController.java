package com.coopledger.api.controller;

import com.coopledger.api.dto.ConfigurePhaseRequest;
import com.coopledger.api.dto.CreateCycleRequest;
import com.coopledger.api.dto.LockCycleRequest;
import com.coopledger.cycle.Cycle;
import com.coopledger.cycle.CyclePhase;
import com.coopledger.cycle.CycleService;
import com.coopledger.cycle.PhaseType;
import com.coopledger.ledger.LedgerService;
import com.coopledger.ledger.PostingLock;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;

/**
 * REST API for cycles and their phase calendar.
 */
@RestController
@RequestMapping("/api/v1/cycles")
@RequiredArgsConstructor
@Tag(name = "Cycles", description = "Cycle lifecycle and phase API")
public class CycleController {

    private final CycleService cycleService;
    private final LedgerService ledgerService;

    @PostMapping
    @Operation(summary = "Create a cycle in draft")
    public ResponseEntity<Cycle> createCycle(@RequestHeader(ApiHeaders.ACTOR_ID) String actorId,
                                             @Valid @RequestBody CreateCycleRequest request) {
        Cycle cycle = cycleService.createCycle(request.getYear(), request.getStartDate(), request.getEndDate(),
            request.getSocialFundRequired(), request.getAdminFundRequired(), actorId);
        return ResponseEntity.status(HttpStatus.CREATED).body(cycle);
    }

    @GetMapping("/active")
    @Operation(summary = "Get the active cycle")
    public ResponseEntity<Cycle> getActiveCycle() {
        return ResponseEntity.ok(cycleService.getActiveCycle());
    }

    @GetMapping("/{cycleId}")
    @Operation(summary = "Get cycle details")
    public ResponseEntity<Cycle> getCycle(@PathVariable String cycleId) {
        return ResponseEntity.ok(cycleService.getCycle(cycleId));
    }

    @PostMapping("/{cycleId}/activate")
    @Operation(summary = "Activate a cycle, demoting the currently active one")
    public ResponseEntity<Cycle> activate(@RequestHeader(ApiHeaders.ACTOR_ID) String actorId,
                                          @PathVariable String cycleId) {
        return ResponseEntity.ok(cycleService.activateCycle(cycleId, actorId));
    }

    @PostMapping("/{cycleId}/close")
    @Operation(summary = "Close a cycle and all of its phases")
    public ResponseEntity<Cycle> close(@RequestHeader(ApiHeaders.ACTOR_ID) String actorId,
                                       @PathVariable String cycleId) {
        return ResponseEntity.ok(cycleService.closeCycle(cycleId, actorId));
    }

    @PostMapping("/{cycleId}/reopen")
    @Operation(summary = "Reopen a closed cycle of the current or a future year")
    public ResponseEntity<Cycle> reopen(@RequestHeader(ApiHeaders.ACTOR_ID) String actorId,
                                        @PathVariable String cycleId) {
        return ResponseEntity.ok(cycleService.reopenCycle(cycleId, actorId));
    }

    @GetMapping("/{cycleId}/phases")
    @Operation(summary = "List the phases of a cycle")
    public ResponseEntity<List<CyclePhase>> getPhases(@PathVariable String cycleId) {
        return ResponseEntity.ok(cycleService.getPhases(cycleId));
    }

    @PutMapping("/{cycleId}/phases/{phaseType}")
    @Operation(summary = "Configure a phase window and its penalty")
    public ResponseEntity<CyclePhase> configurePhase(@PathVariable String cycleId,
                                                     @PathVariable PhaseType phaseType,
                                                     @Valid @RequestBody ConfigurePhaseRequest request) {
        CyclePhase phase = cycleService.configurePhase(cycleId, phaseType, request.getStartDay(),
            request.getEndDay(), request.getPenaltyTypeId(), request.isAutoApplyPenalty());
        return ResponseEntity.ok(phase);
    }

    @PostMapping("/{cycleId}/phases/{phaseType}/open")
    @Operation(summary = "Open a phase")
    public ResponseEntity<CyclePhase> openPhase(@PathVariable String cycleId, @PathVariable PhaseType phaseType) {
        return ResponseEntity.ok(cycleService.openPhase(cycleId, phaseType));
    }

    @PostMapping("/{cycleId}/phases/{phaseType}/close")
    @Operation(summary = "Close a phase")
    public ResponseEntity<CyclePhase> closePhase(@PathVariable String cycleId, @PathVariable PhaseType phaseType) {
        return ResponseEntity.ok(cycleService.closePhase(cycleId, phaseType));
    }

    @PostMapping("/{cycleId}/posting-lock")
    @Operation(summary = "Lock the cycle against deposit approvals and loan disbursements")
    public ResponseEntity<PostingLock> lock(@RequestHeader(ApiHeaders.ACTOR_ID) String actorId,
                                            @PathVariable String cycleId,
                                            @RequestBody(required = false) LockCycleRequest request) {
        cycleService.getCycle(cycleId);
        String reason = request != null ? request.getReason() : null;
        return ResponseEntity.ok(ledgerService.lockCycle(cycleId, actorId, reason));
    }

    @DeleteMapping("/{cycleId}/posting-lock")
    @Operation(summary = "Release the posting lock of a cycle")
    public ResponseEntity<Void> unlock(@RequestHeader(ApiHeaders.ACTOR_ID) String actorId,
                                       @PathVariable String cycleId) {
        ledgerService.unlockCycle(cycleId, actorId);
        return ResponseEntity.noContent().build();
    }
}
