package com.coopledger.api.controller;

import com.coopledger.api.dto.CreatePenaltyTypeRequest;
import com.coopledger.api.dto.RecordPenaltyRequest;
import com.coopledger.penalties.ApplicablePenalties;
import com.coopledger.penalties.PenaltyRecord;
import com.coopledger.penalties.PenaltyService;
import com.coopledger.penalties.PenaltyType;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

/**
 * REST API for penalty types and penalty records.
 */
@RestController
@RequestMapping("/api/v1/penalties")
@RequiredArgsConstructor
@Tag(name = "Penalties", description = "Penalty API")
public class PenaltyController {

    private final PenaltyService penaltyService;

    @PostMapping("/types")
    @Operation(summary = "Create a penalty type")
    public ResponseEntity<PenaltyType> createType(@Valid @RequestBody CreatePenaltyTypeRequest request) {
        PenaltyType type = penaltyService.createPenaltyType(request.getName(), request.getDescription(),
            request.getFeeAmount());
        return ResponseEntity.status(HttpStatus.CREATED).body(type);
    }

    @PostMapping("/types/{typeId}/enable")
    @Operation(summary = "Enable a penalty type")
    public ResponseEntity<PenaltyType> enable(@PathVariable String typeId) {
        return ResponseEntity.ok(penaltyService.setEnabled(typeId, true));
    }

    @PostMapping("/types/{typeId}/disable")
    @Operation(summary = "Disable a penalty type")
    public ResponseEntity<PenaltyType> disable(@PathVariable String typeId) {
        return ResponseEntity.ok(penaltyService.setEnabled(typeId, false));
    }

    @PostMapping("/records")
    @Operation(summary = "Record a penalty against a member")
    public ResponseEntity<PenaltyRecord> record(@RequestHeader(ApiHeaders.ACTOR_ID) String actorId,
                                                @Valid @RequestBody RecordPenaltyRequest request) {
        PenaltyRecord record = penaltyService.recordPenalty(request.getMemberId(), request.getPenaltyTypeId(),
            request.getCycleId(), request.getNotes(), actorId);
        return ResponseEntity.status(HttpStatus.CREATED).body(record);
    }

    @PostMapping("/records/{recordId}/approve")
    @Operation(summary = "Approve a penalty and charge it")
    public ResponseEntity<PenaltyRecord> approve(@RequestHeader(ApiHeaders.ACTOR_ID) String actorId,
                                                 @PathVariable String recordId) {
        return ResponseEntity.ok(penaltyService.approvePenalty(recordId, actorId));
    }

    @GetMapping("/member/{memberId}")
    @Operation(summary = "List a member's unpaid penalties")
    public ResponseEntity<ApplicablePenalties> getApplicable(@PathVariable String memberId) {
        return ResponseEntity.ok(penaltyService.applicablePenalties(memberId));
    }
}
