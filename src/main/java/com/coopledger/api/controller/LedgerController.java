package com.coopledger.api.controller;

import com.coopledger.api.dto.CommentRequest;
import com.coopledger.ledger.JournalEntry;
import com.coopledger.ledger.JournalLine;
import com.coopledger.ledger.LedgerAccount;
import com.coopledger.ledger.LedgerService;
import com.coopledger.ledger.StatementLine;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.format.annotation.DateTimeFormat;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.List;

/**
 * REST API for ledger queries and reversals.
 */
@RestController
@RequestMapping("/api/v1/ledger")
@RequiredArgsConstructor
@Tag(name = "Ledger", description = "Double-entry ledger API")
public class LedgerController {

    private final LedgerService ledgerService;

    @GetMapping("/accounts/{accountId}/balance")
    @Operation(summary = "Get an account balance, optionally as of a date")
    public ResponseEntity<BigDecimal> getBalance(
            @PathVariable String accountId,
            @RequestParam(required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate asOf) {
        return ResponseEntity.ok(ledgerService.getAccountBalance(accountId, asOf));
    }

    @GetMapping("/accounts/{accountId}/statement")
    @Operation(summary = "Get an account statement with running balance")
    public ResponseEntity<List<StatementLine>> getStatement(@PathVariable String accountId) {
        return ResponseEntity.ok(ledgerService.getAccountStatement(accountId));
    }

    @GetMapping("/members/{memberId}/accounts")
    @Operation(summary = "List a member's sub-ledger accounts")
    public ResponseEntity<List<LedgerAccount>> getMemberAccounts(@PathVariable String memberId) {
        return ResponseEntity.ok(ledgerService.getMemberAccounts(memberId));
    }

    @GetMapping("/entries/{entryId}")
    @Operation(summary = "Get a journal entry header")
    public ResponseEntity<JournalEntry> getEntry(@PathVariable String entryId) {
        return ResponseEntity.ok(ledgerService.getEntry(entryId));
    }

    @GetMapping("/entries/{entryId}/lines")
    @Operation(summary = "Get the lines of a journal entry")
    public ResponseEntity<List<JournalLine>> getLines(@PathVariable String entryId) {
        return ResponseEntity.ok(ledgerService.getLines(entryId));
    }

    @PostMapping("/entries/{entryId}/reverse")
    @Operation(summary = "Reverse a journal entry")
    public ResponseEntity<JournalEntry> reverse(@RequestHeader(ApiHeaders.ACTOR_ID) String actorId,
                                                @PathVariable String entryId,
                                                @Valid @RequestBody CommentRequest request) {
        return ResponseEntity.ok(ledgerService.reverseEntry(entryId, actorId, request.getComment()));
    }
}
