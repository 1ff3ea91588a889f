package com.coopledger.api.controller;

import com.coopledger.api.dto.AssignTierRequest;
import com.coopledger.api.dto.RegisterMemberRequest;
import com.coopledger.credit.CreditRatingService;
import com.coopledger.credit.MemberCreditRating;
import com.coopledger.members.Member;
import com.coopledger.members.MemberService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

/**
 * REST API for member profiles and credit tier assignment.
 */
@RestController
@RequestMapping("/api/v1/members")
@RequiredArgsConstructor
@Tag(name = "Members", description = "Member API")
public class MemberController {

    private final MemberService memberService;
    private final CreditRatingService creditRatingService;

    @PostMapping
    @Operation(summary = "Register a member profile")
    public ResponseEntity<Member> register(@Valid @RequestBody RegisterMemberRequest request) {
        Member member = memberService.registerMember(request.getUserId(), request.getDisplayName());
        return ResponseEntity.status(HttpStatus.CREATED).body(member);
    }

    @GetMapping("/{memberId}")
    @Operation(summary = "Get member details")
    public ResponseEntity<Member> getMember(@PathVariable String memberId) {
        return ResponseEntity.ok(memberService.getMember(memberId));
    }

    @GetMapping("/by-user/{userId}")
    @Operation(summary = "Find a member by user identity")
    public ResponseEntity<Member> getByUser(@PathVariable String userId) {
        return ResponseEntity.ok(memberService.findByUserId(userId));
    }

    @PostMapping("/credit-ratings")
    @Operation(summary = "Assign a member to a credit tier for a cycle")
    public ResponseEntity<MemberCreditRating> assignTier(@RequestHeader(ApiHeaders.ACTOR_ID) String actorId,
                                                         @Valid @RequestBody AssignTierRequest request) {
        MemberCreditRating rating = creditRatingService.assignTier(request.getMemberId(), request.getCycleId(),
            request.getTierId(), actorId, request.getNotes());
        return ResponseEntity.ok(rating);
    }
}
