package com.coopledger.members;

import com.coopledger.common.exception.InvalidStateException;
import com.coopledger.common.exception.NotFoundException;
import com.coopledger.common.exception.ValidationException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;

/**
 * Member lookups used by the workflows.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class MemberService {

    private final MemberRepository memberRepository;

    @Transactional
    public Member registerMember(String userId, String displayName) {
        if (memberRepository.findByUserId(userId).isPresent()) {
            throw new ValidationException("A member profile already exists for user " + userId);
        }
        Member member = memberRepository.save(new Member(userId, displayName));
        log.info("Registered member {} for user {}", member.getId(), userId);
        return member;
    }

    @Transactional(readOnly = true)
    public Member getMember(String memberId) {
        return memberRepository.findById(memberId)
            .orElseThrow(() -> new NotFoundException("Member", memberId));
    }

    @Transactional(readOnly = true)
    public Member findByUserId(String userId) {
        return memberRepository.findByUserId(userId)
            .orElseThrow(() -> new NotFoundException("Member profile for user", userId));
    }

    /**
     * @throws InvalidStateException if the member is inactive
     */
    @Transactional(readOnly = true)
    public Member getActiveMember(String memberId) {
        Member member = getMember(memberId);
        if (!member.isActive()) {
            throw new InvalidStateException("Member " + memberId + " is not active");
        }
        return member;
    }

    @Transactional(readOnly = true)
    public List<Member> activeMembers() {
        return memberRepository.findByStatus(MemberStatus.ACTIVE);
    }

    @Transactional
    public Member deactivateMember(String memberId) {
        Member member = getMember(memberId);
        member.deactivate();
        log.info("Deactivated member {}", memberId);
        return memberRepository.save(member);
    }
}
