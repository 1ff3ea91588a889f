package com.coopledger.members;

import com.coopledger.common.exception.InvalidStateException;
import jakarta.persistence.*;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.UUID;

/**
 * Member profile as far as the ledger needs it. Profile management lives elsewhere.
 */
@Entity
@Table(name = "members", uniqueConstraints =
    @UniqueConstraint(name = "uk_member_user", columnNames = "user_id"))
@Data
@NoArgsConstructor
public class Member {

    @Id
    private String id;

    @Column(name = "user_id", nullable = false)
    private String userId;

    @Column(name = "display_name", nullable = false)
    private String displayName;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false)
    private MemberStatus status;

    @Column(name = "created_at")
    private Instant createdAt;

    public Member(String userId, String displayName) {
        this.id = UUID.randomUUID().toString();
        this.userId = userId;
        this.displayName = displayName;
        this.status = MemberStatus.ACTIVE;
        this.createdAt = Instant.now();
    }

    public boolean isActive() {
        return status == MemberStatus.ACTIVE;
    }

    public void deactivate() {
        if (status == MemberStatus.INACTIVE) {
            throw new InvalidStateException("Member", id, status.name(), "deactivate");
        }
        this.status = MemberStatus.INACTIVE;
    }
}
