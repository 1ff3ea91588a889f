package com.coopledger.members;

public enum MemberStatus {
    ACTIVE,
    INACTIVE
}
