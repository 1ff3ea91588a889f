package com.coopledger.api.dto;

import lombok.Data;

@Data
public class LockCycleRequest {

    private String reason;
}
