package com.coopledger.ledger;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.List;

/**
 * Everything needed to post one journal entry.
 */
@Value
@Builder
public class JournalEntryRequest {

    String description;

    @Singular
    List<JournalLineRequest> lines;

    String cycleId;

    @Builder.Default
    SourceType sourceType = SourceType.MANUAL;

    String sourceRef;

    String createdBy;
}
