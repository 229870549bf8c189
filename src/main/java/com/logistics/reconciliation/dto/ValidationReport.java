package com.logistics.reconciliation.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;

/**
 * Row counts of one transferred slice in both stores.
 * A mismatch is advisory; it never undoes a committed transfer.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ValidationReport {

    @JsonProperty("source_table")
    private String sourceTable;

    @JsonProperty("target_table")
    private String targetTable;

    private String scope;

    @JsonProperty("source_count")
    private long sourceCount;

    @JsonProperty("target_count")
    private long targetCount;

    @JsonProperty("checked_at")
    private LocalDateTime checkedAt;

    /**
     * Target minus Source; negative when rows are missing in Target.
     */
    public long getDifference() {
        return targetCount - sourceCount;
    }

    public boolean isMatched() {
        return sourceCount == targetCount;
    }
}
