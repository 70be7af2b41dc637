package com.example.settlement.service;

import com.example.settlement.state.ProcessingOutcome;
import com.example.settlement.state.RejectionReason;
import lombok.Getter;

import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;

/**
 * Counters for one settlement run.
 */
@Getter
public class SettlementStatistics {

    private long recordsRead;
    private long applied;
    private long rejected;
    private long skipped;
    private int accounts;
    private final Map<RejectionReason, Long> rejectionsByReason = new EnumMap<>(RejectionReason.class);

    /**
     * @return the 1-based number of the record just read
     */
    long recordRead() {
        return ++recordsRead;
    }

    void recordOutcome(ProcessingOutcome outcome) {
        if (outcome.isApplied()) {
            applied++;
        } else {
            rejected++;
            rejectionsByReason.merge(outcome.getRejectionReason(), 1L, Long::sum);
        }
    }

    void recordSkipped() {
        skipped++;
    }

    void setAccounts(int accounts) {
        this.accounts = accounts;
    }

    public Map<RejectionReason, Long> getRejectionsByReason() {
        return Collections.unmodifiableMap(rejectionsByReason);
    }

    @Override
    public String toString() {
        return String.format("read=%d, applied=%d, rejected=%d %s, skipped=%d, accounts=%d",
                recordsRead, applied, rejected, rejectionsByReason, skipped, accounts);
    }
}
