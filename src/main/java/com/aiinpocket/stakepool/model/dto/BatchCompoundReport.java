package com.aiinpocket.stakepool.model.dto;

import java.util.List;

public record BatchCompoundReport(
        List<CompoundOutcome> outcomes
) {
    public long compoundedCount() {
        return outcomes.stream().filter(CompoundOutcome::isCompounded).count();
    }

    public long failedCount() {
        return outcomes.stream().filter(o -> o.status() == CompoundOutcome.Status.FAILED).count();
    }

    public long skippedCount() {
        return outcomes.stream().filter(o -> o.status() == CompoundOutcome.Status.SKIPPED).count();
    }
}
