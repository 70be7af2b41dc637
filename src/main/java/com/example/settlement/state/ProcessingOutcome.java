package com.example.settlement.state;

import lombok.AccessLevel;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.RequiredArgsConstructor;

import java.util.EnumMap;
import java.util.Map;
import java.util.Objects;

/**
 * Result of applying one transaction: either applied, or rejected with a reason.
 * A rejected transaction has left all state untouched.
 */
@Getter
@EqualsAndHashCode
@RequiredArgsConstructor(access = AccessLevel.PRIVATE)
public final class ProcessingOutcome {

    public static final ProcessingOutcome APPLIED = new ProcessingOutcome(null);

    private static final Map<RejectionReason, ProcessingOutcome> REJECTIONS = new EnumMap<>(RejectionReason.class);

    static {
        for (RejectionReason reason : RejectionReason.values()) {
            REJECTIONS.put(reason, new ProcessingOutcome(reason));
        }
    }

    private final RejectionReason rejectionReason;

    public static ProcessingOutcome rejected(RejectionReason reason) {
        return REJECTIONS.get(Objects.requireNonNull(reason, "reason"));
    }

    public boolean isApplied() {
        return rejectionReason == null;
    }

    public boolean isRejected() {
        return rejectionReason != null;
    }

    @Override
    public String toString() {
        return isApplied() ? "APPLIED" : "REJECTED(" + rejectionReason + ")";
    }
}
