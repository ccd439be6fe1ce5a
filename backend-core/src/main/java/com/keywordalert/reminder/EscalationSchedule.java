package com.keywordalert.reminder;

import java.time.Duration;
import java.time.Instant;
import java.util.List;

/**
 * Offsets from the first detection at which a reminder is delivered. Slot {@code i} is due at
 * {@code firstDetectedAt + offset(i)}.
 */
public final class EscalationSchedule {

    private final List<Duration> offsets;

    public EscalationSchedule(List<Duration> offsets) {
        if (offsets == null || offsets.isEmpty()) {
            throw new IllegalArgumentException("Escalation schedule must have at least one slot");
        }
        Duration previous = null;
        for (Duration offset : offsets) {
            if (offset == null || offset.isNegative()) {
                throw new IllegalArgumentException("Escalation offsets must be non-negative: " + offsets);
            }
            if (previous != null && offset.compareTo(previous) <= 0) {
                throw new IllegalArgumentException("Escalation offsets must be strictly increasing: " + offsets);
            }
            previous = offset;
        }
        this.offsets = List.copyOf(offsets);
    }

    public int size() {
        return offsets.size();
    }

    public Duration last() {
        return offsets.get(offsets.size() - 1);
    }

    public Instant dueAt(Instant firstDetectedAt, int slot) {
        return firstDetectedAt.plus(offsets.get(slot));
    }

    /**
     * Latest slot at or after {@code fromSlot} whose offset has elapsed, or -1 when none has.
     */
    public int latestDueSlot(Duration elapsed, int fromSlot) {
        int latest = -1;
        for (int slot = Math.max(0, fromSlot); slot < offsets.size(); slot++) {
            if (offsets.get(slot).compareTo(elapsed) > 0) {
                break;
            }
            latest = slot;
        }
        return latest;
    }

    @Override
    public String toString() {
        return offsets.toString();
    }
}
