package com.tradesim.feed;

import com.tradesim.domain.model.MarketEvent;
import java.time.Instant;
import java.util.HashSet;
import java.util.Set;

/**
 * Enforces per-stream ordering before events leave an adapter.
 *
 * <p>An event is accepted when it is strictly newer than the last accepted one: by exchange
 * sequence id when both carry one, otherwise by timestamp. Events sharing the latest timestamp
 * are accepted only when a sequence id proves they are new, or when no event equal to them was
 * accepted at that timestamp (several prints in one millisecond). Everything else is a
 * duplicate or arrived late, typically replayed after a reconnect, and is dropped.
 *
 * <p>Not thread-safe; each adapter calls it from its single transport thread.
 */
public class EventSequencer {

    private MarketEvent last;
    private long rejected;

    // events accepted at last.getTimestamp(); cleared whenever the timestamp advances
    private final Set<MarketEvent> acceptedAtLatest = new HashSet<>();

    public boolean accept(MarketEvent event) {
        if (last == null) {
            remember(event);
            return true;
        }

        int byTime = event.getTimestamp().compareTo(last.getTimestamp());
        boolean newer;
        if (event.getSequence() != null && last.getSequence() != null) {
            newer = event.getSequence() > last.getSequence() && byTime >= 0;
        } else if (byTime != 0) {
            newer = byTime > 0;
        } else {
            newer = !acceptedAtLatest.contains(event);
        }

        if (newer) {
            remember(event);
        } else {
            rejected++;
        }
        return newer;
    }

    private void remember(MarketEvent event) {
        Instant previous = last == null ? null : last.getTimestamp();
        if (!event.getTimestamp().equals(previous)) {
            acceptedAtLatest.clear();
        }
        acceptedAtLatest.add(event);
        last = event;
    }

    public long rejectedCount() {
        return rejected;
    }
}
