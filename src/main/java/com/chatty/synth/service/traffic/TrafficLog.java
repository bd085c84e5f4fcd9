package com.chatty.synth.service.traffic;

import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.locks.Lock;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Bounded in-memory log of recent sync exchanges for diagnostics. Oldest entries are evicted first.
 */
@Component
public class TrafficLog {

    public static final String IN = "in";
    public static final String OUT = "out";
    static final int MAX_ENTRIES = 100;

    private final Lock lock = new ReentrantLock();
    private final Deque<TrafficEntry> entries = new ArrayDeque<>();
    private final Clock clock;

    public TrafficLog(Clock clock) {
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    public void record(String dir, Object payload) {
        TrafficEntry entry = new TrafficEntry(dir, payload, Instant.now(clock).toString());
        lock.lock();
        try {
            entries.addLast(entry);
            while (entries.size() > MAX_ENTRIES) {
                entries.removeFirst();
            }
        } finally {
            lock.unlock();
        }
    }

    /**
     * @return entries oldest first
     */
    public List<TrafficEntry> snapshot() {
        lock.lock();
        try {
            return List.copyOf(entries);
        } finally {
            lock.unlock();
        }
    }
}
