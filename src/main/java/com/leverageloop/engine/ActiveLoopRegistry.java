package com.leverageloop.engine;

import com.leverageloop.domain.model.LeverageLoop;
import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * In-memory registry of active leverage loops, loops still deploying, and the history of
 * retired ones.
 *
 * <p><b>Concurrency model:</b> ConcurrentHashMap for the active and deploying maps, a
 * CopyOnWriteArrayList for history, and one ReentrantLock per loop id. The deploy path
 * holds the loop's lock across all of its borrow iterations and the finalize step; an
 * unwind holds the same lock across withdrawal, repayments and retirement. The two can
 * therefore never interleave on the same loop. Iteration over active loops always works
 * on a snapshot copy.
 *
 * <p>Reserved balances are rebuilt from every loop holding an asset, so each rebuild and
 * the write that follows it run under a second, per-asset lock ({@link #withAssetLock}).
 * Lock order is always loop lock first, asset lock second.
 */
@Component
public class ActiveLoopRegistry {

    private static final Logger log = LoggerFactory.getLogger(ActiveLoopRegistry.class);

    private final ConcurrentHashMap<String, LeverageLoop> activeLoops = new ConcurrentHashMap<>();
    private final ConcurrentHashMap<String, LeverageLoop> deployingLoops = new ConcurrentHashMap<>();
    private final ConcurrentHashMap<String, ReentrantLock> loopLocks = new ConcurrentHashMap<>();
    private final ConcurrentHashMap<String, ReentrantLock> assetLocks = new ConcurrentHashMap<>();
    private final List<LeverageLoop> history = new CopyOnWriteArrayList<>();

    /**
     * Adds a loop to the active map. Returns false (and leaves the map untouched) when a
     * loop with the same id is already registered.
     */
    public boolean register(LeverageLoop loop) {
        LeverageLoop existing = activeLoops.putIfAbsent(loop.getLoopId(), loop);
        deployingLoops.remove(loop.getLoopId());
        if (existing != null) {
            log.debug("Loop {} already registered, keeping existing instance", loop.getLoopId());
            return false;
        }
        return true;
    }

    /**
     * Marks a loop as deploying. Until it is registered (or {@link #endDeployment} is
     * called) it counts as a holder of its collateral for reservations, but not as active.
     */
    public void beginDeployment(LeverageLoop loop) {
        deployingLoops.put(loop.getLoopId(), loop);
    }

    public void endDeployment(String loopId) {
        if (deployingLoops.remove(loopId) != null) {
            log.debug("Loop {} left the deploying set without being registered", loopId);
        }
    }

    public boolean isDeploying(String loopId) {
        return deployingLoops.containsKey(loopId);
    }

    /**
     * Moves a loop from the active map to history. A loop that is not active (a retried
     * unwind of an already retired loop) is not appended twice.
     */
    public void retire(LeverageLoop loop) {
        LeverageLoop removed = activeLoops.remove(loop.getLoopId());
        if (removed != null || !isInHistory(loop.getLoopId())) {
            history.add(loop);
        }
    }

    /**
     * Runs {@code action} while holding the loop's lock. The lock is created on first use.
     */
    public <T> T withLock(String loopId, Supplier<T> action) {
        ReentrantLock lock = loopLocks.computeIfAbsent(loopId, id -> new ReentrantLock());
        lock.lock();
        try {
            return action.get();
        } finally {
            lock.unlock();
        }
    }

    /**
     * Runs {@code action} while holding the lock for a collateral asset. Every
     * reservation rebuild and its store write for that asset go through here.
     */
    public <T> T withAssetLock(String assetId, Supplier<T> action) {
        ReentrantLock lock = assetLocks.computeIfAbsent(assetId, id -> new ReentrantLock());
        lock.lock();
        try {
            return action.get();
        } finally {
            lock.unlock();
        }
    }

    public boolean isActive(String loopId) {
        return activeLoops.containsKey(loopId);
    }

    public Optional<LeverageLoop> getActiveLoop(String loopId) {
        return Optional.ofNullable(activeLoops.get(loopId));
    }

    /** Active loop or, failing that, the most recent retired loop with this id. */
    public Optional<LeverageLoop> findLoop(String loopId) {
        LeverageLoop active = activeLoops.get(loopId);
        if (active != null) {
            return Optional.of(active);
        }
        for (int i = history.size() - 1; i >= 0; i--) {
            if (history.get(i).getLoopId().equals(loopId)) {
                return Optional.of(history.get(i));
            }
        }
        return Optional.empty();
    }

    /** Snapshot copy of the active loops. */
    public List<LeverageLoop> getActiveLoops() {
        return new ArrayList<>(activeLoops.values());
    }

    /**
     * Active loops plus loops still deploying, one entry per loop id. These are the loops
     * whose collateral is committed.
     */
    public List<LeverageLoop> getCommittedLoops() {
        Map<String, LeverageLoop> committed = new LinkedHashMap<>(activeLoops);
        deployingLoops.forEach(committed::putIfAbsent);
        return new ArrayList<>(committed.values());
    }

    public List<LeverageLoop> getHistory() {
        return Collections.unmodifiableList(history);
    }

    public int getActiveLoopCount() {
        return activeLoops.size();
    }

    public BigDecimal getTotalExposureUsd() {
        return activeLoops.values().stream()
                .map(LeverageLoop::getTotalExposureUsd)
                .filter(exposure -> exposure != null)
                .reduce(BigDecimal.ZERO, BigDecimal::add);
    }

    private boolean isInHistory(String loopId) {
        return history.stream().anyMatch(loop -> loop.getLoopId().equals(loopId));
    }
}
