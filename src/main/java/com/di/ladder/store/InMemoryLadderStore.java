package com.di.ladder.store;

import com.di.ladder.exception.AssignmentContentionException;
import com.di.ladder.exception.EntityNotFoundException;
import com.di.ladder.kind.EntityKind;
import com.di.ladder.model.Tier;
import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeMap;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;
import java.util.function.UnaryOperator;
import java.util.stream.Collectors;

/**
 * In-memory implementation of {@link LadderStore} for single-node deployments and tests.
 * Tier locks are in-process {@link ReentrantLock}s keyed by tier; a transaction keeps an undo log
 * and restores it when the work throws.
 */
@Slf4j
public class InMemoryLadderStore<E> implements LadderStore<E> {

    private final EntityKind<E> kind;
    private final Duration lockTimeout;
    private final Map<Long, E> rows = new ConcurrentHashMap<>();
    private final AtomicLong sequence = new AtomicLong();
    private final Map<Tier, ReentrantLock> tierLocks;
    private final ThreadLocal<TxContext<E>> currentTx = new ThreadLocal<>();

    public InMemoryLadderStore(EntityKind<E> kind, Duration lockTimeout) {
        this.kind = kind;
        this.lockTimeout = lockTimeout;
        Map<Tier, ReentrantLock> locks = new EnumMap<>(Tier.class);
        for (Tier tier : Tier.values()) {
            locks.put(tier, new ReentrantLock(true));
        }
        this.tierLocks = Collections.unmodifiableMap(locks);
    }

    @Override
    public <T> T inTransaction(Supplier<T> work) {
        if (currentTx.get() != null) {
            return work.get();
        }
        TxContext<E> tx = new TxContext<>();
        currentTx.set(tx);
        try {
            return work.get();
        } catch (RuntimeException | Error e) {
            rollback(tx);
            throw e;
        } finally {
            currentTx.remove();
            releaseLocks(tx);
        }
    }

    @Override
    public <T> T inTierTransaction(Tier tier, Supplier<T> work) {
        return inTransaction(() -> {
            acquire(tier);
            return work.get();
        });
    }

    @Override
    public Map<Integer, Integer> countMembersByInstance(Tier tier) {
        Map<Integer, Integer> counts = new TreeMap<>();
        for (E e : rows.values()) {
            if (kind.tierOf(e) == tier && !kind.isPlaceholder(e)) {
                counts.merge(kind.instanceOf(e), 1, Integer::sum);
            }
        }
        return counts;
    }

    @Override
    public List<E> findByTier(Tier tier) {
        return rows.values().stream()
                .filter(e -> kind.tierOf(e) == tier && !kind.isPlaceholder(e))
                .sorted((a, b) -> Long.compare(kind.idOf(a), kind.idOf(b)))
                .collect(Collectors.toList());
    }

    @Override
    public List<E> findByInstance(Tier tier, int instanceNumber) {
        return rows.values().stream()
                .filter(e -> kind.tierOf(e) == tier && kind.instanceOf(e) == instanceNumber && !kind.isPlaceholder(e))
                .sorted((a, b) -> Long.compare(kind.idOf(a), kind.idOf(b)))
                .collect(Collectors.toList());
    }

    @Override
    public Optional<E> findById(long id) {
        return Optional.ofNullable(rows.get(id));
    }

    @Override
    public E insert(E entity) {
        long id = sequence.incrementAndGet();
        E stored = kind.withId(entity, id);
        write(id, stored);
        return stored;
    }

    @Override
    public void updatePlacement(long id, Tier tier, int instanceNumber) {
        if (apply(id, cur -> kind.withCyclesInTier(kind.withPlacement(cur, tier, instanceNumber), 0)) == null) {
            throw new EntityNotFoundException(kind.name(), id);
        }
    }

    @Override
    public boolean updateInstance(long id, Tier expectedTier, int instanceNumber) {
        boolean[] matched = {false};
        E updated = apply(id, cur -> {
            if (kind.tierOf(cur) != expectedTier) {
                return cur;
            }
            matched[0] = true;
            return kind.withPlacement(cur, expectedTier, instanceNumber);
        });
        if (updated == null) {
            throw new EntityNotFoundException(kind.name(), id);
        }
        return matched[0];
    }

    /** Increments each row against its current value, so concurrent placement writes are kept. */
    @Override
    public int incrementCyclesInTier() {
        int updated = 0;
        for (Long id : new ArrayList<>(rows.keySet())) {
            if (apply(id, cur -> kind.withCyclesInTier(cur, kind.cyclesInTierOf(cur) + 1)) != null) {
                updated++;
            }
        }
        return updated;
    }

    @Override
    public long countAll() {
        return rows.values().stream().filter(e -> !kind.isPlaceholder(e)).count();
    }

    @Override
    public long countInTier(Tier tier) {
        return rows.values().stream().filter(e -> kind.tierOf(e) == tier && !kind.isPlaceholder(e)).count();
    }

    /** True while the calling thread holds the lock of {@code tier}. */
    public boolean isTierLockHeldByCurrentThread(Tier tier) {
        return tierLocks.get(tier).isHeldByCurrentThread();
    }

    private void write(long id, E value) {
        TxContext<E> tx = currentTx.get();
        if (tx != null && !tx.undo.containsKey(id)) {
            tx.undo.put(id, rows.get(id));
        }
        rows.put(id, value);
    }

    /**
     * Replaces the row with {@code change} applied to its current value, atomically per id.
     * Returns null when the row does not exist.
     */
    private E apply(long id, UnaryOperator<E> change) {
        TxContext<E> tx = currentTx.get();
        return rows.computeIfPresent(id, (key, current) -> {
            if (tx != null && !tx.undo.containsKey(key)) {
                tx.undo.put(key, current);
            }
            return change.apply(current);
        });
    }

    private void acquire(Tier tier) {
        TxContext<E> tx = currentTx.get();
        if (tx.lockedTiers.contains(tier)) {
            return;
        }
        ReentrantLock lock = tierLocks.get(tier);
        boolean acquired;
        try {
            acquired = lock.tryLock(lockTimeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new AssignmentContentionException(kind.name(), tier,
                    "Interrupted while waiting for " + kind.name() + " lock on " + tier.key(), e);
        }
        if (!acquired) {
            throw new AssignmentContentionException(kind.name(), tier,
                    "Timed out after " + lockTimeout.toMillis() + "ms waiting for " + kind.name() + " lock on " + tier.key());
        }
        tx.lockedTiers.add(tier);
    }

    private void rollback(TxContext<E> tx) {
        if (tx.undo.isEmpty()) {
            return;
        }
        log.debug("[STORE] Rolling back {} {} write(s)", tx.undo.size(), kind.name());
        for (Map.Entry<Long, E> entry : tx.undo.entrySet()) {
            if (entry.getValue() == null) {
                rows.remove(entry.getKey());
            } else {
                rows.put(entry.getKey(), entry.getValue());
            }
        }
    }

    private void releaseLocks(TxContext<E> tx) {
        for (Tier tier : tx.lockedTiers) {
            tierLocks.get(tier).unlock();
        }
    }

    private static final class TxContext<E> {
        /** Original row per id written in this transaction; null value = row did not exist. */
        final Map<Long, E> undo = new HashMap<>();
        final Set<Tier> lockedTiers = new LinkedHashSet<>();
    }
}
