package com.di.ladder.store;

import com.di.ladder.exception.AssignmentContentionException;
import com.di.ladder.exception.EntityNotFoundException;
import com.di.ladder.kind.EntityKind;
import com.di.ladder.model.Tier;
import com.di.ladder.sql.SqlQueriesProperties;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.PessimisticLockingFailureException;
import org.springframework.dao.QueryTimeoutException;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.transaction.TransactionException;
import org.springframework.transaction.support.TransactionTemplate;

import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;
import java.util.function.Supplier;

/**
 * JDBC implementation of {@link LadderStore}. Tier locks are PostgreSQL transaction-scoped
 * advisory locks keyed by {@code (kind, tier)}, so they are released on commit or rollback.
 * Active when {@code ladder.persistence.mode=jdbc}.
 */
@Slf4j
public class JdbcLadderStore<E> implements LadderStore<E> {

    private final EntityKind<E> kind;
    private final JdbcTemplate jdbc;
    private final TransactionTemplate tx;
    private final SqlQueriesProperties.KindQueries sql;
    private final SqlQueriesProperties.Lock lockSql;
    private final LadderRowBinding<E> binding;
    private final Duration lockTimeout;

    public JdbcLadderStore(EntityKind<E> kind,
                           JdbcTemplate jdbcTemplate,
                           TransactionTemplate transactionTemplate,
                           SqlQueriesProperties.KindQueries sql,
                           SqlQueriesProperties.Lock lockSql,
                           LadderRowBinding<E> binding,
                           Duration lockTimeout) {
        this.kind = kind;
        this.jdbc = jdbcTemplate;
        this.tx = transactionTemplate;
        this.sql = sql;
        this.lockSql = lockSql;
        this.binding = binding;
        this.lockTimeout = lockTimeout;
    }

    @Override
    public <T> T inTransaction(Supplier<T> work) {
        return tx.execute(status -> work.get());
    }

    @Override
    public <T> T inTierTransaction(Tier tier, Supplier<T> work) {
        try {
            return inTransaction(() -> {
                acquireTierLock(tier);
                return work.get();
            });
        } catch (TransactionException e) {
            throw new AssignmentContentionException(kind.name(), tier,
                    "Transaction on " + kind.name() + " tier " + tier.key() + " aborted: " + e.getMessage(), e);
        }
    }

    @Override
    public Map<Integer, Integer> countMembersByInstance(Tier tier) {
        Map<Integer, Integer> counts = new TreeMap<>();
        jdbc.query(sql.getCountByInstance(),
                rs -> {
                    counts.put(rs.getInt("instance_number"), rs.getInt("member_count"));
                },
                tier.key());
        return counts;
    }

    @Override
    public List<E> findByTier(Tier tier) {
        return jdbc.query(sql.getFindByTier(), binding.rowMapper(), tier.key());
    }

    @Override
    public List<E> findByInstance(Tier tier, int instanceNumber) {
        return jdbc.query(sql.getFindByInstance(), binding.rowMapper(), tier.key(), instanceNumber);
    }

    @Override
    public Optional<E> findById(long id) {
        List<E> found = jdbc.query(sql.getFindById(), binding.rowMapper(), id);
        return found.isEmpty() ? Optional.empty() : Optional.of(found.get(0));
    }

    @Override
    public E insert(E entity) {
        Long id = jdbc.queryForObject(sql.getInsert(), Long.class, binding.insertParameters(entity));
        if (id == null) {
            throw new IllegalStateException("Insert into " + kind.name() + " returned no id");
        }
        return kind.withId(entity, id);
    }

    @Override
    public void updatePlacement(long id, Tier tier, int instanceNumber) {
        int updated = jdbc.update(sql.getUpdatePlacement(), tier.key(), instanceNumber, id);
        if (updated == 0) {
            throw new EntityNotFoundException(kind.name(), id);
        }
    }

    @Override
    public boolean updateInstance(long id, Tier expectedTier, int instanceNumber) {
        int updated = jdbc.update(sql.getUpdateInstance(), instanceNumber, id, expectedTier.key());
        if (updated > 0) {
            return true;
        }
        if (findById(id).isEmpty()) {
            throw new EntityNotFoundException(kind.name(), id);
        }
        return false;
    }

    @Override
    public int incrementCyclesInTier() {
        return jdbc.update(sql.getIncrementCycles());
    }

    @Override
    public long countAll() {
        Long count = jdbc.queryForObject(sql.getCountAll(), Long.class);
        return count != null ? count : 0L;
    }

    @Override
    public long countInTier(Tier tier) {
        Long count = jdbc.queryForObject(sql.getCountInTier(), Long.class, tier.key());
        return count != null ? count : 0L;
    }

    private void acquireTierLock(Tier tier) {
        long key = lockKey(kind.name(), tier);
        try {
            if (lockSql.getSetTimeout() != null && !lockSql.getSetTimeout().isBlank()) {
                jdbc.execute(String.format(lockSql.getSetTimeout(), lockTimeout.toMillis()));
            }
            jdbc.queryForList(lockSql.getAcquire(), key);
            log.debug("[STORE] Acquired {} lock on {} (key={})", kind.name(), tier.key(), key);
        } catch (PessimisticLockingFailureException | QueryTimeoutException e) {
            throw new AssignmentContentionException(kind.name(), tier,
                    "Could not lock " + kind.name() + " tier " + tier.key() + ": " + e.getMessage(), e);
        }
    }

    /**
     * Stable non-negative lock key for {@code (kind, tier)}. Distinct kinds never share a key
     * for the same tier.
     */
    static long lockKey(String kindName, Tier tier) {
        String name = kindName + ":" + tier.key();
        int hash = 0;
        for (int i = 0; i < name.length(); i++) {
            hash = 31 * hash + name.charAt(i);
        }
        return Math.abs((long) hash) % Integer.MAX_VALUE;
    }
}
