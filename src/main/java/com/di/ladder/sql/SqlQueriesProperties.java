package com.di.ladder.sql;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

/**
 * SQL statements loaded from sql-queries.yml (ladder.sql.*).
 * No SQL is hardcoded in the JDBC store; it uses these named statements.
 */
@Component
@ConfigurationProperties(prefix = "ladder.sql")
public class SqlQueriesProperties {

    private Lock lock = new Lock();
    private KindQueries combatant = new KindQueries();
    private KindQueries team = new KindQueries();

    public Lock getLock() { return lock; }
    public void setLock(Lock lock) { this.lock = lock; }
    public KindQueries getCombatant() { return combatant; }
    public void setCombatant(KindQueries combatant) { this.combatant = combatant; }
    public KindQueries getTeam() { return team; }
    public void setTeam(KindQueries team) { this.team = team; }

    public static class Lock {
        /** Takes a transaction-scoped lock on one bigint key. */
        private String acquire;
        /** Bounds the wait for {@link #acquire}; one {@code %d} placeholder for milliseconds. */
        private String setTimeout;
        public String getAcquire() { return acquire; }
        public void setAcquire(String acquire) { this.acquire = acquire; }
        public String getSetTimeout() { return setTimeout; }
        public void setSetTimeout(String setTimeout) { this.setTimeout = setTimeout; }
    }

    public static class KindQueries {
        private String countByInstance;
        private String findByTier;
        private String findByInstance;
        private String findById;
        private String insert;
        private String updatePlacement;
        private String updateInstance;
        private String incrementCycles;
        private String countAll;
        private String countInTier;
        public String getCountByInstance() { return countByInstance; }
        public void setCountByInstance(String countByInstance) { this.countByInstance = countByInstance; }
        public String getFindByTier() { return findByTier; }
        public void setFindByTier(String findByTier) { this.findByTier = findByTier; }
        public String getFindByInstance() { return findByInstance; }
        public void setFindByInstance(String findByInstance) { this.findByInstance = findByInstance; }
        public String getFindById() { return findById; }
        public void setFindById(String findById) { this.findById = findById; }
        public String getInsert() { return insert; }
        public void setInsert(String insert) { this.insert = insert; }
        public String getUpdatePlacement() { return updatePlacement; }
        public void setUpdatePlacement(String updatePlacement) { this.updatePlacement = updatePlacement; }
        public String getUpdateInstance() { return updateInstance; }
        public void setUpdateInstance(String updateInstance) { this.updateInstance = updateInstance; }
        public String getIncrementCycles() { return incrementCycles; }
        public void setIncrementCycles(String incrementCycles) { this.incrementCycles = incrementCycles; }
        public String getCountAll() { return countAll; }
        public void setCountAll(String countAll) { this.countAll = countAll; }
        public String getCountInTier() { return countInTier; }
        public void setCountInTier(String countInTier) { this.countInTier = countInTier; }
    }
}
