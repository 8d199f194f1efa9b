package com.di.ladder.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.time.Duration;

/**
 * Single binding for all ladder tuning.
 *
 * <pre>
 * ladder:
 *   persistence:
 *     mode: memory          # memory | jdbc
 *     lock-timeout: 5s
 *   datasource:             # used when persistence.mode = jdbc
 *     jdbc-url: jdbc:postgresql://localhost:5432/ladder
 *     username: ladder
 *     password: ...
 *     maximum-pool-size: 10
 *   instances:
 *     combatant-capacity: 100
 *     team-capacity: 50
 *     deviation-threshold: 20
 *   rebalance:
 *     promotion-fraction: 0.10
 *     demotion-fraction: 0.10
 *     min-cycles-in-tier: 5
 *     min-eligible-per-instance: 10
 *     min-points-for-promotion: 25
 *   admission:
 *     max-attempts: 3
 *   standings:
 *     default-page-size: 50
 *     max-page-size: 100
 * </pre>
 */
@Data
@Component
@ConfigurationProperties(prefix = "ladder")
public class LadderProperties {

    private Persistence persistence = new Persistence();
    private Datasource datasource = new Datasource();
    private Instances instances = new Instances();
    private Rebalance rebalance = new Rebalance();
    private Admission admission = new Admission();
    private Standings standings = new Standings();

    @Data
    public static class Persistence {
        /** {@code memory}: in-process store and locks. {@code jdbc}: PostgreSQL with advisory locks. */
        private String mode = "memory";
        /** Longest wait for a tier lock before an admission counts as contended. */
        private Duration lockTimeout = Duration.ofSeconds(5);
    }

    @Data
    public static class Datasource {
        private String jdbcUrl;
        private String username;
        private String password;
        private String driverClassName = "org.postgresql.Driver";
        private int maximumPoolSize = 10;
        private int minimumIdle = 2;
        private Duration connectionTimeout = Duration.ofSeconds(30);
    }

    @Data
    public static class Instances {
        private int combatantCapacity = 100;
        private int teamCapacity = 50;
        /** Max allowed |members - tier average| for an instance before the tier is flagged. */
        private int deviationThreshold = 20;
    }

    @Data
    public static class Rebalance {
        private double promotionFraction = 0.10;
        private double demotionFraction = 0.10;
        /** Cycles in the current tier before an entity can be promoted or demoted. */
        private int minCyclesInTier = 5;
        /** Below this many eligible entities an instance is left alone. */
        private int minEligiblePerInstance = 10;
        /** Absolute points gate applied to promotion only. */
        private int minPointsForPromotion = 25;
    }

    @Data
    public static class Admission {
        /** Attempts of one admission when the tier lock is contended. */
        private int maxAttempts = 3;
    }

    @Data
    public static class Standings {
        private int defaultPageSize = 50;
        private int maxPageSize = 100;
    }
}
