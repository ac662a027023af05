package com.bbthechange.teaminvite.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.convert.DurationUnit;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.time.temporal.ChronoUnit;

/**
 * All tunables of the seat dispatch core, bound from {@code team-invite.*}.
 */
@Data
@Component
@ConfigurationProperties(prefix = "team-invite")
public class TeamInviteProperties {

    /** Seat store backend: dynamodb or memory. */
    private String store = "dynamodb";

    /** Coordination backend: redis or memory. */
    private String coordination = "redis";

    private Ledger ledger = new Ledger();
    private Reservation reservation = new Reservation();
    private Dispatch dispatch = new Dispatch();
    private Retry retry = new Retry();
    private Reconciler reconciler = new Reconciler();
    private Throttle throttle = new Throttle();
    private Queue queue = new Queue();
    private Membership membership = new Membership();

    @Data
    public static class Ledger {
        /** Invites older than this no longer count as pending. */
        @DurationUnit(ChronoUnit.HOURS)
        private Duration pendingWindow = Duration.ofHours(24);
        private int lowSeatThreshold = 5;
    }

    @Data
    public static class Reservation {
        /** Wait limit for a team lock in the in-memory store. */
        private Duration lockTimeout = Duration.ofSeconds(5);
        private int lockConflictRetries = 3;
    }

    @Data
    public static class Dispatch {
        private boolean enabled = true;
        private int workers = 2;
        private int batchSize = 20;
        private Duration batchMaxWait = Duration.ofSeconds(2);
        private int channelCapacity = 1000;
        @DurationUnit(ChronoUnit.SECONDS)
        private Duration hardTimeLimit = Duration.ofSeconds(300);
        @DurationUnit(ChronoUnit.SECONDS)
        private Duration softTimeLimit = Duration.ofSeconds(240);
        private int localRetries = 2;
        private Duration localRetryDelay = Duration.ofSeconds(1);
    }

    @Data
    public static class Retry {
        private int maxRetries = 3;
        @DurationUnit(ChronoUnit.SECONDS)
        private Duration baseDelay = Duration.ofSeconds(60);
        @DurationUnit(ChronoUnit.SECONDS)
        private Duration maxDelay = Duration.ofSeconds(600);
        private boolean jitter = true;
    }

    @Data
    public static class Reconciler {
        private boolean enabled = true;
        private Duration interval = Duration.ofSeconds(30);
        /** Stale reservation cleanup and finished-task purge. */
        private Duration maintenanceInterval = Duration.ofMinutes(10);
        private Duration countSyncInterval = Duration.ofMinutes(5);
        @DurationUnit(ChronoUnit.SECONDS)
        private Duration lockTtl = Duration.ofSeconds(300);
        private int batchLimit = 100;
        private Duration staleReservationAge = Duration.ofHours(1);
        private Duration finishedTaskRetention = Duration.ofDays(30);
    }

    @Data
    public static class Throttle {
        private int maxConcurrentRedemptions = 10;
        @DurationUnit(ChronoUnit.SECONDS)
        private Duration acquireTimeout = Duration.ofSeconds(30);
        @DurationUnit(ChronoUnit.SECONDS)
        private Duration permitLeaseTtl = Duration.ofSeconds(60);
        private Duration acquireBackoff = Duration.ofMillis(100);
        private Duration tokenTtl = Duration.ofHours(24);
        private int requestsPerMinute = 5;
    }

    @Data
    public static class Queue {
        /** Task transport: sqs or local. */
        private String transport = "local";
        private String name = "team-invite-tasks";
        private String url;
    }

    @Data
    public static class Membership {
        private String baseUrl = "http://localhost:8081";
        private Duration connectTimeout = Duration.ofSeconds(10);
        private Duration requestTimeout = Duration.ofSeconds(30);
    }
}
