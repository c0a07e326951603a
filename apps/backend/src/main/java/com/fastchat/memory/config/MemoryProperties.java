package com.fastchat.memory.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

import java.time.Duration;

@Data
@Configuration
@ConfigurationProperties(prefix = "fastchat.memory")
public class MemoryProperties {

    /**
     * Storage backend: "in-memory", "redis", "redis-archive" or "redis-vector".
     */
    private String backend = "in-memory";

    private Redis redis = new Redis();
    private Lock lock = new Lock();
    private Context context = new Context();
    private Retry retry = new Retry();
    private Stream stream = new Stream();
    private BranchSettings branch = new BranchSettings();
    private Archive archive = new Archive();
    private Vector vector = new Vector();

    @Data
    public static class Redis {
        private String prefix = "fast-chat:memory:";
        /** TTL applied (and refreshed) on every entity write. */
        private Duration sessionTtl = Duration.ofHours(24);
    }

    @Data
    public static class Lock {
        /** Upper bound on how long a holder may keep the session lock. */
        private Duration ttl = Duration.ofSeconds(5);
        /** How long an append waits for the lock before failing with LockTimeout. */
        private Duration wait = Duration.ofSeconds(5);
        private Duration pollInterval = Duration.ofMillis(50);
    }

    @Data
    public static class Context {
        private int maxMessages = 50;
        /** Extra messages fetched beyond maxMessages to leave room for selection. */
        private int fetchSlack = 5;
        private int charsPerToken = 4;
    }

    @Data
    public static class Retry {
        private int maxAttempts = 3;
        private Duration baseDelay = Duration.ofSeconds(1);
        private Duration maxDelay = Duration.ofSeconds(10);
    }

    @Data
    public static class Stream {
        /** A token source silent for longer than this fails the stream. */
        private Duration idleTimeout = Duration.ofSeconds(30);
        private Duration sinkWriteTimeout = Duration.ofSeconds(10);
        /** Streams older than this are treated as abandoned and cancelled. */
        private Duration maxAge = Duration.ofMinutes(5);
        private Duration janitorEvery = Duration.ofSeconds(60);
    }

    @Data
    public static class BranchSettings {
        private MergePolicy mergePolicy = MergePolicy.KEEP_SOURCE;
        private int cleanupKeep = 10;
        private Duration cleanupOlderThan = Duration.ofDays(30);
    }

    @Data
    public static class Archive {
        private int queryLimit = 500;
    }

    @Data
    public static class Vector {
        private double threshold = 0.7;
        private int limit = 5;
    }

    public enum MergePolicy {
        /** The source branch stays as it was after a merge. */
        KEEP_SOURCE,
        /** The source branch is archived once its messages are merged. */
        ARCHIVE_SOURCE
    }
}
