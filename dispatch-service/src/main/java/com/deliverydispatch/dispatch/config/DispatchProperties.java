package com.deliverydispatch.dispatch.config;

import com.deliverydispatch.shared.enums.UserRole;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;
import java.util.EnumSet;
import java.util.Set;
import java.util.UUID;

/**
 * Tunables for the dispatch core, bound from the {@code dispatch.*} namespace.
 */
@Data
@ConfigurationProperties(prefix = "dispatch")
public class DispatchProperties {

    /** Identifies this process in shared presence markers and relay messages. */
    private String instanceId = UUID.randomUUID().toString();

    private final Assignment assignment = new Assignment();
    private final Socket socket = new Socket();
    private final Presence presence = new Presence();
    private final Queue queue = new Queue();
    private final Cache cache = new Cache();
    private final Auth auth = new Auth();

    @Data
    public static class Assignment {
        private double maxRadiusKm = 10.0;
        private int maxClaimAttempts = 3;
        private int storageRetryAttempts = 3;
        private Duration storageRetryBackoff = Duration.ofMillis(100);
        /** A freed driver is offered the nearest of this many newest unassigned requests. */
        private int nextRequestCandidates = 10;
        private double nextRequestRadiusKm = 8.0;
    }

    @Data
    public static class Socket {
        private String path = "/ws/dispatch";
        private String[] allowedOriginPatterns = {"*"};
        private Duration probeAfter = Duration.ofMinutes(5);
        private Duration probeTimeout = Duration.ofSeconds(60);
        private Duration reconnectTokenTtl = Duration.ofHours(1);
        private int sendTimeLimitMs = 10_000;
        private int sendBufferSizeLimit = 512 * 1024;
    }

    @Data
    public static class Presence {
        private Duration graceWindow = Duration.ofSeconds(5);
        private Duration markerTtl = Duration.ofMinutes(5);
        private Set<UserRole> publicRoles = EnumSet.of(UserRole.DRIVER, UserRole.MERCHANT);
    }

    @Data
    public static class Queue {
        private Duration messageTtl = Duration.ofHours(24);
    }

    @Data
    public static class Cache {
        private CacheMode mode = CacheMode.REDIS;
    }

    @Data
    public static class Auth {
        private String jwtSecret;
    }

    public enum CacheMode {
        REDIS,
        MEMORY
    }
}
