package com.example.taskboard.shared.config;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Positive;
import lombok.Data;
import org.springframework.validation.annotation.Validated;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;

@Data
@Validated
public class AppProperties {

    private final Realtime realtime = new Realtime();
    private final Jwt jwt = new Jwt();
    private final Membership membership = new Membership();
    private final Service service = new Service();

    @Data
    public static class Service {
        private String name = "taskboard-realtime-0";
    }

    @Data
    public static class Realtime {
        @NotBlank
        private String path = "/ws";
        @NotBlank
        private String tokenParam = "token";
        /** Fixed capacity of every per-connection outbound channel. */
        @Positive
        private int channelCapacity = 1000;
        @Positive
        private long heartbeatInterval = 30000L;
        @Positive
        private long clientTimeoutThreshold = 90000L;
        @Positive
        private long reaperInterval = 60000L;
        @Positive
        private int maxConsecutiveDeliveryFailures = 3;
        @Positive
        private long shutdownNoticeDelay = 500L;
    }

    @Data
    public static class Jwt {
        @NotBlank
        private String secret = "your-super-secret-jwt-key-for-development-only";
    }

    @Data
    public static class Membership {
        // Static seed for the in-memory directory; ignored when the host application supplies its own oracle.
        private Map<UUID, List<UUID>> grants = new LinkedHashMap<>();
    }
}
