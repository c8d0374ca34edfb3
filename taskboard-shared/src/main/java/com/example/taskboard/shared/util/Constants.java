package com.example.taskboard.shared.util;

public final class Constants {

    private Constants() {}

    public static final class Collaborators {
        private Collaborators() {}
        public static final String IDENTITY_VERIFIER = "identity-verifier";
        public static final String MEMBERSHIP_ORACLE = "membership-oracle";
    }

    public static final class ClientMessages {
        private ClientMessages() {}
        public static final String NO_TOKEN = "No token provided";
        public static final String INVALID_TOKEN = "Invalid token";
        public static final String INVALID_USER_ID = "Invalid user ID in token";
        public static final String AUTH_UNAVAILABLE = "Authentication is temporarily unavailable";
        public static final String NOT_A_MEMBER = "Not a project member";
        public static final String MEMBERSHIP_UNAVAILABLE = "Unable to verify project membership";
        public static final String NOT_SUBSCRIBED = "Not subscribed to project";
        public static final String BINARY_UNSUPPORTED = "Binary messages are not supported";
        public static final String RATE_LIMITED = "Connection rate limit exceeded. Please try again later.";
        public static final String SERVER_SHUTDOWN = "Server is shutting down. Please reconnect momentarily.";
    }

    public static final class Metrics {
        private Metrics() {}
        public static final String CONNECTIONS_ACTIVE = "realtime.connections.active";
        public static final String SUBSCRIPTIONS_ACTIVE = "realtime.subscriptions.active";
        public static final String EVENTS_DELIVERED = "realtime.events.delivered";
        public static final String EVENTS_DROPPED = "realtime.events.dropped";
        public static final String CONNECTIONS_EVICTED = "realtime.connections.evicted";
        public static final String PROTOCOL_VIOLATIONS = "realtime.protocol.violations";
    }
}
