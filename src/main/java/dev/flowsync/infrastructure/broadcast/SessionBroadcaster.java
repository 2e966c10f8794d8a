package dev.flowsync.infrastructure.broadcast;

/**
 * Room layer used to fan out session state. This service only publishes to topics and
 * never manages connection lifecycle.
 */
public interface SessionBroadcaster {

    void publish(String topic, String eventType, Object payload);

    static String syncTopic(String sessionId) {
        return "sessions/" + sessionId + "/sync";
    }

    static String executionTopic(String sessionId) {
        return "sessions/" + sessionId + "/execution";
    }
}
