package org.octofleet.orchestrator.service.live;

import lombok.Getter;
import org.octofleet.orchestrator.domain.SessionKind;
import org.octofleet.orchestrator.domain.SessionState;

import java.time.Instant;
import java.util.ArrayDeque;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Broker-side state of one live session. Mutable fields are guarded by the instance monitor;
 * {@link #state} is volatile so listings can read it without locking.
 */
@Getter
final class LiveSession {

    private final String id;
    private final String nodeId;
    private final SessionKind kind;
    private final Map<String, Object> options;
    private final String requestedBy;
    private final Instant createdAt;

    private volatile SessionState state = SessionState.PENDING;
    private volatile Instant activatedAt;
    private volatile Instant closedAt;
    private volatile String reason;
    private volatile Instant lastClientActivity;
    private volatile Instant lastUpstreamActivity;

    /** null until the agent attaches a streaming channel; HTTP-pushed kinds never have one */
    private UpstreamChannel upstream;

    private final Map<String, Subscriber> subscribers = new LinkedHashMap<>();

    /** throttled frames waiting for every viewer to have room; each one is unacknowledged */
    private final ArrayDeque<LiveFrame> parked = new ArrayDeque<>();

    LiveSession(String id, String nodeId, SessionKind kind, Map<String, Object> options,
                String requestedBy, Instant now) {
        this.id = id;
        this.nodeId = nodeId;
        this.kind = kind;
        this.options = options == null ? Map.of() : Map.copyOf(options);
        this.requestedBy = requestedBy;
        this.createdAt = now;
        this.lastClientActivity = now;
        this.lastUpstreamActivity = now;
    }

    String key() {
        return key(nodeId, kind);
    }

    static String key(String nodeId, SessionKind kind) {
        return nodeId + "|" + kind.name();
    }

    void activate(Instant now) {
        state = SessionState.ACTIVE;
        activatedAt = now;
        lastUpstreamActivity = now;
    }

    void terminate(SessionState finalState, String why, Instant now) {
        state = finalState;
        reason = why;
        closedAt = now;
        parked.clear();
    }

    void touchClient(Instant now) { lastClientActivity = now; }

    void touchUpstream(Instant now) { lastUpstreamActivity = now; }

    void upstream(UpstreamChannel channel) { this.upstream = channel; }

    Collection<Subscriber> subscriberList() { return subscribers.values(); }

    long droppedFrames() {
        synchronized (this) {
            return subscribers.values().stream().mapToLong(Subscriber::dropped).sum();
        }
    }

    int subscriberCount() {
        synchronized (this) {
            return subscribers.size();
        }
    }
}
