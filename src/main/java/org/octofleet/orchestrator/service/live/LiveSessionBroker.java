package org.octofleet.orchestrator.service.live;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.octofleet.orchestrator.api.dto.LiveSessionDTO;
import org.octofleet.orchestrator.api.dto.NodeDTO;
import org.octofleet.orchestrator.api.dto.StartSessionDTO;
import org.octofleet.orchestrator.api.error.ErrorCode;
import org.octofleet.orchestrator.config.AppProps;
import org.octofleet.orchestrator.domain.LiveSessionRecord;
import org.octofleet.orchestrator.domain.OverflowPolicy;
import org.octofleet.orchestrator.domain.SessionKind;
import org.octofleet.orchestrator.domain.SessionState;
import org.octofleet.orchestrator.repo.LiveSessionRecordRepo;
import org.octofleet.orchestrator.repo.NodeRepo;
import org.octofleet.orchestrator.service.ConflictException;
import org.octofleet.orchestrator.service.NotFoundException;
import org.octofleet.orchestrator.service.UpstreamUnavailableException;
import org.octofleet.orchestrator.service.ValidationException;
import org.octofleet.orchestrator.service.agent.AgentCommand;
import org.octofleet.orchestrator.service.agent.AgentGateway;
import org.octofleet.orchestrator.service.events.EventBus;
import org.octofleet.orchestrator.service.events.FleetEvent;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executor;

/**
 * Relays live streams (metrics, logs, shell, screen) between node agents and viewers.
 *
 * <p>Metrics and logs drop the oldest queued frame for a viewer that falls behind. Shell and
 * screen never drop: frames the slowest viewer has no room for are parked and left
 * unacknowledged, so the agent stops sending once its window is used up. An agent that sends
 * past its window is a protocol violation and ends the session in error.
 *
 * <p>Lock order is session, then subscriber. Sink writes happen only on the relay executor.
 */
@Service
@Slf4j
public class LiveSessionBroker {

    static final int DEFAULT_QUEUE_CAPACITY = 64;
    static final int DEFAULT_UPSTREAM_WINDOW = 32;
    static final String AGENT_DISCONNECTED = "agent disconnected";

    private static final TypeReference<Map<String, Object>> OPTIONS = new TypeReference<>() { };

    private final AgentGateway agents;
    private final NodeRepo nodes;
    private final LiveSessionRecordRepo records;
    private final EventBus bus;
    private final ObjectMapper mapper;
    private final Clock clock;
    private final Executor relayExecutor;

    private final Duration idleTimeout;
    private final Duration pendingTimeout;
    private final Duration retainClosed;
    private final int queueCapacity;
    private final int upstreamWindow;

    private final Map<String, LiveSession> sessions = new ConcurrentHashMap<>();
    private final Map<String, LiveSession> openByNodeKind = new ConcurrentHashMap<>();
    private Runnable nodeSubscription = () -> { };

    public LiveSessionBroker(AgentGateway agents, NodeRepo nodes, LiveSessionRecordRepo records, EventBus bus,
                             ObjectMapper mapper, Clock clock, AppProps props,
                             @Qualifier("liveRelayExecutor") Executor relayExecutor) {
        this.agents = agents;
        this.nodes = nodes;
        this.records = records;
        this.bus = bus;
        this.mapper = mapper;
        this.clock = clock;
        this.relayExecutor = relayExecutor;
        var s = props == null ? null : props.sessions();
        this.idleTimeout = s != null && s.idleTimeout() != null ? s.idleTimeout() : Duration.ofSeconds(45);
        this.pendingTimeout = s != null && s.pendingTimeout() != null ? s.pendingTimeout() : Duration.ofSeconds(60);
        this.retainClosed = s != null && s.retainClosed() != null ? s.retainClosed() : Duration.ofMinutes(5);
        this.queueCapacity = s != null && s.queueCapacity() > 0 ? s.queueCapacity() : DEFAULT_QUEUE_CAPACITY;
        this.upstreamWindow = s != null && s.upstreamWindow() > 0 ? s.upstreamWindow() : DEFAULT_UPSTREAM_WINDOW;
    }

    @PostConstruct
    void listenForNodes() {
        nodeSubscription = bus.subscribe(EventBus.NODES, this::onNodeEvent);
    }

    @PreDestroy
    void shutdown() {
        nodeSubscription.run();
        for (var s : List.copyOf(sessions.values())) {
            terminate(s, SessionState.CLOSED, "server shutting down");
        }
    }

    // ---------- lifecycle ----------

    /**
     * Opens a session, or hands back the running one for metrics/logs.
     *
     * @throws NotFoundException            unknown node
     * @throws UpstreamUnavailableException node has no live agent channel
     * @throws ConflictException            an exclusive session of this kind is already open on the node
     */
    public StartSessionDTO start(String nodeId, SessionKind kind, Map<String, Object> options, String requestedBy) {
        if (kind == null) throw new ValidationException(ErrorCode.BAD_REQUEST, "session kind is required");
        if (!nodes.existsByNodeId(nodeId)) throw new NotFoundException("node", nodeId);
        if (!agents.isReachable(nodeId)) throw UpstreamUnavailableException.nodeOffline(nodeId);

        var now = clock.instant();
        var created = new LiveSession(UUID.randomUUID().toString(), nodeId, kind, options, requestedBy, now);
        var winner = openByNodeKind.compute(LiveSession.key(nodeId, kind), (k, existing) -> {
            if (existing == null || existing.getState().isTerminal()) return created;
            if (kind.exclusive()) {
                throw new ConflictException(ErrorCode.SESSION_KIND_CONFLICT,
                        "a %s session is already open on %s".formatted(kind.wire(), nodeId),
                        Map.of("session_id", existing.getId()));
            }
            return existing;
        });
        if (winner != created) {
            return new StartSessionDTO(winner.getId(), nodeId, kind, winner.getState(), true);
        }

        sessions.put(created.getId(), created);
        persist(created);
        try {
            var payload = new LinkedHashMap<String, Object>(created.getOptions());
            payload.put("session_id", created.getId());
            payload.put("kind", kind.wire());
            agents.dispatch(nodeId, AgentCommand.of(AgentCommand.Type.OPEN_SESSION, created.getId(), payload));
        } catch (UpstreamUnavailableException e) {
            terminate(created, SessionState.ERROR, "agent unreachable");
            throw e;
        }
        log.info("[Live] {} session {} opened on {} by {}", kind.wire(), created.getId(), nodeId, requestedBy);
        publish(created);
        return new StartSessionDTO(created.getId(), nodeId, kind, created.getState(), false);
    }

    /** Operator or viewer stop. Idempotent on closed sessions. */
    public LiveSessionDTO stop(String sessionId, String why) {
        var s = require(sessionId);
        terminate(s, SessionState.CLOSED, why == null ? "stopped" : why);
        return toDto(s);
    }

    // ---------- agent side ----------

    /** Binds the agent's streaming channel; a second channel for the same session is refused. */
    public void attachUpstream(String sessionId, UpstreamChannel channel) {
        var s = require(sessionId);
        synchronized (s) {
            if (s.getState().isTerminal()) {
                throw new ConflictException(ErrorCode.ILLEGAL_TRANSITION, "session is " + s.getState().wire());
            }
            if (s.getUpstream() != null) {
                throw new ConflictException(ErrorCode.SESSION_KIND_CONFLICT, "session already has an agent channel");
            }
            s.upstream(channel);
            s.touchUpstream(clock.instant());
        }
        log.debug("[Live] agent attached to {}", sessionId);
    }

    public void onUpstreamClosed(String sessionId) {
        var s = sessions.get(sessionId);
        if (s == null) return;
        synchronized (s) {
            s.upstream(null);
        }
        terminate(s, SessionState.ERROR, AGENT_DISCONNECTED);
    }

    /** HTTP push path; only for kinds that tolerate dropped frames. */
    public int pushFrames(String sessionId, List<Map<String, Object>> frames) {
        var s = require(sessionId);
        if (s.getKind().overflow() != OverflowPolicy.DROP_OLDEST) {
            throw new ValidationException(ErrorCode.BAD_REQUEST,
                    s.getKind().wire() + " sessions stream over the agent WebSocket only");
        }
        int accepted = 0;
        for (var f : frames) {
            if (s.getState().isTerminal()) break;
            onUpstreamMessage(sessionId, f);
            accepted++;
        }
        return accepted;
    }

    public void onUpstreamMessage(String sessionId, Map<String, Object> message) {
        var s = sessions.get(sessionId);
        if (s == null || s.getState().isTerminal() || message == null) return;
        var frame = LiveFrame.fromMessage(message);
        var now = clock.instant();
        switch (frame.type()) {
            case "info" -> {
                activateIfPending(s, now);
                relay(s, frame);
            }
            case "heartbeat", "pong" -> s.touchUpstream(now);
            case "error" -> terminate(s, SessionState.ERROR,
                    String.valueOf(frame.fields().getOrDefault("message", "agent reported an error")));
            case "closed", "exit" -> {
                relay(s, frame);
                terminate(s, SessionState.CLOSED, "closed by agent");
            }
            default -> {
                activateIfPending(s, now);
                relay(s, frame);
            }
        }
    }

    private void activateIfPending(LiveSession s, Instant now) {
        boolean activated = false;
        synchronized (s) {
            if (s.getState() == SessionState.PENDING) {
                s.activate(now);
                activated = true;
            }
        }
        if (activated) {
            log.info("[Live] session {} active", s.getId());
            persist(s);
            publish(s);
        }
    }

    // ---------- viewer side ----------

    /** Adds a viewer; exclusive kinds take one viewer at a time. */
    public void subscribe(String sessionId, FrameSink sink) {
        var s = require(sessionId);
        var sub = new Subscriber(sink, queueCapacity, relayExecutor,
                () -> onViewerProgress(s), failed -> unsubscribe(sessionId, failed.id()));
        List<Long> acks;
        synchronized (s) {
            if (s.getState().isTerminal()) {
                throw new ConflictException(ErrorCode.ILLEGAL_TRANSITION, "session is " + s.getState().wire());
            }
            if (s.getKind().exclusive() && !s.getSubscribers().isEmpty()) {
                throw new ConflictException(ErrorCode.SESSION_KIND_CONFLICT,
                        "a viewer is already attached to " + sessionId);
            }
            s.getSubscribers().put(sink.id(), sub);
            s.touchClient(clock.instant());
            sub.offerControl(LiveFrame.control("info", infoFields(s)));
            acks = releaseParked(s);
            sendAcks(s, acks);
        }
        log.debug("[Live] viewer {} joined {}", sink.id(), sessionId);
        sub.schedule();
    }

    /** The last viewer leaving closes the session. */
    public void unsubscribe(String sessionId, String subscriberId) {
        var s = sessions.get(sessionId);
        if (s == null) return;
        boolean last;
        synchronized (s) {
            if (s.getSubscribers().remove(subscriberId) == null) return;
            last = s.getSubscribers().isEmpty();
        }
        log.debug("[Live] viewer {} left {}", subscriberId, sessionId);
        if (last) {
            terminate(s, SessionState.CLOSED, "last viewer left");
        }
    }

    /** Viewer traffic: ping, stop, or input to forward to the agent. */
    public void onClientMessage(String sessionId, String subscriberId, Map<String, Object> message) {
        var s = sessions.get(sessionId);
        if (s == null || s.getState().isTerminal() || message == null) return;
        s.touchClient(clock.instant());
        var type = String.valueOf(message.getOrDefault("type", ""));
        switch (type) {
            case "ping" -> {
                Subscriber sub;
                synchronized (s) {
                    sub = s.getSubscribers().get(subscriberId);
                }
                if (sub != null) {
                    sub.offerControl(LiveFrame.control("pong", Map.of()));
                    sub.schedule();
                }
            }
            case "stop" -> terminate(s, SessionState.CLOSED, "stopped by viewer");
            case "input", "resize", "key", "mouse" -> forwardUpstream(s, message);
            default -> log.debug("[Live] ignoring viewer message '{}' on {}", type, sessionId);
        }
    }

    /** Keep-alive from transports that carry no client messages (SSE). */
    public void touchClient(String sessionId) {
        var s = sessions.get(sessionId);
        if (s != null) s.touchClient(clock.instant());
    }

    private void forwardUpstream(LiveSession s, Map<String, Object> message) {
        synchronized (s) {
            var up = s.getUpstream();
            if (up == null) {
                log.debug("[Live] no agent channel on {}, dropping {}", s.getId(), message.get("type"));
                return;
            }
            try {
                up.send(message);
            } catch (IOException e) {
                log.warn("[Live] forward to agent failed on {}: {}", s.getId(), e.getMessage());
            }
        }
    }

    // ---------- relay ----------

    void relay(LiveSession s, LiveFrame frame) {
        List<Subscriber> wake;
        boolean violation = false;
        synchronized (s) {
            if (s.getState().isTerminal()) return;
            s.touchUpstream(clock.instant());
            if (s.getKind().overflow() == OverflowPolicy.DROP_OLDEST) {
                for (var sub : s.subscriberList()) {
                    sub.offerDroppingOldest(frame);
                }
            } else {
                s.getParked().addLast(frame);
                if (s.getParked().size() > upstreamWindow) {
                    violation = true;
                } else {
                    sendAcks(s, releaseParked(s));
                }
            }
            wake = new ArrayList<>(s.subscriberList());
        }
        if (violation) {
            log.warn("[Live] agent exceeded upstream window of {} on {}", upstreamWindow, s.getId());
            terminate(s, SessionState.ERROR, "upstream window exceeded");
            return;
        }
        wake.forEach(Subscriber::schedule);
    }

    private void onViewerProgress(LiveSession s) {
        if (s.getKind().overflow() != OverflowPolicy.THROTTLE_UPSTREAM) return;
        List<Subscriber> wake;
        synchronized (s) {
            if (s.getState().isTerminal() || s.getParked().isEmpty()) return;
            var acks = releaseParked(s);
            if (acks.isEmpty()) return;
            sendAcks(s, acks);
            wake = new ArrayList<>(s.subscriberList());
        }
        wake.forEach(Subscriber::schedule);
    }

    /** Moves parked frames to the viewers while every one of them has room. Caller holds the session lock. */
    private List<Long> releaseParked(LiveSession s) {
        var acks = new ArrayList<Long>();
        var subs = s.subscriberList();
        if (subs.isEmpty()) return acks;
        while (!s.getParked().isEmpty() && subs.stream().allMatch(Subscriber::hasRoom)) {
            var f = s.getParked().pollFirst();
            for (var sub : subs) {
                sub.offerReserved(f);
            }
            if (f.seq() > 0) acks.add(f.seq());
        }
        return acks;
    }

    /** Caller holds the session lock, which keeps acks in sequence order. */
    private void sendAcks(LiveSession s, List<Long> acks) {
        var up = s.getUpstream();
        if (up == null || acks.isEmpty()) return;
        for (var seq : acks) {
            try {
                up.send(Map.of("type", "ack", "seq", seq));
            } catch (IOException e) {
                log.warn("[Live] ack {} to agent failed on {}: {}", seq, s.getId(), e.getMessage());
                return;
            }
        }
    }

    // ---------- termination ----------

    boolean terminate(LiveSession s, SessionState finalState, String why) {
        List<Subscriber> subs;
        UpstreamChannel up;
        synchronized (s) {
            if (s.getState().isTerminal()) return false;
            s.terminate(finalState, why, clock.instant());
            subs = new ArrayList<>(s.subscriberList());
            s.getSubscribers().clear();
            up = s.getUpstream();
            s.upstream(null);
        }
        openByNodeKind.remove(s.key(), s);

        var last = finalState == SessionState.ERROR
                ? LiveFrame.control("error", Map.of("message", why))
                : LiveFrame.control("closed", Map.of("reason", why));
        subs.forEach(sub -> sub.finish(last));

        if (up != null) {
            try {
                up.send(Map.of("type", "stop", "session_id", s.getId()));
            } catch (IOException e) {
                log.debug("[Live] stop to agent failed on {}: {}", s.getId(), e.getMessage());
            }
            up.close();
        } else if (!AGENT_DISCONNECTED.equals(why)) {
            try {
                agents.dispatch(s.getNodeId(), AgentCommand.of(AgentCommand.Type.CLOSE_SESSION, s.getId(),
                        Map.of("session_id", s.getId())));
            } catch (UpstreamUnavailableException e) {
                log.debug("[Live] close command not delivered for {}: {}", s.getId(), e.getMessage());
            }
        }

        if (finalState == SessionState.ERROR) {
            log.warn("[Live] session {} on {} failed: {}", s.getId(), s.getNodeId(), why);
        } else {
            log.info("[Live] session {} on {} closed: {}", s.getId(), s.getNodeId(), why);
        }
        persist(s);
        publish(s);
        return true;
    }

    private void onNodeEvent(FleetEvent e) {
        if (!"node_offline".equals(e.type())) return;
        var nodeId = nodeIdOf(e.payload());
        if (nodeId == null) return;
        for (var s : List.copyOf(sessions.values())) {
            if (nodeId.equals(s.getNodeId()) && !s.getState().isTerminal()) {
                terminate(s, SessionState.ERROR, "node went offline");
            }
        }
    }

    private static String nodeIdOf(Object payload) {
        if (payload instanceof NodeDTO n) return n.nodeId();
        if (payload instanceof Map<?, ?> m && m.get("node_id") != null) return m.get("node_id").toString();
        return payload instanceof String str ? str : null;
    }

    // ---------- sweeps ----------

    /** Pending and idle timeouts, then eviction of sessions closed longer than the retention period. */
    @Scheduled(fixedDelayString = "${app.sessions.sweep-ms:5000}")
    public int sweep() {
        var now = clock.instant();
        int ended = 0;
        for (var s : List.copyOf(sessions.values())) {
            var state = s.getState();
            if (state == SessionState.PENDING && s.getCreatedAt().plus(pendingTimeout).isBefore(now)) {
                if (terminate(s, SessionState.ERROR, "agent did not acknowledge within " + pendingTimeout.toSeconds() + "s")) {
                    ended++;
                }
            } else if (state == SessionState.ACTIVE) {
                String why = null;
                if (s.getLastUpstreamActivity().plus(idleTimeout).isBefore(now)) {
                    why = "idle timeout: no agent traffic";
                } else if (s.getLastClientActivity().plus(idleTimeout).isBefore(now)) {
                    why = "idle timeout: no viewer traffic";
                }
                if (why != null && terminate(s, SessionState.ERROR, why)) {
                    ended++;
                }
            } else if (state.isTerminal() && s.getClosedAt() != null
                    && s.getClosedAt().plus(retainClosed).isBefore(now)) {
                sessions.remove(s.getId(), s);
            }
        }
        return ended;
    }

    // ---------- queries ----------

    public List<LiveSessionDTO> list(boolean includeClosed) {
        return sessions.values().stream()
                .filter(s -> includeClosed || !s.getState().isTerminal())
                .sorted(Comparator.comparing(LiveSession::getCreatedAt))
                .map(this::toDto)
                .toList();
    }

    public LiveSessionDTO get(String sessionId) {
        var s = sessions.get(sessionId);
        if (s != null) return toDto(s);
        return records.findById(sessionId)
                .map(r -> new LiveSessionDTO(r.getId(), r.getNodeId(), r.getKind(), r.getState(), r.getReason(),
                        r.getRequestedBy(), readOptions(r.getOptions()), 0, 0,
                        r.getCreatedAt(), r.getActivatedAt(), r.getClosedAt()))
                .orElseThrow(() -> new NotFoundException("session", sessionId));
    }

    public Optional<SessionKind> kindOf(String sessionId) {
        return Optional.ofNullable(sessions.get(sessionId)).map(LiveSession::getKind);
    }

    private LiveSession require(String sessionId) {
        var s = sessions.get(sessionId);
        if (s == null) throw new NotFoundException("session", sessionId);
        return s;
    }

    LiveSessionDTO toDto(LiveSession s) {
        return new LiveSessionDTO(s.getId(), s.getNodeId(), s.getKind(), s.getState(), s.getReason(),
                s.getRequestedBy(), s.getOptions(), s.subscriberCount(), s.droppedFrames(),
                s.getCreatedAt(), s.getActivatedAt(), s.getClosedAt());
    }

    private static Map<String, Object> infoFields(LiveSession s) {
        var m = new LinkedHashMap<String, Object>();
        m.put("session_id", s.getId());
        m.put("node_id", s.getNodeId());
        m.put("kind", s.getKind().wire());
        m.put("state", s.getState().wire());
        return m;
    }

    private void publish(LiveSession s) {
        bus.publish(EventBus.SESSIONS, "session_update", "session", toDto(s));
    }

    private void persist(LiveSession s) {
        try {
            records.save(LiveSessionRecord.builder()
                    .id(s.getId())
                    .nodeId(s.getNodeId())
                    .kind(s.getKind())
                    .state(s.getState())
                    .reason(s.getReason())
                    .requestedBy(s.getRequestedBy())
                    .options(writeOptions(s.getOptions()))
                    .createdAt(s.getCreatedAt())
                    .activatedAt(s.getActivatedAt())
                    .closedAt(s.getClosedAt())
                    .build());
        } catch (RuntimeException e) {
            // the stream keeps going without its metadata row
            log.warn("[Live] could not persist session {}: {}", s.getId(), e.getMessage());
        }
    }

    private String writeOptions(Map<String, Object> options) {
        if (options.isEmpty()) return null;
        try {
            return mapper.writeValueAsString(options);
        } catch (JsonProcessingException e) {
            log.debug("[Live] options not serializable: {}", e.getMessage());
            return null;
        }
    }

    private Map<String, Object> readOptions(String json) {
        if (json == null || json.isBlank()) return Map.of();
        try {
            return mapper.readValue(json, OPTIONS);
        } catch (JsonProcessingException e) {
            log.debug("[Live] stored options unreadable: {}", e.getMessage());
            return Map.of();
        }
    }
}
