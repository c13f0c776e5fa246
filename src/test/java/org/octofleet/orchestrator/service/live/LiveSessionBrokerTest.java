package org.octofleet.orchestrator.service.live;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.octofleet.orchestrator.MutableClock;
import org.octofleet.orchestrator.api.dto.LiveSessionDTO;
import org.octofleet.orchestrator.api.dto.NodeDTO;
import org.octofleet.orchestrator.api.error.ErrorCode;
import org.octofleet.orchestrator.config.AppProps;
import org.octofleet.orchestrator.domain.LiveSessionRecord;
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

import java.io.IOException;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.Executor;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.awaitility.Awaitility.await;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.argThat;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class LiveSessionBrokerTest {

    private static final int CAPACITY = 4;
    private static final int WINDOW = 3;

    private final AgentGateway agents = mock(AgentGateway.class);
    private final NodeRepo nodes = mock(NodeRepo.class);
    private final LiveSessionRecordRepo records = mock(LiveSessionRecordRepo.class);
    private final EventBus bus = new EventBus();
    private final MutableClock clock = new MutableClock(Instant.parse("2024-06-03T10:00:00Z"));
    private final ManualExecutor manual = new ManualExecutor();

    @BeforeEach
    void setUp() {
        when(nodes.existsByNodeId(anyString())).thenReturn(true);
        when(agents.isReachable(anyString())).thenReturn(true);
    }

    private LiveSessionBroker broker(Executor executor) {
        var props = new AppProps(null, null, null, null, null,
                new AppProps.SessionProps(Duration.ofSeconds(45), Duration.ofSeconds(60), Duration.ofMinutes(5),
                        CAPACITY, WINDOW),
                null);
        var b = new LiveSessionBroker(agents, nodes, records, bus, new ObjectMapper(), clock, props, executor);
        b.listenForNodes();
        return b;
    }

    private static Map<String, Object> frame(String type, long seq) {
        return Map.of("type", type, "seq", seq, "data", "chunk-" + seq);
    }

    // ---------- start / exclusivity ----------

    @Test
    void startQueuesOpenCommandAndPersists() {
        var broker = broker(Runnable::run);

        var started = broker.start("n1", SessionKind.SCREEN, Map.of("quality", 70), "token-1");

        assertThat(started.state()).isEqualTo(SessionState.PENDING);
        assertThat(started.reused()).isFalse();
        verify(agents).dispatch(eq("n1"), argThat((AgentCommand c) ->
                c.type() == AgentCommand.Type.OPEN_SESSION
                        && started.sessionId().equals(c.referenceId())
                        && Integer.valueOf(70).equals(c.payload().get("quality"))));
        verify(records).save(any());
    }

    @Test
    void metricsSessionIsSharedPerNode() {
        var broker = broker(Runnable::run);

        var first = broker.start("n1", SessionKind.METRICS, Map.of(), "a");
        var second = broker.start("n1", SessionKind.METRICS, Map.of(), "b");

        assertThat(second.sessionId()).isEqualTo(first.sessionId());
        assertThat(second.reused()).isTrue();
        assertThat(broker.list(false)).hasSize(1);
    }

    @Test
    void concurrentShellStartsYieldExactlyOneSession() throws Exception {
        var broker = broker(Runnable::run);
        int callers = 8;
        var ready = new CountDownLatch(1);
        ExecutorService pool = Executors.newFixedThreadPool(callers);
        try {
            var results = new ArrayList<Future<String>>();
            for (int i = 0; i < callers; i++) {
                results.add(pool.submit(() -> {
                    ready.await();
                    try {
                        return broker.start("n1", SessionKind.SHELL, Map.of(), "op").sessionId();
                    } catch (ConflictException e) {
                        assertThat(e.code()).isEqualTo(ErrorCode.SESSION_KIND_CONFLICT);
                        return null;
                    }
                }));
            }
            ready.countDown();
            int winners = 0;
            for (var f : results) {
                if (f.get(5, TimeUnit.SECONDS) != null) winners++;
            }
            assertThat(winners).isEqualTo(1);
            assertThat(broker.list(false)).hasSize(1);
        } finally {
            pool.shutdownNow();
        }
    }

    @Test
    void shellCanBeReopenedOnceClosed() {
        var broker = broker(Runnable::run);
        var first = broker.start("n1", SessionKind.SHELL, Map.of(), "op");
        broker.stop(first.sessionId(), "done");

        var second = broker.start("n1", SessionKind.SHELL, Map.of(), "op");

        assertThat(second.sessionId()).isNotEqualTo(first.sessionId());
    }

    @Test
    void screenAndShellDoNotConflict() {
        var broker = broker(Runnable::run);
        broker.start("n1", SessionKind.SHELL, Map.of(), "op");

        assertThat(broker.start("n1", SessionKind.SCREEN, Map.of(), "op").reused()).isFalse();
    }

    @Test
    void offlineOrUnknownNodeIsRefused() {
        var broker = broker(Runnable::run);
        when(agents.isReachable("n2")).thenReturn(false);
        when(nodes.existsByNodeId("ghost")).thenReturn(false);

        assertThatThrownBy(() -> broker.start("n2", SessionKind.SHELL, Map.of(), "op"))
                .isInstanceOf(UpstreamUnavailableException.class);
        assertThatThrownBy(() -> broker.start("ghost", SessionKind.SHELL, Map.of(), "op"))
                .isInstanceOf(NotFoundException.class);
        assertThat(broker.list(true)).isEmpty();
    }

    // ---------- relay ----------

    @Test
    void metricsFanOutToEverySubscriber() {
        var broker = broker(Runnable::run);
        var id = broker.start("n1", SessionKind.METRICS, Map.of(), "op").sessionId();
        var a = new RecordingSink();
        var b = new RecordingSink();
        broker.subscribe(id, a);
        broker.subscribe(id, b);

        broker.onUpstreamMessage(id, Map.of("type", "info", "hostname", "n1"));
        for (int i = 1; i <= 3; i++) broker.onUpstreamMessage(id, frame("metrics", i));

        assertThat(broker.get(id).state()).isEqualTo(SessionState.ACTIVE);
        for (var sink : List.of(a, b)) {
            assertThat(sink.seqs("metrics")).containsExactly(1L, 2L, 3L);
            assertThat(sink.types()).startsWith("info", "info");
        }
    }

    @Test
    void slowMetricsViewerLosesOldestFrames() {
        var broker = broker(manual);
        var id = broker.start("n1", SessionKind.METRICS, Map.of(), "op").sessionId();
        var slow = new RecordingSink();
        broker.subscribe(id, slow);

        for (int i = 1; i <= 10; i++) broker.onUpstreamMessage(id, frame("metrics", i));
        manual.runAll();

        assertThat(slow.seqs("metrics")).containsExactly(7L, 8L, 9L, 10L);
        assertThat(broker.get(id).droppedFrames()).isEqualTo(7);
    }

    @Test
    void shellFramesAreParkedAndAckedAsTheViewerDrains() {
        var broker = broker(manual);
        var id = broker.start("n1", SessionKind.SHELL, Map.of(), "op").sessionId();
        var upstream = new RecordingUpstream();
        broker.attachUpstream(id, upstream);
        var viewer = new RecordingSink();
        broker.subscribe(id, viewer);

        broker.onUpstreamMessage(id, Map.of("type", "info", "shell", "powershell"));
        for (int i = 1; i <= 5; i++) broker.onUpstreamMessage(id, frame("output", i));

        // queue holds info x2 and seq 1..2; 3..5 wait unacknowledged
        assertThat(upstream.acks()).containsExactly(1L, 2L);

        manual.runAll();

        assertThat(viewer.seqs("output")).containsExactly(1L, 2L, 3L, 4L, 5L);
        assertThat(upstream.acks()).containsExactly(1L, 2L, 3L, 4L, 5L);
        assertThat(broker.get(id).droppedFrames()).isZero();
        assertThat(broker.get(id).state()).isEqualTo(SessionState.ACTIVE);
    }

    @Test
    void agentExceedingItsWindowFailsTheSession() {
        var broker = broker(manual);
        var id = broker.start("n1", SessionKind.SCREEN, Map.of(), "op").sessionId();
        var upstream = new RecordingUpstream();
        broker.attachUpstream(id, upstream);
        broker.subscribe(id, new RecordingSink());

        // one slot is taken by the info frame: 3 fit, 3 park, the 7th breaks the window
        for (int i = 1; i <= 7; i++) broker.onUpstreamMessage(id, frame("frame", i));

        var s = broker.get(id);
        assertThat(s.state()).isEqualTo(SessionState.ERROR);
        assertThat(s.reason()).isEqualTo("upstream window exceeded");
        assertThat(upstream.sent).anyMatch(m -> "stop".equals(m.get("type")));
        assertThat(upstream.closed).isTrue();
    }

    @Test
    void shellWaitsForAViewerBeforeReleasingFrames() {
        var broker = broker(Runnable::run);
        var id = broker.start("n1", SessionKind.SHELL, Map.of(), "op").sessionId();
        var upstream = new RecordingUpstream();
        broker.attachUpstream(id, upstream);

        broker.onUpstreamMessage(id, frame("output", 1));
        assertThat(upstream.acks()).isEmpty();

        var viewer = new RecordingSink();
        broker.subscribe(id, viewer);

        assertThat(upstream.acks()).containsExactly(1L);
        assertThat(viewer.seqs("output")).containsExactly(1L);
    }

    @Test
    void threadedRelayKeepsPerViewerOrder() {
        ExecutorService pool = Executors.newFixedThreadPool(3);
        try {
            var broker = broker(pool);
            var id = broker.start("n1", SessionKind.SHELL, Map.of(), "op").sessionId();
            var upstream = new RecordingUpstream();
            broker.attachUpstream(id, upstream);
            var viewer = new RecordingSink();
            broker.subscribe(id, viewer);

            // stays inside the window by only sending once the previous frame was acked
            for (long i = 1; i <= 50; i++) {
                final long seq = i;
                broker.onUpstreamMessage(id, frame("output", seq));
                await().atMost(Duration.ofSeconds(5)).until(() -> upstream.acks().contains(seq));
            }

            await().atMost(Duration.ofSeconds(5))
                    .untilAsserted(() -> assertThat(viewer.seqs("output")).hasSize(50).isSorted());
            assertThat(broker.get(id).state()).isEqualTo(SessionState.ACTIVE);
        } finally {
            pool.shutdownNow();
        }
    }

    @Test
    void pingsDuringShellRelayNeverCostAnAckedFrame() throws Exception {
        ExecutorService pool = Executors.newFixedThreadPool(3);
        var pinger = Executors.newSingleThreadExecutor();
        try {
            var broker = broker(pool);
            var id = broker.start("n1", SessionKind.SHELL, Map.of(), "op").sessionId();
            var upstream = new RecordingUpstream();
            broker.attachUpstream(id, upstream);
            var viewer = new RecordingSink();
            broker.subscribe(id, viewer);

            var pings = pinger.submit(() -> {
                for (int i = 0; i < 500; i++) {
                    broker.onClientMessage(id, viewer.id(), Map.of("type", "ping"));
                }
            });
            for (long i = 1; i <= 40; i++) {
                final long seq = i;
                broker.onUpstreamMessage(id, frame("output", seq));
                await().atMost(Duration.ofSeconds(5)).until(() -> upstream.acks().contains(seq));
            }
            pings.get(5, TimeUnit.SECONDS);

            await().atMost(Duration.ofSeconds(5))
                    .untilAsserted(() -> assertThat(viewer.seqs("output")).hasSize(40).isSorted());
            assertThat(viewer.seqs("output")).containsAll(upstream.acks());
        } finally {
            pinger.shutdownNow();
            pool.shutdownNow();
        }
    }

    @Test
    void evictedSessionIsServedFromItsStoredRecord() {
        var broker = broker(Runnable::run);
        var created = Instant.parse("2024-06-03T08:00:00Z");
        when(records.findById("old-1")).thenReturn(Optional.of(LiveSessionRecord.builder()
                .id("old-1").nodeId("n1").kind(SessionKind.SCREEN).state(SessionState.CLOSED)
                .reason("stopped").requestedBy("op")
                .options("{\"quality\":70,\"max_fps\":15}")
                .createdAt(created).closedAt(created.plusSeconds(600))
                .build()));

        var dto = broker.get("old-1");

        assertThat(dto.state()).isEqualTo(SessionState.CLOSED);
        assertThat(dto.options()).containsEntry("quality", 70).containsEntry("max_fps", 15);
        assertThat(dto.subscribers()).isZero();
    }

    // ---------- viewer traffic ----------

    @Test
    void pingIsAnsweredAndInputForwarded() {
        var broker = broker(Runnable::run);
        var id = broker.start("n1", SessionKind.SHELL, Map.of(), "op").sessionId();
        var upstream = new RecordingUpstream();
        broker.attachUpstream(id, upstream);
        var viewer = new RecordingSink();
        broker.subscribe(id, viewer);

        broker.onClientMessage(id, viewer.id(), Map.of("type", "ping"));
        broker.onClientMessage(id, viewer.id(), Map.of("type", "input", "data", "dir\r"));

        assertThat(viewer.types()).contains("pong");
        assertThat(upstream.sent).contains(Map.of("type", "input", "data", "dir\r"));
    }

    @Test
    void exclusiveSessionTakesOneViewer() {
        var broker = broker(Runnable::run);
        var id = broker.start("n1", SessionKind.SCREEN, Map.of(), "op").sessionId();
        broker.subscribe(id, new RecordingSink());

        assertThatThrownBy(() -> broker.subscribe(id, new RecordingSink()))
                .isInstanceOf(ConflictException.class);
    }

    @Test
    void lastViewerLeavingClosesTheSession() {
        var broker = broker(Runnable::run);
        var id = broker.start("n1", SessionKind.METRICS, Map.of(), "op").sessionId();
        var a = new RecordingSink();
        var b = new RecordingSink();
        broker.subscribe(id, a);
        broker.subscribe(id, b);

        broker.unsubscribe(id, a.id());
        assertThat(broker.get(id).state()).isEqualTo(SessionState.PENDING);

        broker.unsubscribe(id, b.id());
        assertThat(broker.get(id).state()).isEqualTo(SessionState.CLOSED);
        verify(agents).dispatch(eq("n1"), argThat((AgentCommand c) -> c.type() == AgentCommand.Type.CLOSE_SESSION));
    }

    @Test
    void viewerStopEndsWithClosedFrame() {
        var broker = broker(Runnable::run);
        var id = broker.start("n1", SessionKind.SHELL, Map.of(), "op").sessionId();
        var viewer = new RecordingSink();
        broker.subscribe(id, viewer);

        broker.onClientMessage(id, viewer.id(), Map.of("type", "stop"));

        assertThat(broker.get(id).state()).isEqualTo(SessionState.CLOSED);
        assertThat(viewer.types()).last().isEqualTo("closed");
        assertThat(viewer.closed).isTrue();
    }

    @Test
    void failingViewerIsDropped() {
        var broker = broker(Runnable::run);
        var id = broker.start("n1", SessionKind.METRICS, Map.of(), "op").sessionId();
        var healthy = new RecordingSink();
        var broken = new RecordingSink();
        broken.fail = true;
        broker.subscribe(id, healthy);
        broker.subscribe(id, broken);

        broker.onUpstreamMessage(id, frame("metrics", 1));

        assertThat(broker.get(id).subscribers()).isEqualTo(1);
        assertThat(healthy.seqs("metrics")).containsExactly(1L);
    }

    // ---------- agent side ----------

    @Test
    void agentErrorAndDisconnectEndTheSession() {
        var broker = broker(Runnable::run);
        var a = broker.start("n1", SessionKind.SHELL, Map.of(), "op").sessionId();
        var b = broker.start("n1", SessionKind.SCREEN, Map.of(), "op").sessionId();
        broker.attachUpstream(b, new RecordingUpstream());

        broker.onUpstreamMessage(a, Map.of("type", "error", "message", "no desktop session"));
        broker.onUpstreamClosed(b);

        assertThat(broker.get(a).state()).isEqualTo(SessionState.ERROR);
        assertThat(broker.get(a).reason()).isEqualTo("no desktop session");
        assertThat(broker.get(b).reason()).isEqualTo("agent disconnected");
    }

    @Test
    void secondAgentChannelIsRefused() {
        var broker = broker(Runnable::run);
        var id = broker.start("n1", SessionKind.SHELL, Map.of(), "op").sessionId();
        broker.attachUpstream(id, new RecordingUpstream());

        assertThatThrownBy(() -> broker.attachUpstream(id, new RecordingUpstream()))
                .isInstanceOf(ConflictException.class);
    }

    @Test
    void httpPushIsOnlyForDroppableKinds() {
        var broker = broker(Runnable::run);
        var metrics = broker.start("n1", SessionKind.METRICS, Map.of(), "op").sessionId();
        var shell = broker.start("n1", SessionKind.SHELL, Map.of(), "op").sessionId();

        assertThat(broker.pushFrames(metrics, List.of(frame("metrics", 1), frame("logs", 2)))).isEqualTo(2);
        assertThatThrownBy(() -> broker.pushFrames(shell, List.of(frame("output", 1))))
                .isInstanceOf(ValidationException.class);
    }

    // ---------- timeouts ----------

    @Test
    void unacknowledgedSessionTimesOut() {
        var broker = broker(Runnable::run);
        var id = broker.start("n1", SessionKind.SCREEN, Map.of(), "op").sessionId();

        clock.advance(Duration.ofSeconds(59));
        assertThat(broker.sweep()).isZero();

        clock.advance(Duration.ofSeconds(2));
        assertThat(broker.sweep()).isEqualTo(1);
        assertThat(broker.get(id).state()).isEqualTo(SessionState.ERROR);
        assertThat(broker.get(id).reason()).contains("did not acknowledge");
    }

    @Test
    void idleSessionTimesOutWithoutViewerTraffic() {
        var broker = broker(Runnable::run);
        var id = broker.start("n1", SessionKind.SHELL, Map.of(), "op").sessionId();
        var viewer = new RecordingSink();
        broker.subscribe(id, viewer);
        broker.onUpstreamMessage(id, Map.of("type", "info"));

        clock.advance(Duration.ofSeconds(30));
        broker.onUpstreamMessage(id, Map.of("type", "heartbeat"));
        broker.onClientMessage(id, viewer.id(), Map.of("type", "ping"));
        clock.advance(Duration.ofSeconds(30));
        broker.onUpstreamMessage(id, Map.of("type", "heartbeat"));
        assertThat(broker.sweep()).isZero();

        clock.advance(Duration.ofSeconds(20));
        broker.onUpstreamMessage(id, Map.of("type", "heartbeat"));
        assertThat(broker.sweep()).isEqualTo(1);
        assertThat(broker.get(id).reason()).isEqualTo("idle timeout: no viewer traffic");
        assertThat(viewer.types()).last().isEqualTo("error");
    }

    @Test
    void closedSessionsAreListedForTheRetentionPeriod() {
        var broker = broker(Runnable::run);
        var id = broker.start("n1", SessionKind.SHELL, Map.of(), "op").sessionId();
        broker.stop(id, "done");

        assertThat(broker.list(false)).isEmpty();
        assertThat(broker.list(true)).extracting(LiveSessionDTO::id).containsExactly(id);

        clock.advance(Duration.ofMinutes(6));
        broker.sweep();
        assertThat(broker.list(true)).isEmpty();
    }

    @Test
    void nodeGoingOfflineErrorsItsSessions() {
        var broker = broker(Runnable::run);
        var events = Collections.synchronizedList(new ArrayList<FleetEvent>());
        bus.subscribe(EventBus.SESSIONS, events::add);
        var n1 = broker.start("n1", SessionKind.SHELL, Map.of(), "op").sessionId();
        var n2 = broker.start("n2", SessionKind.SHELL, Map.of(), "op").sessionId();

        bus.publish(EventBus.NODES, "node_offline", "node",
                new NodeDTO("n1", "host1", null, null, null, null, null, List.of(), false, "DOWN", null, null));

        assertThat(broker.get(n1).state()).isEqualTo(SessionState.ERROR);
        assertThat(broker.get(n1).reason()).isEqualTo("node went offline");
        assertThat(broker.get(n2).state()).isEqualTo(SessionState.PENDING);
        assertThat(events).extracting(FleetEvent::type).contains("session_update");
    }

    // ---------- fakes ----------

    static final class ManualExecutor implements Executor {
        private final ArrayDeque<Runnable> tasks = new ArrayDeque<>();

        @Override
        public synchronized void execute(Runnable command) {
            tasks.add(command);
        }

        void runAll() {
            while (true) {
                Runnable next;
                synchronized (this) {
                    next = tasks.poll();
                }
                if (next == null) return;
                next.run();
            }
        }
    }

    static final class RecordingSink implements FrameSink {
        private final String id = UUID.randomUUID().toString();
        final List<LiveFrame> frames = new CopyOnWriteArrayList<>();
        volatile boolean closed;
        volatile boolean fail;

        @Override
        public String id() { return id; }

        @Override
        public void send(LiveFrame frame) throws IOException {
            if (fail) throw new IOException("broken pipe");
            frames.add(frame);
        }

        @Override
        public void close() { closed = true; }

        List<String> types() {
            return frames.stream().map(LiveFrame::type).toList();
        }

        List<Long> seqs(String type) {
            return frames.stream().filter(f -> f.type().equals(type)).map(LiveFrame::seq).toList();
        }
    }

    static final class RecordingUpstream implements UpstreamChannel {
        final List<Map<String, Object>> sent = new CopyOnWriteArrayList<>();
        volatile boolean closed;

        @Override
        public void send(Map<String, Object> message) {
            sent.add(message);
        }

        @Override
        public void close() { closed = true; }

        List<Long> acks() {
            return sent.stream().filter(m -> "ack".equals(m.get("type"))).map(m -> (Long) m.get("seq")).toList();
        }
    }
}
