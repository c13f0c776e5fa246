package org.octofleet.orchestrator.service.live;

import org.junit.jupiter.api.Test;
import org.octofleet.orchestrator.service.live.LiveSessionBrokerTest.ManualExecutor;
import org.octofleet.orchestrator.service.live.LiveSessionBrokerTest.RecordingSink;

import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class SubscriberTest {

    private final ManualExecutor executor = new ManualExecutor();
    private final RecordingSink sink = new RecordingSink();

    private static LiveFrame output(long seq) {
        return new LiveFrame("output", seq, Map.of("data", "chunk-" + seq));
    }

    @Test
    void reservedFrameIsKeptWhenAPongFilledTheLastSlot() {
        var sub = new Subscriber(sink, 2, executor, () -> { }, s -> { });
        sub.offerReserved(output(1));

        assertThat(sub.hasRoom()).isTrue();
        sub.offerControl(LiveFrame.control("pong", Map.of()));
        sub.offerReserved(output(2));

        assertThat(sub.queued()).isEqualTo(3);
        assertThat(sub.hasRoom()).isFalse();

        sub.schedule();
        executor.runAll();

        assertThat(sink.types()).containsExactly("output", "pong", "output");
        assertThat(sink.seqs("output")).containsExactly(1L, 2L);
    }

    @Test
    void dropOldestCountsWhatWasLost() {
        var sub = new Subscriber(sink, 2, executor, () -> { }, s -> { });
        for (long i = 1; i <= 5; i++) {
            sub.offerDroppingOldest(output(i));
        }

        sub.schedule();
        executor.runAll();

        assertThat(sink.seqs("output")).containsExactly(4L, 5L);
        assertThat(sub.dropped()).isEqualTo(3);
    }

    @Test
    void finishingViewerTakesNoMoreFramesAndClosesAfterTheLastOne() {
        var sub = new Subscriber(sink, 4, executor, () -> { }, s -> { });
        sub.offerReserved(output(1));
        sub.finish(LiveFrame.control("closed", Map.of("reason", "stopped")));
        sub.offerReserved(output(2));
        sub.offerControl(LiveFrame.control("pong", Map.of()));

        executor.runAll();

        assertThat(sink.types()).containsExactly("output", "closed");
        assertThat(sink.closed).isTrue();
    }
}
