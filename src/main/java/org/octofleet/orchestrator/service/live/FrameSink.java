package org.octofleet.orchestrator.service.live;

import java.io.IOException;

/** Viewer end of a live session (WebSocket or SSE). */
public interface FrameSink {

    String id();

    void send(LiveFrame frame) throws IOException;

    /** Closes the transport; called once, after the final frame went out. */
    void close();
}
