package org.octofleet.orchestrator.service.live;

import java.io.IOException;
import java.util.Map;

/** Agent end of a live session. */
public interface UpstreamChannel {

    void send(Map<String, Object> message) throws IOException;

    void close();
}
