package org.octofleet.orchestrator.service.agent;

import org.octofleet.orchestrator.service.UpstreamUnavailableException;

/** Outbound command channel to node agents. Dispatch never waits for the outcome. */
public interface AgentGateway {

    boolean isReachable(String nodeId);

    /**
     * Hands the command to the node's channel.
     * @throws UpstreamUnavailableException when the node has no live channel
     */
    void dispatch(String nodeId, AgentCommand command);
}
