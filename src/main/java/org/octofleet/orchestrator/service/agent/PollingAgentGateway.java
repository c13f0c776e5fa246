package org.octofleet.orchestrator.service.agent;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.octofleet.orchestrator.repo.NodeRepo;
import org.octofleet.orchestrator.service.UpstreamUnavailableException;
import org.octofleet.orchestrator.domain.Node;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentLinkedDeque;

/**
 * Agents pull their work: commands wait in a per-node queue until the agent's next
 * {@code GET /api/v1/agent/{nodeId}/commands}. A node is reachable while the registry
 * has it online.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class PollingAgentGateway implements AgentGateway {

    private final NodeRepo nodes;
    private final Map<String, Deque<AgentCommand>> queues = new ConcurrentHashMap<>();

    @Override
    public boolean isReachable(String nodeId) {
        return nodes.findByNodeId(nodeId).map(Node::isOnline).orElse(false);
    }

    @Override
    public void dispatch(String nodeId, AgentCommand command) {
        if (!isReachable(nodeId)) {
            throw UpstreamUnavailableException.nodeOffline(nodeId);
        }
        queues.computeIfAbsent(nodeId, k -> new ConcurrentLinkedDeque<>()).offerLast(command);
        log.debug("[Agent] queued {} {} for {}", command.type(), command.referenceId(), nodeId);
    }

    /** Removes and returns up to {@code max} queued commands, oldest first. */
    public List<AgentCommand> drain(String nodeId, int max) {
        var q = queues.get(nodeId);
        var out = new ArrayList<AgentCommand>();
        if (q == null) return out;
        AgentCommand c;
        while (out.size() < max && (c = q.pollFirst()) != null) {
            out.add(c);
        }
        return out;
    }

    public int pending(String nodeId) {
        var q = queues.get(nodeId);
        return q == null ? 0 : q.size();
    }
}
