package org.octofleet.orchestrator.api;

import jakarta.servlet.http.HttpServletRequest;
import lombok.RequiredArgsConstructor;
import org.octofleet.orchestrator.api.dto.LiveSessionDTO;
import org.octofleet.orchestrator.api.dto.StartSessionDTO;
import org.octofleet.orchestrator.domain.SessionKind;
import org.octofleet.orchestrator.security.ApiKeyFilter;
import org.octofleet.orchestrator.service.audit.AuditService;
import org.octofleet.orchestrator.service.live.LiveSessionBroker;
import org.octofleet.orchestrator.service.live.SseLiveBridge;
import org.springframework.web.bind.annotation.*;
import org.springframework.web.servlet.mvc.method.annotation.SseEmitter;

import java.util.LinkedHashMap;
import java.util.List;

/**
 * Starts and lists live sessions. Screen and shell streams are then opened on
 * /api/v1/screen/ws/{id} and /api/v1/shell/ws/{id}; metrics and logs stream over SSE.
 */
@RestController
@RequestMapping("/api/v1")
@RequiredArgsConstructor
public class LiveSessionController {
    private final LiveSessionBroker broker;
    private final SseLiveBridge sse;
    private final AuditService audit;

    @PostMapping("/screen/start/{nodeId}")
    public StartSessionDTO startScreen(@PathVariable String nodeId,
                                       @RequestParam(value = "quality", required = false) Integer quality,
                                       @RequestParam(value = "max_fps", required = false) Integer maxFps,
                                       HttpServletRequest req) {
        var options = new LinkedHashMap<String, Object>();
        if (quality != null) options.put("quality", Math.max(1, Math.min(quality, 100)));
        if (maxFps != null) options.put("max_fps", Math.max(1, Math.min(maxFps, 60)));
        var started = broker.start(nodeId, SessionKind.SCREEN, options, ApiKeyFilter.actor(req));
        audit.log(req, "session.start", "session", started.sessionId(), "screen on " + nodeId);
        return started;
    }

    @PostMapping("/shell/start/{nodeId}")
    public StartSessionDTO startShell(@PathVariable String nodeId,
                                      @RequestParam(value = "shell_type", required = false, defaultValue = "powershell") String shellType,
                                      HttpServletRequest req) {
        var options = new LinkedHashMap<String, Object>();
        options.put("shell_type", shellType);
        var started = broker.start(nodeId, SessionKind.SHELL, options, ApiKeyFilter.actor(req));
        audit.log(req, "session.start", "session", started.sessionId(), "shell(" + shellType + ") on " + nodeId);
        return started;
    }

    /** Metrics (default) or logs stream of one node as Server-Sent Events. */
    @GetMapping("/live/{nodeId}")
    public SseEmitter live(@PathVariable String nodeId,
                           @RequestParam(value = "kind", required = false, defaultValue = "metrics") String kind,
                           HttpServletRequest req) {
        var k = SessionKind.fromWire(kind);
        if (k.exclusive()) {
            throw new IllegalArgumentException(kind + " is not available as an event stream");
        }
        return sse.open(nodeId, k, ApiKeyFilter.actor(req));
    }

    @GetMapping("/sessions")
    public List<LiveSessionDTO> list(@RequestParam(value = "include_closed", required = false, defaultValue = "false")
                                     boolean includeClosed) {
        return broker.list(includeClosed);
    }

    @GetMapping("/sessions/{id}")
    public LiveSessionDTO get(@PathVariable String id) {
        return broker.get(id);
    }

    @DeleteMapping("/sessions/{id}")
    public LiveSessionDTO stop(@PathVariable String id, HttpServletRequest req) {
        var s = broker.stop(id, "stopped by " + ApiKeyFilter.actor(req));
        audit.log(req, "session.stop", "session", id, null);
        return s;
    }
}
