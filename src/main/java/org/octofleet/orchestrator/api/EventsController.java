package org.octofleet.orchestrator.api;

import lombok.RequiredArgsConstructor;
import org.octofleet.orchestrator.api.dto.ActionLogDTO;
import org.octofleet.orchestrator.service.audit.AuditService;
import org.octofleet.orchestrator.service.events.SseFanout;
import org.springframework.web.bind.annotation.*;
import org.springframework.web.servlet.mvc.method.annotation.SseEmitter;

import java.util.List;

@RestController
@RequestMapping("/api/v1")
@RequiredArgsConstructor
public class EventsController {
    private final SseFanout fanout;
    private final AuditService audit;

    /** Every topic on one stream: deployment, job, node and session updates. */
    @GetMapping("/events")
    public SseEmitter events() {
        return fanout.subscribe(null);
    }

    @GetMapping("/audit")
    public List<ActionLogDTO> audit(@RequestParam(value = "target_type", required = false) String targetType,
                                    @RequestParam(value = "target_id", required = false) String targetId,
                                    @RequestParam(value = "limit", required = false, defaultValue = "100") int limit,
                                    @RequestParam(value = "offset", required = false, defaultValue = "0") int offset) {
        return audit.list(targetType, targetId, limit, offset);
    }
}
