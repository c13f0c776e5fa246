package org.octofleet.orchestrator.service.audit;

import jakarta.servlet.http.HttpServletRequest;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.octofleet.orchestrator.api.dto.ActionLogDTO;
import org.octofleet.orchestrator.domain.ActionLog;
import org.octofleet.orchestrator.repo.ActionLogRepo;
import org.octofleet.orchestrator.security.ApiKeyFilter;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.List;

@Service @RequiredArgsConstructor @Slf4j
public class AuditService {
    private static final int MAX_DETAILS = 2000;

    private final ActionLogRepo repo;
    private final Clock clock;

    public void log(HttpServletRequest req, String action, String targetType, String targetId, String details) {
        var actor = ApiKeyFilter.actor(req);
        var ip = req.getRemoteAddr();
        if (details != null && details.length() > MAX_DETAILS) details = details.substring(0, MAX_DETAILS);
        repo.save(ActionLog.builder()
                .userIp(ip).actor(actor).action(action)
                .targetType(targetType).targetId(targetId).details(details)
                .ts(clock.instant())
                .build());
        log.debug("[Audit] {} {} {}/{}", actor, action, targetType, targetId);
    }

    public List<ActionLogDTO> list(String targetType, String targetId, int limit, int offset) {
        int size = Math.max(1, Math.min(limit, 500));
        var page = PageRequest.of(Math.max(0, offset) / size, size);
        var rows = targetType != null && targetId != null
                ? repo.findByTargetTypeAndTargetIdOrderByTsDesc(targetType, targetId, page)
                : repo.findAllByOrderByTsDesc(page);
        return rows.stream().map(AuditService::toDto).toList();
    }

    static ActionLogDTO toDto(ActionLog a) {
        return new ActionLogDTO(a.getId(), a.getUserIp(), a.getActor(), a.getAction(),
                a.getTargetType(), a.getTargetId(), a.getDetails(), a.getTs());
    }
}
