package org.octofleet.orchestrator.api;

import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.octofleet.orchestrator.api.dto.FindingIngest;
import org.octofleet.orchestrator.domain.Severity;
import org.octofleet.orchestrator.service.remediation.Finding;
import org.octofleet.orchestrator.service.remediation.FindingIngestService;
import org.springframework.web.bind.annotation.*;

import java.util.EnumSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/** Scanner ingest for the local findings store. */
@RestController
@RequestMapping("/api/v1/vulnerabilities")
@RequiredArgsConstructor
public class VulnerabilityController {
    private final FindingIngestService findings;

    @PostMapping("/findings")
    public Map<String, Integer> ingest(@Valid @RequestBody FindingIngest body) {
        return Map.of("ingested", findings.ingest(body));
    }

    /** @param severity optional comma separated severities, e.g. CRITICAL,HIGH */
    @GetMapping("/findings")
    public List<Finding> list(@RequestParam(value = "severity", required = false) List<String> severity) {
        Set<Severity> filter = EnumSet.noneOf(Severity.class);
        if (severity != null) severity.forEach(s -> filter.add(Severity.parse(s)));
        return findings.list(filter);
    }
}
