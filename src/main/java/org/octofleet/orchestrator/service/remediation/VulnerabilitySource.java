package org.octofleet.orchestrator.service.remediation;

import org.octofleet.orchestrator.domain.Severity;

import java.util.List;
import java.util.Set;

/** Read side of the vulnerability data the remediation scan works from. */
public interface VulnerabilitySource {

    /** @param severities empty means every severity */
    List<Finding> findings(Set<Severity> severities);
}
