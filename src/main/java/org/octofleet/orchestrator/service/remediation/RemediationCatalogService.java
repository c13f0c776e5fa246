package org.octofleet.orchestrator.service.remediation;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.octofleet.orchestrator.api.dto.RemediationPackageDTO;
import org.octofleet.orchestrator.api.dto.RemediationPackageRequest;
import org.octofleet.orchestrator.api.dto.RemediationRuleDTO;
import org.octofleet.orchestrator.api.dto.RemediationRuleRequest;
import org.octofleet.orchestrator.api.error.ErrorCode;
import org.octofleet.orchestrator.domain.FixMethod;
import org.octofleet.orchestrator.domain.RemediationPackage;
import org.octofleet.orchestrator.domain.RemediationRule;
import org.octofleet.orchestrator.repo.RemediationJobRepo;
import org.octofleet.orchestrator.repo.RemediationPackageRepo;
import org.octofleet.orchestrator.repo.RemediationRuleRepo;
import org.octofleet.orchestrator.repo.SoftwarePackageRepo;
import org.octofleet.orchestrator.service.ConflictException;
import org.octofleet.orchestrator.service.NotFoundException;
import org.octofleet.orchestrator.service.ValidationException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;
import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;

@Slf4j
@Service
@RequiredArgsConstructor
public class RemediationCatalogService {

    private final RemediationPackageRepo packages;
    private final RemediationRuleRepo rules;
    private final RemediationJobRepo jobs;
    private final SoftwarePackageRepo softwarePackages;

    // ---- packages

    @Transactional(readOnly = true)
    public List<RemediationPackageDTO> listPackages() {
        return packages.findAllByOrderByNameAsc().stream().map(RemediationCatalogService::toDto).toList();
    }

    @Transactional
    public RemediationPackageDTO createPackage(RemediationPackageRequest r) {
        var p = new RemediationPackage();
        apply(p, r);
        packages.save(p);
        log.info("[Remediation] package {} '{}' for '{}' ({})", p.getId(), p.getName(), p.getTargetSoftware(), p.getFixMethod());
        return toDto(p);
    }

    @Transactional
    public RemediationPackageDTO updatePackage(Long id, RemediationPackageRequest r) {
        var p = packages.findById(id).orElseThrow(() -> new NotFoundException("remediation package", id));
        apply(p, r);
        return toDto(p);
    }

    @Transactional
    public void deletePackage(Long id) {
        var p = packages.findById(id).orElseThrow(() -> new NotFoundException("remediation package", id));
        if (jobs.existsByRemediationPackageId(id)) {
            throw new ConflictException(ErrorCode.ILLEGAL_TRANSITION, "remediation package " + id + " is referenced by jobs; disable it instead");
        }
        packages.delete(p);
    }

    private void apply(RemediationPackage p, RemediationPackageRequest r) {
        if (r.fixMethod() == FixMethod.PACKAGE) {
            if (r.packageId() == null || !softwarePackages.existsById(r.packageId())) {
                throw new ValidationException(ErrorCode.BAD_REQUEST, "fix method 'package' needs an existing package_id");
            }
        }
        if (r.fixMethod() == FixMethod.SCRIPT && (r.fixCommand() == null || r.fixCommand().isBlank())) {
            throw new ValidationException(ErrorCode.BAD_REQUEST, "fix method 'script' needs a fix_command");
        }
        p.setName(r.name().trim());
        p.setDescription(r.description());
        p.setTargetSoftware(r.targetSoftware().trim());
        p.setMinFixedVersion(blankToNull(r.minFixedVersion()));
        p.setFixMethod(r.fixMethod());
        p.setFixCommand(blankToNull(r.fixCommand()));
        p.setRollbackCommand(blankToNull(r.rollbackCommand()));
        p.setSoftwarePackageId(r.fixMethod() == FixMethod.PACKAGE ? r.packageId() : null);
        p.setEnabled(r.enabled() == null || r.enabled());
    }

    // ---- rules

    @Transactional(readOnly = true)
    public List<RemediationRuleDTO> listRules() {
        return rules.findAllByOrderByIdAsc().stream().map(RemediationCatalogService::toDto).toList();
    }

    @Transactional
    public RemediationRuleDTO createRule(RemediationRuleRequest r) {
        var rule = new RemediationRule();
        apply(rule, r);
        rules.save(rule);
        log.info("[Remediation] rule {} '{}' >= {} pattern={}", rule.getId(), rule.getName(), rule.getMinSeverity(), rule.getSoftwarePattern());
        return toDto(rule);
    }

    @Transactional
    public RemediationRuleDTO updateRule(Long id, RemediationRuleRequest r) {
        var rule = rules.findById(id).orElseThrow(() -> new NotFoundException("remediation rule", id));
        apply(rule, r);
        return toDto(rule);
    }

    @Transactional
    public void deleteRule(Long id) {
        var rule = rules.findById(id).orElseThrow(() -> new NotFoundException("remediation rule", id));
        if (jobs.existsByRuleId(id)) {
            throw new ConflictException(ErrorCode.ILLEGAL_TRANSITION, "remediation rule " + id + " is referenced by jobs; disable it instead");
        }
        rules.delete(rule);
    }

    private void apply(RemediationRule rule, RemediationRuleRequest r) {
        var pattern = blankToNull(r.softwarePattern());
        if (pattern != null) {
            try {
                Pattern.compile(pattern);
            } catch (PatternSyntaxException e) {
                throw new ValidationException(ErrorCode.BAD_REQUEST, "invalid software_pattern: " + e.getDescription());
            }
        }
        rule.setName(r.name().trim());
        rule.setMinSeverity(r.minSeverity());
        rule.setSoftwarePattern(pattern);
        rule.setAutoRemediate(r.autoRemediate());
        rule.setRequireApproval(r.requireApproval() == null || r.requireApproval());
        rule.setMaintenanceWindowOnly(r.maintenanceWindowOnly());
        rule.setEnabled(r.enabled() == null || r.enabled());
    }

    static RemediationPackageDTO toDto(RemediationPackage p) {
        return new RemediationPackageDTO(p.getId(), p.getName(), p.getDescription(),
                p.getTargetSoftware(), p.getMinFixedVersion(), p.getFixMethod(),
                p.getFixCommand(), p.getRollbackCommand(), p.getSoftwarePackageId(),
                p.isEnabled(), p.getCreatedAt());
    }

    static RemediationRuleDTO toDto(RemediationRule r) {
        return new RemediationRuleDTO(r.getId(), r.getName(), r.getMinSeverity(), r.getSoftwarePattern(),
                r.isAutoRemediate(), r.isRequireApproval(), r.isMaintenanceWindowOnly(),
                r.isEnabled(), r.getCreatedAt());
    }

    private static String blankToNull(String s) {
        return s == null || s.isBlank() ? null : s.trim();
    }
}
