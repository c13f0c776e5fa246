package org.octofleet.orchestrator.service.deployment;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.octofleet.orchestrator.api.dto.PackageDTO;
import org.octofleet.orchestrator.api.dto.PackageRequest;
import org.octofleet.orchestrator.api.error.ErrorCode;
import org.octofleet.orchestrator.domain.SoftwarePackage;
import org.octofleet.orchestrator.repo.SoftwarePackageRepo;
import org.octofleet.orchestrator.service.NotFoundException;
import org.octofleet.orchestrator.service.ValidationException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;

@Slf4j
@Service
@RequiredArgsConstructor
public class PackageCatalogService {

    private final SoftwarePackageRepo repo;

    @Transactional
    public PackageDTO create(PackageRequest r) {
        var name = r.name().trim();
        var version = r.version().trim();
        if (repo.findByNameIgnoreCaseAndVersion(name, version).isPresent()) {
            throw new ValidationException(ErrorCode.BAD_REQUEST, "package already exists: " + name + " " + version);
        }
        var p = SoftwarePackage.builder()
                .name(name).version(version)
                .displayName(r.displayName())
                .installerUrl(r.installerUrl())
                .sha256(r.sha256())
                .installCommand(r.installCommand())
                .uninstallCommand(r.uninstallCommand())
                .active(r.active() == null || r.active())
                .build();
        repo.save(p);
        log.info("[Packages] registered {} {}", name, version);
        return toDto(p);
    }

    @Transactional
    public PackageDTO setActive(Long id, boolean active) {
        var p = repo.findById(id).orElseThrow(() -> new NotFoundException("package", id));
        p.setActive(active);
        return toDto(p);
    }

    @Transactional(readOnly = true)
    public List<PackageDTO> list() {
        return repo.findAllByOrderByNameAscVersionAsc().stream().map(this::toDto).toList();
    }

    /** Deployable package by name + version; unknown and inactive are both PACKAGE_NOT_FOUND. */
    @Transactional(readOnly = true)
    public SoftwarePackage requireActive(String name, String version) {
        var n = name == null ? "" : name.trim();
        var v = version == null ? "" : version.trim();
        return repo.findByNameIgnoreCaseAndVersion(n, v)
                .filter(SoftwarePackage::isActive)
                .orElseThrow(() -> ValidationException.packageNotFound(n, v));
    }

    @Transactional(readOnly = true)
    public boolean isActive(Long id) {
        return id != null && repo.findById(id).map(SoftwarePackage::isActive).orElse(false);
    }

    @Transactional(readOnly = true)
    public SoftwarePackage find(Long id) {
        return repo.findById(id).orElseThrow(() -> new NotFoundException("package", id));
    }

    public PackageDTO toDto(SoftwarePackage p) {
        return new PackageDTO(p.getId(), p.getName(), p.getVersion(), p.getDisplayName(),
                p.getInstallerUrl(), p.getSha256(), p.getInstallCommand(), p.getUninstallCommand(),
                p.isActive(), p.getCreatedAt());
    }
}
