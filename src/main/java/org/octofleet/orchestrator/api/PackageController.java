package org.octofleet.orchestrator.api;

import jakarta.servlet.http.HttpServletRequest;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.octofleet.orchestrator.api.dto.ActivePatch;
import org.octofleet.orchestrator.api.dto.PackageDTO;
import org.octofleet.orchestrator.api.dto.PackageRequest;
import org.octofleet.orchestrator.service.audit.AuditService;
import org.octofleet.orchestrator.service.deployment.PackageCatalogService;
import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.*;

import java.util.List;

@RestController
@RequestMapping("/api/v1/packages")
@RequiredArgsConstructor
public class PackageController {
    private final PackageCatalogService catalog;
    private final AuditService audit;

    @GetMapping
    public List<PackageDTO> list() {
        return catalog.list();
    }

    @PostMapping
    @ResponseStatus(HttpStatus.CREATED)
    public PackageDTO create(@Valid @RequestBody PackageRequest body, HttpServletRequest req) {
        var p = catalog.create(body);
        audit.log(req, "package.create", "package", String.valueOf(p.id()), p.name() + " " + p.version());
        return p;
    }

    @PatchMapping("/{id}")
    public PackageDTO setActive(@PathVariable Long id, @Valid @RequestBody ActivePatch body, HttpServletRequest req) {
        var p = catalog.setActive(id, body.active());
        audit.log(req, "package.active", "package", String.valueOf(id), "active=" + body.active());
        return p;
    }
}
