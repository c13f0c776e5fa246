package org.octofleet.orchestrator.api;

import jakarta.servlet.http.HttpServletRequest;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.octofleet.orchestrator.api.dto.ActiveWindowsDTO;
import org.octofleet.orchestrator.api.dto.MaintenanceWindowDTO;
import org.octofleet.orchestrator.api.dto.MaintenanceWindowRequest;
import org.octofleet.orchestrator.service.audit.AuditService;
import org.octofleet.orchestrator.service.deployment.MaintenanceWindowService;
import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.*;

import java.util.List;

@RestController
@RequestMapping("/api/v1/maintenance-windows")
@RequiredArgsConstructor
public class MaintenanceWindowController {
    private final MaintenanceWindowService windows;
    private final AuditService audit;

    @GetMapping
    public List<MaintenanceWindowDTO> list() {
        return windows.list();
    }

    @PostMapping
    @ResponseStatus(HttpStatus.CREATED)
    public MaintenanceWindowDTO create(@Valid @RequestBody MaintenanceWindowRequest body, HttpServletRequest req) {
        var w = windows.create(body);
        audit.log(req, "window.create", "maintenance_window", String.valueOf(w.id()), w.name());
        return w;
    }

    @DeleteMapping("/{id}")
    @ResponseStatus(HttpStatus.NO_CONTENT)
    public void delete(@PathVariable Long id, HttpServletRequest req) {
        windows.delete(id);
        audit.log(req, "window.delete", "maintenance_window", String.valueOf(id), null);
    }

    /** Windows open right now, optionally restricted to those applying to one node. */
    @GetMapping("/active")
    public ActiveWindowsDTO active(@RequestParam(value = "node_id", required = false) String nodeId) {
        return windows.active(nodeId);
    }
}
