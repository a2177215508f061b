package com.stationery.tracker.controller;

import com.stationery.tracker.model.AuditLog;
import com.stationery.tracker.service.Actor;
import com.stationery.tracker.service.AuditService;
import com.stationery.tracker.service.SettingsService;
import org.springframework.data.domain.Page;
import org.springframework.security.access.prepost.PreAuthorize;
import org.springframework.web.bind.annotation.*;

import java.util.Map;
import java.util.Set;

@RestController
@RequestMapping("/api/admin")
@PreAuthorize("hasRole('ADMIN')")
public class AdminController {

    private static final Set<String> KEYS = Set.of(
            SettingsService.KEY_COMPANY_NAME, SettingsService.KEY_CONTACT_NUMBER, SettingsService.KEY_CURRENCY);

    private final SettingsService settingsService;
    private final AuditService auditService;

    public AdminController(SettingsService settingsService, AuditService auditService) {
        this.settingsService = settingsService;
        this.auditService = auditService;
    }

    @GetMapping("/settings")
    public Map<String, String> settings() {
        return settingsService.getAll();
    }

    @PutMapping("/settings")
    public Map<String, String> saveSettings(@RequestBody Map<String, String> values, Actor actor) {
        // Unknown keys are ignored
        for (Map.Entry<String, String> entry : values.entrySet()) {
            if (KEYS.contains(entry.getKey())) {
                settingsService.updateSetting(entry.getKey(), entry.getValue());
            }
        }
        auditService.log(actor, "UPDATE_SETTINGS", "Settings updated: " + values.keySet());
        return settingsService.getAll();
    }

    @GetMapping("/audit")
    public Page<AuditLog> audit(@RequestParam(defaultValue = "0") int page,
            @RequestParam(defaultValue = "50") int size) {
        return auditService.recent(page, Math.min(size, 200));
    }
}
