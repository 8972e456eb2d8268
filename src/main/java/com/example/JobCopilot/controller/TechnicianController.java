package com.example.JobCopilot.controller;

import com.example.JobCopilot.model.Technician;
import com.example.JobCopilot.model.TechnicianCreateRequest;
import com.example.JobCopilot.model.TechnicianList;
import com.example.JobCopilot.security.TenantContext;
import com.example.JobCopilot.service.TechnicianService;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.ResponseStatus;
import org.springframework.web.bind.annotation.RestController;

import java.util.Map;

@RestController
@RequestMapping("/technicians")
@RequiredArgsConstructor
public class TechnicianController {

    private final TechnicianService technicianService;

    @GetMapping
    public TechnicianList list(TenantContext tenant,
                               @RequestParam(required = false) String search,
                               @RequestParam(required = false) String role) {
        return technicianService.listTechnicians(tenant.tenantId(), search, role);
    }

    @GetMapping("/{technicianId}")
    public Technician get(TenantContext tenant, @PathVariable String technicianId) {
        return technicianService.getTechnician(tenant.tenantId(), technicianId);
    }

    @PostMapping
    @ResponseStatus(HttpStatus.CREATED)
    public Map<String, String> create(TenantContext tenant, @RequestBody(required = false) TechnicianCreateRequest request) {
        return Map.of("id", technicianService.createTechnician(tenant.tenantId(), request));
    }
}
