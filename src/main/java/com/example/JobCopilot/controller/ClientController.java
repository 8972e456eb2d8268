package com.example.JobCopilot.controller;

import com.example.JobCopilot.model.ClientSummary;
import com.example.JobCopilot.model.PageResult;
import com.example.JobCopilot.security.TenantContext;
import com.example.JobCopilot.service.ClientService;
import lombok.RequiredArgsConstructor;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/clients")
@RequiredArgsConstructor
public class ClientController {

    private final ClientService clientService;

    @GetMapping
    public PageResult<ClientSummary> list(TenantContext tenant,
                                          @RequestParam(required = false) String search,
                                          @RequestParam(required = false) String city,
                                          @RequestParam(required = false) String state) {
        return clientService.listClients(tenant.tenantId(), search, city, state);
    }

    @GetMapping("/{clientId}")
    public ClientSummary get(TenantContext tenant, @PathVariable String clientId) {
        return clientService.getClient(tenant.tenantId(), clientId);
    }
}
