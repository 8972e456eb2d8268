package com.example.JobCopilot.controller;

import com.example.JobCopilot.model.JwksProbe;
import com.example.JobCopilot.security.AdminTokenVerifier;
import com.example.JobCopilot.security.JwksProbeService;
import lombok.RequiredArgsConstructor;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/debug")
@RequiredArgsConstructor
public class DebugController {

    static final String ADMIN_TOKEN_HEADER = "x-admin-token";

    private final AdminTokenVerifier adminTokenVerifier;
    private final JwksProbeService jwksProbeService;

    @GetMapping("/jwks")
    public JwksProbe jwks(@RequestHeader(value = ADMIN_TOKEN_HEADER, required = false) String adminToken) {
        adminTokenVerifier.verify(adminToken);
        return jwksProbeService.probe();
    }
}
