package com.example.JobCopilot.controller;

import com.example.JobCopilot.config.CopilotProperties;
import com.example.JobCopilot.model.JwksProbe;
import com.example.JobCopilot.security.AdminTokenVerifier;
import com.example.JobCopilot.security.JwksProbeService;
import com.example.JobCopilot.support.ControllerTestSupport;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.test.web.servlet.MockMvc;

import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

class DebugControllerTest {

    private JwksProbeService probeService;
    private MockMvc mockMvc;

    @BeforeEach
    void setUp() {
        CopilotProperties properties = new CopilotProperties();
        properties.getVector().setAdminToken("admin-1");
        probeService = mock(JwksProbeService.class);
        mockMvc = ControllerTestSupport.mockMvc(new DebugController(new AdminTokenVerifier(properties), probeService));
    }

    @Test
    void probeNeedsNoTenantButNeedsAdminToken() throws Exception {
        when(probeService.probe()).thenReturn(
                new JwksProbe("https://team.example.com/certs", 200, "application/json", "{\"keys\":[]}"));

        mockMvc.perform(get("/debug/jwks").header("x-admin-token", "admin-1"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.status").value(200))
                .andExpect(jsonPath("$.contentType").value("application/json"));
    }

    @Test
    void probeWithoutAdminTokenIsUnauthorized() throws Exception {
        mockMvc.perform(get("/debug/jwks"))
                .andExpect(status().isUnauthorized());

        verifyNoInteractions(probeService);
    }
}
