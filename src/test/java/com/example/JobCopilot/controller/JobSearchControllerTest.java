package com.example.JobCopilot.controller;

import com.example.JobCopilot.service.JobSearchIndexService;
import com.example.JobCopilot.support.ControllerTestSupport;
import org.junit.jupiter.api.Test;
import org.springframework.test.web.servlet.MockMvc;

import java.util.List;

import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

class JobSearchControllerTest {

    @Test
    void searchReturnsRankedJobIds() throws Exception {
        JobSearchIndexService service = mock(JobSearchIndexService.class);
        when(service.searchJobIds("tenant_a", "oak street")).thenReturn(List.of("job_2", "job_1"));
        MockMvc mockMvc = ControllerTestSupport.mockMvc(new JobSearchController(service));

        mockMvc.perform(get("/jobs/search").param("q", "oak street").header("x-tenant-id", "tenant_a"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.items[0]").value("job_2"))
                .andExpect(jsonPath("$.items[1]").value("job_1"))
                .andExpect(jsonPath("$.total").value(2));
    }
}
