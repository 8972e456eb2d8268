package com.example.JobCopilot.controller;

import com.example.JobCopilot.model.PageResult;
import com.example.JobCopilot.security.TenantContext;
import com.example.JobCopilot.service.JobSearchIndexService;
import lombok.RequiredArgsConstructor;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequiredArgsConstructor
public class JobSearchController {

    private final JobSearchIndexService jobSearchIndexService;

    /** Job ids ranked by lexical relevance; an empty query returns no jobs. */
    @GetMapping("/jobs/search")
    public PageResult<String> search(TenantContext tenant, @RequestParam(name = "q", required = false) String query) {
        return PageResult.of(jobSearchIndexService.searchJobIds(tenant.tenantId(), query));
    }
}
