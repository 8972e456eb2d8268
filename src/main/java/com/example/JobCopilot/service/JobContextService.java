package com.example.JobCopilot.service;

import com.example.JobCopilot.config.CopilotProperties;
import com.example.JobCopilot.exception.JobNotFoundException;
import com.example.JobCopilot.model.JobContextRow;
import com.example.JobCopilot.model.JobContextSnapshot;
import com.example.JobCopilot.repository.EquipmentRepository;
import com.example.JobCopilot.repository.JobEventRepository;
import com.example.JobCopilot.repository.JobRepository;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;

import java.time.Instant;

@Service
@RequiredArgsConstructor
public class JobContextService {

    private final JobRepository jobRepository;
    private final EquipmentRepository equipmentRepository;
    private final JobEventRepository jobEventRepository;
    private final CopilotProperties properties;

    /**
     * Job with its assignee, client and property from one joined read, plus the property's
     * equipment and the most recent events, all inside the caller's tenant.
     *
     * @throws JobNotFoundException when the job does not exist in the tenant
     */
    public JobContextSnapshot getJobContextSnapshot(String tenantId, String jobId) {
        JobContextRow row = jobRepository.findContext(tenantId, jobId)
                .orElseThrow(() -> new JobNotFoundException(tenantId, jobId));

        return new JobContextSnapshot(
                row.job(),
                row.client(),
                row.property(),
                equipmentRepository.findByProperty(tenantId, row.property().id()),
                jobEventRepository.findRecentByJob(tenantId, jobId, properties.getRetrieval().getRecentEventLimit()),
                Instant.now());
    }

    /** @throws JobNotFoundException when the job does not exist in the tenant */
    public void requireJob(String tenantId, String jobId) {
        if (!jobRepository.exists(tenantId, jobId)) {
            throw new JobNotFoundException(tenantId, jobId);
        }
    }
}
