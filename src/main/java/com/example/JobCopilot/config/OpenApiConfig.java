package com.example.JobCopilot.config;

import io.swagger.v3.oas.annotations.OpenAPIDefinition;
import io.swagger.v3.oas.annotations.info.Info;
import org.springframework.context.annotation.Configuration;

@Configuration
@OpenAPIDefinition(
        info = @Info(
                title = "Job Copilot API",
                version = "v1",
                description = "Tenant-scoped job context, ingestion and AI answers for field technicians"
        )
)
public class OpenApiConfig {
}
