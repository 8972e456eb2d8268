package com.example.JobCopilot;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

@SpringBootApplication
@ConfigurationPropertiesScan
public class JobCopilotApplication {

    public static void main(String[] args) {
        SpringApplication.run(JobCopilotApplication.class, args);
    }
}
