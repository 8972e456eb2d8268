package com.example.JobCopilot.repository;

import com.example.JobCopilot.model.CopilotMessage;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

@Repository
public interface CopilotMessageRepository extends JpaRepository<CopilotMessage, String> {
}
