package com.example.JobCopilot.service;

import com.example.JobCopilot.model.PromptMessage;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

@Component
public class PromptBuilder {

    /**
     * Messages in the order the model receives them:
     * system prompt, structured context with evidence, prior turns, then the question.
     */
    public List<PromptMessage> build(String version,
                                     String snapshotJson,
                                     String evidenceText,
                                     List<PromptMessage> history,
                                     String userMessage) {
        List<PromptMessage> messages = new ArrayList<>();
        messages.add(PromptMessage.system(PromptTemplates.systemPrompt(version)));
        messages.add(PromptMessage.system("Structured context:\n" + snapshotJson
                + "\n\nEvidence (labeled sections):\n" + evidenceText));
        if (history != null) {
            messages.addAll(history);
        }
        messages.add(PromptMessage.user(userMessage));
        return messages;
    }
}
