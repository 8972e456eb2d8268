package com.example.JobCopilot.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;

@Data
@ConfigurationProperties(prefix = "copilot")
public class CopilotProperties {

    private Model model = new Model();
    private Retrieval retrieval = new Retrieval();
    private Prompt prompt = new Prompt();
    private Vector vector = new Vector();
    private Access access = new Access();

    @Data
    public static class Model {
        /** Name of the ChatClient bean prefix: "openai" or "deepseek". */
        private String provider = "openai";
        private String name = "gpt-4o";
        private double temperature = 0.2;
        private double topP = 1.0;
        private int maxTokens = 800;
        private boolean jsonMode = true;
        private String apiKey = "";
    }

    @Data
    public static class Retrieval {
        private int topK = 6;
        private int fallbackTopK = 10;
        private int debugTopK = 3;
        private int evidenceLimit = 6;
        private int historyLimit = 25;
        private int recentEventLimit = 3;
        /** Max job ids returned by one lexical job search. */
        private int searchLimit = 50;
    }

    @Data
    public static class Prompt {
        private String version = "copilot.v1";
    }

    @Data
    public static class Vector {
        private boolean enabled = false;
        private String adminToken = "";
        private int reindexLimit = 50;
    }

    @Data
    public static class Access {
        private boolean enabled = false;
        private String jwksUrl = "";
        private String issuer = "";
        private String audience = "";
        /** Zero keeps a loaded key set for the lifetime of the process. */
        private Duration jwksCacheTtl = Duration.ofHours(1);
    }
}
