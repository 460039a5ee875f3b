package com.oracle.lats.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

import java.util.List;

@Configuration
@ConfigurationProperties(prefix = "lats.sandbox")
@Data
public class SandboxConfig {

    /**
     * Command run inside the scratch directory after the strategy's files are written
     */
    private List<String> command = List.of("python3", "-m", "pytest", "-q");

    private int maxExecutionTimeSeconds = 60;

    /**
     * Largest single file a strategy may write
     */
    private int maxFileSizeKb = 512;

    /**
     * Leave the scratch directory behind for debugging
     */
    private boolean keepWorkspace = false;
}
