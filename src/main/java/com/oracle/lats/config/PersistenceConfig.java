package com.oracle.lats.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

@Configuration
@ConfigurationProperties(prefix = "lats.persistence")
@Data
public class PersistenceConfig {

    /**
     * Append the best trace of each successful run to a JSONL file
     */
    private boolean saveWinningPaths = true;

    /**
     * Directory for winning path files
     */
    private String winningPathDir = "data/lats/winning_paths";

    /**
     * Directory for debug tree snapshots (written only with debug logging)
     */
    private String treeSnapshotDir = "data/lats/trees";
}
