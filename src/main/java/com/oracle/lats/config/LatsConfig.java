package com.oracle.lats.config;

import com.oracle.lats.search.model.MctsConfig;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

import java.util.LinkedHashMap;
import java.util.Map;

@Configuration
@ConfigurationProperties(prefix = "lats")
@Data
public class LatsConfig {

    /**
     * Upper bound on MCTS iterations per search
     */
    private int maxIterations = 100;

    /**
     * Depth of the thought tree; strategies are generated one level above it
     */
    private int maxDepth = 5;

    /**
     * UCB1 exploration constant
     */
    private double explorationConstant = 1.4;

    /**
     * Thoughts requested per expansion
     */
    private int strategiesPerExpansion = 3;

    private double thoughtEvalThreshold = 0.5;

    /**
     * Stop as soon as a leaf reaches this Q-value
     */
    private double earlyStopThreshold = 0.9;

    private boolean enableEarlyGiveup = true;

    private int earlyGiveupIterations = 20;

    private double earlyGiveupThreshold = 0.3;

    private boolean enableBudgetLimit = true;

    private long maxTotalTokens = 50_000;

    private double maxCostUsd = 5.0;

    private double costPer1kTokens = 0.01;

    private Long seed;

    private double temperatureExpansion = 0.8;

    private double temperatureEvaluation = 0.2;

    private double temperatureSimulation = 0.0;

    private double temperatureFinal = 0.3;

    private String generatorModel = "gpt-4o";

    private String verifierModel = "gpt-4o-mini";

    private boolean enableCrossModel = false;

    private boolean enableReflexion = true;

    /**
     * Score at which a strategy counts as passed
     */
    private double passThreshold = 0.6;

    public MctsConfig toMctsConfig() {
        return MctsConfig.builder()
                .maxIterations(maxIterations)
                .maxDepth(maxDepth)
                .explorationConstant(explorationConstant)
                .strategiesPerExpansion(strategiesPerExpansion)
                .thoughtEvalThreshold(thoughtEvalThreshold)
                .earlyStopThreshold(earlyStopThreshold)
                .enableEarlyGiveup(enableEarlyGiveup)
                .earlyGiveupIterations(earlyGiveupIterations)
                .earlyGiveupThreshold(earlyGiveupThreshold)
                .enableBudgetLimit(enableBudgetLimit)
                .maxTotalTokens(maxTotalTokens)
                .maxCostUsd(maxCostUsd)
                .costPer1kTokens(costPer1kTokens)
                .seed(seed)
                .llmModel(generatorModel)
                .modelSettings(modelSettings())
                .enableReflexion(enableReflexion)
                .passThreshold(passThreshold)
                .build();
    }

    /**
     * Settings the chat adapters read from here, in the form recorded next to a winning path.
     */
    public Map<String, Object> modelSettings() {
        Map<String, Object> settings = new LinkedHashMap<>();
        settings.put("generator_model", generatorModel);
        settings.put("verifier_model", verifierModel);
        settings.put("enable_cross_model", enableCrossModel);
        settings.put("temperature_expansion", temperatureExpansion);
        settings.put("temperature_evaluation", temperatureEvaluation);
        settings.put("temperature_simulation", temperatureSimulation);
        settings.put("temperature_final", temperatureFinal);
        return settings;
    }
}
