package com.oracle.lats.model;

import com.oracle.lats.core.CodeStrategy;
import com.oracle.lats.search.model.StrategyScore;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class LatsResponse {

    private String searchId;

    private String problem;

    private CodeStrategy bestStrategy;

    private Double bestScore;

    @Builder.Default
    private Map<String, StrategyScore> scores = new LinkedHashMap<>();

    private Integer totalGenerated;

    private Integer totalExecuted;

    private Integer totalPassed;

    private String terminationState;

    @Builder.Default
    private List<String> winningThoughts = new ArrayList<>();

    @Builder.Default
    private Map<String, Object> metrics = new LinkedHashMap<>();

    /**
     * Only filled for verbose requests
     */
    @Builder.Default
    private List<SearchEventView> events = new ArrayList<>();

    private Long processingTimeMs;

    private String error;

    @Builder.Default
    private LocalDateTime timestamp = LocalDateTime.now();
}
