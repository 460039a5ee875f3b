package com.oracle.lats.model;

import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Pattern;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.HashMap;
import java.util.Map;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class LatsRequest {

    @NotBlank(message = "Problem statement cannot be blank")
    private String problem;

    @Builder.Default
    private Map<String, Object> context = new HashMap<>();

    private String problemType; // bug_fix, feature, refactor, ...

    /**
     * Caller-chosen id used to cancel the run; generated when absent
     */
    @Pattern(regexp = "[A-Za-z0-9_-]{1,64}", message = "Search id may only contain letters, digits, '_' and '-'")
    private String searchId;

    @Min(value = 1, message = "Max iterations must be at least 1")
    @Max(value = 500, message = "Max iterations cannot exceed 500")
    private Integer maxIterations;

    @Min(value = 1, message = "Max depth must be at least 1")
    @Max(value = 10, message = "Max depth cannot exceed 10")
    private Integer maxDepth;

    @Min(value = 1, message = "Max branching must be at least 1")
    @Max(value = 10, message = "Max branching cannot exceed 10")
    private Integer maxBranching;

    @DecimalMin(value = "0.0", message = "Early stop threshold must be within [0, 1]")
    @DecimalMax(value = "1.0", message = "Early stop threshold must be within [0, 1]")
    private Double earlyStopThreshold;

    @Builder.Default
    private Boolean verbose = false;
}
