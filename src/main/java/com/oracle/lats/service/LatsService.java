package com.oracle.lats.service;

import com.oracle.lats.config.LatsConfig;
import com.oracle.lats.config.PersistenceConfig;
import com.oracle.lats.core.AgentExperience;
import com.oracle.lats.core.CodeStrategy;
import com.oracle.lats.core.ExperienceRepository;
import com.oracle.lats.core.LatsExecutor;
import com.oracle.lats.core.ProblemType;
import com.oracle.lats.core.SearchEventListener;
import com.oracle.lats.core.StrategyScorer;
import com.oracle.lats.core.WinningPathStore;
import com.oracle.lats.model.LatsRequest;
import com.oracle.lats.model.LatsResponse;
import com.oracle.lats.model.SearchEventView;
import com.oracle.lats.persistence.TreeSnapshotWriter;
import com.oracle.lats.search.CancellationToken;
import com.oracle.lats.search.SearchEngine;
import com.oracle.lats.search.model.LatsEvent;
import com.oracle.lats.search.model.MctsConfig;
import com.oracle.lats.search.model.SearchResult;
import com.oracle.lats.search.model.WinningPath;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Runs one search per request. Each run gets its own engine and tree; running searches are
 * registered by id so another request can cancel them.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class LatsService {

    static final String PAST_SUCCESSES_KEY = "past_successes";
    static final int MAX_PAST_SUCCESSES = 3;

    private final LatsExecutor executor;
    private final StrategyScorer scorer;
    private final LatsConfig latsConfig;
    private final PersistenceConfig persistenceConfig;
    private final ObjectProvider<SearchEventListener> listeners;
    private final ObjectProvider<WinningPathStore> winningPathStore;
    private final ObjectProvider<TreeSnapshotWriter> treeSnapshotWriter;
    private final ExperienceRepository experienceRepository;

    private final Map<String, CancellationToken> running = new ConcurrentHashMap<>();

    public LatsResponse search(LatsRequest request) {
        long startTime = System.currentTimeMillis();
        String searchId = request.getSearchId() != null ? request.getSearchId() : UUID.randomUUID().toString();
        log.info("Processing LATS request {}: {}", searchId, request.getProblem());

        CancellationToken token = new CancellationToken();
        if (running.putIfAbsent(searchId, token) != null) {
            throw new IllegalStateException("Search " + searchId + " is already running");
        }

        List<LatsEvent> recorded = Collections.synchronizedList(new ArrayList<>());
        List<SearchEventListener> searchListeners = new ArrayList<>(listeners.orderedStream().toList());
        if (Boolean.TRUE.equals(request.getVerbose())) {
            searchListeners.add(recorded::add);
        }

        try {
            SearchEngine engine = SearchEngine.builder()
                    .executor(executor)
                    .scorer(scorer)
                    .config(toMctsConfig(request))
                    .listeners(searchListeners)
                    .winningPathStore(winningPathStore.getIfAvailable())
                    .treeSnapshotWriter(treeSnapshotWriter.getIfAvailable())
                    .build();

            SearchResult result = engine.search(request.getProblem(), buildContext(request), token);
            return toResponse(searchId, request, result, recorded, System.currentTimeMillis() - startTime);
        } finally {
            running.remove(searchId);
        }
    }

    /**
     * @return false when no search with that id is running
     */
    public boolean cancel(String searchId) {
        CancellationToken token = running.get(searchId);
        if (token == null) {
            return false;
        }
        log.info("Cancelling LATS search {}", searchId);
        token.cancel();
        return true;
    }

    MctsConfig toMctsConfig(LatsRequest request) {
        MctsConfig base = latsConfig.toMctsConfig();
        return base.toBuilder()
                .maxIterations(request.getMaxIterations() != null ?
                        request.getMaxIterations() : base.getMaxIterations())
                .maxDepth(request.getMaxDepth() != null ?
                        request.getMaxDepth() : base.getMaxDepth())
                .strategiesPerExpansion(request.getMaxBranching() != null ?
                        request.getMaxBranching() : base.getStrategiesPerExpansion())
                .earlyStopThreshold(request.getEarlyStopThreshold() != null ?
                        request.getEarlyStopThreshold() : base.getEarlyStopThreshold())
                .saveWinningPaths(persistenceConfig.isSaveWinningPaths())
                .build();
    }

    Map<String, Object> buildContext(LatsRequest request) {
        Map<String, Object> context = new HashMap<>();
        if (request.getContext() != null) {
            context.putAll(request.getContext());
        }
        if (request.getProblemType() != null) {
            context.put(SearchEngine.PROBLEM_TYPE_KEY, request.getProblemType());
            String pastSuccesses = describePastSuccesses(ProblemType.fromValue(request.getProblemType()));
            if (!pastSuccesses.isEmpty()) {
                context.put(PAST_SUCCESSES_KEY, pastSuccesses);
            }
        }
        return context;
    }

    /**
     * Most recent accepted solutions of the same problem type, newest first; empty when there are none.
     */
    private String describePastSuccesses(ProblemType problemType) {
        List<AgentExperience> past;
        try {
            past = experienceRepository.findByProblemType(problemType);
        } catch (Exception e) {
            log.warn("Failed to read Experience Store: {}", e.getMessage());
            return "";
        }
        List<String> lines = new ArrayList<>();
        for (int i = past.size() - 1; i >= 0 && lines.size() < MAX_PAST_SUCCESSES; i--) {
            AgentExperience experience = past.get(i);
            if (!experience.isSuccess()) {
                continue;
            }
            lines.add(String.format("%s (score %.2f, files: %s)",
                    experience.getProblemDescription(), experience.getTotScore(),
                    String.join(", ", experience.getFilePaths())));
        }
        return String.join("; ", lines);
    }

    private static LatsResponse toResponse(String searchId, LatsRequest request, SearchResult result,
                                           List<LatsEvent> recorded, long elapsedMs) {
        CodeStrategy best = result.getAllStrategies().stream()
                .filter(s -> s.getStrategyId().equals(result.getBestStrategyId()))
                .findFirst()
                .orElse(null);

        List<SearchEventView> events;
        synchronized (recorded) {
            events = recorded.stream().map(SearchEventView::from).toList();
        }

        return LatsResponse.builder()
                .searchId(searchId)
                .problem(request.getProblem())
                .bestStrategy(best)
                .bestScore(result.getBestScore())
                .scores(result.getScores())
                .totalGenerated(result.getTotalGenerated())
                .totalExecuted(result.getTotalExecuted())
                .totalPassed(result.getTotalPassed())
                .terminationState(result.getTerminationState().name())
                .winningThoughts(result.winningPath()
                        .map(WinningPath::getThoughtSequence)
                        .orElse(List.of()))
                .metrics(result.getMetrics().toMap())
                .events(events)
                .processingTimeMs(elapsedMs)
                .build();
    }
}
