package com.oracle.lats.persistence;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.oracle.lats.config.PersistenceConfig;
import com.oracle.lats.search.TreeWalker;
import com.oracle.lats.search.model.SearchMetrics;
import com.oracle.lats.search.model.ThoughtNode;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.IdentityHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Dumps a finished tree as indented JSON for offline inspection.
 */
@Component
@Slf4j
public class TreeSnapshotWriter {

    private static final int THOUGHT_PREVIEW_CHARS = 50;

    private final Path directory;
    private final ObjectMapper objectMapper = new ObjectMapper().enable(SerializationFeature.INDENT_OUTPUT);

    @Autowired
    public TreeSnapshotWriter(PersistenceConfig persistenceConfig) {
        this(Path.of(persistenceConfig.getTreeSnapshotDir()));
    }

    public TreeSnapshotWriter(Path directory) {
        this.directory = directory;
    }

    public Optional<Path> write(ThoughtNode root, SearchMetrics metrics, String runId) {
        Path file = directory.resolve("lats_tree_" + runId + ".json");
        try {
            Files.createDirectories(directory);
            objectMapper.writeValue(file.toFile(), toJson(root, metrics));
            log.info("Tree dumped to {}", file);
            return Optional.of(file);
        } catch (IOException e) {
            log.warn("Failed to dump tree to {}: {}", file, e.getMessage());
            return Optional.empty();
        }
    }

    ObjectNode toJson(ThoughtNode root, SearchMetrics metrics) {
        ObjectNode snapshot = objectMapper.createObjectNode();
        snapshot.put("problem", abbreviate(root.getPartialThought(), 100));
        snapshot.put("total_nodes", TreeWalker.countNodes(root));
        snapshot.put("max_depth", TreeWalker.maxDepth(root));
        snapshot.set("metrics", objectMapper.valueToTree(metrics.toMap()));

        // iterative build: parent json nodes are created before their children are visited
        Map<ThoughtNode, ObjectNode> built = new IdentityHashMap<>();
        Deque<ThoughtNode> queue = new ArrayDeque<>();
        queue.add(root);
        while (!queue.isEmpty()) {
            ThoughtNode node = queue.poll();
            ObjectNode json = describe(node);
            built.put(node, json);
            if (node.getParent() != null) {
                ((ArrayNode) built.get(node.getParent()).get("children")).add(json);
            }
            queue.addAll(node.getChildren());
        }
        snapshot.set("tree", built.get(root));
        return snapshot;
    }

    private ObjectNode describe(ThoughtNode node) {
        ObjectNode json = objectMapper.createObjectNode();
        json.put("id", node.getId());
        json.put("thought", abbreviate(node.getPartialThought(), THOUGHT_PREVIEW_CHARS));
        json.put("q_value", Math.round(node.getQValue() * 1000) / 1000.0);
        json.put("visit_count", node.getVisitCount());
        json.put("thought_score", Math.round(node.getThoughtScore() * 1000) / 1000.0);
        json.put("is_promising", node.isPromising());
        json.put("is_terminal", node.isTerminal());
        json.put("depth", node.getDepth());
        if (node.hasCompletedStrategy()) {
            json.put("strategy_id", node.getCompletedStrategy().getStrategyId());
        }
        if (!node.getRejectedReasons().isEmpty()) {
            ArrayNode reasons = json.putArray("rejected_reasons");
            node.getRejectedReasons().forEach(reasons::add);
        }
        json.putArray("children");
        return json;
    }

    private static String abbreviate(String s, int maxLen) {
        if (s == null) return "";
        return s.length() <= maxLen ? s : s.substring(0, maxLen) + "...";
    }
}
