package com.oracle.lats.persistence;

import com.oracle.lats.config.PersistenceConfig;
import com.oracle.lats.core.AgentExperience;
import com.oracle.lats.core.ExperienceRepository;
import com.oracle.lats.core.ProblemType;
import com.oracle.lats.core.WinningPathStore;
import com.oracle.lats.search.WinningPathExtractor;
import com.oracle.lats.search.model.WinningPath;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.time.Clock;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Writes each winning path as one JSON line to {@code {timestamp}_{hash}.jsonl} and mirrors it
 * into the experience repository when one is configured.
 */
@Component
@Slf4j
public class JsonlWinningPathStore implements WinningPathStore {

    private static final DateTimeFormatter TIMESTAMP = DateTimeFormatter.ofPattern("yyyyMMdd_HHmmss");

    private final Path directory;
    private final ExperienceRepository experienceRepository;
    private final Clock clock;
    private final WinningPathCodec codec = new WinningPathCodec();

    @Autowired
    public JsonlWinningPathStore(PersistenceConfig persistenceConfig,
                                 ObjectProvider<ExperienceRepository> experienceRepository) {
        this(Path.of(persistenceConfig.getWinningPathDir()), experienceRepository.getIfAvailable(), Clock.systemDefaultZone());
    }

    public JsonlWinningPathStore(Path directory, ExperienceRepository experienceRepository, Clock clock) {
        this.directory = directory;
        this.experienceRepository = experienceRepository;
        this.clock = clock;
    }

    @Override
    public void record(WinningPath winningPath) {
        if (winningPath == null) {
            return;
        }
        writeFile(winningPath);
        mirrorToExperienceStore(winningPath);
    }

    /**
     * @return the file written, or empty when the write failed
     */
    Optional<Path> writeFile(WinningPath winningPath) {
        Path file = directory.resolve(fileName(winningPath.getProblemDescription()));
        try {
            Files.createDirectories(directory);
            String line = codec.toJsonLine(winningPath) + "\n";
            Files.writeString(file, line, StandardCharsets.UTF_8,
                    StandardOpenOption.CREATE, StandardOpenOption.APPEND, StandardOpenOption.WRITE);
            log.info("Winning path saved to file: {}", file);
            return Optional.of(file);
        } catch (IOException e) {
            log.warn("Failed to save winning path to {}: {}", file, e.getMessage());
            return Optional.empty();
        }
    }

    String fileName(String problem) {
        String timestamp = LocalDateTime.now(clock).format(TIMESTAMP);
        int problemHash = Math.floorMod(problem == null ? 0 : problem.hashCode(), 10000);
        return String.format("%s_%04d.jsonl", timestamp, problemHash);
    }

    private void mirrorToExperienceStore(WinningPath winningPath) {
        if (experienceRepository == null) {
            return;
        }
        try {
            experienceRepository.save(toExperience(winningPath));
            log.info("Winning path saved to Experience Store");
        } catch (Exception e) {
            log.warn("Failed to save to Experience Store: {}", e.getMessage());
        }
    }

    static AgentExperience toExperience(WinningPath winningPath) {
        Object passRate = winningPath.getExecutionResult() == null
                ? null
                : winningPath.getExecutionResult().get("test_pass_rate");

        List<String> filePaths = winningPath.getFinalCodeChanges() == null
                ? List.of()
                : new ArrayList<>(winningPath.getFinalCodeChanges().keySet());

        return AgentExperience.builder()
                .problemDescription(winningPath.getProblemDescription())
                .problemType(ProblemType.fromValue(winningPath.getProblemType()))
                .strategyId(winningPath.getFinalStrategyId())
                .strategyType("LATS")
                .filePaths(filePaths)
                .success(WinningPathExtractor.VERDICT_ACCEPT.equals(winningPath.getReflectionVerdict()))
                .totScore(winningPath.getFinalQValue())
                .reflectionVerdict(winningPath.getReflectionVerdict())
                .testPassRate(passRate instanceof Number ? ((Number) passRate).doubleValue() : null)
                .tags(List.of("lats", "iterations_" + winningPath.getTotalIterations()))
                .build();
    }
}
