package com.oracle.lats.core.impl;

import com.oracle.lats.config.SandboxConfig;
import com.oracle.lats.core.CodeStrategy;
import com.oracle.lats.core.ExecutionResult;
import com.oracle.lats.core.LatsExecutionException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.stream.Stream;

/**
 * Writes a strategy's files into a scratch directory and runs the configured test command there.
 */
@Component
@Slf4j
public class ProcessSandbox {

    private static final Pattern PYTEST_PASSED = Pattern.compile("(\\d+) passed");
    private static final Pattern PYTEST_FAILED = Pattern.compile("(\\d+) (?:failed|error)");
    private static final Pattern JUNIT_SUMMARY =
            Pattern.compile("Tests run: (\\d+), Failures: (\\d+), Errors: (\\d+)");

    private final SandboxConfig config;
    private final ExecutorService executor = Executors.newCachedThreadPool(r -> {
        Thread t = new Thread(r, "lats-sandbox-io");
        t.setDaemon(true);
        return t;
    });

    public ProcessSandbox(SandboxConfig config) {
        this.config = config;
    }

    public ExecutionResult execute(CodeStrategy strategy) {
        long start = System.currentTimeMillis();
        Path workDir;
        try {
            workDir = Files.createTempDirectory("lats_sandbox_");
        } catch (IOException e) {
            throw new LatsExecutionException("Failed to create sandbox directory", e);
        }
        log.debug("Executing strategy {} in {}", strategy.getStrategyId(), workDir);

        try {
            writeFiles(workDir, strategy.getFileChanges());
            return run(workDir, start);
        } finally {
            if (!config.isKeepWorkspace()) {
                deleteQuietly(workDir);
            }
        }
    }

    void writeFiles(Path workDir, Map<String, String> fileChanges) {
        long maxBytes = config.getMaxFileSizeKb() * 1024L;
        for (Map.Entry<String, String> change : fileChanges.entrySet()) {
            Path target = resolveInside(workDir, change.getKey());
            byte[] content = change.getValue() == null
                    ? new byte[0]
                    : change.getValue().getBytes(StandardCharsets.UTF_8);
            if (content.length > maxBytes) {
                throw new LatsExecutionException("File " + change.getKey() + " exceeds "
                        + config.getMaxFileSizeKb() + " KB");
            }
            try {
                if (target.getParent() != null) {
                    Files.createDirectories(target.getParent());
                }
                Files.write(target, content);
            } catch (IOException e) {
                throw new LatsExecutionException("Failed to write " + change.getKey(), e);
            }
        }
    }

    static Path resolveInside(Path workDir, String relative) {
        if (relative == null || relative.isBlank()) {
            throw new LatsExecutionException("Empty file path in strategy");
        }
        Path candidate = Path.of(relative);
        if (candidate.isAbsolute()) {
            throw new LatsExecutionException("Absolute path not allowed: " + relative);
        }
        Path resolved = workDir.resolve(candidate).normalize();
        if (!resolved.startsWith(workDir)) {
            throw new LatsExecutionException("Path escapes sandbox: " + relative);
        }
        return resolved;
    }

    private ExecutionResult run(Path workDir, long start) {
        List<String> command = config.getCommand();
        Process process;
        try {
            ProcessBuilder pb = new ProcessBuilder(command);
            pb.directory(workDir.toFile());
            pb.redirectErrorStream(false);
            process = pb.start();
        } catch (IOException e) {
            throw new LatsExecutionException("Failed to start " + String.join(" ", command), e);
        }

        Future<String> outputFuture = executor.submit(() ->
                new String(process.getInputStream().readAllBytes(), StandardCharsets.UTF_8));
        Future<String> errorFuture = executor.submit(() ->
                new String(process.getErrorStream().readAllBytes(), StandardCharsets.UTF_8));

        try {
            boolean finished = process.waitFor(config.getMaxExecutionTimeSeconds(), TimeUnit.SECONDS);
            if (!finished) {
                process.destroyForcibly();
                throw new LatsExecutionException("Execution timeout ("
                        + config.getMaxExecutionTimeSeconds() + "s)");
            }
            String stdout = outputFuture.get(1, TimeUnit.SECONDS);
            String stderr = errorFuture.get(1, TimeUnit.SECONDS);
            int exitCode = process.exitValue();
            int[] counts = parseTestCounts(stdout + "\n" + stderr);

            return ExecutionResult.builder()
                    .success(exitCode == 0)
                    .exitCode(exitCode)
                    .stdout(stdout)
                    .stderr(stderr)
                    .testsPassed(counts[0])
                    .testsFailed(counts[1])
                    .executionTimeMs(System.currentTimeMillis() - start)
                    .build();
        } catch (InterruptedException e) {
            process.destroyForcibly();
            Thread.currentThread().interrupt();
            throw new LatsExecutionException("Sandbox execution interrupted", e);
        } catch (LatsExecutionException e) {
            throw e;
        } catch (Exception e) {
            throw new LatsExecutionException("Failed to collect sandbox output: " + e.getMessage(), e);
        }
    }

    /**
     * @return {passed, failed} parsed from pytest or surefire style summaries
     */
    static int[] parseTestCounts(String output) {
        if (output == null) {
            return new int[]{0, 0};
        }
        Matcher junit = JUNIT_SUMMARY.matcher(output);
        int run = -1;
        int failed = 0;
        while (junit.find()) {
            // last summary line is the aggregate
            run = Integer.parseInt(junit.group(1));
            failed = Integer.parseInt(junit.group(2)) + Integer.parseInt(junit.group(3));
        }
        if (run >= 0) {
            return new int[]{Math.max(0, run - failed), failed};
        }

        int passed = 0;
        Matcher p = PYTEST_PASSED.matcher(output);
        while (p.find()) {
            passed = Integer.parseInt(p.group(1));
        }
        int pyFailed = 0;
        Matcher f = PYTEST_FAILED.matcher(output);
        while (f.find()) {
            pyFailed += Integer.parseInt(f.group(1));
        }
        return new int[]{passed, pyFailed};
    }

    private static void deleteQuietly(Path dir) {
        try (Stream<Path> walk = Files.walk(dir)) {
            walk.sorted(Comparator.reverseOrder()).forEach(path -> {
                try {
                    Files.deleteIfExists(path);
                } catch (IOException e) {
                    log.warn("Failed to delete {}: {}", path, e.getMessage());
                }
            });
        } catch (IOException e) {
            log.warn("Failed to clean sandbox {}: {}", dir, e.getMessage());
        }
    }
}
