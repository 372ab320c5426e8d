package org.agentmarket.simulator.config;

import jakarta.annotation.PostConstruct;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Configuration;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Comparator;
import java.util.List;
import java.util.stream.Stream;

/**
 * Prunes old per-session simulator log files on startup, keeping only the most recent ones.
 */
@Slf4j
@Configuration
@RequiredArgsConstructor
public class LogCleanupConfig {

    static final String LOG_FILE_PREFIX = "simulator_";
    static final String LOG_FILE_SUFFIX = ".log";

    private final SimulatorProperties properties;

    @PostConstruct
    public void cleanupOldLogs() {
        Path logsPath = Paths.get(properties.getLogging().getDirectory());
        int keep = properties.getLogging().getMaxSessionFiles();

        if (!Files.exists(logsPath)) {
            log.debug("Logs directory does not exist yet: {}", logsPath.toAbsolutePath());
            return;
        }

        try (Stream<Path> logFiles = Files.list(logsPath)) {
            List<Path> sessionLogs = logFiles
                    .filter(Files::isRegularFile)
                    .filter(p -> p.getFileName().toString().startsWith(LOG_FILE_PREFIX))
                    .filter(p -> p.getFileName().toString().endsWith(LOG_FILE_SUFFIX))
                    .sorted(Comparator.comparingLong(this::getFileLastModified).reversed())
                    .toList();

            if (sessionLogs.size() <= keep) {
                log.debug("Session log files count ({}) is within limit ({})", sessionLogs.size(), keep);
                return;
            }

            log.info("Found {} session log files, removing {} oldest (keeping {})",
                    sessionLogs.size(), sessionLogs.size() - keep, keep);
            for (Path oldLog : sessionLogs.subList(keep, sessionLogs.size())) {
                try {
                    Files.delete(oldLog);
                    log.debug("Deleted old log file: {}", oldLog.getFileName());
                } catch (IOException e) {
                    log.warn("Failed to delete old log file: {} - {}", oldLog.getFileName(), e.getMessage());
                }
            }
        } catch (IOException e) {
            log.warn("Failed to cleanup old log files: {}", e.getMessage());
        }
    }

    private long getFileLastModified(Path path) {
        try {
            return Files.getLastModifiedTime(path).toMillis();
        } catch (IOException e) {
            return 0L;
        }
    }
}
