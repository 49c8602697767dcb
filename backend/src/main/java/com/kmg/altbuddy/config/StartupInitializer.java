package com.kmg.altbuddy.config;

import com.kmg.altbuddy.service.ProgressChannel;
import com.kmg.altbuddy.service.SessionRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;

@Component
public class StartupInitializer implements ApplicationRunner {
    private static final Logger log = LoggerFactory.getLogger(StartupInitializer.class);

    private final AltBuddyProperties properties;
    private final ProgressChannel progressChannel;
    private final SessionRegistry sessionRegistry;

    public StartupInitializer(
            AltBuddyProperties properties,
            ProgressChannel progressChannel,
            SessionRegistry sessionRegistry
    ) {
        this.properties = properties;
        this.progressChannel = progressChannel;
        this.sessionRegistry = sessionRegistry;
    }

    @Override
    public void run(ApplicationArguments args) throws Exception {
        createDirectories();
        int stale = progressChannel.deleteStale();
        if (stale > 0) {
            log.info("Removed {} stale progress file(s) from {}", stale, progressChannel.directory());
        }
        Map<String, Integer> sessions = sessionRegistry.countByType();
        log.info("Working directory {} holds {} session(s) ({} web, {} cli)",
                properties.baseDirPath(), sessions.get("total"), sessions.get("web"), sessions.get("cli"));
    }

    private void createDirectories() throws IOException {
        Files.createDirectories(properties.baseDirPath());
        Files.createDirectories(properties.resolve(properties.getSessions().getImagesDir()));
        Files.createDirectories(properties.resolve(properties.getSessions().getAltTextDir()));
        Files.createDirectories(properties.resolve(properties.getSessions().getReportsDir()));
        Files.createDirectories(properties.resolve(properties.getJobs().getProgressDir()));
        Files.createDirectories(Path.of(properties.getLogs().getDir()));
    }
}
