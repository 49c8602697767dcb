package com.kmg.altbuddy.config;

import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.NotNull;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

@Validated
@ConfigurationProperties(prefix = "altbuddy")
public class AltBuddyProperties {
    @NotBlank
    private String baseDir;
    @NotNull
    private Analyzer analyzer = new Analyzer();
    @NotNull
    private Jobs jobs = new Jobs();
    @NotNull
    private Sessions sessions = new Sessions();
    @NotNull
    private Logs logs = new Logs();
    @NotNull
    private Languages languages = new Languages();

    public String getBaseDir() {
        return baseDir;
    }

    public void setBaseDir(String baseDir) {
        this.baseDir = baseDir;
    }

    public Analyzer getAnalyzer() {
        return analyzer;
    }

    public void setAnalyzer(Analyzer analyzer) {
        this.analyzer = analyzer;
    }

    public Jobs getJobs() {
        return jobs;
    }

    public void setJobs(Jobs jobs) {
        this.jobs = jobs;
    }

    public Sessions getSessions() {
        return sessions;
    }

    public void setSessions(Sessions sessions) {
        this.sessions = sessions;
    }

    public Logs getLogs() {
        return logs;
    }

    public void setLogs(Logs logs) {
        this.logs = logs;
    }

    public Languages getLanguages() {
        return languages;
    }

    public void setLanguages(Languages languages) {
        this.languages = languages;
    }

    public Path baseDirPath() {
        return Path.of(baseDir).toAbsolutePath().normalize();
    }

    // Relative directories are resolved against the base directory.
    public Path resolve(String dir) {
        Path path = Path.of(dir);
        if (path.isAbsolute()) {
            return path.normalize();
        }
        return baseDirPath().resolve(path).normalize();
    }

    public static class Analyzer {
        @NotEmpty
        private List<String> command = new ArrayList<>(List.of("python3", "app.py"));
        private String workingDir;

        public List<String> getCommand() {
            return command;
        }

        public void setCommand(List<String> command) {
            this.command = command;
        }

        public String getWorkingDir() {
            return workingDir;
        }

        public void setWorkingDir(String workingDir) {
            this.workingDir = workingDir;
        }
    }

    public static class Jobs {
        @NotNull
        private Duration pollInterval = Duration.ofMillis(500);
        @NotNull
        private Duration pageTimeout = Duration.ofMinutes(10);
        @NotNull
        private Duration batchTimeout = Duration.ofMinutes(60);
        @NotNull
        private Duration retention = Duration.ofMinutes(5);
        @NotNull
        private Duration drainJoinTimeout = Duration.ofSeconds(5);
        @Min(1)
        private int maxConcurrent = 4;
        @Min(0)
        private int queueCapacity = 16;
        @Min(1)
        private int maxNumImages = 500;
        @NotBlank
        private String progressDir = "progress";
        private List<String> batchRoots = new ArrayList<>();

        public Duration getPollInterval() {
            return pollInterval;
        }

        public void setPollInterval(Duration pollInterval) {
            this.pollInterval = pollInterval;
        }

        public Duration getPageTimeout() {
            return pageTimeout;
        }

        public void setPageTimeout(Duration pageTimeout) {
            this.pageTimeout = pageTimeout;
        }

        public Duration getBatchTimeout() {
            return batchTimeout;
        }

        public void setBatchTimeout(Duration batchTimeout) {
            this.batchTimeout = batchTimeout;
        }

        public Duration getRetention() {
            return retention;
        }

        public void setRetention(Duration retention) {
            this.retention = retention;
        }

        public Duration getDrainJoinTimeout() {
            return drainJoinTimeout;
        }

        public void setDrainJoinTimeout(Duration drainJoinTimeout) {
            this.drainJoinTimeout = drainJoinTimeout;
        }

        public int getMaxConcurrent() {
            return maxConcurrent;
        }

        public void setMaxConcurrent(int maxConcurrent) {
            this.maxConcurrent = maxConcurrent;
        }

        public int getQueueCapacity() {
            return queueCapacity;
        }

        public void setQueueCapacity(int queueCapacity) {
            this.queueCapacity = queueCapacity;
        }

        public int getMaxNumImages() {
            return maxNumImages;
        }

        public void setMaxNumImages(int maxNumImages) {
            this.maxNumImages = maxNumImages;
        }

        public String getProgressDir() {
            return progressDir;
        }

        public void setProgressDir(String progressDir) {
            this.progressDir = progressDir;
        }

        public List<String> getBatchRoots() {
            return batchRoots;
        }

        public void setBatchRoots(List<String> batchRoots) {
            this.batchRoots = batchRoots;
        }
    }

    public static class Sessions {
        @NotBlank
        private String imagesDir = "images";
        @NotBlank
        private String altTextDir = "output/alt-text";
        @NotBlank
        private String reportsDir = "output/reports";
        @NotNull
        private Duration maxAge = Duration.ofHours(24);
        @NotBlank
        private String cookieName = "web_session_id";
        private boolean janitorEnabled = true;

        public String getImagesDir() {
            return imagesDir;
        }

        public void setImagesDir(String imagesDir) {
            this.imagesDir = imagesDir;
        }

        public String getAltTextDir() {
            return altTextDir;
        }

        public void setAltTextDir(String altTextDir) {
            this.altTextDir = altTextDir;
        }

        public String getReportsDir() {
            return reportsDir;
        }

        public void setReportsDir(String reportsDir) {
            this.reportsDir = reportsDir;
        }

        public Duration getMaxAge() {
            return maxAge;
        }

        public void setMaxAge(Duration maxAge) {
            this.maxAge = maxAge;
        }

        public String getCookieName() {
            return cookieName;
        }

        public void setCookieName(String cookieName) {
            this.cookieName = cookieName;
        }

        public boolean isJanitorEnabled() {
            return janitorEnabled;
        }

        public void setJanitorEnabled(boolean janitorEnabled) {
            this.janitorEnabled = janitorEnabled;
        }
    }

    public static class Logs {
        @NotBlank
        private String dir = "logs";

        public String getDir() {
            return dir;
        }

        public void setDir(String dir) {
            this.dir = dir;
        }
    }

    public static class Languages {
        @NotEmpty
        private List<String> allowed = new ArrayList<>(List.of(
                "bg", "cs", "da", "de", "el", "en", "es", "et", "fi", "fr", "ga", "hr",
                "hu", "it", "lt", "lv", "mt", "nl", "pl", "pt", "ro", "sk", "sl", "sv"));
        @NotBlank
        private String defaultLanguage = "en";

        public List<String> getAllowed() {
            return allowed;
        }

        public void setAllowed(List<String> allowed) {
            this.allowed = allowed;
        }

        public String getDefaultLanguage() {
            return defaultLanguage;
        }

        public void setDefaultLanguage(String defaultLanguage) {
            this.defaultLanguage = defaultLanguage;
        }
    }
}
