package io.lapse4j.config;

import io.lapse4j.core.DateSource;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;

/**
 * Runtime configuration for indexing, selection and parallel execution.
 */
@ConfigurationProperties(prefix = "lapse")
public class LapseProperties {
    private Integer workers; // null = available processors
    private int threadMultiplier = 5;
    private int chunksPerWorker = 4;
    private Duration pollInterval = Duration.ofMillis(250);
    private boolean debug = false;
    private int debugSampleSize = 10;
    private DateSource dateSource = DateSource.FILENAME;
    private String filenamePattern;
    private String timezone;
    private Duration shutdownGrace = Duration.ofSeconds(5);

    public Integer getWorkers() {
        return workers;
    }

    public void setWorkers(Integer workers) {
        this.workers = workers;
    }

    public int getThreadMultiplier() {
        return threadMultiplier;
    }

    public void setThreadMultiplier(int threadMultiplier) {
        this.threadMultiplier = threadMultiplier;
    }

    public int getChunksPerWorker() {
        return chunksPerWorker;
    }

    public void setChunksPerWorker(int chunksPerWorker) {
        this.chunksPerWorker = chunksPerWorker;
    }

    public Duration getPollInterval() {
        return pollInterval;
    }

    public void setPollInterval(Duration pollInterval) {
        this.pollInterval = pollInterval;
    }

    public boolean isDebug() {
        return debug;
    }

    public void setDebug(boolean debug) {
        this.debug = debug;
    }

    public int getDebugSampleSize() {
        return debugSampleSize;
    }

    public void setDebugSampleSize(int debugSampleSize) {
        this.debugSampleSize = debugSampleSize;
    }

    public DateSource getDateSource() {
        return dateSource;
    }

    public void setDateSource(DateSource dateSource) {
        this.dateSource = dateSource;
    }

    public String getFilenamePattern() {
        return filenamePattern;
    }

    public void setFilenamePattern(String filenamePattern) {
        this.filenamePattern = filenamePattern;
    }

    public String getTimezone() {
        return timezone;
    }

    public void setTimezone(String timezone) {
        this.timezone = timezone;
    }

    public Duration getShutdownGrace() {
        return shutdownGrace;
    }

    public void setShutdownGrace(Duration shutdownGrace) {
        this.shutdownGrace = shutdownGrace;
    }
}
