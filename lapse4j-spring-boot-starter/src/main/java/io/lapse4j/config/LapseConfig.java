package io.lapse4j.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.lapse4j.exec.ExecutorSettings;
import io.lapse4j.exec.ParallelExecutor;
import io.lapse4j.export.EncodingImageWriter;
import io.lapse4j.export.ImageWriter;
import io.lapse4j.export.ScheduleDefinitions;
import io.lapse4j.index.TimestampIndexer;
import io.lapse4j.select.CronFireTimeSelector;
import io.lapse4j.select.FixedWindowSelector;
import io.lapse4j.task.TaskManager;
import org.quartz.CronExpression;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnClass;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;

import java.time.ZoneId;
import java.util.regex.Pattern;

/**
 * Spring Boot auto-configuration entrypoint for lapse4j components.
 */
@AutoConfiguration
@ConditionalOnClass({ParallelExecutor.class, CronExpression.class})
@EnableConfigurationProperties(LapseProperties.class)
@ConditionalOnProperty(prefix = "lapse", name = "enabled", havingValue = "true", matchIfMissing = true)
public class LapseConfig {

    @Bean
    @ConditionalOnMissingBean
    public ExecutorSettings executorSettings(LapseProperties props) {
        ExecutorSettings.Builder builder = ExecutorSettings.builder()
                .threadMultiplier(props.getThreadMultiplier())
                .chunksPerWorker(props.getChunksPerWorker())
                .pollInterval(props.getPollInterval())
                .debug(props.isDebug())
                .debugSampleSize(props.getDebugSampleSize());
        if (props.getWorkers() != null) {
            builder.workers(props.getWorkers());
        }
        return builder.build();
    }

    @Bean
    @ConditionalOnMissingBean
    public ParallelExecutor parallelExecutor(ExecutorSettings settings) {
        return new ParallelExecutor(settings);
    }

    @Bean
    @ConditionalOnMissingBean
    public TimestampIndexer timestampIndexer(LapseProperties props) {
        Pattern pattern = props.getFilenamePattern() == null || props.getFilenamePattern().isBlank()
                ? TimestampIndexer.DEFAULT_FILENAME_PATTERN
                : Pattern.compile(props.getFilenamePattern());
        ZoneId zone = props.getTimezone() == null || props.getTimezone().isBlank()
                ? ZoneId.systemDefault()
                : ZoneId.of(props.getTimezone());
        return new TimestampIndexer(pattern, props.getDateSource(), zone);
    }

    @Bean
    @ConditionalOnMissingBean
    public FixedWindowSelector fixedWindowSelector() {
        return new FixedWindowSelector();
    }

    @Bean
    @ConditionalOnMissingBean
    public CronFireTimeSelector cronFireTimeSelector() {
        return new CronFireTimeSelector();
    }

    @Bean
    @ConditionalOnMissingBean
    public ScheduleDefinitions scheduleDefinitions(ObjectProvider<ObjectMapper> objectMapperProvider) {
        return new ScheduleDefinitions(objectMapperProvider.getIfAvailable(ObjectMapper::new));
    }

    @Bean
    @ConditionalOnMissingBean
    public ImageWriter imageWriter() {
        return new EncodingImageWriter();
    }

    @Bean
    @ConditionalOnMissingBean
    public TaskManager taskManager(LapseProperties props) {
        return new TaskManager(props.getShutdownGrace());
    }

    @Bean
    @ConditionalOnMissingBean
    public TaskManagerLifecycle taskManagerLifecycle(TaskManager taskManager) {
        return new TaskManagerLifecycle(taskManager);
    }
}
