package com.phillippitts.podscribe.config;

import com.phillippitts.podscribe.config.properties.FeedProperties;
import com.phillippitts.podscribe.config.properties.ImportProperties;
import com.phillippitts.podscribe.config.properties.SchedulerProperties;
import com.phillippitts.podscribe.service.scheduling.PassScheduler;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.annotation.SchedulingConfigurer;
import org.springframework.scheduling.concurrent.ThreadPoolTaskScheduler;
import org.springframework.scheduling.config.FixedDelayTask;
import org.springframework.scheduling.config.ScheduledTaskRegistrar;

import java.time.Duration;

/**
 * Registers the pass as a fixed-delay task on a dedicated single-thread scheduler.
 *
 * <p>Fixed delay means the next pass is timed from the end of the previous one, so passes cannot
 * overlap even when one outlasts the interval. The interval is the feed check interval, or the import
 * check interval when only the import folder is configured.
 */
@Configuration
@ConditionalOnProperty(prefix = "podscribe.scheduler", name = "enabled", havingValue = "true", matchIfMissing = true)
public class PassSchedulingConfig implements SchedulingConfigurer {

    private static final Logger LOG = LogManager.getLogger(PassSchedulingConfig.class);

    private final PassScheduler passScheduler;
    private final FeedProperties feedProperties;
    private final ImportProperties importProperties;
    private final SchedulerProperties schedulerProperties;

    public PassSchedulingConfig(PassScheduler passScheduler,
                                FeedProperties feedProperties,
                                ImportProperties importProperties,
                                SchedulerProperties schedulerProperties) {
        this.passScheduler = passScheduler;
        this.feedProperties = feedProperties;
        this.importProperties = importProperties;
        this.schedulerProperties = schedulerProperties;
    }

    /**
     * Single pass thread. As a bean it is initialized and shut down with the application context.
     */
    @Bean(name = "passTaskScheduler")
    public ThreadPoolTaskScheduler passTaskScheduler() {
        ThreadPoolTaskScheduler scheduler = new ThreadPoolTaskScheduler();
        scheduler.setPoolSize(1);
        scheduler.setThreadNamePrefix("podscribe-pass-");
        scheduler.setWaitForTasksToCompleteOnShutdown(false);
        return scheduler;
    }

    @Override
    public void configureTasks(ScheduledTaskRegistrar registrar) {
        registrar.setTaskScheduler(passTaskScheduler());

        Duration interval = passInterval(feedProperties, importProperties);
        registrar.addFixedDelayTask(new FixedDelayTask(passScheduler::trigger, interval,
                schedulerProperties.getInitialDelay()));
        LOG.info("Pass scheduled every {} after a {} initial delay ({} feed(s), import folder {})",
                interval, schedulerProperties.getInitialDelay(), feedProperties.urlList().size(),
                importProperties.isEnabled() ? importProperties.root() : "disabled");
    }

    static Duration passInterval(FeedProperties feeds, ImportProperties imports) {
        return feeds.hasFeeds() ? feeds.getCheckInterval() : imports.getCheckInterval();
    }
}
