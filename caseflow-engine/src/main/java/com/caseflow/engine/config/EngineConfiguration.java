package com.caseflow.engine.config;

import com.caseflow.core.repository.EventRepository;
import com.caseflow.core.repository.WorkflowInstanceRepository;
import com.caseflow.core.repository.WorkflowTemplateRepository;
import com.caseflow.engine.activities.LocalLifecycleActivities;
import com.caseflow.engine.coordinator.WorkflowCoordinator;
import com.caseflow.engine.history.WorkflowHistoryService;
import com.caseflow.engine.metrics.WorkflowMetrics;
import com.caseflow.engine.runtime.RunnerEnvironment;
import com.caseflow.engine.runtime.WorkflowDispatcher;
import com.caseflow.engine.runtime.WorkflowRehydrator;
import com.caseflow.engine.template.TemplateService;
import com.caseflow.scheduler.WakeupScheduler;
import com.caseflow.worker.ActivityExecutor;
import com.caseflow.worker.HttpLifecycleActivities;
import com.caseflow.worker.LifecycleActivities;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Wires the engine: pools, activity implementation, runners and services.
 */
@Configuration
@EnableConfigurationProperties(CaseflowProperties.class)
public class EngineConfiguration {

    private static final Logger log = LoggerFactory.getLogger(EngineConfiguration.class);

    @Bean
    public Clock caseflowClock() {
        return Clock.systemUTC();
    }

    @Bean(name = "caseflowLoopPool", destroyMethod = "shutdownNow")
    public ExecutorService caseflowLoopPool(CaseflowProperties properties) {
        return Executors.newFixedThreadPool(properties.getEngine().getWorkerThreads(), named("caseflow-loop-"));
    }

    @Bean(name = "caseflowActivityPool", destroyMethod = "shutdownNow")
    public ExecutorService caseflowActivityPool(CaseflowProperties properties) {
        return Executors.newFixedThreadPool(properties.getEngine().getActivityThreads(), named("caseflow-activity-"));
    }

    @Bean
    public LifecycleActivities lifecycleActivities(CaseflowProperties properties,
                                                   WorkflowTemplateRepository templateRepository,
                                                   ObjectMapper objectMapper) {
        CaseflowProperties.Activities activities = properties.getActivities();
        if ("http".equalsIgnoreCase(activities.getMode())) {
            log.info("Using HTTP activities against {}", activities.getBaseUrl());
            return new HttpLifecycleActivities(activities.getBaseUrl(), objectMapper, activities.getRequestTimeout());
        }
        log.info("Using local activities");
        return new LocalLifecycleActivities(templateRepository);
    }

    @Bean
    public ActivityExecutor activityExecutor(@Qualifier("caseflowActivityPool") ExecutorService activityPool,
                                             WorkflowMetrics metrics) {
        return new ActivityExecutor(activityPool, ActivityExecutor.Sleeper.THREAD, metrics);
    }

    @Bean
    public RunnerEnvironment runnerEnvironment(EventRepository eventRepository,
                                               WorkflowInstanceRepository instanceRepository,
                                               LifecycleActivities activities,
                                               ActivityExecutor activityExecutor,
                                               CaseflowProperties properties,
                                               Clock clock,
                                               WorkflowMetrics metrics) {
        return new RunnerEnvironment(eventRepository, instanceRepository, activities, activityExecutor,
            properties.getActivities().toActivityOptions(), clock, properties.getEngine().getPollInterval(), metrics);
    }

    @Bean
    public WorkflowDispatcher workflowDispatcher(@Qualifier("caseflowLoopPool") ExecutorService loopPool, Clock clock) {
        return new WorkflowDispatcher(loopPool, clock);
    }

    @Bean(destroyMethod = "stop")
    public WakeupScheduler wakeupScheduler(Clock clock, WorkflowDispatcher dispatcher) {
        WakeupScheduler scheduler = new WakeupScheduler(clock, dispatcher);
        dispatcher.bind(scheduler);
        scheduler.start();
        return scheduler;
    }

    @Bean
    public WorkflowRehydrator workflowRehydrator(EventRepository eventRepository,
                                                 WorkflowInstanceRepository instanceRepository) {
        return new WorkflowRehydrator(eventRepository, instanceRepository);
    }

    @Bean
    public WorkflowCoordinator workflowCoordinator(RunnerEnvironment env, WorkflowDispatcher dispatcher,
                                                   WorkflowRehydrator rehydrator, WakeupScheduler scheduler) {
        return new WorkflowCoordinator(env, dispatcher, rehydrator);
    }

    @Bean
    public WorkflowHistoryService workflowHistoryService(EventRepository eventRepository,
                                                         WorkflowInstanceRepository instanceRepository,
                                                         WorkflowCoordinator coordinator) {
        return new WorkflowHistoryService(eventRepository, instanceRepository, coordinator);
    }

    @Bean
    public TemplateService templateService(WorkflowTemplateRepository templateRepository, Clock clock,
                                           CaseflowProperties properties) {
        TemplateService service = new TemplateService(templateRepository, clock);
        if (properties.getEngine().isSeedPresets()) {
            service.seedPresets();
        }
        return service;
    }

    private static ThreadFactory named(String prefix) {
        AtomicInteger counter = new AtomicInteger();
        ThreadFactory delegate = Executors.defaultThreadFactory();
        return runnable -> {
            Thread thread = delegate.newThread(runnable);
            thread.setName(prefix + counter.incrementAndGet());
            return thread;
        };
    }
}
