package com.caseflow.recovery;

import com.caseflow.core.repository.WorkflowInstanceRepository;
import com.caseflow.engine.config.CaseflowProperties;
import com.caseflow.engine.coordinator.WorkflowCoordinator;
import com.caseflow.engine.runtime.WorkflowDispatcher;
import com.caseflow.engine.runtime.WorkflowRehydrator;
import com.caseflow.scheduler.WakeupScheduler;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.event.EventListener;

/**
 * Starts recovery once the application is ready to serve.
 */
@Configuration
public class RecoveryConfiguration {

    @Bean(destroyMethod = "stop")
    public RecoveryEngine recoveryEngine(WorkflowInstanceRepository instanceRepository,
                                         WorkflowRehydrator rehydrator,
                                         WorkflowCoordinator coordinator,
                                         WorkflowDispatcher dispatcher,
                                         WakeupScheduler wakeupScheduler,
                                         CaseflowProperties properties) {
        return new RecoveryEngine(instanceRepository, rehydrator, coordinator, dispatcher, wakeupScheduler,
            properties.getRecovery().getSnapshotInterval());
    }

    @EventListener(ApplicationReadyEvent.class)
    public void onReady(ApplicationReadyEvent event) {
        event.getApplicationContext().getBean(RecoveryEngine.class).start();
    }
}
