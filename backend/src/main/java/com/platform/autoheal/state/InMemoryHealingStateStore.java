package com.platform.autoheal.state;

import com.platform.autoheal.error.StateConflictException;
import com.platform.autoheal.model.WorkloadRef;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import java.util.Map;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Process-local store for platforms without workload metadata, and for tests.
 */
@Slf4j
@Component
@ConditionalOnProperty(name = "autoheal.state.store", havingValue = "in-memory")
public class InMemoryHealingStateStore implements HealingStateStore {

    private final Map<WorkloadRef, HealingState> states = new ConcurrentHashMap<>();

    @Override
    public HealingState read(WorkloadRef workload) {
        return states.getOrDefault(workload, HealingState.initial(workload));
    }

    @Override
    public HealingState compareAndSet(HealingState expected, HealingState next) {
        WorkloadRef workload = expected.workload();
        return states.compute(workload, (key, current) -> {
            String actual = current != null ? current.versionToken() : HealingState.INITIAL_TOKEN;
            if (!actual.equals(expected.versionToken())) {
                throw new StateConflictException(workload, expected.versionToken(), actual);
            }
            HealingState stored = next.withVersionToken(UUID.randomUUID().toString());
            log.debug("Stored healing state for {}: attempt={}, version={}", workload, stored.attempt(), stored.versionToken());
            return stored;
        });
    }
}
