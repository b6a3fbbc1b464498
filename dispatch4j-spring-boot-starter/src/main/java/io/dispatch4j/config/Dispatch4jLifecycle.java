package io.dispatch4j.config;

import io.dispatch4j.FleetScheduler;
import io.dispatch4j.affinity.StateAffinityManager;
import org.springframework.context.SmartLifecycle;

/**
 * Bridges the scheduler and the affinity sweeper with the Spring container lifecycle.
 */
public class Dispatch4jLifecycle implements SmartLifecycle {
    private final FleetScheduler scheduler;
    private final StateAffinityManager affinityManager;
    private volatile boolean running = false;

    public Dispatch4jLifecycle(FleetScheduler scheduler, StateAffinityManager affinityManager) {
        this.scheduler = scheduler;
        this.affinityManager = affinityManager;
    }

    @Override
    public void start() {
        affinityManager.start();
        scheduler.start();
        running = true;
    }

    @Override
    public void stop() {
        scheduler.stop(true);
        affinityManager.stop();
        running = false;
    }

    @Override
    public boolean isRunning() {
        return running;
    }

    @Override
    public int getPhase() {
        return Integer.MAX_VALUE;
    }

    @Override
    public boolean isAutoStartup() {
        return true;
    }
}
