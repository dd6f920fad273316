package com.libragraph.inventory.core.health;

import com.libragraph.inventory.core.scan.ScanWorkerPool;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.eclipse.microprofile.health.HealthCheck;
import org.eclipse.microprofile.health.HealthCheckResponse;
import org.eclipse.microprofile.health.Readiness;

@Readiness
@ApplicationScoped
public class ScanWorkerPoolHealthCheck implements HealthCheck {

    @Inject
    ScanWorkerPool pool;

    @Override
    public HealthCheckResponse call() {
        return HealthCheckResponse.named("scan-worker-pool")
                .status(pool.isRunning())
                .withData("state", pool.state().name())
                .withData("workers", pool.workerCount())
                .build();
    }
}
