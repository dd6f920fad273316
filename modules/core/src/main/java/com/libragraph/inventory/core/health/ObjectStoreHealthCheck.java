package com.libragraph.inventory.core.health;

import io.minio.MinioClient;
import io.quarkus.arc.properties.IfBuildProperty;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.eclipse.microprofile.health.HealthCheck;
import org.eclipse.microprofile.health.HealthCheckResponse;
import org.eclipse.microprofile.health.Readiness;

@Readiness
@ApplicationScoped
@IfBuildProperty(name = "inventory.object-store.type", stringValue = "s3")
public class ObjectStoreHealthCheck implements HealthCheck {

    @Inject
    MinioClient minioClient;

    @Override
    public HealthCheckResponse call() {
        try {
            minioClient.listBuckets();
            return HealthCheckResponse.named("object-store")
                    .up()
                    .build();
        } catch (Exception e) {
            return HealthCheckResponse.named("object-store")
                    .down()
                    .withData("error", e.getMessage())
                    .build();
        }
    }
}
