package com.libragraph.inventory.core.storage;

import io.minio.MinioClient;
import io.quarkus.arc.properties.IfBuildProperty;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.inject.Produces;
import jakarta.inject.Singleton;
import org.eclipse.microprofile.config.inject.ConfigProperty;

import java.util.Optional;

@ApplicationScoped
@IfBuildProperty(name = "inventory.object-store.type", stringValue = "s3")
public class MinioClientProducer {

    @ConfigProperty(name = "inventory.s3.endpoint", defaultValue = "https://s3.amazonaws.com")
    String endpoint;

    @ConfigProperty(name = "inventory.s3.access-key")
    String accessKey;

    @ConfigProperty(name = "inventory.s3.secret-key")
    String secretKey;

    @ConfigProperty(name = "inventory.s3.region")
    Optional<String> region;

    @Produces
    @Singleton
    public MinioClient minioClient() {
        MinioClient.Builder builder = MinioClient.builder()
                .endpoint(endpoint)
                .credentials(accessKey, secretKey);
        region.filter(r -> !r.isBlank()).ifPresent(builder::region);
        return builder.build();
    }
}
