package com.taskforge.resize.infrastructure.storage;

import com.taskforge.resize.config.WorkerProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import software.amazon.awssdk.regions.Region;
import software.amazon.awssdk.services.s3.S3Client;
import software.amazon.awssdk.services.s3.S3ClientBuilder;
import software.amazon.awssdk.services.s3.S3Configuration;
import software.amazon.awssdk.services.s3.presigner.S3Presigner;

import java.net.URI;

/**
 * S3 clients use the default AWS credentials chain; {@code worker.storage.endpoint} points them at
 * an S3-compatible store such as MinIO.
 */
@Configuration
public class StorageConfig {

  @Bean(destroyMethod = "close")
  S3Client s3Client(WorkerProperties props) {
    WorkerProperties.Storage storage = props.storage();
    S3ClientBuilder builder = S3Client.builder()
        .region(Region.of(storage.region()))
        .serviceConfiguration(S3Configuration.builder()
            .pathStyleAccessEnabled(storage.pathStyleAccess())
            .build());
    if (storage.endpoint() != null && !storage.endpoint().isBlank()) {
      builder.endpointOverride(URI.create(storage.endpoint()));
    }
    return builder.build();
  }

  @Bean(destroyMethod = "close")
  S3Presigner s3Presigner(WorkerProperties props) {
    WorkerProperties.Storage storage = props.storage();
    S3Presigner.Builder builder = S3Presigner.builder()
        .region(Region.of(storage.region()))
        .serviceConfiguration(S3Configuration.builder()
            .pathStyleAccessEnabled(storage.pathStyleAccess())
            .build());
    if (storage.endpoint() != null && !storage.endpoint().isBlank()) {
      builder.endpointOverride(URI.create(storage.endpoint()));
    }
    return builder.build();
  }
}
