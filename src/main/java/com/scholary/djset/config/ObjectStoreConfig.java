package com.scholary.djset.config;

import com.scholary.djset.objectstore.ObjectStoreClient;
import com.scholary.djset.objectstore.ObjectStoreProperties;
import com.scholary.djset.objectstore.S3ObjectStoreClient;
import com.scholary.djset.objectstore.TrackPublisher;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Wires publishing to S3/MinIO when {@code objectstore.enabled=true}.
 *
 * <p>Without it no {@link TrackPublisher} exists and tracks are only kept on local disk.
 */
@Configuration
@EnableConfigurationProperties(ObjectStoreProperties.class)
@ConditionalOnProperty(prefix = "objectstore", name = "enabled", havingValue = "true")
public class ObjectStoreConfig {

  @Bean(destroyMethod = "close")
  public S3ObjectStoreClient objectStoreClient(ObjectStoreProperties properties) {
    return new S3ObjectStoreClient(properties);
  }

  @Bean
  public TrackPublisher trackPublisher(
      ObjectStoreClient objectStoreClient, ObjectStoreProperties properties) {
    return new TrackPublisher(objectStoreClient, properties.bucket(), properties.presignTtl());
  }
}
