package com.scholary.djset.objectstore;

import jakarta.validation.constraints.NotNull;
import java.time.Duration;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Settings bound from {@code objectstore.*}.
 *
 * <p>When {@code enabled} is false no client is created and tracks are served from local disk.
 */
@ConfigurationProperties(prefix = "objectstore")
@Validated
public record ObjectStoreProperties(
    boolean enabled,
    String endpoint,
    String accessKey,
    String secretKey,
    String bucket,
    String region,
    boolean pathStyleAccess,
    @NotNull Duration presignTtl) {}
