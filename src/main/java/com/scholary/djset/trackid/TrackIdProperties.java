package com.scholary.djset.trackid;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import java.time.Duration;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Connection settings for the TrackID recognition API.
 *
 * @param baseUrl audiostreams endpoint; searches hit it directly, detections live under {@code
 *     /<slug>}
 */
@ConfigurationProperties(prefix = "trackid")
@Validated
public record TrackIdProperties(
    @NotBlank String baseUrl,
    @NotNull Duration connectTimeout,
    @NotNull Duration requestTimeout,
    @NotBlank String userAgent) {}
