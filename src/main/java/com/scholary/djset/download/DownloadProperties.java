package com.scholary.djset.download;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import java.time.Duration;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

@ConfigurationProperties(prefix = "download")
@Validated
public record DownloadProperties(
    @NotNull Duration connectTimeout,
    @NotNull Duration requestTimeout,
    @NotBlank String userAgent) {}
