package com.scholary.djset.config;

import com.scholary.djset.audio.FfmpegProperties;
import com.scholary.djset.download.DownloadProperties;
import com.scholary.djset.trackid.TrackIdProperties;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Configuration;

@Configuration
@EnableConfigurationProperties({
  SplitterProperties.class,
  FfmpegProperties.class,
  DownloadProperties.class,
  TrackIdProperties.class
})
public class SplitterConfig {}
