package com.scholary.djset.objectstore;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoMoreInteractions;
import static org.mockito.Mockito.when;

import java.io.IOException;
import java.io.InputStream;
import java.net.URL;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.Arrays;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.junit.jupiter.api.io.TempDir;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class TrackPublisherTest {

  @Mock private ObjectStoreClient client;

  @TempDir Path tempDir;

  private TrackPublisher publisher;
  private Path setDirectory;

  @BeforeEach
  void setUp() throws IOException {
    publisher = new TrackPublisher(client, "djsets", Duration.ofHours(1));
    setDirectory = Files.createDirectories(tempDir.resolve("DJ - Set"));
  }

  @Test
  void publish_shouldUploadEachSplitTrack() throws IOException {
    Path first = Files.writeString(setDirectory.resolve("01 - One.mp3"), "abc");
    Path third = Files.writeString(setDirectory.resolve("03 - Three.flac"), "abcdef");

    publisher.publish(Arrays.asList(first.toString(), null, third.toString()));

    verify(client)
        .putObject(
            eq("djsets"),
            eq("DJ - Set/01 - One.mp3"),
            any(InputStream.class),
            eq(3L),
            eq("audio/mpeg"));
    verify(client)
        .putObject(
            eq("djsets"),
            eq("DJ - Set/03 - Three.flac"),
            any(InputStream.class),
            eq(6L),
            eq("audio/flac"));
    verifyNoMoreInteractions(client);
  }

  @Test
  void downloadUrl_shouldPresignObjectKey() throws Exception {
    URL url = new URL("http://minio/djsets/x");
    when(client.presignGet("djsets", "DJ - Set/01 - One.mp3", Duration.ofHours(1))).thenReturn(url);

    assertThat(publisher.downloadUrl(setDirectory.resolve("01 - One.mp3"))).isEqualTo(url);
  }

  @Test
  void contentType_shouldFallBackToOctetStream() {
    assertThat(TrackPublisher.contentType(Path.of("a.m4a"))).isEqualTo("audio/mp4");
    assertThat(TrackPublisher.contentType(Path.of("a.bin"))).isEqualTo("application/octet-stream");
  }
}
