package com.scholary.djset.api;

import com.scholary.djset.job.Job;
import com.scholary.djset.job.JobPage;
import com.scholary.djset.job.JobStore;
import com.scholary.djset.objectstore.TrackPublisher;
import com.scholary.djset.service.DjSetProcessingService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import java.net.URI;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.core.io.FileSystemResource;
import org.springframework.core.io.Resource;
import org.springframework.http.ContentDisposition;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

/**
 * REST API for split jobs.
 *
 * <p>Jobs are asynchronous: submitting returns a job id straight away, and callers poll the job
 * until it reaches a terminal state.
 */
@RestController
@Tag(name = "Jobs", description = "Download DJ sets and split them into tracks")
public class JobController {

  private static final Logger LOGGER = LoggerFactory.getLogger(JobController.class);

  private final DjSetProcessingService processingService;
  private final JobStore jobStore;

  public JobController(DjSetProcessingService processingService, JobStore jobStore) {
    this.processingService = processingService;
    this.jobStore = jobStore;
  }

  @PostMapping("/api/process")
  @Operation(
      summary = "Start a split job",
      description = "Download the set at the given URL and split it along the tracklist")
  public ResponseEntity<SubmitJobResponse> process(@Valid @RequestBody ProcessRequest request) {
    LOGGER.info(
        "Process request: url={}, set={}, tracks={}",
        request.url(),
        request.tracklist().name(),
        request.tracklist().tracks().size());

    String jobId =
        processingService.submit(
            request.url(),
            request.tracklist(),
            request.fileExtension(),
            request.maxConcurrentTasks());
    return ResponseEntity.accepted().body(new SubmitJobResponse("Processing started", jobId));
  }

  @GetMapping("/api/jobs/{id}")
  @Operation(summary = "Get job status", description = "Current state, progress and results")
  public ResponseEntity<Job> getJob(@PathVariable String id) {
    return ResponseEntity.ok(processingService.getJob(id));
  }

  @PostMapping("/api/jobs/{id}/cancel")
  @Operation(summary = "Cancel a job", description = "Cancel a pending or processing job")
  public ResponseEntity<Job> cancelJob(@PathVariable String id) {
    return ResponseEntity.ok(jobStore.cancelJob(id));
  }

  @GetMapping("/api/jobs")
  @Operation(summary = "List jobs", description = "Jobs in creation order, one page at a time")
  public ResponseEntity<JobPage> listJobs(
      @RequestParam(defaultValue = "1") int page,
      @RequestParam(defaultValue = "10") int pageSize) {
    return ResponseEntity.ok(jobStore.listJobs(page, pageSize));
  }

  @GetMapping("/api/jobs/{id}/tracks/{trackNumber}/download")
  @Operation(
      summary = "Download a track",
      description = "Stream a split track, or redirect to object storage when publishing is on")
  public ResponseEntity<Resource> downloadTrack(
      @PathVariable String id, @PathVariable int trackNumber) {
    Path file = processingService.trackFile(id, trackNumber);

    Optional<TrackPublisher> publisher = processingService.trackPublisher();
    if (publisher.isPresent()) {
      URI location = URI.create(publisher.get().downloadUrl(file).toString());
      return ResponseEntity.status(HttpStatus.FOUND).location(location).build();
    }

    return ResponseEntity.ok()
        .header(
            HttpHeaders.CONTENT_DISPOSITION,
            ContentDisposition.attachment()
                .filename(file.getFileName().toString(), StandardCharsets.UTF_8)
                .build()
                .toString())
        .contentType(MediaType.APPLICATION_OCTET_STREAM)
        .body(new FileSystemResource(file));
  }
}
