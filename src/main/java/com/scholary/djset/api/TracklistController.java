package com.scholary.djset.api;

import com.scholary.djset.trackid.TrackIdImporter;
import com.scholary.djset.tracklist.CsvTracklistImporter;
import com.scholary.djset.tracklist.Tracklist;
import com.scholary.djset.tracklist.TracklistException;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import java.io.IOException;
import java.io.InputStream;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.multipart.MultipartFile;

@RestController
@Tag(name = "Tracklists", description = "Import and reconcile tracklists")
public class TracklistController {

  private final CsvTracklistImporter csvImporter;
  private final TrackIdImporter trackIdImporter;

  public TracklistController(
      CsvTracklistImporter csvImporter, TrackIdImporter trackIdImporter) {
    this.csvImporter = csvImporter;
    this.trackIdImporter = trackIdImporter;
  }

  @GetMapping("/api/tracklists/trackid")
  @Operation(
      summary = "Import a tracklist from TrackID",
      description = "Search recognised audiostreams and reconcile the best match")
  public ResponseEntity<Tracklist> importTrackId(@RequestParam String keywords) {
    return ResponseEntity.ok(trackIdImporter.importSet(keywords));
  }

  @PostMapping(value = "/api/tracklists/csv", consumes = MediaType.MULTIPART_FORM_DATA_VALUE)
  @Operation(
      summary = "Import a CSV tracklist",
      description = "Parse a CSV export and fill timing gaps with ID tracks")
  public ResponseEntity<Tracklist> importCsv(@RequestParam("file") MultipartFile file) {
    try (InputStream input = file.getInputStream()) {
      return ResponseEntity.ok(csvImporter.importCsv(input));
    } catch (IOException e) {
      throw new TracklistException("Failed to read uploaded tracklist", e);
    }
  }
}
