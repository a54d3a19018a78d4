package com.scholary.djset.tracklist;

import com.fasterxml.jackson.databind.MappingIterator;
import com.fasterxml.jackson.dataformat.csv.CsvMapper;
import com.fasterxml.jackson.dataformat.csv.CsvParser;
import java.io.IOException;
import java.io.InputStream;
import java.util.ArrayList;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Imports a tracklist from a CSV export.
 *
 * <p>Layout:
 *
 * <ul>
 *   <li>row 1: header, ignored
 *   <li>row 2: {@code totalDuration, artist, name, _, start, end, trackArtist, trackTitle, ...}.
 *       This row also carries the first track.
 *   <li>rows 3+: {@code _, _, _, _, start, end, trackArtist, trackTitle}
 * </ul>
 *
 * <p>Rows become {@link RawSegment}s and go through the {@link TimingReconciler}.
 */
@Component
public class CsvTracklistImporter {

  private static final Logger LOGGER = LoggerFactory.getLogger(CsvTracklistImporter.class);

  private static final int METADATA_MIN_FIELDS = 9;
  private static final int TRACK_MIN_FIELDS = 8;

  private final CsvMapper csvMapper;
  private final TimingReconciler reconciler;

  public CsvTracklistImporter(TimingReconciler reconciler) {
    this.reconciler = reconciler;
    this.csvMapper = new CsvMapper();
    this.csvMapper.enable(CsvParser.Feature.WRAP_AS_ARRAY);
  }

  /**
   * Parse and reconcile a CSV tracklist.
   *
   * @throws TracklistException if the file is malformed or has no tracks
   */
  public Tracklist importCsv(InputStream input) {
    List<String[]> rows = readRows(input);
    if (rows.size() < 2) {
      throw new TracklistException("CSV must contain a header row and a metadata row");
    }

    String[] metadata = rows.get(1);
    if (metadata.length < METADATA_MIN_FIELDS) {
      throw new TracklistException(
          String.format(
              "Invalid CSV metadata row: expected at least %d fields, got %d",
              METADATA_MIN_FIELDS, metadata.length));
    }
    String totalDuration = metadata[0].trim();
    String artist = metadata[1].trim();
    String name = metadata[2].trim();

    List<RawSegment> segments = new ArrayList<>();
    segments.add(toSegment(metadata));
    for (int i = 2; i < rows.size(); i++) {
      String[] row = rows.get(i);
      if (isEmptyRow(row)) {
        continue;
      }
      if (row.length < TRACK_MIN_FIELDS) {
        throw new TracklistException(
            String.format(
                "Invalid CSV record on row %d: expected at least %d fields, got %d",
                i + 1, TRACK_MIN_FIELDS, row.length));
      }
      segments.add(toSegment(row));
    }

    LOGGER.info(
        "Imported {} segments from CSV: artist={}, name={}, totalDuration={}",
        segments.size(),
        artist,
        name,
        totalDuration);
    return reconciler.reconcile(name, artist, segments, totalDuration);
  }

  private List<String[]> readRows(InputStream input) {
    try (MappingIterator<String[]> iterator =
        csvMapper.readerFor(String[].class).readValues(input)) {
      return iterator.readAll();
    } catch (IOException e) {
      throw new TracklistException("Failed to read CSV tracklist", e);
    }
  }

  private static RawSegment toSegment(String[] row) {
    return new RawSegment(row[6].trim(), row[7].trim(), row[4].trim(), row[5].trim());
  }

  private static boolean isEmptyRow(String[] row) {
    for (String field : row) {
      if (!field.isBlank()) {
        return false;
      }
    }
    return true;
  }
}
