package com.scholary.djset.progress;

import com.fasterxml.jackson.annotation.JsonValue;
import java.util.Locale;

public enum ProgressStage {
  INITIALIZING,
  IMPORTING,
  DOWNLOADING,
  PROCESSING,
  COMPLETE,
  ERROR;

  @JsonValue
  public String value() {
    return name().toLowerCase(Locale.ROOT);
  }
}
