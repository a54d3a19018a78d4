package com.scholary.djset.progress;

/**
 * Receives progress events from long running work.
 *
 * <p>Implementations may be called from several worker threads.
 */
@FunctionalInterface
public interface ProgressListener {

  void emit(ProgressEvent event);
}
