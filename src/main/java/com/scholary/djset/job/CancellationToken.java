package com.scholary.djset.job;

import java.util.concurrent.CancellationException;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Cooperative cancellation signal shared by all work belonging to one job.
 *
 * <p>A token is cancelled either by a caller ({@link #cancel()}) or by a deadline ({@link
 * #expire()}); the first reason wins. Child tokens observe their parent but cancelling a child
 * leaves the parent untouched.
 */
public final class CancellationToken {

  private enum Reason {
    CANCELLED,
    EXPIRED
  }

  private final CancellationToken parent;
  private final AtomicReference<Reason> reason = new AtomicReference<>();

  private CancellationToken(CancellationToken parent) {
    this.parent = parent;
  }

  public static CancellationToken create() {
    return new CancellationToken(null);
  }

  public CancellationToken child() {
    return new CancellationToken(this);
  }

  /** @return true if this call cancelled the token */
  public boolean cancel() {
    return reason.compareAndSet(null, Reason.CANCELLED);
  }

  /** @return true if this call expired the token */
  public boolean expire() {
    return reason.compareAndSet(null, Reason.EXPIRED);
  }

  public boolean isCancelled() {
    return reason.get() != null || (parent != null && parent.isCancelled());
  }

  /** True when cancellation came from a deadline rather than a caller. */
  public boolean isExpired() {
    Reason own = reason.get();
    if (own != null) {
      return own == Reason.EXPIRED;
    }
    return parent != null && parent.isExpired();
  }

  public void throwIfCancelled() {
    if (isCancelled()) {
      throw new CancellationException(isExpired() ? "Deadline exceeded" : "Cancelled");
    }
  }
}
