package ca.gc.cra.vigil.infrastructure.host;

import ca.gc.cra.vigil.application.port.HostTerminationPort;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * {@link HostTerminationPort} for hosts that run their own loop: a failed assertion raises a flag that the
 * loop polls between iterations.
 *
 * @since 0.1.0
 */
public final class StopFlagTerminationAdapter implements HostTerminationPort {
  private final AtomicBoolean stopRequested = new AtomicBoolean();
  private final AtomicInteger requests = new AtomicInteger();

  @Override
  public void requestStop() {
    requests.incrementAndGet();
    stopRequested.set(true);
  }

  /**
   * Indicates whether the host loop should stop.
   *
   * @return {@code true} once any stop was requested
   */
  public boolean stopRequested() {
    return stopRequested.get();
  }

  /**
   * Returns how many stop requests were received.
   *
   * @return request count
   */
  public int requestCount() {
    return requests.get();
  }

  /** Clears the flag, e.g. when the host restarts its loop. */
  public void reset() {
    stopRequested.set(false);
  }
}
