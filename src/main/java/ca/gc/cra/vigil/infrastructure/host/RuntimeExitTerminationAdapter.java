package ca.gc.cra.vigil.infrastructure.host;

import ca.gc.cra.vigil.application.port.HostTerminationPort;
import java.util.Objects;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.IntConsumer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> {@link HostTerminationPort} that asks the JVM to exit.
 * <p><strong>Why:</strong> Some hosts must stop immediately rather than wait for the failure to unwind their
 * event loop.</p>
 * <p><strong>Thread-safety:</strong> Only the first request spawns the exit thread; later requests are ignored.</p>
 * <p><strong>Performance:</strong> {@link #requestStop()} returns without waiting; {@link Runtime#exit(int)}
 * runs on a daemon thread so the calling thread can still raise its failure.</p>
 * <p><strong>Observability:</strong> Logs the requested exit status at WARN.</p>
 *
 * @since 0.1.0
 */
public final class RuntimeExitTerminationAdapter implements HostTerminationPort {
  private static final Logger log = LoggerFactory.getLogger(RuntimeExitTerminationAdapter.class);

  /** Exit status used when none is configured ({@code EX_SOFTWARE}). */
  public static final int DEFAULT_EXIT_STATUS = 70;

  private final int status;
  private final IntConsumer exit;
  private final ThreadFactory threadFactory;
  private final AtomicBoolean requested = new AtomicBoolean();

  /** Creates an adapter that exits with {@link #DEFAULT_EXIT_STATUS}. */
  public RuntimeExitTerminationAdapter() {
    this(DEFAULT_EXIT_STATUS);
  }

  /**
   * Creates an adapter that exits with the given status.
   *
   * @param status process exit status
   */
  public RuntimeExitTerminationAdapter(int status) {
    this(status, code -> Runtime.getRuntime().exit(code), RuntimeExitTerminationAdapter::exitThread);
  }

  RuntimeExitTerminationAdapter(int status, IntConsumer exit, ThreadFactory threadFactory) {
    this.status = status;
    this.exit = Objects.requireNonNull(exit, "exit");
    this.threadFactory = Objects.requireNonNull(threadFactory, "threadFactory");
  }

  @Override
  public void requestStop() {
    if (!requested.compareAndSet(false, true)) {
      log.debug("JVM exit already requested; ignoring repeat request");
      return;
    }
    log.warn("Failed assertion requested JVM exit with status {}", status);
    threadFactory.newThread(() -> exit.accept(status)).start();
  }

  /**
   * Indicates whether an exit has been requested.
   *
   * @return {@code true} after the first {@link #requestStop()}
   */
  public boolean requested() {
    return requested.get();
  }

  private static Thread exitThread(Runnable runnable) {
    Thread thread = new Thread(runnable);
    thread.setName("vigil-assert-exit");
    thread.setDaemon(true);
    return thread;
  }
}
