package ca.gc.cra.harvest.infrastructure.system;

import ca.gc.cra.harvest.application.port.SystemResourcesPort;
import com.sun.management.UnixOperatingSystemMXBean;
import java.lang.management.ManagementFactory;
import java.lang.management.OperatingSystemMXBean;
import java.util.Objects;
import java.util.OptionalLong;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Reads host memory and descriptor limits from the platform {@link OperatingSystemMXBean}.
 *
 * <p>Total memory comes from {@code com.sun.management.OperatingSystemMXBean}; the descriptor ceiling from
 * {@link UnixOperatingSystemMXBean}, so non-Unix JVMs report no ceiling. Lookup failures are logged at
 * DEBUG and reported as empty values.</p>
 *
 * @since 0.1.0
 */
public final class OperatingSystemResourcesAdapter implements SystemResourcesPort {
  private static final Logger log = LoggerFactory.getLogger(OperatingSystemResourcesAdapter.class);

  private final OperatingSystemMXBean bean;

  /** Creates an adapter bound to the running JVM's operating system bean. */
  public OperatingSystemResourcesAdapter() {
    this(ManagementFactory.getOperatingSystemMXBean());
  }

  OperatingSystemResourcesAdapter(OperatingSystemMXBean bean) {
    this.bean = Objects.requireNonNull(bean, "bean");
  }

  @Override
  public OptionalLong totalMemoryBytes() {
    if (!(bean instanceof com.sun.management.OperatingSystemMXBean extended)) {
      log.debug("Total memory unavailable from {}", bean.getClass().getName());
      return OptionalLong.empty();
    }
    try {
      long total = extended.getTotalMemorySize();
      return total > 0 ? OptionalLong.of(total) : OptionalLong.empty();
    } catch (RuntimeException ex) {
      log.debug("Failed to read total memory size", ex);
      return OptionalLong.empty();
    }
  }

  @Override
  public OptionalLong availableFileDescriptors() {
    if (!(bean instanceof UnixOperatingSystemMXBean unix)) {
      log.debug("File descriptor limits not supported on this platform");
      return OptionalLong.empty();
    }
    try {
      long max = unix.getMaxFileDescriptorCount();
      long open = unix.getOpenFileDescriptorCount();
      if (max <= 0) {
        return OptionalLong.empty();
      }
      return OptionalLong.of(Math.max(0L, max - Math.max(0L, open)));
    } catch (RuntimeException ex) {
      log.debug("Failed to read file descriptor counts", ex);
      return OptionalLong.empty();
    }
  }
}
