package ca.gc.cra.harvest.application.port;

import java.util.OptionalLong;

/**
 * <strong>What:</strong> Reads host limits relevant to sizing the fetch concurrency budget.
 * <p><strong>Role:</strong> Port implemented by {@code OperatingSystemResourcesAdapter}; tests supply fixed
 * values.</p>
 * <p><strong>Failure model:</strong> Never throws. A value that cannot be determined on the current platform
 * is reported as empty.</p>
 *
 * @since 0.1.0
 */
public interface SystemResourcesPort {
  /**
   * Total physical memory of the host.
   *
   * @return bytes, empty when undeterminable
   */
  OptionalLong totalMemoryBytes();

  /**
   * File descriptors still available to this process (ceiling minus descriptors in use).
   *
   * @return descriptor count, empty when undeterminable
   */
  OptionalLong availableFileDescriptors();
}
