package ca.gc.cra.harvest.application.budget;

import ca.gc.cra.harvest.application.port.SystemResourcesPort;
import ca.gc.cra.harvest.domain.fetch.ConcurrencyBudget;
import ca.gc.cra.harvest.domain.fetch.FetchConfigurationException;
import java.util.Objects;
import java.util.OptionalLong;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> Sizes the maximum number of concurrently running fetch units.
 * <p><strong>Why:</strong> Every unit holds sockets and buffers; the budget keeps a fetch inside the host's
 * memory and file-descriptor limits without requiring operators to tune it.</p>
 * <p><strong>Algorithm:</strong>
 * <ul>
 *   <li>A non-zero override wins unconditionally.</li>
 *   <li>Otherwise {@code max(100, floor(250000 * memoryGiB * 0.8))}, assuming 2 GiB when memory is
 *   unknown.</li>
 *   <li>When the descriptor ceiling is known and {@code floor(available * 0.3)} is lower, that share is
 *   used instead.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> Stateless apart from the injected port; safe for concurrent use.</p>
 * <p><strong>Observability:</strong> Logs the chosen budget and its source at DEBUG.</p>
 *
 * @since 0.1.0
 */
public final class ConcurrencyBudgetCalculator {
  private static final Logger log = LoggerFactory.getLogger(ConcurrencyBudgetCalculator.class);

  static final long GIB = 1024L * 1024L * 1024L;
  static final long UNITS_PER_GIB = 250_000L;
  static final long MIN_UNITS = 100L;
  static final long BASELINE_MEMORY_BYTES = 2L * GIB;
  private static final long REDUCER_PERCENT = 80L;
  private static final long FD_SHARE_PERCENT = 30L;
  private static final long REDUCED_UNITS_PER_GIB = UNITS_PER_GIB * REDUCER_PERCENT / 100L;

  private final SystemResourcesPort resources;

  /**
   * Creates a calculator reading host limits from {@code resources}.
   *
   * @param resources host limits port
   */
  public ConcurrencyBudgetCalculator(SystemResourcesPort resources) {
    this.resources = Objects.requireNonNull(resources, "resources");
  }

  /**
   * Computes the budget for one fetch.
   *
   * @param override explicit budget; {@code 0} computes one from host resources
   * @return budget with at least one slot
   * @throws FetchConfigurationException if {@code override} is negative
   */
  public ConcurrencyBudget calculate(long override) {
    if (override != 0) {
      return compute(override, OptionalLong.empty(), OptionalLong.empty());
    }
    ConcurrencyBudget budget =
        compute(0L, resources.totalMemoryBytes(), resources.availableFileDescriptors());
    log.debug("Calculated fetch concurrency budget {} from {}", budget.slots(), budget.source());
    return budget;
  }

  /**
   * Pure form of the budget calculation.
   *
   * @param override explicit budget; {@code 0} computes one
   * @param totalMemoryBytes total host memory, empty or {@code 0} when unknown
   * @param availableFileDescriptors descriptors still available, empty when unknown
   * @return budget with at least one slot
   * @throws FetchConfigurationException if {@code override} is negative
   */
  public static ConcurrencyBudget compute(
      long override, OptionalLong totalMemoryBytes, OptionalLong availableFileDescriptors) {
    if (override < 0) {
      throw new FetchConfigurationException("max_concurrency must not be negative (was " + override + ")");
    }
    if (override > 0) {
      return new ConcurrencyBudget(clamp(override), ConcurrencyBudget.Source.OVERRIDE);
    }
    long memory = totalMemoryBytes.orElse(0L);
    long memoryBudget = memoryBudget(memory > 0 ? memory : BASELINE_MEMORY_BYTES);
    if (availableFileDescriptors.isPresent()) {
      long fdBudget = descriptorShare(Math.max(0L, availableFileDescriptors.getAsLong()));
      if (fdBudget < memoryBudget) {
        return new ConcurrencyBudget(clamp(fdBudget), ConcurrencyBudget.Source.FILE_DESCRIPTORS);
      }
    }
    return new ConcurrencyBudget(clamp(memoryBudget), ConcurrencyBudget.Source.MEMORY);
  }

  // floor(bytes / GiB * 200000) without floating point or overflow
  static long memoryBudget(long memoryBytes) {
    long whole = memoryBytes / GIB * REDUCED_UNITS_PER_GIB;
    long fraction = memoryBytes % GIB * REDUCED_UNITS_PER_GIB / GIB;
    return Math.max(MIN_UNITS, whole + fraction);
  }

  // floor(descriptors * 0.3)
  static long descriptorShare(long descriptors) {
    return descriptors / 100L * FD_SHARE_PERCENT + descriptors % 100L * FD_SHARE_PERCENT / 100L;
  }

  private static int clamp(long value) {
    return (int) Math.max(1L, Math.min(Integer.MAX_VALUE, value));
  }
}
