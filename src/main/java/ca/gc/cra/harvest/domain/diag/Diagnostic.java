package ca.gc.cra.harvest.domain.diag;

import java.util.Arrays;
import java.util.EnumSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * <strong>What:</strong> Structured, severity-classified error produced while fetching tables.
 * <p><strong>Why:</strong> Plugin hosts need more than a stack trace: which table failed, for which
 * account and resource id, how severe it is, and what the operator can do about it.</p>
 * <p><strong>Role:</strong> Domain value thrown by resolvers and carried by
 * {@link ca.gc.cra.harvest.domain.fetch.FetchException}.</p>
 * <p><strong>Composition:</strong> Diagnostics are built with {@link #wrap(Throwable, DiagnosticType,
 * DiagnosticOption...)}. Wrapping a diagnostic again seeds the new instance from the existing fields
 * instead of nesting it, so each layer of a call chain can refine fields without double wrapping.
 * Protected options lock a field for the rest of one call only.</p>
 * <p><strong>Thread-safety:</strong> Immutable once constructed.</p>
 *
 * @since 0.1.0
 */
public final class Diagnostic extends RuntimeException {
  private static final long serialVersionUID = 1L;

  private final String resource;
  private final List<String> resourceIdPath;
  private final String accountId;
  private final Severity severity;
  private final DiagnosticType type;
  private final String summary;
  private final String detail;
  private final long repeatCount;

  private Diagnostic(Assembly assembly, long repeatCount) {
    super(assembly.summary, assembly.cause);
    this.resource = assembly.resource;
    this.resourceIdPath = List.copyOf(assembly.resourceIdPath);
    this.accountId = assembly.accountId;
    this.severity = assembly.severity;
    this.type = assembly.type;
    this.summary = assembly.summary;
    this.detail = assembly.detail;
    this.repeatCount = repeatCount;
  }

  /**
   * Wraps {@code cause} into a diagnostic, applying {@code options} in order.
   *
   * <p>When {@code cause} is already a {@code Diagnostic} its fields (including its cause and
   * classification) seed the result and {@code type} is ignored. Otherwise the result starts with
   * severity {@link Severity#ERROR}, the given classification and, when {@code cause} implements
   * {@link ResourceIdentified}, its resource id path.</p>
   *
   * <p>An option marked with {@link DiagnosticOption#protect()} locks its field: later options for the
   * same field in this call are ignored. Locks are discarded when the call returns.</p>
   *
   * @param cause failure to wrap; may be {@code null}
   * @param type classification used for fresh diagnostics; {@code null} means {@link DiagnosticType#UNKNOWN}
   * @param options ordered field-set instructions; {@code null} entries are skipped
   * @return new diagnostic; never {@code null}
   */
  public static Diagnostic wrap(Throwable cause, DiagnosticType type, DiagnosticOption... options) {
    return wrap(cause, type, options == null ? List.of() : Arrays.asList(options));
  }

  /**
   * List form of {@link #wrap(Throwable, DiagnosticType, DiagnosticOption...)}.
   *
   * @param cause failure to wrap; may be {@code null}
   * @param type classification used for fresh diagnostics
   * @param options ordered field-set instructions
   * @return new diagnostic; never {@code null}
   */
  public static Diagnostic wrap(Throwable cause, DiagnosticType type, List<DiagnosticOption> options) {
    Assembly assembly = cause instanceof Diagnostic existing
        ? Assembly.seededFrom(existing)
        : Assembly.fresh(cause, type == null ? DiagnosticType.UNKNOWN : type);
    Set<DiagnosticOption.Field> locked = EnumSet.noneOf(DiagnosticOption.Field.class);
    for (DiagnosticOption option : options) {
      if (option == null || locked.contains(option.field())) {
        continue;
      }
      assembly.apply(option);
      if (option.locked()) {
        locked.add(option.field());
      }
    }
    return new Diagnostic(assembly, 1L);
  }

  /**
   * Creates a diagnostic without an underlying cause.
   *
   * @param severity severity of the problem
   * @param type classification
   * @param resource table name; may be {@code null}
   * @param summary summary; also used as the message
   * @return new diagnostic
   */
  public static Diagnostic of(Severity severity, DiagnosticType type, String resource, String summary) {
    return wrap(null, type,
        DiagnosticOption.severity(severity),
        DiagnosticOption.resource(resource),
        DiagnosticOption.summary(summary));
  }

  /**
   * Creates an {@link Severity#IGNORE} diagnostic used to report telemetry-only events.
   *
   * @param cause observed failure
   * @param eventType event name placed in the detail field
   * @return telemetry diagnostic
   */
  public static Diagnostic telemetry(Throwable cause, String eventType) {
    return wrap(cause, DiagnosticType.TELEMETRY,
        DiagnosticOption.severity(Severity.IGNORE),
        DiagnosticOption.detail(eventType));
  }

  /**
   * Returns the cause message when a cause exists, otherwise the summary.
   *
   * @return externally visible message
   */
  @Override
  public String getMessage() {
    Throwable cause = getCause();
    if (cause != null) {
      return causeMessage(cause);
    }
    return summary;
  }

  /**
   * Combines summary and cause message when both exist and differ.
   *
   * @return combined human description
   */
  public String describe() {
    Throwable cause = getCause();
    String causeMessage = cause == null ? "" : causeMessage(cause);
    if (summary.isEmpty()) {
      return causeMessage;
    }
    if (causeMessage.isEmpty() || causeMessage.equals(summary)) {
      return summary;
    }
    return summary + ": " + causeMessage;
  }

  /**
   * Returns the description, falling back to the message when no summary was set. A squashed
   * diagnostic reports its repeat count in the detail.
   *
   * @return description value
   */
  public DiagnosticDescription description() {
    String effectiveSummary = summary.isEmpty() ? Objects.toString(getMessage(), "") : summary;
    String effectiveDetail = detail;
    if (repeatCount > 1) {
      effectiveDetail = detail.isEmpty()
          ? "Repeated[" + repeatCount + "]"
          : "Repeated[" + repeatCount + "]: " + detail;
    }
    return new DiagnosticDescription(resource, resourceIdPath, accountId, effectiveSummary, effectiveDetail);
  }

  public Severity severity() {
    return severity;
  }

  public DiagnosticType type() {
    return type;
  }

  public String resource() {
    return resource;
  }

  public List<String> resourceIdPath() {
    return resourceIdPath;
  }

  public String accountId() {
    return accountId;
  }

  public String summary() {
    return summary;
  }

  public String detail() {
    return detail;
  }

  /**
   * Number of identical diagnostics this instance stands for after {@link Diagnostics#squash()}.
   *
   * @return repeat count, at least one
   */
  public long repeatCount() {
    return repeatCount;
  }

  Diagnostic withRepeatCount(long count) {
    return new Diagnostic(Assembly.seededFrom(this), Math.max(1L, count));
  }

  /**
   * Renders the diagnostic as {@code [account:id1,id2] summary: detail}.
   *
   * @return single line rendering
   */
  public String renderLine() {
    DiagnosticDescription desc = description();
    StringBuilder line = new StringBuilder();
    boolean hasIds = !desc.resourceIdPath().isEmpty();
    if (hasIds || !desc.accountId().isEmpty()) {
      line.append('[');
      if (!desc.accountId().isEmpty()) {
        line.append(desc.accountId());
        if (hasIds) {
          line.append(':');
        }
      }
      if (hasIds) {
        line.append(String.join(",", desc.resourceIdPath()));
      }
      line.append("] ");
    }
    line.append(desc.summary());
    if (!desc.detail().isEmpty()) {
      line.append(": ").append(desc.detail());
    }
    return line.toString();
  }

  private static String causeMessage(Throwable cause) {
    String message = cause.getMessage();
    return message != null ? message : cause.getClass().getName();
  }

  private static final class Assembly {
    private Throwable cause;
    private String resource = "";
    private List<String> resourceIdPath = List.of();
    private String accountId = "";
    private Severity severity = Severity.ERROR;
    private DiagnosticType type = DiagnosticType.UNKNOWN;
    private String summary = "";
    private String detail = "";

    static Assembly fresh(Throwable cause, DiagnosticType type) {
      Assembly assembly = new Assembly();
      assembly.cause = cause;
      assembly.type = type;
      if (cause instanceof ResourceIdentified identified && identified.resourceIdPath() != null) {
        assembly.resourceIdPath = List.copyOf(identified.resourceIdPath());
      }
      return assembly;
    }

    static Assembly seededFrom(Diagnostic existing) {
      Assembly assembly = new Assembly();
      assembly.cause = existing.getCause();
      assembly.resource = existing.resource;
      assembly.resourceIdPath = existing.resourceIdPath;
      assembly.accountId = existing.accountId;
      assembly.severity = existing.severity;
      assembly.type = existing.type;
      assembly.summary = existing.summary;
      assembly.detail = existing.detail;
      return assembly;
    }

    void apply(DiagnosticOption option) {
      switch (option.field()) {
        case SEVERITY -> severity = option.severityValue();
        case TYPE -> type = option.typeValue();
        case RESOURCE -> resource = option.textValue();
        case RESOURCE_ID -> resourceIdPath = option.idPathValue();
        case ACCOUNT_ID -> accountId = option.textValue();
        case SUMMARY -> summary = option.textValue();
        case DETAIL -> detail = option.textValue();
        default -> throw new IllegalStateException("Unhandled diagnostic field " + option.field());
      }
    }
  }
}
