package ca.gc.cra.harvest.domain.diag;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Objects;

/**
 * <strong>What:</strong> A single field-set instruction applied while assembling a {@link Diagnostic}.
 * <p><strong>Why:</strong> Resolvers and the scheduler wrap the same failure at several levels of a call
 * chain; each level contributes fields as an ordered list of instructions rather than mutating the error.</p>
 * <p><strong>Protection:</strong> an option returned by {@link #protect()} locks its field for the remainder
 * of the {@link Diagnostic#wrap} call it is passed to. Later options for the same field in that call are
 * skipped. The lock never outlives the call.</p>
 * <p><strong>Thread-safety:</strong> Immutable record.</p>
 *
 * @param field field written by this instruction
 * @param value value to write; type depends on {@code field}
 * @param locked whether the field is locked once this instruction applies
 * @since 0.1.0
 */
public record DiagnosticOption(Field field, Object value, boolean locked) {

  /** Diagnostic fields that options can set. */
  public enum Field {
    SEVERITY,
    TYPE,
    RESOURCE,
    RESOURCE_ID,
    ACCOUNT_ID,
    SUMMARY,
    DETAIL
  }

  /**
   * Validates that {@code value} matches {@code field}.
   *
   * <p>{@link Field#SEVERITY} and {@link Field#TYPE} require a non-null value of their enum type.
   * {@link Field#RESOURCE_ID} takes a list of non-null strings, {@code null} meaning an empty path. The
   * remaining fields take a string, {@code null} meaning empty.</p>
   *
   * @throws NullPointerException if {@code field} is {@code null}, or a required value is missing
   * @throws IllegalArgumentException if {@code value} has the wrong type for {@code field}
   */
  public DiagnosticOption {
    Objects.requireNonNull(field, "field");
    value = switch (field) {
      case SEVERITY -> requireType(field, Objects.requireNonNull(value, "severity"), Severity.class);
      case TYPE -> requireType(field, Objects.requireNonNull(value, "type"), DiagnosticType.class);
      case RESOURCE_ID -> value == null ? List.of() : idPath(value);
      default -> value == null ? "" : requireType(field, value, String.class);
    };
  }

  /**
   * Sets the severity.
   *
   * @param severity severity to apply; must not be {@code null}
   * @return unprotected option
   */
  public static DiagnosticOption severity(Severity severity) {
    return new DiagnosticOption(Field.SEVERITY, Objects.requireNonNull(severity, "severity"), false);
  }

  /**
   * Sets the classification.
   *
   * @param type classification to apply; must not be {@code null}
   * @return unprotected option
   */
  public static DiagnosticOption type(DiagnosticType type) {
    return new DiagnosticOption(Field.TYPE, Objects.requireNonNull(type, "type"), false);
  }

  /**
   * Sets the resource (table) name.
   *
   * @param resource table name
   * @return unprotected option
   */
  public static DiagnosticOption resource(String resource) {
    return new DiagnosticOption(Field.RESOURCE, resource, false);
  }

  /**
   * Sets the resource id path.
   *
   * @param ids identifier path, outermost first
   * @return unprotected option
   */
  public static DiagnosticOption resourceId(List<String> ids) {
    return new DiagnosticOption(Field.RESOURCE_ID, ids == null ? List.of() : ids, false);
  }

  /**
   * Sets the resource id path.
   *
   * @param ids identifier path, outermost first
   * @return unprotected option
   */
  public static DiagnosticOption resourceId(String... ids) {
    return resourceId(ids == null ? List.of() : List.of(ids));
  }

  /**
   * Sets the account identifier.
   *
   * @param accountId account the failure belongs to
   * @return unprotected option
   */
  public static DiagnosticOption accountId(String accountId) {
    return new DiagnosticOption(Field.ACCOUNT_ID, accountId, false);
  }

  /**
   * Sets the summary. Arguments, when present, are applied with {@link String#format}.
   *
   * @param summary summary text or format string
   * @param args optional format arguments
   * @return unprotected option
   */
  public static DiagnosticOption summary(String summary, Object... args) {
    return new DiagnosticOption(Field.SUMMARY, format(summary, args), false);
  }

  /**
   * Sets the detail line, typically a hint on how to fix the problem.
   *
   * @param detail detail text or format string
   * @param args optional format arguments
   * @return unprotected option
   */
  public static DiagnosticOption detail(String detail, Object... args) {
    return new DiagnosticOption(Field.DETAIL, format(detail, args), false);
  }

  /**
   * Returns a copy of this option that locks its field for the rest of the construction call.
   *
   * @return protected copy
   */
  public DiagnosticOption protect() {
    return locked ? this : new DiagnosticOption(field, value, true);
  }

  Severity severityValue() {
    return (Severity) value;
  }

  DiagnosticType typeValue() {
    return (DiagnosticType) value;
  }

  String textValue() {
    return (String) value;
  }

  List<String> idPathValue() {
    return ((List<?>) value).stream().map(String.class::cast).toList();
  }

  private static <T> T requireType(Field field, Object value, Class<T> type) {
    if (!type.isInstance(value)) {
      throw new IllegalArgumentException("Option " + field + " expects " + type.getSimpleName()
          + " but got " + value.getClass().getName());
    }
    return type.cast(value);
  }

  private static List<String> idPath(Object value) {
    if (!(value instanceof List<?> list)) {
      throw new IllegalArgumentException(
          "Option " + Field.RESOURCE_ID + " expects a List of String but got " + value.getClass().getName());
    }
    List<String> ids = new ArrayList<>(list.size());
    for (Object id : list) {
      ids.add(requireType(Field.RESOURCE_ID, Objects.requireNonNull(id, "resource id"), String.class));
    }
    return List.copyOf(ids);
  }

  private static String format(String text, Object... args) {
    if (text == null || args == null || args.length == 0) {
      return text;
    }
    return String.format(Locale.ROOT, text, args);
  }
}
