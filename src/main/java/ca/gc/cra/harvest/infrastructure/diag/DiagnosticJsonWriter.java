package ca.gc.cra.harvest.infrastructure.diag;

import ca.gc.cra.harvest.domain.diag.DiagnosticDescription;
import ca.gc.cra.harvest.domain.diag.Diagnostics;
import ca.gc.cra.harvest.domain.diag.FlatDiagnostic;
import ca.gc.cra.harvest.domain.diag.Severity;
import com.fasterxml.jackson.core.JsonFactory;
import com.fasterxml.jackson.core.JsonGenerator;
import java.io.IOException;
import java.io.OutputStream;
import java.io.StringWriter;
import java.io.UncheckedIOException;
import java.io.Writer;
import java.util.List;
import java.util.Locale;
import java.util.Objects;

/**
 * Renders a {@link Diagnostics} collection as a JSON document with Jackson's streaming generator.
 *
 * <p>Layout:</p>
 * <pre>{@code
 * {"severity":"error","errors":1,"warnings":0,
 *  "diagnostics":[{"error":"...","resource":"t","resourceId":["i-1"],"accountId":"",
 *                  "type":"Resolving","severity":"error","summary":"...",
 *                  "description":{"summary":"...","detail":"..."}}]}
 * }</pre>
 *
 * <p>{@code resourceId} is omitted when empty and {@code description} when descriptions are skipped.</p>
 *
 * @since 0.1.0
 */
public final class DiagnosticJsonWriter {
  private final JsonFactory jsonFactory = new JsonFactory();
  private final boolean skipDescription;
  private final boolean pretty;

  /**
   * Creates a writer.
   *
   * @param skipDescription omit the {@code description} object of each entry
   * @param pretty indent the output
   */
  public DiagnosticJsonWriter(boolean skipDescription, boolean pretty) {
    this.skipDescription = skipDescription;
    this.pretty = pretty;
  }

  /**
   * Renders diagnostics to a string.
   *
   * @param diagnostics collection to render
   * @return JSON document
   */
  public String toJson(Diagnostics diagnostics) {
    StringWriter out = new StringWriter(256);
    try {
      write(diagnostics, out);
    } catch (IOException ex) {
      throw new UncheckedIOException("Failed to render diagnostics", ex);
    }
    return out.toString();
  }

  /**
   * Writes diagnostics to a stream as UTF-8; the stream is left open.
   *
   * @param diagnostics collection to render
   * @param out destination
   * @throws IOException if writing fails
   */
  public void write(Diagnostics diagnostics, OutputStream out) throws IOException {
    try (JsonGenerator gen = jsonFactory.createGenerator(out)) {
      gen.disable(JsonGenerator.Feature.AUTO_CLOSE_TARGET);
      writeDocument(gen, diagnostics);
    }
  }

  /**
   * Writes diagnostics to a character stream; the writer is left open.
   *
   * @param diagnostics collection to render
   * @param out destination
   * @throws IOException if writing fails
   */
  public void write(Diagnostics diagnostics, Writer out) throws IOException {
    try (JsonGenerator gen = jsonFactory.createGenerator(out)) {
      gen.disable(JsonGenerator.Feature.AUTO_CLOSE_TARGET);
      writeDocument(gen, diagnostics);
    }
  }

  private void writeDocument(JsonGenerator gen, Diagnostics diagnostics) throws IOException {
    Objects.requireNonNull(diagnostics, "diagnostics");
    if (pretty) {
      gen.useDefaultPrettyPrinter();
    }
    gen.writeStartObject();
    if (diagnostics.severity().isPresent()) {
      gen.writeStringField("severity", label(diagnostics.severity().get()));
    } else {
      gen.writeNullField("severity");
    }
    gen.writeNumberField("errors", diagnostics.errors());
    gen.writeNumberField("warnings", diagnostics.warnings());
    gen.writeArrayFieldStart("diagnostics");
    for (FlatDiagnostic flat : diagnostics.flatten(skipDescription)) {
      writeEntry(gen, flat);
    }
    gen.writeEndArray();
    gen.writeEndObject();
  }

  private static void writeEntry(JsonGenerator gen, FlatDiagnostic flat) throws IOException {
    gen.writeStartObject();
    gen.writeStringField("error", flat.error());
    gen.writeStringField("resource", flat.resource());
    writeIds(gen, flat.resourceIdPath());
    gen.writeStringField("accountId", flat.accountId());
    gen.writeStringField("type", flat.type().label());
    gen.writeStringField("severity", label(flat.severity()));
    gen.writeStringField("summary", flat.summary());
    DiagnosticDescription description = flat.description();
    if (description != null) {
      gen.writeObjectFieldStart("description");
      gen.writeStringField("resource", description.resource());
      writeIds(gen, description.resourceIdPath());
      gen.writeStringField("accountId", description.accountId());
      gen.writeStringField("summary", description.summary());
      gen.writeStringField("detail", description.detail());
      gen.writeEndObject();
    }
    gen.writeEndObject();
  }

  private static void writeIds(JsonGenerator gen, List<String> ids) throws IOException {
    if (ids.isEmpty()) {
      return;
    }
    gen.writeArrayFieldStart("resourceId");
    for (String id : ids) {
      gen.writeString(id);
    }
    gen.writeEndArray();
  }

  private static String label(Severity severity) {
    return severity.name().toLowerCase(Locale.ROOT);
  }
}
