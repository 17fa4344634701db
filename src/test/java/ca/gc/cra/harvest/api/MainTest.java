package ca.gc.cra.harvest.api;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.io.IOException;
import java.io.PrintWriter;
import java.io.StringWriter;
import java.nio.file.Files;
import java.nio.file.Path;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class MainTest {
  @TempDir Path tempDir;

  private final StringWriter buffer = new StringWriter();

  @BeforeEach
  void setUp() {
    CliPrinter.setWriterForTesting(new PrintWriter(buffer));
  }

  @AfterEach
  void tearDown() {
    CliPrinter.clearTestWriter();
  }

  @Test
  void missingCommandReturnsInvalidArgs() {
    assertEquals(ExitCode.INVALID_ARGS, Main.run(new String[0]));
    assertTrue(buffer.toString().contains("usage: harvest"));
  }

  @Test
  void helpWithoutCommandSucceeds() {
    assertEquals(ExitCode.SUCCESS, Main.run(new String[] {"--help"}));
    assertTrue(buffer.toString().contains("check-spec"));
  }

  @Test
  void unknownCommandReturnsInvalidArgs() {
    assertEquals(ExitCode.INVALID_ARGS, Main.run(new String[] {"crawl"}));
  }

  @Test
  void dispatchesToCheckSpec() throws IOException {
    Path yaml = tempDir.resolve("fetch.yaml");
    Files.writeString(yaml, "fetch:\n  tables: [users]\n  max_concurrency: 8\n");

    ExitCode code = Main.run(new String[] {"check-spec", "spec=" + yaml});

    assertEquals(ExitCode.SUCCESS, code);
    assertTrue(buffer.toString().contains("max_concurrency=8"));
  }

  @Test
  void dispatchesToBudget() {
    ExitCode code = Main.run(new String[] {"budget", "maxConcurrency=3"});

    assertEquals(ExitCode.SUCCESS, code);
    assertTrue(buffer.toString().contains("budget=3"));
  }
}
