package ca.gc.cra.harvest.api;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.core.read.ListAppender;
import java.io.IOException;
import java.io.PrintWriter;
import java.io.StringWriter;
import java.nio.file.Files;
import java.nio.file.Path;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.slf4j.LoggerFactory;

class CheckSpecCliTest {
  @TempDir Path tempDir;

  private final StringWriter buffer = new StringWriter();
  private ListAppender<ILoggingEvent> appender;
  private Logger logger;

  @BeforeEach
  void setUp() {
    logger = (Logger) LoggerFactory.getLogger(CheckSpecCli.class);
    appender = new ListAppender<>();
    appender.start();
    logger.addAppender(appender);
    CliPrinter.setWriterForTesting(new PrintWriter(buffer));
  }

  @AfterEach
  void tearDown() {
    if (logger != null && appender != null) {
      logger.detachAppender(appender);
    }
    CliPrinter.clearTestWriter();
  }

  @Test
  void printsNormalizedSpec() throws IOException {
    Path yaml = tempDir.resolve("fetch.yaml");
    Files.writeString(yaml, """
        fetch:
          tables: [instances, buckets]
          skip_tables: [buckets]
        """);

    ExitCode code = CheckSpecCli.run(new String[] {"spec=" + yaml});

    assertEquals(ExitCode.SUCCESS, code);
    String output = buffer.toString();
    assertTrue(output.contains("tables=instances,buckets"), output);
    assertTrue(output.contains("skip_tables=buckets"), output);
    assertTrue(output.contains("max_concurrency=auto"), output);
    assertTrue(output.contains("unit_timeout=none"), output);
  }

  @Test
  void missingSpecArgumentReturnsInvalidArgs() {
    ExitCode code = CheckSpecCli.run(new String[0]);

    assertEquals(ExitCode.INVALID_ARGS, code);
    assertTrue(buffer.toString().contains("usage: harvest check-spec"));
  }

  @Test
  void missingFileIsConfigError() {
    ExitCode code = CheckSpecCli.run(new String[] {"spec=" + tempDir.resolve("absent.yaml")});

    assertEquals(ExitCode.CONFIG_ERROR, code);
    assertTrue(appender.list.stream()
        .anyMatch(event -> event.getLevel() == Level.ERROR
            && event.getFormattedMessage().contains("Fetch spec does not exist")));
  }

  @Test
  void invalidSpecIsConfigError() throws IOException {
    Path yaml = tempDir.resolve("bad.yaml");
    Files.writeString(yaml, "fetch:\n  max_concurrency: lots\n");

    assertEquals(ExitCode.CONFIG_ERROR, CheckSpecCli.run(new String[] {"spec=" + yaml}));
  }
}
