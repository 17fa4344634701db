package ca.gc.cra.harvest.api;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ca.gc.cra.harvest.application.port.SystemResourcesPort;
import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.core.read.ListAppender;
import java.io.PrintWriter;
import java.io.StringWriter;
import java.util.OptionalLong;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.slf4j.LoggerFactory;

class BudgetCliTest {
  private static final long GIB = 1024L * 1024L * 1024L;

  private final StringWriter buffer = new StringWriter();
  private ListAppender<ILoggingEvent> appender;
  private Logger logger;

  @BeforeEach
  void setUp() {
    logger = (Logger) LoggerFactory.getLogger(BudgetCli.class);
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
  void printsComputedBudgetAndHostLimits() {
    ExitCode code = BudgetCli.run(new String[0], host(OptionalLong.of(4 * GIB), OptionalLong.empty()));

    assertEquals(ExitCode.SUCCESS, code);
    String output = buffer.toString();
    assertTrue(output.contains("budget=800000"), output);
    assertTrue(output.contains("source=MEMORY"), output);
    assertTrue(output.contains("totalMemoryBytes=" + 4 * GIB), output);
    assertTrue(output.contains("availableFileDescriptors=unknown"), output);
  }

  @Test
  void overrideIsReported() {
    ExitCode code = BudgetCli.run(new String[] {"maxConcurrency=25"},
        host(OptionalLong.empty(), OptionalLong.of(1000L)));

    assertEquals(ExitCode.SUCCESS, code);
    assertTrue(buffer.toString().contains("budget=25"));
    assertTrue(buffer.toString().contains("source=OVERRIDE"));
  }

  @Test
  void invalidOverrideReturnsInvalidArgs() {
    ExitCode code = BudgetCli.run(new String[] {"maxConcurrency=-3"},
        host(OptionalLong.empty(), OptionalLong.empty()));

    assertEquals(ExitCode.INVALID_ARGS, code);
    assertTrue(buffer.toString().contains("usage: harvest budget"));
    assertTrue(appender.list.stream()
        .anyMatch(event -> event.getLevel() == Level.ERROR
            && event.getFormattedMessage().contains("maxConcurrency must be between")));
  }

  @Test
  void unknownArgumentReturnsInvalidArgs() {
    ExitCode code = BudgetCli.run(new String[] {"threads=4"}, host(OptionalLong.empty(), OptionalLong.empty()));

    assertEquals(ExitCode.INVALID_ARGS, code);
  }

  @Test
  void helpPrintsUsage() {
    assertEquals(ExitCode.SUCCESS, BudgetCli.run(new String[] {"--help"}));
    assertTrue(buffer.toString().contains("maxConcurrency=N"));
  }

  private static SystemResourcesPort host(OptionalLong memory, OptionalLong descriptors) {
    return new SystemResourcesPort() {
      @Override
      public OptionalLong totalMemoryBytes() {
        return memory;
      }

      @Override
      public OptionalLong availableFileDescriptors() {
        return descriptors;
      }
    };
  }
}
