package ca.gc.cra.meshgate.api;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ca.gc.cra.meshgate.config.CompositionRoot;
import ca.gc.cra.meshgate.testutil.Eventually;
import ca.gc.cra.meshgate.testutil.FakeRadioTransport;
import ca.gc.cra.meshgate.testutil.ManualClock;
import ca.gc.cra.meshgate.testutil.RecordingMetricsPort;
import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.core.read.ListAppender;
import java.io.IOException;
import java.io.PrintWriter;
import java.io.StringWriter;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.slf4j.LoggerFactory;

class ServeCliTest {
  @TempDir Path tempDir;

  private ListAppender<ILoggingEvent> appender;
  private Logger logger;
  private StringWriter buffer;

  @BeforeEach
  void setUp() {
    logger = (Logger) LoggerFactory.getLogger(ServeCli.class);
    appender = new ListAppender<>();
    appender.start();
    logger.addAppender(appender);
    buffer = new StringWriter();
    CliPrinter.setWriterForTesting(new PrintWriter(buffer));
  }

  @AfterEach
  void tearDown() {
    if (logger != null && appender != null) {
      logger.detachAppender(appender);
    }
    CliPrinter.clearTestWriter();
    System.clearProperty("otel.metrics.exporter");
  }

  @Test
  void missingRadioReturnsInvalidArgs() {
    ExitCode code = ServeCli.run(new String[] {"httpPort=9000", "metricsExporter=none"});

    assertEquals(ExitCode.INVALID_ARGS, code);
    assertTrue(buffer.toString().contains("usage: serve"));
    assertTrue(appender.list.stream()
        .anyMatch(event -> event.getLevel() == Level.ERROR
            && event.getFormattedMessage().contains("radio is required")));
  }

  @Test
  void outOfRangePortReturnsInvalidArgs() {
    ExitCode code = ServeCli.run(new String[] {"radio=gw", "httpPort=70000", "metricsExporter=none"});

    assertEquals(ExitCode.INVALID_ARGS, code);
  }

  @Test
  void missingConfigFileReturnsInvalidArgs() {
    ExitCode code = ServeCli.run(new String[] {"config=" + tempDir.resolve("absent.yaml"), "--dry-run"});

    assertEquals(ExitCode.INVALID_ARGS, code);
    assertTrue(appender.list.stream()
        .anyMatch(event -> event.getFormattedMessage().contains("does not exist")));
  }

  @Test
  void dryRunPrintsPlanWithoutConnecting() {
    ExitCode code = ServeCli.run(new String[] {"radio=10.0.0.9", "httpPort=8088", "metricsExporter=none", "--dry-run"});

    assertEquals(ExitCode.SUCCESS, code);
    String output = buffer.toString();
    assertTrue(output.contains("Serve dry-run"));
    assertTrue(output.contains("10.0.0.9:4403"));
    assertTrue(output.contains("127.0.0.1:8088"));
    assertTrue(output.contains("Metrics exporter   : none"));
  }

  @Test
  void yamlSuppliesRadioAndCliOverridesWithWarning() throws Exception {
    Path yaml = tempDir.resolve("meshgate.yaml");
    Files.writeString(yaml, """
        common:
          metricsExporter: none
        serve:
          radio: gw-yaml.local
          httpPort: 7000
        """);

    ExitCode code = ServeCli.run(new String[] {"config=" + yaml, "httpPort=7100", "--dry-run"});

    assertEquals(ExitCode.SUCCESS, code);
    assertTrue(buffer.toString().contains("gw-yaml.local:4403"));
    assertTrue(buffer.toString().contains("127.0.0.1:7100"));
    assertTrue(appender.list.stream()
        .anyMatch(event -> event.getLevel() == Level.WARN
            && event.getFormattedMessage().equals("CLI overrides YAML for key: httpPort")));
  }

  @Test
  void helpPrintsUsage() {
    assertEquals(ExitCode.SUCCESS, ServeCli.run(new String[] {"--help"}));
    assertTrue(buffer.toString().contains("meshgate serve"));
  }

  @Test
  void serveAnswersHttpUntilStoppedThenCloses() {
    FakeRadioTransport transport = new FakeRadioTransport();
    AtomicReference<CompositionRoot> created = new AtomicReference<>();
    AtomicInteger statusCode = new AtomicInteger();

    ExitCode code = ServeCli.run(
        new String[] {"radio=gw.local", "httpPort=0", "metricsExporter=none", "reconnectBackoffMillis=10"},
        config -> {
          CompositionRoot root = new CompositionRoot(config, new RecordingMetricsPort(), new ManualClock(0L), transport);
          created.set(root);
          return root;
        },
        stopped -> {
          Eventually.await("first connect attempt", () -> transport.connectCalls() >= 1);
          int port = created.get().httpServer().port();
          HttpClient client = HttpClient.newBuilder().version(HttpClient.Version.HTTP_1_1).build();
          HttpRequest request = HttpRequest.newBuilder(URI.create("http://127.0.0.1:" + port + "/api/mesh/status"))
              .timeout(Duration.ofSeconds(5))
              .build();
          try {
            statusCode.set(client.send(request, HttpResponse.BodyHandlers.ofString()).statusCode());
          } catch (IOException ex) {
            throw new IllegalStateException(ex);
          }
        });

    assertEquals(ExitCode.SUCCESS, code);
    assertEquals(200, statusCode.get());
    assertThrows(IllegalStateException.class, () -> created.get().httpServer().port());
  }

  @Test
  void interruptedWaitMapsToInterruptedExit() {
    ExitCode code = ServeCli.run(
        new String[] {"radio=gw.local", "httpPort=0", "metricsExporter=none"},
        config -> new CompositionRoot(config, new RecordingMetricsPort(), new ManualClock(0L), new FakeRadioTransport()),
        stopped -> {
          throw new InterruptedException("test stop");
        });

    assertTrue(Thread.interrupted());
    assertEquals(ExitCode.INTERRUPTED, code);
  }
}
