package ca.gc.cra.meshgate.api;

import ca.gc.cra.meshgate.config.CompositionRoot;
import ca.gc.cra.meshgate.config.ConfigMerger;
import ca.gc.cra.meshgate.config.ServeConfig;
import ca.gc.cra.meshgate.config.YamlConfigLoader;
import ca.gc.cra.meshgate.logging.LoggingConfigurator;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CountDownLatch;
import java.util.function.Function;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Runs the gateway: connects to the mesh gateway and serves the HTTP query API until the JVM is stopped.
 *
 * @since 0.1.0
 */
public final class ServeCli {
  private static final Logger log = LoggerFactory.getLogger(ServeCli.class);
  private static final String COMMAND = "serve";
  private static final String SUMMARY_USAGE =
      "usage: serve radio=<host[:port]> [httpHost=HOST] [httpPort=0-65535] [httpWorkers=1-64] "
          + "[messageCapacity=1-10000] [reconnectBackoffMillis=N] [pollTimeoutMillis=N] "
          + "[handshakeTimeoutMillis=N] [config=PATH] [metricsExporter=otlp|none] [otelEndpoint=URL] "
          + "[otelResourceAttributes=K=V,...] [--dry-run]";
  private static final String HELP_TEXT = """
      meshgate serve

      Usage:
        serve radio=<host[:port]> [options]

      Required:
        radio=HOST[:PORT]            Mesh gateway bridge (default port 4403; IPv6 in [ ])

      Optional (validated):
        httpHost=HOST                HTTP bind address (default 127.0.0.1)
        httpPort=0-65535             HTTP port (default 8080; 0 picks a free port)
        httpWorkers=1-64             HTTP worker threads (default 8)
        messageCapacity=1-10000      Recent messages retained (default 100)
        reconnectBackoffMillis=N     Pause between failed connects (default 1000)
        pollTimeoutMillis=N          Gateway poll wait (default 500)
        handshakeTimeoutMillis=N     Connect and handshake timeout (default 5000)
        config=PATH                  YAML file with common: and serve: sections
        metricsExporter=otlp|none    Metrics exporter (default otlp)
        otelEndpoint=URL             OTLP metrics endpoint when exporter=otlp
        otelResourceAttributes=K=V   Comma-separated OTel resource attributes
        --dry-run                    Validate inputs and print the plan without connecting
        --verbose                    Enable DEBUG logging
        --help                       Show this message
      """;

  private ServeCli() {}

  /**
   * Entry point invoked by the JVM.
   *
   * @param args raw CLI arguments
   */
  public static void main(String[] args) {
    System.exit(run(args).code());
  }

  /**
   * Runs the serve command and blocks until shutdown.
   *
   * @param args raw CLI arguments
   * @return exit code
   */
  static ExitCode run(String[] args) {
    return run(args, CompositionRoot::new, CountDownLatch::await);
  }

  static ExitCode run(
      String[] args, Function<ServeConfig, CompositionRoot> rootFactory, StopSignal stopSignal) {
    CliInput input = CliInput.parse(args);
    if (input.help()) {
      CliPrinter.println(HELP_TEXT.stripTrailing());
      return ExitCode.SUCCESS;
    }
    if (input.verbose()) {
      LoggingConfigurator.enableVerboseLogging();
      log.debug("Verbose logging enabled for serve");
    }

    ServeConfig config;
    try {
      Map<String, String> cli = CliArgsParser.toMap(input.keyValueArray());
      Optional<Map<String, String>> yaml = loadYaml(cli.remove("config"));
      Map<String, String> effective = new LinkedHashMap<>(
          ConfigMerger.buildEffectiveConfig(yaml, cli, ServeConfig.defaultsAsFlatMap(), log::warn));
      TelemetryConfigurator.configureMetrics(effective);
      config = ServeConfig.fromMap(effective);
    } catch (IllegalArgumentException ex) {
      log.error("Invalid serve configuration: {}", ex.getMessage());
      CliPrinter.println(SUMMARY_USAGE);
      return ExitCode.INVALID_ARGS;
    } catch (IOException ex) {
      log.error("Unable to read configuration file", ex);
      return ExitCode.IO_ERROR;
    }

    if (input.hasFlag("--dry-run")) {
      printDryRunPlan(config);
      return ExitCode.SUCCESS;
    }
    return serve(config, rootFactory, stopSignal);
  }

  private static ExitCode serve(
      ServeConfig config, Function<ServeConfig, CompositionRoot> rootFactory, StopSignal stopSignal) {
    CompositionRoot root;
    try {
      root = rootFactory.apply(config);
    } catch (IllegalArgumentException ex) {
      log.error("Gateway configuration error: {}", ex.getMessage(), ex);
      return ExitCode.CONFIG_ERROR;
    }
    CountDownLatch stopped = new CountDownLatch(1);
    Thread hook = new Thread(() -> {
      log.info("Shutdown requested; stopping gateway");
      root.close();
      stopped.countDown();
    }, "meshgate-shutdown");

    try {
      root.httpServer().start();
      root.connectionManager().start();
      Runtime.getRuntime().addShutdownHook(hook);
      log.info("Gateway for {} serving http://{}:{}/api/mesh/",
          config.radioAddress(), config.httpHost(), root.httpServer().port());
      stopSignal.await(stopped);
      return ExitCode.SUCCESS;
    } catch (IOException ex) {
      log.error("Unable to start HTTP server on {}:{}", config.httpHost(), config.httpPort(), ex);
      return ExitCode.IO_ERROR;
    } catch (InterruptedException ex) {
      Thread.currentThread().interrupt();
      log.error("Gateway interrupted; shutting down");
      return ExitCode.INTERRUPTED;
    } catch (RuntimeException ex) {
      log.error("Unexpected runtime failure in gateway", ex);
      return ExitCode.RUNTIME_FAILURE;
    } finally {
      if (stopped.getCount() > 0) {
        removeHook(hook);
        root.close();
      }
    }
  }

  private static Optional<Map<String, String>> loadYaml(String configPath) throws IOException {
    if (configPath == null || configPath.isBlank()) {
      return Optional.empty();
    }
    Path path = Path.of(configPath.trim());
    if (!Files.exists(path)) {
      throw new IllegalArgumentException("Configuration file does not exist: " + path);
    }
    return YamlConfigLoader.load(path, COMMAND);
  }

  private static void removeHook(Thread hook) {
    try {
      Runtime.getRuntime().removeShutdownHook(hook);
    } catch (IllegalStateException ex) {
      log.debug("JVM already shutting down; shutdown hook stays registered");
    }
  }

  private static void printDryRunPlan(ServeConfig config) {
    CliPrinter.printLines(
        "Serve dry-run: no gateway connection will be opened.",
        " Radio gateway      : " + config.radioAddress(),
        " HTTP listener      : " + config.httpHost() + ":" + config.httpPort(),
        " HTTP workers       : " + config.httpWorkers(),
        " Message capacity   : " + config.messageCapacity(),
        " Reconnect backoff  : " + config.reconnectBackoffMillis() + " ms",
        " Poll timeout       : " + config.pollTimeoutMillis() + " ms",
        " Handshake timeout  : " + config.handshakeTimeoutMillis() + " ms",
        " Metrics exporter   : " + System.getProperty("otel.metrics.exporter", "otlp"),
        " Re-run without --dry-run to start the gateway.");
  }

  /** Blocks the serving thread until the gateway should exit. */
  @FunctionalInterface
  interface StopSignal {
    void await(CountDownLatch stopped) throws InterruptedException;
  }
}
