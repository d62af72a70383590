package ca.gc.cra.tracesplit.api;

import ca.gc.cra.tracesplit.application.port.LabelStoreException;
import ca.gc.cra.tracesplit.application.port.LabelStoreReader;
import ca.gc.cra.tracesplit.config.CompositionRoot;
import ca.gc.cra.tracesplit.config.LabelSource;
import ca.gc.cra.tracesplit.domain.trace.LabelSummary;
import ca.gc.cra.tracesplit.logging.LoggingConfigurator;
import ca.gc.cra.tracesplit.logging.Logs;
import ca.gc.cra.tracesplit.validation.Paths;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Prints a summary of a label store so it can be checked before splitting.
 *
 * @since 0.1.0
 */
public final class DescribeCli {
  private static final Logger log = LoggerFactory.getLogger(DescribeCli.class);
  private static final int MAX_REGIONS_CHARS = 200;
  private static final String SUMMARY_USAGE =
      "usage: describe in=PATH [format=auto|hdf5|ndjson] [dataset=PATH] [config=PATH]";
  private static final String HELP_TEXT = """
      tracesplit describe

      Usage:
        describe in=./labels.h5 [options]

      Required:
        in=PATH                    Label store (HDF5 or NDJSON)

      Optional:
        format=auto|hdf5|ndjson    Label store format; auto uses the file extension (default auto)
        dataset=PATH               HDF5 dataset or group holding the labels (default labels)
        config=PATH                YAML file with 'common' and 'describe' sections
        --verbose                  Enable DEBUG logging
        --help                     Show this message
      """;

  private DescribeCli() {}

  /**
   * Entry point invoked by the JVM.
   *
   * @param args raw CLI arguments
   */
  public static void main(String[] args) {
    ExitCode exit = run(args);
    System.exit(exit.code());
  }

  /**
   * Runs the describe command without terminating the JVM.
   *
   * @param args raw CLI arguments
   * @return exit code capturing the outcome
   */
  static ExitCode run(String[] args) {
    CliInput input = CliInput.parse(args);
    if (input.help()) {
      CliPrinter.println(HELP_TEXT.stripTrailing());
      return ExitCode.SUCCESS;
    }
    if (input.verbose()) {
      LoggingConfigurator.enableVerboseLogging();
      log.debug("Verbose logging enabled for describe CLI");
    }

    ConfigCliUtils.Resolution resolution = ConfigCliUtils.resolve("describe", input, log);
    if (resolution.isFailure()) {
      CliPrinter.println(SUMMARY_USAGE);
      return resolution.failure();
    }
    Map<String, String> configInputs = new LinkedHashMap<>(resolution.effective());
    String metricsExporter;
    LabelSource source;
    try {
      metricsExporter = TelemetryConfigurator.configureMetrics(configInputs);
      source = LabelSource.fromMap(configInputs);
    } catch (IllegalArgumentException ex) {
      log.error("Invalid describe arguments: {}", ex.getMessage());
      CliPrinter.println(SUMMARY_USAGE);
      return ExitCode.INVALID_ARGS;
    }
    try {
      Paths.validateReadableFile("in", source.input());
    } catch (IllegalArgumentException ex) {
      log.error("Unusable label store: {}", ex.getMessage());
      return ExitCode.INPUT_ERROR;
    }

    try (CompositionRoot root = new CompositionRoot(metricsExporter)) {
      LabelStoreReader reader = root.labelStoreReader(source);
      LabelSummary summary = LabelSummary.of(reader.read());
      CliPrinter.printLines(render(reader.describe(), summary));
      return ExitCode.SUCCESS;
    } catch (LabelStoreException ex) {
      log.error("Unable to load labels from {}: {}", source.input(), ex.getMessage(), ex);
      return ExitCode.INPUT_ERROR;
    } catch (RuntimeException ex) {
      log.error("Unexpected runtime failure in describe", ex);
      return ExitCode.RUNTIME_FAILURE;
    }
  }

  static String[] render(String store, LabelSummary summary) {
    List<String> lines = new ArrayList<>();
    lines.add("Label store        : " + store);
    lines.add(" Samples           : " + summary.samples());
    lines.add(" Monitored         : " + summary.monitoredSamples() + " in " + summary.monitoredClasses() + " classes");
    lines.add(" Unmonitored       : " + summary.unmonitoredSamples() + " in " + summary.unmonitoredGroups()
        + " groups");
    summary.samplesPerProtocol().forEach((protocol, count) ->
        lines.add(" Protocol " + String.format("%-9s: %d", protocol, count)));
    lines.add(" Min class/protocol: " + summary.minimumPerClassAndProtocol());
    lines.add(" Regions           : "
        + Logs.truncate(String.join(", ", summary.regions()), MAX_REGIONS_CHARS));
    return lines.toArray(String[]::new);
  }
}
