package ca.gc.cra.tracesplit.api;

import ca.gc.cra.tracesplit.application.pipeline.SplitUseCase;
import ca.gc.cra.tracesplit.application.port.LabelStoreException;
import ca.gc.cra.tracesplit.config.CompositionRoot;
import ca.gc.cra.tracesplit.config.SplitConfig;
import ca.gc.cra.tracesplit.domain.split.SplitInvariantException;
import ca.gc.cra.tracesplit.logging.LoggingConfigurator;
import ca.gc.cra.tracesplit.validation.Paths;
import java.io.IOException;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Entry point for partitioning a label store into train, validation, and test index sets.
 *
 * @since 0.1.0
 */
public final class SplitCli {
  private static final Logger log = LoggerFactory.getLogger(SplitCli.class);
  private static final String SUMMARY_USAGE =
      "usage: split in=PATH [out=PATH|-] [format=auto|hdf5|ndjson] [dataset=PATH] "
          + "[nSplits=N] [nRepeats=N] [validationFraction=F] [withMonitoredQuic=true|false] "
          + "[withUnmonitoredQuic=true|false] [quicFraction=F] [seed=N] [tracesPerClass=N] [nClasses=N] "
          + "[config=PATH] [--dry-run] [--allow-overwrite] [metricsExporter=otlp|none]";
  private static final String HELP_TEXT = """
      tracesplit split

      Usage:
        split in=./labels.h5 out=./splits.ndjson [options]

      Required:
        in=PATH                    Label store (HDF5 or NDJSON)

      Optional:
        out=PATH|-                 Output file; '-' writes records to stdout (default -)
        format=auto|hdf5|ndjson    Label store format; auto uses the file extension (default auto)
        dataset=PATH               HDF5 dataset or group holding the labels (default labels)
        nSplits=N                  Folds per repeat, 2..1000 (default 10)
        nRepeats=N                 Repeats of the k-fold, 1..1000 (default 2)
        validationFraction=F       Share of training carved out for validation, [0, 1) (default 0.1)
        withMonitoredQuic=BOOL     Mix QUIC traces into monitored test sets (default false)
        withUnmonitoredQuic=BOOL   Mix QUIC traces into unmonitored test sets (default false)
        quicFraction=F             QUIC share of mixed test sets, [0, 1] (default 0.5)
        seed=N                     Generator seed (default 16248)
        tracesPerClass=N           Select N traces per monitored class first; 0 disables (default 0)
        nClasses=N                 Keep N randomly chosen classes after selection; 0 keeps all (default 0)
        config=PATH                YAML file with 'common' and 'split' sections
        metricsExporter=otlp|none  Metrics exporter (default none)
        otelEndpoint=URL           OTLP metrics endpoint when exporter=otlp
        otelResourceAttributes=K=V Comma-separated OTel resource attributes
        --dry-run                  Validate inputs and print the plan without splitting
        --allow-overwrite          Replace an existing output file
        --verbose                  Enable DEBUG logging
        --help                     Show this message

      Exit codes:
        0 success, 2 invalid arguments, 3 I/O error, 4 unsatisfiable parameters,
        5 unexpected failure, 6 split verification failed, 7 unreadable label store
      """;

  private SplitCli() {}

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
   * Runs the split command without terminating the JVM.
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
      log.debug("Verbose logging enabled for split CLI");
    }

    ConfigCliUtils.Resolution resolution = ConfigCliUtils.resolve("split", input, log);
    if (resolution.isFailure()) {
      CliPrinter.println(SUMMARY_USAGE);
      return resolution.failure();
    }
    Map<String, String> effective = resolution.effective();
    boolean dryRun = input.has(CliInput.Flag.DRY_RUN) || ConfigCliUtils.parseBoolean(effective, "dryRun");
    boolean allowOverwrite =
        input.has(CliInput.Flag.ALLOW_OVERWRITE) || ConfigCliUtils.parseBoolean(effective, "allowOverwrite");

    Map<String, String> configInputs = new LinkedHashMap<>(effective);
    String metricsExporter;
    SplitConfig config;
    try {
      metricsExporter = TelemetryConfigurator.configureMetrics(configInputs);
      config = SplitConfig.fromMap(configInputs);
    } catch (IllegalArgumentException ex) {
      log.error("Invalid split arguments: {}", ex.getMessage());
      CliPrinter.println(SUMMARY_USAGE);
      return ExitCode.INVALID_ARGS;
    }

    Path labels;
    try {
      labels = Paths.validateReadableFile("in", config.source().input());
    } catch (IllegalArgumentException ex) {
      log.error("Unusable label store: {}", ex.getMessage());
      return ExitCode.INPUT_ERROR;
    }
    try {
      config.output().ifPresent(out -> Paths.validateWritableFile("out", out, allowOverwrite));
    } catch (IllegalArgumentException ex) {
      log.error("Invalid output path: {}", ex.getMessage());
      CliPrinter.println(SUMMARY_USAGE);
      return ExitCode.INVALID_ARGS;
    }

    if (dryRun) {
      printDryRunPlan(config, allowOverwrite, metricsExporter);
      return ExitCode.SUCCESS;
    }

    try (CompositionRoot root = new CompositionRoot(metricsExporter)) {
      SplitUseCase useCase = root.splitUseCase(config, allowOverwrite);
      log.info("Configured split: input={} ({}), output={}, nSplits={}, nRepeats={}, seed={}, metricsExporter={}",
          labels, config.source().effectiveFormat(), config.outputDescription(), config.nSplits(),
          config.nRepeats(), config.seed(), metricsExporter);
      int written = useCase.run();
      log.info("Split completed: {} records written to {}", written, config.outputDescription());
      return ExitCode.SUCCESS;
    } catch (LabelStoreException ex) {
      log.error("Unable to load labels from {}: {}", labels, ex.getMessage(), ex);
      return ExitCode.INPUT_ERROR;
    } catch (SplitInvariantException ex) {
      log.error("Split verification failed; no records were written: {}", ex.getMessage(), ex);
      return ExitCode.INVARIANT_VIOLATION;
    } catch (IllegalArgumentException ex) {
      log.error("Split configuration error: {}", ex.getMessage(), ex);
      return ExitCode.CONFIG_ERROR;
    } catch (IOException ex) {
      log.error("Split I/O failure while writing {}", config.outputDescription(), ex);
      return ExitCode.IO_ERROR;
    } catch (InterruptedException ex) {
      Thread.currentThread().interrupt();
      log.error("Split interrupted; shutting down", ex);
      return ExitCode.INTERRUPTED;
    } catch (RuntimeException ex) {
      log.error("Unexpected runtime failure in split", ex);
      return ExitCode.RUNTIME_FAILURE;
    } catch (Exception ex) {
      log.error("Unexpected checked exception in split", ex);
      return ExitCode.RUNTIME_FAILURE;
    }
  }

  private static void printDryRunPlan(SplitConfig config, boolean allowOverwrite, String metricsExporter) {
    CliPrinter.printLines(
        "Split dry-run: no records will be produced.",
        " Label store        : " + config.source().input(),
        " Format             : " + config.source().effectiveFormat(),
        " Dataset            : " + config.source().dataset(),
        " Output             : " + config.outputDescription(),
        " Folds x repeats    : " + config.nSplits() + " x " + config.nRepeats(),
        " Validation fraction: " + config.validationFraction(),
        " Monitored QUIC     : " + config.withMonitoredQuic(),
        " Unmonitored QUIC   : " + config.withUnmonitoredQuic(),
        " QUIC fraction      : " + config.quicFraction(),
        " Seed               : " + config.seed(),
        " Trace selection    : " + (config.tracesPerClass() > 0
            ? config.tracesPerClass() + " per class, "
                + (config.nClasses() > 0 ? config.nClasses() + " classes" : "all valid classes")
            : "disabled"),
        " Metrics exporter   : " + metricsExporter,
        " Allow overwrite    : " + allowOverwrite,
        " Re-run without --dry-run to write the splits.");
  }
}
