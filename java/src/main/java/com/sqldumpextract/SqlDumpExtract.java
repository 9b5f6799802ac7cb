package com.sqldumpextract;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStream;
import java.io.PrintStream;
import java.nio.charset.Charset;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.logging.LogManager;
import java.util.stream.Collectors;
import java.util.stream.Stream;

import lombok.extern.java.Log;

/**
 * Command-line entry point: extracts every table of a SQL dump into per-table
 * files (or one SQLite database) and prints a summary.
 */
@Log
public class SqlDumpExtract {

    static {
        // Load logging configuration from classpath but don't log yet
        try (InputStream loggingConfig = SqlDumpExtract.class.getResourceAsStream("/logging.properties")) {
            if (loggingConfig != null) {
                LogManager.getLogManager().readConfiguration(loggingConfig);
            } else {
                System.err.println("Warning: logging.properties not found, using default configuration");
            }
        } catch (IOException e) {
            System.err.println("Warning: Failed to load logging.properties: " + e.getMessage());
        }
    }

    private static void configureLogging(boolean debug) {
        java.util.logging.Logger rootLogger = java.util.logging.Logger.getLogger("");

        if (!debug) {
            // Remove console handler when not in debug mode - logs only go to file
            for (java.util.logging.Handler handler : rootLogger.getHandlers()) {
                if (handler instanceof java.util.logging.ConsoleHandler) {
                    rootLogger.removeHandler(handler);
                }
            }
        } else {
            java.util.logging.Logger extractLogger = java.util.logging.Logger.getLogger("com.sqldumpextract");
            extractLogger.setLevel(java.util.logging.Level.FINE);

            for (java.util.logging.Handler handler : rootLogger.getHandlers()) {
                if (handler instanceof java.util.logging.ConsoleHandler) {
                    handler.setLevel(java.util.logging.Level.FINE);
                }
            }
        }

        log.info("Logging configuration loaded - debug mode: " + debug);
    }

    public static void main(String[] args) {
        int status = run(args, System.err);
        if (status != 0) {
            System.exit(status);
        }
    }

    static int run(String[] args, PrintStream err) {
        boolean debug = false;
        String format = null;
        String charsetName = null;
        String profilePath = null;
        String profileName = "default";
        List<String> tables = new ArrayList<>();
        List<String> positional = new ArrayList<>();

        for (int i = 0; i < args.length; i++) {
            String arg = args[i];
            if ("--debug".equals(arg)) {
                debug = true;
                continue;
            }
            String option = optionName(arg);
            if (option != null) {
                String value = optionValue(args, i);
                if (value == null) {
                    err.println("Missing value for " + option);
                    printUsage(err);
                    return 1;
                }
                if (!arg.contains("=")) {
                    i++;
                }
                switch (option) {
                    case "--format":
                        format = value;
                        break;
                    case "--charset":
                        charsetName = value;
                        break;
                    case "--table":
                        Arrays.stream(value.split(",")).map(String::trim).filter(t -> !t.isEmpty())
                                .forEach(tables::add);
                        break;
                    case "--profile":
                        profilePath = value;
                        break;
                    default:
                        profileName = value;
                        break;
                }
                continue;
            }
            positional.add(arg);
        }

        configureLogging(debug);

        if (positional.size() != 2) {
            printUsage(err);
            return 1;
        }

        Path dumpFile = Path.of(positional.get(0));
        Path output = Path.of(positional.get(1));

        try {
            ExtractionProfile profile = profilePath != null
                    ? ExtractionProfileLoader.load(Path.of(profilePath), profileName)
                    : new ExtractionProfile();

            OutputFormat outputFormat = OutputFormat.fromName(firstNonNull(format, profile.format(), "csv"));
            Charset charset = Charset.forName(firstNonNull(charsetName, profile.charset(), StandardCharsets.UTF_8.name()));
            ExtractionOptions options = ExtractionOptions.defaults()
                    .withTables(tables.isEmpty() ? profile.tables() : tables)
                    .withMaxRecordedWarnings(profile.max_warnings());

            if (!Files.isRegularFile(dumpFile)) {
                throw new IOException("Dump file not found: " + dumpFile);
            }

            Instant start = Instant.now();
            log.info("Starting SQL dump extraction");
            log.log(java.util.logging.Level.INFO, "Dump: {0}", dumpFile);
            log.log(java.util.logging.Level.INFO, "Output ({0}): {1}", new Object[] { outputFormat, output });
            err.println("Extracting " + dumpFile + " -> " + output + " (" + outputFormat.name().toLowerCase() + ")");

            ExtractionSummary summary;
            ProgressBarFactory progress = new ProgressBarFactory(debug);
            try (TableSinkFactory sinks = outputFormat.createFactory(output, profile.sqlite());
                    BufferedReader reader = DumpExtractor.openReader(
                            progress.wrap(Files.newInputStream(dumpFile), "Extracting", Files.size(dumpFile)), charset)) {
                summary = new DumpExtractor(sinks, options).extract(reader);
            }

            printSummary(summary, err);

            Duration duration = Duration.between(start, Instant.now());
            err.printf("\nCompleted in %d.%03ds\n", duration.toSeconds(), duration.toMillisPart());

            // Flush all logging handlers to ensure file is written
            java.util.logging.Logger rootLogger = java.util.logging.Logger.getLogger("");
            for (java.util.logging.Handler handler : rootLogger.getHandlers()) {
                handler.flush();
            }
            if (!debug) {
                printLogFile(err);
            }

            log.log(java.util.logging.Level.INFO, "Extraction completed in {0}ms", duration.toMillis());
            return 0;
        } catch (IOException | IllegalArgumentException e) {
            log.log(java.util.logging.Level.SEVERE, "Fatal error during extraction", e);
            err.println("Error: " + e.getMessage());
            return 1;
        }
    }

    static void printSummary(ExtractionSummary summary, PrintStream out) {
        out.println("\n" + "=".repeat(60));
        out.println("SUMMARY");
        out.println("=".repeat(60));
        for (TableReport table : summary.tables()) {
            String status;
            if (!table.selected()) {
                status = "not selected";
            } else if (table.failure() != null) {
                status = "INCOMPLETE: " + table.failure();
            } else if (!table.complete()) {
                status = "INCOMPLETE";
            } else {
                status = "ok";
            }
            out.printf("%-32s %,12d rows  %,8d skipped  %s\n", table.name(), table.rowsWritten(),
                    table.arityMismatches() + table.malformedTuples(), status);
        }
        out.println("-".repeat(60));
        out.printf("Tables:   %,d\n", summary.tables().size());
        out.printf("Rows:     %,d\n", summary.totalRows());
        out.printf("Lines:    %,d\n", summary.linesRead());
        if (!summary.warningCounts().isEmpty()) {
            out.println("Warnings: " + summary.warningCounts().entrySet().stream()
                    .map(e -> e.getKey() + "=" + e.getValue())
                    .collect(Collectors.joining(", ")));
        }
        if (summary.cancelled()) {
            out.println("Extraction was cancelled before the end of the dump.");
        }
        out.println("=".repeat(60));
    }

    private static void printUsage(PrintStream err) {
        err.println("Usage: sqldumpextract [--debug] [--format csv|jsonl|bin|sqlite] [--charset <name>]");
        err.println("                      [--table <name>]... [--profile <file.yaml> [--profile-name <name>]]");
        err.println("                      <dump.sql> <output>");
        err.println();
        err.println("Options:");
        err.println("  --debug         Enable detailed console logging and disable progress bars");
        err.println("  --format        Output format (default csv)");
        err.println("  --charset       Character encoding of the dump (default UTF-8)");
        err.println("  --table         Extract only the named table(s); repeatable or comma-separated");
        err.println("  --profile       YAML profile file; --profile-name picks a profile (default \"default\")");
        err.println();
        err.println("Notes:");
        err.println("  <output> is a directory of per-table files, or a database file for --format sqlite");
    }

    private static String optionName(String arg) {
        for (String name : List.of("--format", "--charset", "--table", "--profile-name", "--profile")) {
            if (arg.equals(name) || arg.startsWith(name + "=")) {
                return name;
            }
        }
        return null;
    }

    private static String optionValue(String[] args, int i) {
        String arg = args[i];
        if (arg.contains("=")) {
            return arg.substring(arg.indexOf('=') + 1);
        }
        return i + 1 < args.length ? args[i + 1] : null;
    }

    private static String firstNonNull(String... values) {
        for (String value : values) {
            if (value != null && !value.isBlank()) {
                return value;
            }
        }
        return null;
    }

    private static void printLogFile(PrintStream err) {
        try (Stream<Path> paths = Files.list(Paths.get(System.getProperty("java.io.tmpdir")))) {
            paths.filter(p -> p.getFileName().toString().startsWith("sqldumpextract")
                            && p.getFileName().toString().endsWith(".log"))
                    .max((a, b) -> Long.compare(a.toFile().lastModified(), b.toFile().lastModified()))
                    .ifPresent(logFile -> err.println("Log file: " + logFile));
        } catch (IOException e) {
            log.fine(() -> "Could not locate the log file: " + e.getMessage());
        }
    }
}
