package org.luxbulb.webinfo.enricher;

import com.google.common.util.concurrent.ThreadFactoryBuilder;
import org.apache.commons.cli.CommandLine;
import org.apache.commons.cli.DefaultParser;
import org.apache.commons.cli.HelpFormatter;
import org.apache.commons.cli.Option;
import org.apache.commons.cli.Options;
import org.apache.commons.cli.ParseException;
import org.jetbrains.annotations.NotNull;
import org.luxbulb.webinfo.Common;
import org.luxbulb.webinfo.EnricherConfig;
import org.luxbulb.webinfo.enricher.asn.AsnLookupTable;
import org.luxbulb.webinfo.enricher.asn.Ip2AsnTableLoader;
import org.luxbulb.webinfo.enricher.dns.DnsLookupService;
import org.luxbulb.webinfo.enricher.dns.ResolverFactory;
import org.luxbulb.webinfo.enricher.pipeline.ConcurrentDispatcher;
import org.luxbulb.webinfo.enricher.pipeline.RecordEnrichmentPipeline;
import org.luxbulb.webinfo.enricher.pipeline.ResultChannel;
import org.luxbulb.webinfo.enricher.sink.JsonLinesResultConsumer;
import org.luxbulb.webinfo.enricher.sink.ResultSink;
import org.luxbulb.webinfo.enricher.tls.TlsCertificateProbe;
import org.luxbulb.webinfo.serialization.OriginRecordCsvReader;
import org.slf4j.LoggerFactory;
import org.xbill.DNS.Resolver;

import java.io.FileInputStream;
import java.io.IOException;
import java.io.PrintStream;
import java.io.PrintWriter;
import java.io.UncheckedIOException;
import java.nio.file.InvalidPathException;
import java.nio.file.Path;
import java.security.GeneralSecurityException;
import java.util.Properties;
import java.util.concurrent.Executors;

/**
 * The main class of the {@code webinfo} command-line tool.
 * <p>
 * Reads origins from a CSV file, enriches them concurrently and writes one JSON object per origin
 * to the standard output. Log messages go to the standard error output and to a log file.
 * <p>
 * Exit codes: 0 on success, 1 for an invalid command line, 2 when the input or the properties file
 * cannot be read, 4 when the ASN table, the resolver or the TLS context cannot be initialized.
 */
public class WebInfoRunner {
    private static final org.slf4j.Logger Logger = LoggerFactory.getLogger(WebInfoRunner.class);

    static final int EXIT_OK = 0;
    static final int EXIT_INVALID_ARGUMENTS = 1;
    static final int EXIT_INPUT_ERROR = 2;
    static final int EXIT_INIT_ERROR = 4;

    /**
     * Signals that the run must end with the given exit code.
     */
    static class ExitException extends Exception {
        final int exitCode;

        ExitException(int exitCode) {
            this.exitCode = exitCode;
        }
    }

    public static void main(String[] args) {
        System.exit(run(args, System.out));
    }

    /**
     * Runs the tool.
     *
     * @param args   The command-line arguments.
     * @param output The stream to write the results to.
     * @return The exit code.
     */
    static int run(String[] args, PrintStream output) {
        final var options = makeOptions();

        try {
            final var cmd = parseCommandLine(args, options);
            initLogFile(cmd);
            final var properties = initProperties(cmd);
            return enrich(Path.of(cmd.getOptionValue("csv")), properties, output);
        } catch (ExitException e) {
            return e.exitCode;
        } catch (InterruptedException e) {
            Logger.error("Interrupted");
            Thread.currentThread().interrupt();
            return EXIT_INIT_ERROR;
        }
    }

    private static int enrich(Path csvPath, Properties properties, PrintStream output)
            throws ExitException, InterruptedException {
        final int maxConcurrency;
        try {
            maxConcurrency = Integer.parseInt(properties.getProperty(EnricherConfig.MAX_CONCURRENCY_CONFIG,
                    EnricherConfig.MAX_CONCURRENCY_DEFAULT));
        } catch (NumberFormatException e) {
            Logger.error("Invalid concurrency limit: {}", e.getMessage());
            throw new ExitException(EXIT_INVALID_ARGUMENTS);
        }

        if (maxConcurrency < 1) {
            Logger.error("The concurrency limit must be at least 1");
            throw new ExitException(EXIT_INVALID_ARGUMENTS);
        }

        // Shared read-only state
        final AsnLookupTable asnTable;
        try {
            asnTable = new Ip2AsnTableLoader(properties).load();
        } catch (IOException | RuntimeException e) {
            Logger.error("Cannot load the ASN table: {}", e.getMessage());
            throw new ExitException(EXIT_INIT_ERROR);
        }

        final Resolver resolver;
        final TlsCertificateProbe probe;
        try {
            resolver = ResolverFactory.makeResolver(properties);
            probe = new TlsCertificateProbe(properties);
        } catch (GeneralSecurityException | RuntimeException e) {
            Logger.error("Cannot initialize the lookup services: {}", e.getMessage());
            throw new ExitException(EXIT_INIT_ERROR);
        }

        final var dnsExecutor = Executors.newFixedThreadPool(Math.max(4, maxConcurrency * 2),
                new ThreadFactoryBuilder().setNameFormat("dns-%d").setDaemon(true).build());

        try (probe; var reader = openInput(csvPath)) {
            final var mapper = Common.makeMapper().build();
            final var dns = new DnsLookupService(resolver, dnsExecutor, asnTable);
            final var pipeline = new RecordEnrichmentPipeline(dns, asnTable, probe, properties);
            final var channel = new ResultChannel(maxConcurrency);
            final var consumer = new JsonLinesResultConsumer(output, mapper,
                    Boolean.parseBoolean(properties.getProperty(EnricherConfig.OUTPUT_PRETTY_CONFIG,
                            EnricherConfig.OUTPUT_PRETTY_DEFAULT)));
            final var sink = new ResultSink(channel, consumer,
                    Boolean.parseBoolean(properties.getProperty(EnricherConfig.OUTPUT_ERRORS_CONFIG,
                            EnricherConfig.OUTPUT_ERRORS_DEFAULT)));

            Logger.info("Enriching {} with at most {} records in parallel", csvPath, maxConcurrency);
            sink.start();

            final ConcurrentDispatcher.DispatchSummary summary;
            try {
                summary = new ConcurrentDispatcher(pipeline, channel, maxConcurrency).dispatch(reader);
            } catch (UncheckedIOException e) {
                Logger.error("Cannot read the input: {}", e.getMessage());
                sink.awaitTermination();
                throw new ExitException(EXIT_INPUT_ERROR);
            }

            final var consumed = sink.awaitTermination();
            Logger.info("Finished: {} records enriched, {} invalid rows, {} results written, {} failed",
                    summary.submitted(), summary.invalidInput(), consumed, sink.getFailedCount());
            return EXIT_OK;
        } catch (IOException e) {
            Logger.error("Cannot close the input: {}", e.getMessage());
            return EXIT_INPUT_ERROR;
        } finally {
            dnsExecutor.shutdownNow();
        }
    }

    private static OriginRecordCsvReader openInput(Path csvPath) throws ExitException {
        try {
            return OriginRecordCsvReader.open(csvPath);
        } catch (IOException e) {
            Logger.error("Cannot open the input file {}: {}", csvPath, e.getMessage());
            throw new ExitException(EXIT_INPUT_ERROR);
        }
    }

    /**
     * Parses the command line arguments.
     *
     * @throws ExitException With code 0 if help was requested, or 1 if the arguments are invalid.
     */
    @NotNull
    static CommandLine parseCommandLine(String[] args, Options options) throws ExitException {
        for (var arg : args) {
            if (arg.equals("-h") || arg.equals("--help")) {
                printHelp(options);
                throw new ExitException(EXIT_OK);
            }
        }

        try {
            return new DefaultParser().parse(options, args);
        } catch (ParseException e) {
            System.err.println(e.getMessage());
            printHelp(options);
            throw new ExitException(EXIT_INVALID_ARGUMENTS);
        }
    }

    /**
     * Creates the command line options.
     */
    @NotNull
    static Options makeOptions() {
        final var options = new Options();
        options.addOption("h", "help", false, "Print this help message");

        options.addOption(Option.builder("c")
                .longOpt("csv")
                .desc("Path to the CSV file with the origins (required)")
                .argName("path")
                .hasArg()
                .required()
                .build());
        options.addOption(Option.builder("s")
                .longOpt("size")
                .desc("Maximum number of origins enriched in parallel (default "
                        + EnricherConfig.MAX_CONCURRENCY_DEFAULT + ")")
                .argName("n")
                .hasArg()
                .build());
        options.addOption(Option.builder("d")
                .longOpt("dns")
                .desc("DNS server IP(s) to use, separated by commas (default "
                        + EnricherConfig.DNS_SERVERS_DEFAULT + ")")
                .argName("ip,...")
                .hasArg()
                .build());
        options.addOption(Option.builder("p")
                .longOpt("properties")
                .desc("Path to a configuration file")
                .argName("path")
                .hasArg()
                .build());
        options.addOption(Option.builder("l")
                .longOpt("logfile")
                .desc("Path to the log file (default ./webinfo.log)")
                .argName("path")
                .hasArg()
                .build());
        options.addOption(Option.builder("o")
                .longOpt("option")
                .desc("A properties key/value to add to the configuration")
                .argName("key=value")
                .hasArg()
                .build());

        return options;
    }

    /**
     * Redirects the log file if {@code --logfile} is given.
     *
     * @throws ExitException With code 1 if the path is invalid.
     */
    static void initLogFile(CommandLine cmd) throws ExitException {
        final var logFile = cmd.getOptionValue("logfile");
        if (logFile == null)
            return;

        try {
            LoggingConfigurator.useLogFile(Path.of(logFile));
        } catch (InvalidPathException e) {
            Logger.error("Invalid log file path: {}", e.getMessage());
            throw new ExitException(EXIT_INVALID_ARGUMENTS);
        }
    }

    /**
     * Initializes the properties from the file and the command line. The dedicated options take precedence
     * over the file, the {@code --option} values take precedence over both.
     *
     * @throws ExitException With code 2 if the properties file cannot be read.
     */
    static Properties initProperties(CommandLine cmd) throws ExitException {
        final var props = new Properties();

        if (cmd.hasOption("properties")) {
            final var path = cmd.getOptionValue("properties");
            try (var inStream = new FileInputStream(path)) {
                props.load(inStream);
            } catch (IOException e) {
                Logger.error("Failed to load properties: {}", e.getMessage());
                throw new ExitException(EXIT_INPUT_ERROR);
            }
        }

        final var size = cmd.getOptionValue("size");
        if (size != null) {
            props.put(EnricherConfig.MAX_CONCURRENCY_CONFIG, size);
        }

        final var dns = cmd.getOptionValue("dns");
        if (dns != null) {
            props.put(EnricherConfig.DNS_SERVERS_CONFIG, dns);
        }

        final var cmdLineProperties = cmd.getOptionValues("option");
        if (cmdLineProperties != null) {
            for (var option : cmdLineProperties) {
                if (option.contains("=")) {
                    var parts = option.split("=", 2);
                    props.put(parts[0].trim(), parts[1].trim());
                } else {
                    Logger.warn("Ignoring invalid command-line option: {}", option);
                }
            }
        }

        return props;
    }

    private static void printHelp(Options options) {
        final var formatter = new HelpFormatter();
        final var writer = new PrintWriter(System.err);
        formatter.printHelp(writer, 119, "webinfo --csv <path> [options]", "", options,
                formatter.getLeftPadding(), formatter.getDescPadding(), "");
        writer.flush();
    }
}
