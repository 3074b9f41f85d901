/*
 * Copyright (C) 2025 The Certvet Authors
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *      http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package org.certvet.openjdk;

import java.io.File;
import java.io.IOException;
import java.io.InputStream;
import java.io.PrintStream;
import java.io.PrintWriter;
import java.util.List;
import java.util.Locale;
import java.util.logging.Level;
import java.util.logging.LogManager;
import java.util.logging.Logger;
import org.apache.commons.cli.CommandLine;
import org.apache.commons.cli.DefaultParser;
import org.apache.commons.cli.HelpFormatter;
import org.apache.commons.cli.Option;
import org.apache.commons.cli.Options;
import org.apache.commons.cli.ParseException;
import org.certvet.CertChain;
import org.certvet.ChainValidator;
import org.certvet.TrustChecker;
import org.certvet.TrustStore;
import org.certvet.TrustStoreLoader;
import org.certvet.TrustStoreSnapshot;
import org.certvet.ValidationException;
import org.certvet.ValidationReport;
import org.certvet.filter.Filter;
import org.certvet.filter.FilterSyntaxException;
import org.certvet.output.OutputFormat;
import org.certvet.output.StoreListFormatter;
import org.certvet.output.ValidationReportFormatter;
import org.json.JSONObject;

/**
 * Command line entry point: {@code certvet validate|list|version}.
 */
public final class Main {
    private static final Logger logger = Logger.getLogger(Main.class.getName());

    static final String COMMAND_VALIDATE = "validate";
    static final String COMMAND_LIST = "list";
    static final String COMMAND_VERSION = "version";

    private final PrintStream out;
    private final PrintStream err;
    private final ChainSource chainSource;

    public Main(PrintStream out, PrintStream err) {
        this(out, err, null);
    }

    /**
     * @param chainSource source of server chains, or {@code null} to connect with
     *     {@link ChainFetcher}
     */
    Main(PrintStream out, PrintStream err, ChainSource chainSource) {
        this.out = out;
        this.err = err;
        this.chainSource = chainSource;
    }

    public static void main(String[] args) {
        configureLogging();
        System.exit(new Main(System.out, System.err).run(args));
    }

    private static void configureLogging() {
        InputStream in = Main.class.getResourceAsStream("/logging.properties");
        if (in == null) {
            return;
        }
        try {
            try {
                LogManager.getLogManager().readConfiguration(in);
            } finally {
                in.close();
            }
        } catch (IOException e) {
            logger.log(Level.WARNING, "Could not read logging configuration", e);
        }
    }

    /** Runs one command and returns the process exit status. */
    public int run(String[] args) {
        if (args.length == 0 || isHelp(args[0])) {
            printUsage();
            return ExitCodes.SUCCESS;
        }
        String command = args[0];
        String[] rest = new String[args.length - 1];
        System.arraycopy(args, 1, rest, 0, rest.length);

        Options options = optionsFor(command);
        if (options == null) {
            return fail("unknown command \"" + command + "\"");
        }
        CommandLine cmd;
        try {
            cmd = new DefaultParser().parse(options, rest);
        } catch (ParseException e) {
            return fail(e.getMessage());
        }
        if (cmd.hasOption("help")) {
            printHelp(command, options);
            return ExitCodes.SUCCESS;
        }
        if (cmd.hasOption("verbose")) {
            Logger.getLogger("org.certvet").setLevel(Level.FINE);
        }

        if (COMMAND_VALIDATE.equals(command)) {
            return validate(cmd);
        } else if (COMMAND_LIST.equals(command)) {
            return list(cmd);
        }
        return version(cmd);
    }

    private int validate(CommandLine cmd) {
        List<String> args = cmd.getArgList();
        if (args.size() != 1) {
            return fail("validate requires exactly one endpoint argument, got " + args.size());
        }
        Endpoint endpoint;
        int timeoutMillis;
        try {
            endpoint = Endpoint.parse(args.get(0));
            timeoutMillis = cmd.hasOption("timeout")
                    ? parseTimeout(cmd.getOptionValue("timeout"))
                    : HostProperties.timeoutMillis();
        } catch (IllegalArgumentException e) {
            return fail(e.getMessage());
        }
        String filter = cmd.getOptionValue("filter");

        TrustStoreSnapshot snapshot;
        try {
            snapshot = loadSnapshot(cmd);
        } catch (IOException e) {
            return fail("loading trust stores: " + e.getMessage());
        }
        ChainValidator validator = ChainValidator.builder(snapshot.getRegistry())
                .setParallelism(HostProperties.parallelism())
                .setHostnameVerification(cmd.hasOption("verify-hostname"))
                .build();
        TrustChecker checker = new TrustChecker(snapshot, validator, ToolVersion.get());

        try {
            // Reject a bad or empty selection before touching the network.
            if (checker.selectStores(filter).isEmpty()) {
                return fail("no trust stores match filter");
            }
        } catch (FilterSyntaxException e) {
            return fail(e.getMessage());
        }

        ChainSource source = chainSource != null ? chainSource : new ChainFetcher(timeoutMillis);
        CertChain chain;
        try {
            chain = source.fetch(endpoint);
        } catch (IOException e) {
            logger.log(Level.FINE, "Fetching " + endpoint + " failed", e);
            return fail(e.getMessage());
        }

        ValidationReport report;
        try {
            report = checker.check(chain, filter);
        } catch (FilterSyntaxException e) {
            return fail(e.getMessage());
        } catch (ValidationException e) {
            return fail(e.getMessage());
        }
        out.println(format(cmd).render(new ValidationReportFormatter(report)));
        return report.allPassed() ? ExitCodes.SUCCESS : ExitCodes.TRUST_FAILURE;
    }

    private int list(CommandLine cmd) {
        if (!cmd.getArgList().isEmpty()) {
            return fail("list takes no arguments");
        }
        TrustStoreSnapshot snapshot;
        try {
            snapshot = loadSnapshot(cmd);
        } catch (IOException e) {
            return fail("loading trust stores: " + e.getMessage());
        }
        List<TrustStore> stores;
        try {
            String expression = cmd.getOptionValue("filter");
            Filter filter = expression == null || expression.isEmpty()
                    ? null : Filter.parse(expression);
            stores = Filter.filterStores(snapshot.getStores(), filter);
        } catch (FilterSyntaxException e) {
            return fail(e.getMessage());
        }
        OutputFormat format = format(cmd);
        boolean full = format == OutputFormat.JSON || cmd.hasOption("wide");
        StoreListFormatter formatter =
                StoreListFormatter.fromStores(stores, snapshot.getRegistry(), full);
        if (formatter.isEmpty()) {
            return ExitCodes.SUCCESS;
        }
        out.println(format.render(formatter));
        return ExitCodes.SUCCESS;
    }

    private int version(CommandLine cmd) {
        if (format(cmd) == OutputFormat.JSON) {
            out.println(new JSONObject().put("version", ToolVersion.get()).toString());
        } else {
            out.println("certvet " + ToolVersion.get());
        }
        return ExitCodes.SUCCESS;
    }

    private static OutputFormat format(CommandLine cmd) {
        return cmd.hasOption("json") ? OutputFormat.JSON : OutputFormat.TEXT;
    }

    private static TrustStoreSnapshot loadSnapshot(CommandLine cmd) throws IOException {
        File dir = cmd.hasOption("data-dir")
                ? new File(cmd.getOptionValue("data-dir"))
                : HostProperties.dataDirectory();
        if (dir == null) {
            return TrustStoreLoader.loadFromClasspath();
        }
        logger.fine("Loading trust stores from " + dir);
        return TrustStoreLoader.load(dir.toPath());
    }

    /**
     * Parses a timeout such as {@code 10s}, {@code 1500ms} or {@code 1m}. A bare number is
     * read as milliseconds.
     */
    static int parseTimeout(String value) {
        String v = value.trim().toLowerCase(Locale.ROOT);
        long multiplier = 1;
        if (v.endsWith("ms")) {
            v = v.substring(0, v.length() - 2);
        } else if (v.endsWith("s")) {
            multiplier = 1000;
            v = v.substring(0, v.length() - 1);
        } else if (v.endsWith("m")) {
            multiplier = 60000;
            v = v.substring(0, v.length() - 1);
        }
        long millis;
        try {
            millis = Long.parseLong(v) * multiplier;
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("invalid timeout \"" + value + "\"", e);
        }
        if (millis <= 0 || millis > Integer.MAX_VALUE) {
            throw new IllegalArgumentException("timeout out of range: " + value);
        }
        return (int) millis;
    }

    static Options optionsFor(String command) {
        Options options = new Options();
        options.addOption(Option.builder("h").longOpt("help").desc("Show help").build());
        options.addOption(Option.builder("v").longOpt("verbose")
                .desc("Log diagnostic details to stderr").build());
        options.addOption(Option.builder("j").longOpt("json").desc("Output as JSON").build());
        if (COMMAND_VERSION.equals(command)) {
            return options;
        }
        if (!COMMAND_VALIDATE.equals(command) && !COMMAND_LIST.equals(command)) {
            return null;
        }
        options.addOption(Option.builder("f").longOpt("filter").hasArg().argName("expr")
                .desc("Restrict trust stores, e.g. \"ios>=16,android>=10\"").build());
        options.addOption(Option.builder("d").longOpt("data-dir").hasArg().argName("dir")
                .desc("Directory holding certificates.csv and stores.csv").build());
        if (COMMAND_VALIDATE.equals(command)) {
            options.addOption(Option.builder().longOpt("timeout").hasArg().argName("duration")
                    .desc("Connection timeout, e.g. 10s or 500ms (default 10s)").build());
            options.addOption(Option.builder().longOpt("verify-hostname")
                    .desc("Also require the leaf to match the endpoint host name").build());
        } else {
            options.addOption(Option.builder("w").longOpt("wide")
                    .desc("Show full fingerprints").build());
        }
        return options;
    }

    private static boolean isHelp(String arg) {
        return "-h".equals(arg) || "--help".equals(arg) || "help".equals(arg);
    }

    private void printUsage() {
        out.println("certvet checks a server's certificate chain against platform root stores.");
        out.println();
        out.println("Usage:");
        out.println("  certvet validate <host[:port]> [-j] [-f filter] [--timeout 10s]");
        out.println("  certvet list [-j] [-w] [-f filter]");
        out.println("  certvet version [-j]");
        out.println();
        out.println("Run \"certvet <command> --help\" for the options of a command.");
    }

    private void printHelp(String command, Options options) {
        PrintWriter pw = new PrintWriter(out);
        new HelpFormatter().printHelp(pw, HelpFormatter.DEFAULT_WIDTH, "certvet " + command,
                null, options, HelpFormatter.DEFAULT_LEFT_PAD, HelpFormatter.DEFAULT_DESC_PAD,
                null, true);
        pw.flush();
    }

    private int fail(String message) {
        err.println("Error: " + message);
        return ExitCodes.INPUT_ERROR;
    }
}
