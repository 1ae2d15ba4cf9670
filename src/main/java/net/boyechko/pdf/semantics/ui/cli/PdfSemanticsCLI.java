/*
 * PDF-Semantics - Accessible roles and MathML from tagged PDFs
 * Copyright (C) 2025 Richard Boyechko
 *
 * This program is free software: you can redistribute it and/or modify
 * it under the terms of the GNU Affero General Public License as published
 * by the Free Software Foundation, either version 3 of the License, or
 * (at your option) any later version.
 *
 * This program is distributed in the hope that it will be useful,
 * but WITHOUT ANY WARRANTY; without even the implied warranty of
 * MERCHANTABILITY or FITNESS FOR A PARTICULAR PURPOSE.  See the
 * GNU Affero General Public License for more details.
 *
 * You should have received a copy of the GNU Affero General Public License
 * along with this program.  If not, see <https://www.gnu.org/licenses/>.
 */
package net.boyechko.pdf.semantics.ui.cli;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.LoggerContext;
import java.io.IOException;
import java.io.OutputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import net.boyechko.pdf.semantics.core.SemanticsReport;
import net.boyechko.pdf.semantics.core.SemanticsService;
import net.boyechko.pdf.semantics.core.VerbosityLevel;
import net.boyechko.pdf.semantics.document.PdfCustodian;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

public class PdfSemanticsCLI {
    private static final String REPORT_SUFFIX = "_semantics";

    private static Logger logger;

    // Configuration record to hold parsed CLI arguments
    public record CLIConfig(
            Path inputPath,
            String password,
            boolean mathOnly,
            boolean locatePages,
            boolean printStructureTree,
            Path reportPath,
            VerbosityLevel verbosity) {
        public CLIConfig {
            if (inputPath == null) {
                throw new IllegalArgumentException("Input path is required");
            }
            if (verbosity == null) {
                throw new IllegalArgumentException("Verbosity level is required");
            }
        }
    }

    // Custom exception for CLI errors
    public static class CLIException extends Exception {
        public CLIException(String message) {
            super(message);
        }
    }

    /** Mutable builder that accumulates parsed CLI arguments and resolves the report path. */
    static class CLIConfigBuilder {
        Path inputPath;
        String password;
        boolean mathOnly;
        boolean locatePages;
        boolean printStructureTree;
        boolean generateReport;
        Path reportPath;
        VerbosityLevel verbosity = VerbosityLevel.NORMAL;

        CLIConfig build() throws CLIException {
            if (inputPath == null) {
                throw new CLIException("No input file specified");
            }
            if (!Files.exists(inputPath)) {
                throw new CLIException("File not found: " + inputPath);
            }
            resolveReportPath();
            return new CLIConfig(
                    inputPath,
                    password,
                    mathOnly,
                    locatePages,
                    printStructureTree,
                    reportPath,
                    verbosity);
        }

        private void resolveReportPath() {
            String baseName = inputPath.getFileName().toString().replaceFirst("[.][^.]+$", "");
            String reportFilename = baseName + REPORT_SUFFIX + ".txt";
            if (generateReport && reportPath == null) {
                reportPath = inputPath.resolveSibling(reportFilename);
            } else if (reportPath != null && Files.isDirectory(reportPath)) {
                reportPath = reportPath.resolve(reportFilename);
            }
        }
    }

    public static void main(String[] args) {
        try {
            if (isHelpRequested(args)) {
                System.out.println(usageMessage());
                return;
            }
            CLIConfig config = parseArguments(args);
            configureLogging(config.verbosity());
            logger().info(
                            "Starting analysis of {} with verbosity level {}",
                            config.inputPath(),
                            config.verbosity());
            if (!processFile(config)) {
                System.exit(1);
            }
        } catch (CLIException e) {
            System.err.println("Error: " + e.getMessage());
            System.exit(1);
        }
    }

    static CLIConfig parseArguments(String[] args) throws CLIException {
        if (args.length == 0) {
            throw new CLIException("No input file specified\n" + usageMessage());
        }

        CLIConfigBuilder b = new CLIConfigBuilder();

        for (int i = 0; i < args.length; i++) {
            if (args[i].startsWith("--report=")) {
                b.reportPath = Paths.get(args[i].substring("--report=".length()));
                b.generateReport = true;
            } else if (args[i].startsWith("-r=")) {
                b.reportPath = Paths.get(args[i].substring("-r=".length()));
                b.generateReport = true;
            } else {
                switch (args[i]) {
                    case "-p", "--password" -> {
                        if (i + 1 < args.length) {
                            b.password = args[++i];
                        } else {
                            throw new CLIException("Password not specified after -p");
                        }
                    }
                    case "-q", "--quiet" -> b.verbosity = VerbosityLevel.QUIET;
                    case "-v", "--verbose" -> b.verbosity = VerbosityLevel.VERBOSE;
                    case "-vv", "--debug" -> b.verbosity = VerbosityLevel.DEBUG;
                    case "-m", "--math-only" -> b.mathOnly = true;
                    case "-l", "--locate" -> b.locatePages = true;
                    case "-t", "--print-tree" -> b.printStructureTree = true;
                    case "-r", "--report" -> b.generateReport = true;
                    default -> {
                        if (args[i].startsWith("-")) {
                            throw new CLIException("Unknown option: " + args[i]);
                        } else if (b.inputPath == null) {
                            b.inputPath = Paths.get(args[i]);
                        } else {
                            throw new CLIException("Multiple input files specified");
                        }
                    }
                }
            }
        }

        return b.build();
    }

    private static void configureLogging(VerbosityLevel verbosity) {
        if (LoggerFactory.getILoggerFactory() instanceof LoggerContext ctx) {
            ctx.getLogger(Logger.ROOT_LOGGER_NAME).setLevel(Level.toLevel(verbosity.logLevel()));
        }
    }

    private static Logger logger() {
        if (logger == null) {
            logger = LoggerFactory.getLogger(PdfSemanticsCLI.class);
        }
        return logger;
    }

    /** Returns false if the document could not be analyzed. */
    private static boolean processFile(CLIConfig config) {
        OutputStream reportFile = null;
        PrintStream output = System.out;

        try {
            reportFile = openReportStream(config);
            if (reportFile != null) {
                output =
                        new PrintStream(
                                new TeeOutputStream(System.out, reportFile),
                                true,
                                StandardCharsets.UTF_8);
            }

            CliProcessingListener listener =
                    new CliProcessingListener(output, config.verbosity());
            SemanticsService service =
                    new SemanticsService.SemanticsServiceBuilder()
                            .withPdfCustodian(
                                    new PdfCustodian(config.inputPath(), config.password()))
                            .withListener(listener)
                            .withMathOnly(config.mathOnly())
                            .withLocatePages(config.locatePages())
                            .withPrintStructureTree(config.printStructureTree())
                            .build();

            SemanticsReport report = service.analyze();
            return report.isTagged();
        } catch (Exception e) {
            System.err.println("✗ Failed to analyze " + config.inputPath() + ": " + e.getMessage());
            logger().debug("Analysis failed", e);
            return false;
        } finally {
            if (reportFile != null) {
                output.flush();
                try {
                    reportFile.close();
                } catch (IOException e) {
                    logger().warn("Failed to close report file", e);
                }
            }
        }
    }

    private static OutputStream openReportStream(CLIConfig config) throws IOException {
        if (config.reportPath() == null) {
            return null;
        }
        Path reportParent = config.reportPath().getParent();
        if (reportParent != null) {
            Files.createDirectories(reportParent);
        }
        logger().info("Saving report to {}", config.reportPath());
        return Files.newOutputStream(config.reportPath());
    }

    /** Writes to two output streams simultaneously, like the Unix tee command. */
    private static class TeeOutputStream extends OutputStream {
        private final OutputStream out1;
        private final OutputStream out2;

        TeeOutputStream(OutputStream out1, OutputStream out2) {
            this.out1 = out1;
            this.out2 = out2;
        }

        @Override
        public void write(int b) throws IOException {
            out1.write(b);
            out2.write(b);
        }

        @Override
        public void write(byte[] b, int off, int len) throws IOException {
            out1.write(b, off, len);
            out2.write(b, off, len);
        }

        @Override
        public void flush() throws IOException {
            out1.flush();
            out2.flush();
        }
    }

    static boolean isHelpRequested(String[] args) {
        for (String arg : args) {
            if ("-h".equals(arg) || "--help".equals(arg)) {
                return true;
            }
        }
        return false;
    }

    static String usageMessage() {
        return "Usage: java PdfSemanticsCLI [-q|-v|-vv] [-m] [-l] [-t] [-p password] [-r[=report]] <input.pdf>\n"
                + "  -h, --help        Show this help message\n"
                + "  -q, --quiet       Print only the recovered MathML, one formula per line\n"
                + "  -v, --verbose     List every element that has a semantic role\n"
                + "  -vv, --debug      Show all debug information\n"
                + "  -m, --math-only   Report formulas only\n"
                + "  -l, --locate      Resolve the page of every element\n"
                + "  -t, --print-tree  Print the structure tree with roles\n"
                + "  -p, --password    Password for encrypted PDFs\n"
                + "  -r, --report      Save output to report file (auto-named from input)\n"
                + "                    Use -r=<file> or --report=<file> for a custom path\n"
                + "Examples:\n"
                + "  java PdfSemanticsCLI -v document.pdf\n"
                + "  java PdfSemanticsCLI -q -m document.pdf\n"
                + "  java PdfSemanticsCLI --report=roles.txt -l -t document.pdf";
    }
}
