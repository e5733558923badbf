package org.Aayush.geomatch.app;

import org.Aayush.geomatch.core.GeodesicMatcher;
import org.Aayush.geomatch.core.LoggingMatchObserver;
import org.Aayush.geomatch.core.MatcherConfig;
import org.Aayush.geomatch.io.DelimitedPointReader;
import org.Aayush.geomatch.io.DelimitedReaderConfig;
import org.Aayush.geomatch.io.InteractivePointCollector;
import org.Aayush.geomatch.io.LineTextSource;
import org.Aayush.geomatch.io.MatchResultJsonWriter;
import org.Aayush.geomatch.model.GeoMatchException;
import org.Aayush.geomatch.model.PointSet;
import org.Aayush.geomatch.model.ResultSet;
import org.Aayush.geomatch.parse.CoordinateParser;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.PrintStream;
import java.io.PrintWriter;
import java.io.UncheckedIOException;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * Command-line entry point.
 *
 * <pre>
 * geomatch [--candidates=N] [--delimiter=C] [--no-header] &lt;set-a-file&gt; &lt;set-b-file&gt; [output.json]
 * geomatch                      (interactive entry on stdin, prompts on stderr)
 * </pre>
 */
public class Main {
    private static final Logger logger = LoggerFactory.getLogger(Main.class);

    static final int EXIT_OK = 0;
    static final int EXIT_FAILURE = 1;
    static final int EXIT_USAGE = 2;

    private static final String USAGE =
            "Usage: geomatch [--candidates=N] [--delimiter=C] [--no-header] <set-a-file> <set-b-file> [output.json]";

    /**
     * Launches the matcher CLI.
     *
     * @param args command-line arguments.
     */
    public static void main(String[] args) {
        int code = run(args, System.in, System.out, System.err);
        if (code != EXIT_OK) {
            System.exit(code);
        }
    }

    /**
     * Runs the CLI against explicit streams and returns the process exit code.
     */
    static int run(String[] args, InputStream in, PrintStream out, PrintStream err) {
        List<String> positional = new ArrayList<>();
        MatcherConfig.MatcherConfigBuilder matcherConfig = MatcherConfig.builder()
                .observer(new LoggingMatchObserver());
        DelimitedReaderConfig.DelimitedReaderConfigBuilder readerConfig = DelimitedReaderConfig.builder();

        try {
            for (String arg : args) {
                if (arg.startsWith("--candidates=")) {
                    matcherConfig.candidateCount(Integer.parseInt(arg.substring("--candidates=".length())));
                } else if (arg.startsWith("--delimiter=")) {
                    String delimiter = arg.substring("--delimiter=".length());
                    if (delimiter.length() != 1) {
                        throw new IllegalArgumentException("delimiter must be a single character");
                    }
                    readerConfig.delimiter(delimiter.charAt(0));
                } else if (arg.equals("--no-header")) {
                    readerConfig.header(false);
                } else if (arg.startsWith("--")) {
                    throw new IllegalArgumentException("unknown option " + arg);
                } else {
                    positional.add(arg);
                }
            }
            if (positional.size() == 1 || positional.size() > 3) {
                throw new IllegalArgumentException("expected two input files and an optional output file");
            }
        } catch (IllegalArgumentException e) {
            err.println(e.getMessage());
            err.println(USAGE);
            return EXIT_USAGE;
        }

        try {
            GeodesicMatcher matcher = new GeodesicMatcher(matcherConfig.build());
            PointSet setA;
            PointSet setB;
            if (positional.isEmpty()) {
                InteractivePointCollector collector = new InteractivePointCollector(
                        LineTextSource.of(new InputStreamReader(in, StandardCharsets.UTF_8)),
                        CoordinateParser.defaultParser(),
                        err::println
                );
                setA = collector.collect("A");
                setB = collector.collect("B");
            } else {
                DelimitedPointReader reader = new DelimitedPointReader(readerConfig.build());
                setA = reader.read(Path.of(positional.get(0))).points();
                setB = reader.read(Path.of(positional.get(1))).points();
            }

            ResultSet results = matcher.match(setA, setB);
            MatchResultJsonWriter writer = new MatchResultJsonWriter();
            if (positional.size() == 3) {
                Path output = Path.of(positional.get(2));
                writer.write(results, output);
                logger.info("Wrote {} matches to {}", results.size(), output);
            } else {
                Writer stdout = new PrintWriter(out, false, StandardCharsets.UTF_8);
                writer.write(results, stdout);
                out.println();
            }
            return EXIT_OK;
        } catch (IOException | UncheckedIOException e) {
            logger.error("I/O failure: {}", e.getMessage(), e);
            err.println("I/O failure: " + e.getMessage());
            return EXIT_FAILURE;
        } catch (GeoMatchException | IllegalArgumentException e) {
            logger.error("Match failed: {}", e.getMessage());
            err.println(e.getMessage());
            return EXIT_FAILURE;
        }
    }
}
