package io.baconscore;

import io.baconscore.graph.GraphBuilder;
import io.baconscore.graph.MovieGraph;
import io.baconscore.query.BaconScorer;
import io.baconscore.query.QuerySession;
import io.baconscore.report.ConsoleReporter;
import io.baconscore.report.GraphPrinter;
import io.baconscore.report.JsonReporter;
import io.baconscore.report.Reporter;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.OutputStreamWriter;
import java.io.PrintStream;
import java.io.PrintWriter;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.concurrent.Callable;

/**
 * CLI entry point for the bacon-score tool.
 */
@Command(
        name = "bacon-score",
        mixinStandardHelpOptions = true,
        version = "bacon-score 1.0.0",
        description = "Reads actor names from standard input and prints each actor's Bacon Number "
                + "computed from a movie/cast dataset.",
        footer = {
                "",
                "Examples:",
                "  bacon-score movies.txt < queries.txt",
                "  echo 'John Lithgow' | bacon-score -l movies.txt",
                "  bacon-score movies.txt --reference 'Tom Hanks' --output-format json"
        }
)
public class BaconScoreCli implements Callable<Integer> {

    @Parameters(
            index = "0",
            paramLabel = "DATASET",
            description = "Dataset file: movie headings ('Movie: Title') each followed by one actor per line"
    )
    private Path dataset;

    @Option(
            names = {"-l", "--path"},
            description = "Print the chain of actors and movies behind each score"
    )
    private boolean showPath;

    @Option(
            names = {"-c", "--config"},
            description = "Path to configuration YAML file"
    )
    private Path configFile;

    @Option(
            names = {"-r", "--reference"},
            description = "Reference actor to measure against (default from configuration: Kevin Bacon)"
    )
    private String referenceActor;

    @Option(
            names = {"-o", "--output-format"},
            description = "Output format: console (default), json",
            defaultValue = "console"
    )
    private OutputFormat outputFormat;

    @Option(
            names = {"--dump-graph"},
            description = "Print every movie and its cast before answering queries"
    )
    private boolean dumpGraph;

    @Option(
            names = {"-v", "--verbose"},
            description = "Enable verbose output"
    )
    private boolean verbose;

    public enum OutputFormat {
        console,
        json
    }

    private final InputStream in;
    private final PrintStream out;
    private final PrintStream err;

    public BaconScoreCli() {
        this(System.in, System.out, System.err);
    }

    BaconScoreCli(InputStream in, PrintStream out, PrintStream err) {
        this.in = in;
        this.out = out;
        this.err = err;
    }

    @Override
    public Integer call() {
        try {
            if (!Files.isRegularFile(dataset) || !Files.isReadable(dataset)) {
                err.println("Error: Could not open the dataset: " + dataset);
                return 1;
            }

            ScoreConfig config = loadConfig();
            String reference = config.getReferenceActor();

            log("Loading dataset " + dataset + "...");
            MovieGraph graph = GraphBuilder.fromFile(dataset);
            log("  " + graph.actorCount() + " actors, " + graph.movieCount() + " movies, "
                    + graph.linkCount() + " appearances");
            if (graph.findActor(reference).isEmpty()) {
                log("  Reference actor '" + reference + "' is not in the dataset, every score will be '"
                        + config.getUnreachableLabel() + "'");
            }

            PrintWriter stdout = new PrintWriter(new OutputStreamWriter(out, StandardCharsets.UTF_8));
            PrintWriter stderr = new PrintWriter(new OutputStreamWriter(err, StandardCharsets.UTF_8));

            if (dumpGraph) {
                GraphPrinter.print(graph, stdout);
            }

            Reporter reporter = createReporter(config);
            log("Answering queries against '" + reference + "' (" + reporter.format() + " output)");
            BaconScorer scorer = new BaconScorer(graph, reference, showPath);
            QuerySession session = new QuerySession(scorer, reporter, stdout, stderr);

            BufferedReader queries = new BufferedReader(new InputStreamReader(in, StandardCharsets.UTF_8));
            int status = session.run(queries);

            log("Answered " + session.getQueriesAnswered() + " queries ("
                    + session.getActorsNotFound() + " not found)");
            return status;

        } catch (GraphBuilder.MalformedDatasetException e) {
            err.println("Error: Malformed dataset " + dataset + ": " + e.getMessage());
            if (verbose) {
                e.printStackTrace(err);
            }
            return 1;
        } catch (IOException e) {
            err.println("Error: " + e.getMessage());
            if (verbose) {
                e.printStackTrace(err);
            }
            return 1;
        }
    }

    /**
     * Default configuration, then the config file, then command-line overrides.
     */
    private ScoreConfig loadConfig() throws IOException {
        ScoreConfig config = ScoreConfig.loadDefault();

        if (configFile != null) {
            if (!Files.exists(configFile)) {
                throw new IOException("Config file does not exist: " + configFile);
            }
            log("Loading configuration from: " + configFile);
            config = config.merge(ScoreConfig.loadFromFile(configFile));
        }

        if (referenceActor != null) {
            config = config.withReferenceActor(referenceActor);
        }
        return config;
    }

    private Reporter createReporter(ScoreConfig config) {
        return switch (outputFormat) {
            case console -> new ConsoleReporter(config.getUnreachableLabel());
            case json -> new JsonReporter();
        };
    }

    private void log(String message) {
        if (verbose) {
            err.println(message);
        }
    }

    /**
     * Builds the command line. Usage errors exit with status 1 rather than picocli's default 2.
     */
    static CommandLine commandLine(BaconScoreCli cli) {
        CommandLine cmd = new CommandLine(cli);
        cmd.setOut(new PrintWriter(new OutputStreamWriter(cli.out, StandardCharsets.UTF_8), true));
        cmd.setErr(new PrintWriter(new OutputStreamWriter(cli.err, StandardCharsets.UTF_8), true));
        cmd.setParameterExceptionHandler((ex, args) -> {
            CommandLine failed = ex.getCommandLine();
            PrintWriter writer = failed.getErr();
            writer.println("Error: " + ex.getMessage());
            failed.usage(writer);
            return 1;
        });
        return cmd;
    }

    public static void main(String[] args) {
        int exitCode = commandLine(new BaconScoreCli()).execute(args);
        System.exit(exitCode);
    }
}
