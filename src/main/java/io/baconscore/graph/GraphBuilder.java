package io.baconscore.graph;

import io.baconscore.model.Actor;
import io.baconscore.model.Movie;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

/**
 * Builds a {@link MovieGraph} from a line-oriented dataset.
 * <p>
 * Dataset grammar, one record per line:
 * <ul>
 *   <li>Empty or whitespace-leading line: separator, ignored</li>
 *   <li>Line containing {@code ':'}: movie heading, the title follows the first colon and one space</li>
 *   <li>Any other line: an actor in the most recent movie, the whole line is the name</li>
 * </ul>
 * Example:
 * <pre>
 * Movie: Footloose
 * Kevin Bacon
 * John Lithgow
 *
 * Movie: Apollo 13
 * Kevin Bacon
 * Tom Hanks
 * </pre>
 */
public class GraphBuilder {

    private final MovieGraph graph;

    private Movie currentMovie;
    private int lineNumber;

    public GraphBuilder() {
        this(new MovieGraph());
    }

    /**
     * Create a builder that adds to an existing graph.
     */
    public GraphBuilder(MovieGraph graph) {
        this.graph = graph;
    }

    /**
     * Parses a dataset file as UTF-8. Bytes that are not valid UTF-8 are replaced with
     * U+FFFD instead of failing the whole file, the same way the query stream is read.
     */
    public static MovieGraph fromFile(Path dataset) throws IOException, MalformedDatasetException {
        try (BufferedReader reader = new BufferedReader(
                new InputStreamReader(Files.newInputStream(dataset), StandardCharsets.UTF_8))) {
            return new GraphBuilder().read(reader).build();
        }
    }

    /**
     * Parses dataset lines held in memory.
     */
    public static MovieGraph fromLines(List<String> lines) throws MalformedDatasetException {
        GraphBuilder builder = new GraphBuilder();
        for (String line : lines) {
            builder.acceptLine(line);
        }
        return builder.build();
    }

    /**
     * Feeds every line of the reader into the builder. The reader is not closed.
     */
    public GraphBuilder read(BufferedReader reader) throws IOException, MalformedDatasetException {
        String line;
        while ((line = reader.readLine()) != null) {
            acceptLine(line);
        }
        return this;
    }

    /**
     * Processes a single dataset line (without its line terminator).
     */
    public GraphBuilder acceptLine(String line) throws MalformedDatasetException {
        lineNumber++;

        if (line.isEmpty() || Character.isWhitespace(line.charAt(0))) {
            return this;
        }

        if (isMovieHeading(line)) {
            finishMovie();
            currentMovie = graph.newMovie(parseTitle(line));
            return this;
        }

        if (currentMovie == null) {
            throw new MalformedDatasetException(lineNumber, line);
        }
        Actor actor = graph.getOrCreateActor(line);
        graph.link(actor, currentMovie);
        return this;
    }

    /**
     * Registers the movie in progress, if any, and returns the graph.
     */
    public MovieGraph build() {
        finishMovie();
        return graph;
    }

    private void finishMovie() {
        if (currentMovie != null) {
            graph.registerMovie(currentMovie);
            currentMovie = null;
        }
    }

    static boolean isMovieHeading(String line) {
        return line.indexOf(':') >= 0;
    }

    /**
     * Extracts the title of a heading line.
     * E.g., "Movie: Footloose" -> "Footloose", "Title:Tron" -> "Tron"
     */
    static String parseTitle(String line) {
        int start = line.indexOf(':') + 1;
        if (start < line.length() && line.charAt(start) == ' ') {
            start++;
        }
        return line.substring(start);
    }

    /**
     * Thrown when an actor line appears before any movie heading.
     */
    public static class MalformedDatasetException extends Exception {

        private final int lineNumber;
        private final String line;

        public MalformedDatasetException(int lineNumber, String line) {
            super("Line " + lineNumber + ": actor '" + line + "' appears before any movie heading");
            this.lineNumber = lineNumber;
            this.line = line;
        }

        public int getLineNumber() {
            return lineNumber;
        }

        public String getLine() {
            return line;
        }
    }
}
