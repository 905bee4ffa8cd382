package io.baconscore.report;

import io.baconscore.graph.MovieGraph;
import io.baconscore.model.Actor;
import io.baconscore.model.Movie;

import java.io.IOException;
import java.io.Writer;

/**
 * Lists every movie with its cast, for checking how a dataset was parsed.
 * <pre>
 * MOVIE: Footloose
 * 	ACTOR: Kevin Bacon
 * 	ACTOR: John Lithgow
 * </pre>
 */
public final class GraphPrinter {

    private GraphPrinter() {
    }

    public static void print(MovieGraph graph, Writer writer) throws IOException {
        for (Movie movie : graph.movies()) {
            writer.write("MOVIE: " + movie.title() + "\n");
            for (Actor actor : movie.cast()) {
                writer.write("\tACTOR: " + actor.name() + "\n");
            }
        }
        writer.flush();
    }
}
