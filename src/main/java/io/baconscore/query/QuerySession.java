package io.baconscore.query;

import io.baconscore.report.Reporter;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.PrintWriter;
import java.io.Writer;

/**
 * Interactive query loop: one actor name per input line until end of stream.
 * <p>
 * An unknown actor is reported on the error channel and the loop moves on; it only
 * affects the final status.
 */
public class QuerySession {

    static final String ACTOR_NOT_FOUND_MESSAGE = "Actor Could Not be Found.";

    private final BaconScorer scorer;
    private final Reporter reporter;
    private final Writer out;
    private final PrintWriter err;

    private int queriesAnswered;
    private int actorsNotFound;

    public QuerySession(BaconScorer scorer, Reporter reporter, Writer out, PrintWriter err) {
        this.scorer = scorer;
        this.reporter = reporter;
        this.out = out;
        this.err = err;
    }

    /**
     * Answers every query in the reader.
     *
     * @return 0 if every queried actor was found, 1 otherwise
     */
    public int run(BufferedReader queries) throws IOException {
        String line;
        while ((line = queries.readLine()) != null) {
            answer(line);
        }
        return actorsNotFound == 0 ? 0 : 1;
    }

    /**
     * Answers a single query and writes its result.
     */
    public QueryResult answer(String actorName) throws IOException {
        QueryResult result = scorer.score(actorName);
        queriesAnswered++;

        if (!result.isFound()) {
            actorsNotFound++;
            err.println(ACTOR_NOT_FOUND_MESSAGE);
            err.flush();
        }

        reporter.write(result, out);
        out.flush();
        return result;
    }

    public int getQueriesAnswered() {
        return queriesAnswered;
    }

    public int getActorsNotFound() {
        return actorsNotFound;
    }
}
