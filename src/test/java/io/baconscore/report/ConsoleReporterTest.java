package io.baconscore.report;

import io.baconscore.graph.GraphBuilder;
import io.baconscore.graph.MovieGraph;
import io.baconscore.query.BaconScorer;
import io.baconscore.query.QueryResult;
import org.junit.jupiter.api.Test;

import java.io.StringWriter;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class ConsoleReporterTest {

    private final ConsoleReporter reporter = new ConsoleReporter("No Bacon!");

    @Test
    void scored_printsScoreLine() {
        assertThat(reporter.toString(QueryResult.scored("John Lithgow", 1, null)))
                .isEqualTo("Score: 1\n");
    }

    @Test
    void noBacon_printsUnreachableLabel() {
        assertThat(reporter.toString(QueryResult.noBacon("Tom Hanks")))
                .isEqualTo("Score: No Bacon!\n");
        assertThat(new ConsoleReporter("unreachable").toString(QueryResult.noBacon("Tom Hanks")))
                .isEqualTo("Score: unreachable\n");
    }

    @Test
    void notFound_printsNothing() {
        assertThat(reporter.toString(QueryResult.notFound("Ghost"))).isEmpty();
    }

    @Test
    void scoredWithPath_printsOneLinePerHop() throws Exception {
        MovieGraph graph = GraphBuilder.fromLines(List.of(
                "Movie: A", "X", "Kevin Bacon",
                "Movie: B", "X", "Y"
        ));
        QueryResult result = new BaconScorer(graph, "Kevin Bacon", true).score("Y");

        StringWriter writer = new StringWriter();
        reporter.write(result, writer);

        assertThat(writer.toString()).isEqualTo("""
                Score: 2
                  Y was in B with X
                  X was in A with Kevin Bacon
                """);
    }

    @Test
    void referenceActorWithPath_printsScoreOnly() throws Exception {
        MovieGraph graph = GraphBuilder.fromLines(List.of("Movie: Footloose", "Kevin Bacon"));
        QueryResult result = new BaconScorer(graph, "Kevin Bacon", true).score("Kevin Bacon");

        assertThat(reporter.toString(result)).isEqualTo("Score: 0\n");
    }
}
