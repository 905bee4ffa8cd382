package io.baconscore.report;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.baconscore.graph.GraphBuilder;
import io.baconscore.graph.MovieGraph;
import io.baconscore.query.BaconScorer;
import io.baconscore.query.QueryResult;
import org.junit.jupiter.api.Test;

import java.io.StringWriter;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class JsonReporterTest {

    private final JsonReporter reporter = new JsonReporter();
    private final ObjectMapper mapper = new ObjectMapper();

    @Test
    void scored_writesOneCompactLine() throws Exception {
        String json = reporter.toString(QueryResult.scored("John Lithgow", 1, null));

        assertThat(json).endsWith("\n");
        assertThat(json.trim()).doesNotContain("\n");

        JsonNode node = mapper.readTree(json);
        assertThat(node.get("query").asText()).isEqualTo("John Lithgow");
        assertThat(node.get("status").asText()).isEqualTo("SCORED");
        assertThat(node.get("score").asInt()).isEqualTo(1);
        assertThat(node.has("path")).isFalse();
    }

    @Test
    void noBaconAndNotFound_omitScore() throws Exception {
        JsonNode noBacon = mapper.readTree(reporter.toString(QueryResult.noBacon("Tom Hanks")));
        JsonNode notFound = mapper.readTree(reporter.toString(QueryResult.notFound("Ghost")));

        assertThat(noBacon.get("status").asText()).isEqualTo("NO_BACON");
        assertThat(noBacon.has("score")).isFalse();
        assertThat(notFound.get("status").asText()).isEqualTo("ACTOR_NOT_FOUND");
    }

    @Test
    void path_isWrittenAsSteps() throws Exception {
        MovieGraph graph = GraphBuilder.fromLines(List.of(
                "Movie: A", "X", "Kevin Bacon",
                "Movie: B", "X", "Y"
        ));
        QueryResult result = new BaconScorer(graph, "Kevin Bacon", true).score("Y");

        JsonNode path = mapper.readTree(reporter.toString(result)).get("path");

        assertThat(path.size()).isEqualTo(3);
        assertThat(path.get(0).get("actor").asText()).isEqualTo("Y");
        assertThat(path.get(0).get("movie").asText()).isEqualTo("B");
        assertThat(path.get(2).get("actor").asText()).isEqualTo("Kevin Bacon");
        assertThat(path.get(2).has("movie")).isFalse();
    }

    @Test
    void multipleResults_leaveWriterOpen() throws Exception {
        StringWriter writer = new StringWriter();

        reporter.write(QueryResult.scored("A", 1, null), writer);
        reporter.write(QueryResult.scored("B", 2, null), writer);

        assertThat(writer.toString().split("\n")).hasSize(2);
    }
}
