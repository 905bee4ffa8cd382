package io.baconscore.report;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.baconscore.graph.ActorPath;
import io.baconscore.graph.PathStep;
import io.baconscore.query.QueryResult;

import java.io.IOException;
import java.io.Writer;
import java.util.List;

/**
 * Formats query results as JSON lines for machine processing: one compact object per query.
 */
public class JsonReporter implements Reporter {

    private final ObjectMapper mapper;

    public JsonReporter() {
        this.mapper = createMapper();
    }

    private ObjectMapper createMapper() {
        ObjectMapper m = new ObjectMapper();
        m.setSerializationInclusion(JsonInclude.Include.NON_NULL);
        m.disable(JsonGenerator.Feature.AUTO_CLOSE_TARGET);
        return m;
    }

    @Override
    public String format() {
        return "json";
    }

    @Override
    public void write(QueryResult result, Writer writer) throws IOException {
        mapper.writeValue(writer, toJsonResult(result));
        writer.write("\n");
    }

    private JsonResult toJsonResult(QueryResult result) {
        return new JsonResult(
                result.query(),
                result.status().name(),
                result.status() == QueryResult.Status.SCORED ? result.score() : null,
                result.path() != null ? toJsonPath(result.path()) : null
        );
    }

    private List<JsonStep> toJsonPath(ActorPath path) {
        return path.steps().stream()
                .map(this::toJsonStep)
                .toList();
    }

    private JsonStep toJsonStep(PathStep step) {
        return new JsonStep(
                step.actor().name(),
                step.movie() != null ? step.movie().title() : null
        );
    }

    /**
     * JSON structure for a single result.
     */
    public record JsonResult(
            String query,
            String status,
            Integer score,
            List<JsonStep> path
    ) {}

    public record JsonStep(
            String actor,
            String movie
    ) {}
}
