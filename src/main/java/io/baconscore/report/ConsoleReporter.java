package io.baconscore.report;

import io.baconscore.graph.ActorPath;
import io.baconscore.graph.PathStep;
import io.baconscore.query.QueryResult;

import java.io.IOException;
import java.io.Writer;
import java.util.List;

/**
 * Plain text output, one {@code Score:} line per query.
 * <p>
 * Unknown actors produce no output here; they are reported on the error channel.
 */
public class ConsoleReporter implements Reporter {

    private final String unreachableLabel;

    public ConsoleReporter(String unreachableLabel) {
        this.unreachableLabel = unreachableLabel;
    }

    @Override
    public String format() {
        return "console";
    }

    @Override
    public void write(QueryResult result, Writer writer) throws IOException {
        switch (result.status()) {
            case SCORED -> {
                writer.write("Score: " + result.score() + "\n");
                if (result.path() != null) {
                    writePath(result.path(), writer);
                }
            }
            case NO_BACON -> writer.write("Score: " + unreachableLabel + "\n");
            case ACTOR_NOT_FOUND -> {
                // stderr only
            }
        }
    }

    /**
     * One line per hop: "  A was in M with B".
     */
    private void writePath(ActorPath path, Writer writer) throws IOException {
        List<PathStep> steps = path.steps();
        for (int i = 0; i < steps.size() - 1; i++) {
            PathStep step = steps.get(i);
            PathStep next = steps.get(i + 1);
            writer.write("  " + step.actor().name()
                    + " was in " + step.movie().title()
                    + " with " + next.actor().name()
                    + "\n");
        }
    }
}
