package io.baconscore.query;

import io.baconscore.graph.ActorPath;

/**
 * Outcome of a single query.
 *
 * @param query  The actor name as it was asked
 * @param status What the query resolved to
 * @param score  Distance to the reference actor (only meaningful for {@link Status#SCORED})
 * @param path   The connecting path when path tracing is enabled and a score exists, else null
 */
public record QueryResult(
        String query,
        Status status,
        int score,
        ActorPath path
) {
    public enum Status {
        /** Distance to the reference actor was computed. */
        SCORED,
        /** The actor exists but has no connection, or the reference actor is not in the graph. */
        NO_BACON,
        /** No actor with this name exists in the graph. */
        ACTOR_NOT_FOUND
    }

    public QueryResult {
        if (status == null) {
            throw new IllegalArgumentException("Status cannot be null");
        }
        if (status == Status.SCORED && score < 0) {
            throw new IllegalArgumentException("Scored result needs a non-negative score: " + score);
        }
    }

    public static QueryResult scored(String query, int score, ActorPath path) {
        return new QueryResult(query, Status.SCORED, score, path);
    }

    public static QueryResult noBacon(String query) {
        return new QueryResult(query, Status.NO_BACON, -1, null);
    }

    public static QueryResult notFound(String query) {
        return new QueryResult(query, Status.ACTOR_NOT_FOUND, -1, null);
    }

    public boolean isFound() {
        return status != Status.ACTOR_NOT_FOUND;
    }
}
