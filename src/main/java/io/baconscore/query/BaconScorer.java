package io.baconscore.query;

import io.baconscore.graph.MovieGraph;
import io.baconscore.graph.PathFinder;
import io.baconscore.model.Actor;

import java.util.Optional;

/**
 * Answers "how far is this actor from the reference actor" against a built graph.
 */
public class BaconScorer {

    private final MovieGraph graph;
    private final PathFinder pathFinder;
    private final String referenceActor;
    private final boolean tracePath;

    public BaconScorer(MovieGraph graph, String referenceActor) {
        this(graph, referenceActor, false);
    }

    /**
     * @param graph          The graph to query
     * @param referenceActor Name of the actor every query is measured against
     * @param tracePath      Whether results should carry the connecting path
     */
    public BaconScorer(MovieGraph graph, String referenceActor, boolean tracePath) {
        this.graph = graph;
        this.pathFinder = new PathFinder(graph);
        this.referenceActor = referenceActor;
        this.tracePath = tracePath;
    }

    /**
     * Scores a single actor name.
     * <p>
     * The queried actor is resolved first, so an unknown name is reported as
     * {@link QueryResult.Status#ACTOR_NOT_FOUND} even when the reference actor is missing too.
     */
    public QueryResult score(String actorName) {
        Optional<Actor> actor = graph.findActor(actorName);
        if (actor.isEmpty()) {
            return QueryResult.notFound(actorName);
        }

        // No reference actor in the graph, nothing can connect to it
        Optional<Actor> reference = graph.findActor(referenceActor);
        if (reference.isEmpty()) {
            return QueryResult.noBacon(actorName);
        }

        if (tracePath) {
            return pathFinder.shortestPath(reference.get(), actor.get())
                    .map(path -> QueryResult.scored(actorName, path.degrees(), path))
                    .orElseGet(() -> QueryResult.noBacon(actorName));
        }

        int distance = pathFinder.shortestDistance(reference.get(), actor.get());
        if (distance == PathFinder.UNREACHABLE) {
            return QueryResult.noBacon(actorName);
        }
        return QueryResult.scored(actorName, distance, null);
    }
}
