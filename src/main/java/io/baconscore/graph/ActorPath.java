package io.baconscore.graph;

import io.baconscore.model.Actor;

import java.util.List;

/**
 * A shortest path between two actors, starting at the queried actor and ending
 * at the reference actor.
 *
 * @param steps [from, actor1, ..., to], each step carrying the movie that leads to the next one
 */
public record ActorPath(List<PathStep> steps) {

    public ActorPath {
        if (steps == null || steps.isEmpty()) {
            throw new IllegalArgumentException("Path must contain at least one step");
        }
        steps = List.copyOf(steps);
    }

    /**
     * Returns the number of shared-movie hops.
     */
    public int degrees() {
        return steps.size() - 1;
    }

    public Actor from() {
        return steps.get(0).actor();
    }

    public Actor to() {
        return steps.get(steps.size() - 1).actor();
    }

    /**
     * Returns just the actor names, in path order.
     */
    public List<String> actorNames() {
        return steps.stream()
                .map(step -> step.actor().name())
                .toList();
    }
}
