package io.baconscore.graph;

import io.baconscore.model.Actor;
import io.baconscore.model.Movie;

/**
 * A single step in an actor path: the actor and the movie that leads to the next step.
 * <p>
 * For example, if John Lithgow and Kevin Bacon were both in Footloose and we walk
 * from Lithgow to Bacon, the step for Lithgow is (actor=John Lithgow, movie=Footloose).
 *
 * @param actor The actor at this step
 * @param movie The movie shared with the next actor (null for the last step)
 */
public record PathStep(
        Actor actor,
        Movie movie
) {
    public PathStep {
        if (actor == null) {
            throw new IllegalArgumentException("Path step actor cannot be null");
        }
    }

    /**
     * Creates the final step of a path (no outgoing movie).
     */
    public static PathStep last(Actor actor) {
        return new PathStep(actor, null);
    }

    /**
     * Creates a step that continues to the next actor via the given movie.
     */
    public static PathStep via(Actor actor, Movie movie) {
        return new PathStep(actor, movie);
    }
}
