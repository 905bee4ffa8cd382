package io.baconscore.graph;

import io.baconscore.model.Actor;
import io.baconscore.model.Movie;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Optional;
import java.util.Queue;

/**
 * Finds shortest connections between actors using BFS.
 * <p>
 * Two actors are adjacent when they share at least one movie. Neighbors are
 * enumerated in insertion order (an actor's movies, then each movie's cast), so
 * repeated searches over the same graph discover actors in the same order.
 * <p>
 * All traversal state is local to a single search. The graph is never modified,
 * which makes a PathFinder safe to share between threads.
 */
public class PathFinder {

    /**
     * Distance returned when the target cannot be reached from the source.
     */
    public static final int UNREACHABLE = -1;

    private final MovieGraph graph;

    public PathFinder(MovieGraph graph) {
        this.graph = graph;
    }

    /**
     * Returns the number of shared-movie hops between two actors.
     *
     * @return the distance, 0 if source and target are the same actor, or {@link #UNREACHABLE}
     */
    public int shortestDistance(Actor source, Actor target) {
        if (source == target) {
            return 0;
        }
        Traversal traversal = search(source, target, false);
        return traversal.found() ? traversal.level[target.id()] : UNREACHABLE;
    }

    /**
     * Finds a shortest path from {@code target} back to {@code source}.
     * <p>
     * The returned path starts at the target and ends at the source, each step naming
     * the movie that connects it to the next actor.
     *
     * @return the path, or empty if the actors are not connected
     */
    public Optional<ActorPath> shortestPath(Actor source, Actor target) {
        if (source == target) {
            return Optional.of(new ActorPath(List.of(PathStep.last(source))));
        }
        Traversal traversal = search(source, target, true);
        if (!traversal.found()) {
            return Optional.empty();
        }

        List<PathStep> steps = new ArrayList<>();
        Actor current = target;
        while (current != source) {
            int id = current.id();
            steps.add(PathStep.via(current, traversal.viaMovie[id]));
            current = traversal.predecessor[id];
        }
        steps.add(PathStep.last(source));
        return Optional.of(new ActorPath(steps));
    }

    /**
     * Level-order search from source, stopping as soon as target is discovered.
     */
    private Traversal search(Actor source, Actor target, boolean trackPath) {
        requireMember(source);
        requireMember(target);
        Traversal traversal = new Traversal(graph.actorCount(), trackPath);
        Queue<Actor> queue = new ArrayDeque<>();

        traversal.visited[source.id()] = true;
        traversal.level[source.id()] = 0;
        queue.add(source);

        while (!queue.isEmpty()) {
            Actor current = queue.poll();
            int nextLevel = traversal.level[current.id()] + 1;

            for (Movie movie : current.movies()) {
                for (Actor coStar : movie.cast()) {
                    int id = coStar.id();
                    if (traversal.visited[id]) {
                        continue;
                    }
                    traversal.visited[id] = true;
                    traversal.level[id] = nextLevel;
                    if (trackPath) {
                        traversal.predecessor[id] = current;
                        traversal.viaMovie[id] = movie;
                    }

                    if (coStar == target) {
                        traversal.target = coStar;
                        return traversal;
                    }
                    queue.add(coStar);
                }
            }
        }
        return traversal;
    }

    private void requireMember(Actor actor) {
        if (graph.findActor(actor.name()).orElse(null) != actor) {
            throw new IllegalArgumentException("Actor is not part of this graph: " + actor.name());
        }
    }

    /**
     * Per-search state, indexed by actor id.
     */
    private static final class Traversal {
        final boolean[] visited;
        final int[] level;
        final Actor[] predecessor;
        final Movie[] viaMovie;
        Actor target;

        Traversal(int actorCount, boolean trackPath) {
            this.visited = new boolean[actorCount];
            this.level = new int[actorCount];
            Arrays.fill(level, UNREACHABLE);
            this.predecessor = trackPath ? new Actor[actorCount] : null;
            this.viaMovie = trackPath ? new Movie[actorCount] : null;
        }

        boolean found() {
            return target != null;
        }
    }
}
