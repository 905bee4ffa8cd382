package io.baconscore.graph;

import io.baconscore.model.Actor;
import io.baconscore.model.Movie;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * The actor/movie graph.
 * Owns every Actor and Movie record and keeps them in insertion order.
 * <p>
 * The store only grows. Once built it is read-only, so any number of
 * {@link PathFinder} traversals may run over it at the same time.
 */
public class MovieGraph {

    private final List<Actor> actors = new ArrayList<>();
    private final Map<String, Actor> actorsByName = new HashMap<>();
    private final List<Movie> movies = new ArrayList<>();
    private final Set<Movie> registeredMovies = Collections.newSetFromMap(new IdentityHashMap<>());
    private int nextMovieId;
    private int linkCount;

    /**
     * Returns the actor with exactly this name, or empty if not found.
     */
    public Optional<Actor> findActor(String name) {
        return Optional.ofNullable(actorsByName.get(name));
    }

    /**
     * Returns the actor with this name, creating and registering it first if needed.
     */
    public Actor getOrCreateActor(String name) {
        Actor existing = actorsByName.get(name);
        if (existing != null) {
            return existing;
        }
        Actor actor = new Actor(actors.size(), name);
        registerActor(actor);
        return actor;
    }

    /**
     * Registers an actor. Its id must be the next free actor id.
     */
    public void registerActor(Actor actor) {
        if (actorsByName.containsKey(actor.name())) {
            throw new IllegalArgumentException("Duplicate actor: " + actor.name());
        }
        if (actor.id() != actors.size()) {
            throw new IllegalArgumentException("Expected actor id " + actors.size() + " but got " + actor.id());
        }
        actors.add(actor);
        actorsByName.put(actor.name(), actor);
    }

    /**
     * Allocates a movie with the next movie id. The movie is not part of the graph
     * until {@link #registerMovie(Movie)} is called.
     */
    public Movie newMovie(String title) {
        return new Movie(nextMovieId++, title);
    }

    /**
     * Registers a movie, appending it to the movie list.
     */
    public void registerMovie(Movie movie) {
        if (!registeredMovies.add(movie)) {
            throw new IllegalArgumentException("Movie already registered: " + movie.title());
        }
        movies.add(movie);
    }

    /**
     * Links an actor and a movie in both directions.
     *
     * @return false if an actor with the same name is already in the movie's cast
     */
    public boolean link(Actor actor, Movie movie) {
        if (findActor(actor.name()).orElse(null) != actor) {
            throw new IllegalArgumentException("Actor is not part of this graph: " + actor.name());
        }
        boolean added = movie.addCastMember(actor);
        if (added) {
            linkCount++;
        }
        return added;
    }

    /**
     * Returns all actors in creation order. The index of an actor is its id.
     */
    public List<Actor> actors() {
        return Collections.unmodifiableList(actors);
    }

    /**
     * Returns all registered movies in registration order.
     */
    public List<Movie> movies() {
        return Collections.unmodifiableList(movies);
    }

    public int actorCount() {
        return actors.size();
    }

    public int movieCount() {
        return movies.size();
    }

    /**
     * Returns the number of actor/movie memberships.
     */
    public int linkCount() {
        return linkCount;
    }
}
