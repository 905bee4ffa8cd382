package io.baconscore.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * An actor node in the movie graph.
 * <p>
 * Identity is the name; the id is a dense index assigned by the owning
 * {@link io.baconscore.graph.MovieGraph} and is used to address per-traversal state.
 */
public final class Actor {

    private final int id;
    private final String name;
    private final List<Movie> movies = new ArrayList<>();

    public Actor(int id, String name) {
        if (id < 0) {
            throw new IllegalArgumentException("Actor id cannot be negative: " + id);
        }
        if (name == null || name.isEmpty()) {
            throw new IllegalArgumentException("Actor name cannot be null or empty");
        }
        this.id = id;
        this.name = name;
    }

    public int id() {
        return id;
    }

    public String name() {
        return name;
    }

    /**
     * Movies this actor appears in, in the order they were linked.
     */
    public List<Movie> movies() {
        return Collections.unmodifiableList(movies);
    }

    /**
     * Appends a movie. Only {@link Movie#addCastMember} calls this so that both
     * sides of the relationship stay consistent.
     */
    void addMovie(Movie movie) {
        movies.add(movie);
    }

    @Override
    public String toString() {
        return name;
    }
}
