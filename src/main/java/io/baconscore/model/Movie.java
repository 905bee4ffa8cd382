package io.baconscore.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * A movie node. Induces adjacency between every pair of actors in its cast.
 * <p>
 * Titles are not unique: each heading line in a dataset produces its own Movie.
 */
public final class Movie {

    private final int id;
    private final String title;
    private final List<Actor> cast = new ArrayList<>();
    private final Set<String> castNames = new HashSet<>();

    public Movie(int id, String title) {
        if (id < 0) {
            throw new IllegalArgumentException("Movie id cannot be negative: " + id);
        }
        if (title == null) {
            throw new IllegalArgumentException("Movie title cannot be null");
        }
        this.id = id;
        this.title = title;
    }

    public int id() {
        return id;
    }

    public String title() {
        return title;
    }

    /**
     * Cast in the order actors were linked.
     */
    public List<Actor> cast() {
        return Collections.unmodifiableList(cast);
    }

    /**
     * Checks whether an actor with the given name is already in the cast.
     */
    public boolean hasCastMember(String actorName) {
        return castNames.contains(actorName);
    }

    /**
     * Links both sides of the membership. Returns false when the actor is already
     * in the cast, leaving both lists untouched.
     */
    public boolean addCastMember(Actor actor) {
        if (!castNames.add(actor.name())) {
            return false;
        }
        cast.add(actor);
        actor.addMovie(this);
        return true;
    }

    @Override
    public String toString() {
        return title;
    }
}
