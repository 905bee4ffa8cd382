package io.baconscore.graph;

import io.baconscore.model.Actor;
import io.baconscore.model.Movie;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class MovieGraphTest {

    private MovieGraph graph;

    @BeforeEach
    void setUp() {
        graph = new MovieGraph();
    }

    @Test
    void getOrCreateActor_returnsSameInstanceForSameName() {
        Actor first = graph.getOrCreateActor("Kevin Bacon");
        Actor second = graph.getOrCreateActor("Kevin Bacon");

        assertThat(second).isSameAs(first);
        assertThat(graph.actorCount()).isEqualTo(1);
    }

    @Test
    void getOrCreateActor_assignsIdsInCreationOrder() {
        Actor bacon = graph.getOrCreateActor("Kevin Bacon");
        Actor lithgow = graph.getOrCreateActor("John Lithgow");

        assertThat(bacon.id()).isZero();
        assertThat(lithgow.id()).isEqualTo(1);
        assertThat(graph.actors()).containsExactly(bacon, lithgow);
    }

    @Test
    void findActor_isExactAndCaseSensitive() {
        graph.getOrCreateActor("Kevin Bacon");

        assertThat(graph.findActor("Kevin Bacon")).isPresent();
        assertThat(graph.findActor("kevin bacon")).isEmpty();
        assertThat(graph.findActor("Kevin Bacon ")).isEmpty();
    }

    @Test
    void registerActor_rejectsDuplicateName() {
        graph.getOrCreateActor("Kevin Bacon");

        assertThatThrownBy(() -> graph.registerActor(new Actor(1, "Kevin Bacon")))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("Duplicate actor");
    }

    @Test
    void link_isBidirectional() {
        Actor bacon = graph.getOrCreateActor("Kevin Bacon");
        Movie footloose = graph.newMovie("Footloose");

        boolean added = graph.link(bacon, footloose);

        assertThat(added).isTrue();
        assertThat(bacon.movies()).containsExactly(footloose);
        assertThat(footloose.cast()).containsExactly(bacon);
        assertThat(graph.linkCount()).isEqualTo(1);
    }

    @Test
    void link_sameActorTwice_doesNotDuplicateEitherSide() {
        Actor bacon = graph.getOrCreateActor("Kevin Bacon");
        Movie footloose = graph.newMovie("Footloose");

        graph.link(bacon, footloose);
        boolean addedAgain = graph.link(bacon, footloose);

        assertThat(addedAgain).isFalse();
        assertThat(bacon.movies()).hasSize(1);
        assertThat(footloose.cast()).hasSize(1);
        assertThat(graph.linkCount()).isEqualTo(1);
    }

    @Test
    void link_largeCastWithRepeats_keepsOneEntryPerName() {
        Movie crowd = graph.newMovie("Crowd Scene");
        for (int round = 0; round < 3; round++) {
            for (int i = 0; i < 5_000; i++) {
                graph.link(graph.getOrCreateActor("Extra " + i), crowd);
            }
        }

        assertThat(crowd.cast()).hasSize(5_000);
        assertThat(crowd.hasCastMember("Extra 4999")).isTrue();
        assertThat(crowd.hasCastMember("Extra 5000")).isFalse();
        assertThat(graph.findActor("Extra 0").orElseThrow().movies()).containsExactly(crowd);
        assertThat(graph.linkCount()).isEqualTo(5_000);
    }

    @Test
    void link_rejectsActorFromAnotherGraph() {
        Actor stranger = new MovieGraph().getOrCreateActor("Kevin Bacon");
        Movie footloose = graph.newMovie("Footloose");

        assertThatThrownBy(() -> graph.link(stranger, footloose))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void registerMovie_keepsOrderAndAllowsRepeatedTitles() {
        Movie first = graph.newMovie("Footloose");
        Movie remake = graph.newMovie("Footloose");

        graph.registerMovie(first);
        graph.registerMovie(remake);

        assertThat(graph.movies()).containsExactly(first, remake);
        assertThat(first.id()).isNotEqualTo(remake.id());
    }

    @Test
    void registerMovie_rejectsSameMovieTwice() {
        Movie footloose = graph.newMovie("Footloose");
        graph.registerMovie(footloose);

        assertThatThrownBy(() -> graph.registerMovie(footloose))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("already registered");
    }

    @Test
    void views_areUnmodifiable() {
        Actor bacon = graph.getOrCreateActor("Kevin Bacon");

        assertThatThrownBy(() -> graph.actors().clear())
                .isInstanceOf(UnsupportedOperationException.class);
        assertThatThrownBy(() -> bacon.movies().clear())
                .isInstanceOf(UnsupportedOperationException.class);
    }
}
