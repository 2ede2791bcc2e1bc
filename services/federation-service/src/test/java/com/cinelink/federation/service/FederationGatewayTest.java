package com.cinelink.federation.service;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyMap;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.ArgumentMatchers.isNull;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

import com.cinelink.federation.api.dto.CommonMoviesResponse;
import com.cinelink.federation.api.dto.HealthResponse;
import com.cinelink.federation.api.dto.MovieListResponse;
import com.cinelink.federation.api.dto.MovieUpdateResponse;
import com.cinelink.federation.api.dto.MovieUsersResponse;
import com.cinelink.federation.api.dto.UserMoviesResponse;
import com.cinelink.federation.common.ErrorKind;
import com.cinelink.federation.common.FederationException;
import com.cinelink.federation.config.FederationProperties;
import com.cinelink.federation.document.DocumentStoreClient;
import com.cinelink.federation.document.MoviePage;
import com.cinelink.federation.graph.GraphStoreClient;
import com.cinelink.federation.graph.MovieReviewers;
import com.cinelink.federation.graph.PersonRatings;
import com.cinelink.federation.graph.RatedMovie;
import com.cinelink.federation.graph.Reviewer;
import com.cinelink.federation.health.CompositeHealth;
import com.cinelink.federation.health.HealthProbe;
import com.cinelink.federation.health.StoreHealth;
import com.cinelink.federation.match.DocumentPattern;
import com.cinelink.federation.match.MatchNormalizer;
import com.cinelink.federation.reconcile.ReconciliationEngine;
import com.cinelink.federation.reconcile.ReconciliationResult;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class FederationGatewayTest {

    @Mock
    private DocumentStoreClient documentStoreClient;

    @Mock
    private GraphStoreClient graphStoreClient;

    @Mock
    private ReconciliationEngine reconciliationEngine;

    @Mock
    private HealthProbe healthProbe;

    private FederationGateway gateway;

    @BeforeEach
    void setUp() {
        gateway = new FederationGateway(
            documentStoreClient,
            graphStoreClient,
            reconciliationEngine,
            healthProbe,
            new MatchNormalizer(false),
            new FederationProperties()
        );
    }

    @Test
    void listMoviesUsesDefaultPaging() {
        when(documentStoreClient.listPage(0L, 20)).thenReturn(new MoviePage(List.of(), 0L));

        MovieListResponse response = gateway.listMovies(null, null);

        assertThat(response.getPage()).isEqualTo(1);
        assertThat(response.getLimit()).isEqualTo(20);
        assertThat(response.getCount()).isZero();
        assertThat(response.isSuccess()).isTrue();
    }

    @Test
    void listMoviesComputesSkipFromPage() {
        when(documentStoreClient.listPage(20L, 10)).thenReturn(new MoviePage(List.of(), 21349L));

        MovieListResponse response = gateway.listMovies("3", "10");

        assertThat(response.getTotal()).isEqualTo(21349L);
        assertThat(response.getPage()).isEqualTo(3);
    }

    @Test
    void listMoviesClampsOversizedLimit() {
        when(documentStoreClient.listPage(0L, 500)).thenReturn(new MoviePage(List.of(), 0L));

        MovieListResponse response = gateway.listMovies("1", "100000");

        assertThat(response.getLimit()).isEqualTo(500);
    }

    @Test
    void listMoviesRejectsInvalidPaging() {
        assertValidation(() -> gateway.listMovies("0", "20"));
        assertValidation(() -> gateway.listMovies("1", "-5"));
        assertValidation(() -> gateway.listMovies("two", null));
        verifyNoInteractions(documentStoreClient);
    }

    @Test
    void searchRequiresNameOrActor() {
        assertValidation(() -> gateway.searchMovies(null, null));
        assertValidation(() -> gateway.searchMovies("  ", ""));
        verifyNoInteractions(documentStoreClient);
    }

    @Test
    void searchByActorOnlyBuildsCastPattern() {
        when(documentStoreClient.search(isNull(), any(DocumentPattern.class))).thenReturn(List.of());

        gateway.searchMovies(null, " Keanu ");

        ArgumentCaptor<DocumentPattern> castCaptor = ArgumentCaptor.forClass(DocumentPattern.class);
        verify(documentStoreClient).search(isNull(), castCaptor.capture());
        assertThat(castCaptor.getValue().regex()).isEqualTo("Keanu");
        assertThat(castCaptor.getValue().options()).isEqualTo("i");
    }

    @Test
    void updateRejectsMissingOrEmptyBody() {
        assertValidation(() -> gateway.updateMovie("The Matrix", null));
        assertValidation(() -> gateway.updateMovie("The Matrix", Map.of()));
        verifyNoInteractions(documentStoreClient);
    }

    @Test
    void updateMatchesWholeTitleIgnoringCase() {
        when(documentStoreClient.updateByTitle(any(DocumentPattern.class), anyMap())).thenReturn(1L);

        MovieUpdateResponse response = gateway.updateMovie("The Matrix", Map.of("plot", "Neo wakes up."));

        ArgumentCaptor<DocumentPattern> titleCaptor = ArgumentCaptor.forClass(DocumentPattern.class);
        verify(documentStoreClient).updateByTitle(titleCaptor.capture(), eq(Map.of("plot", "Neo wakes up.")));
        assertThat(titleCaptor.getValue().regex()).isEqualTo("^\\QThe Matrix\\E$");
        assertThat(response.getModifiedCount()).isEqualTo(1L);
        assertThat(response.getMessage()).isEqualTo("Movie updated successfully");
    }

    @Test
    void updateReportsUnchangedRecord() {
        when(documentStoreClient.updateByTitle(any(DocumentPattern.class), anyMap())).thenReturn(0L);

        MovieUpdateResponse response = gateway.updateMovie("The Matrix", Map.of("plot", "same"));

        assertThat(response.getModifiedCount()).isZero();
        assertThat(response.getMessage()).isEqualTo("Movie matched but no field changed");
    }

    @Test
    void commonMoviesCopiesReconciliationCounts() {
        when(reconciliationEngine.reconcile()).thenReturn(new ReconciliationResult(3, 2, List.of("The Matrix")));

        CommonMoviesResponse response = gateway.commonMovies();

        assertThat(response.getMongodbCount()).isEqualTo(3);
        assertThat(response.getNeo4jCount()).isEqualTo(2);
        assertThat(response.getCommonCount()).isEqualTo(1);
        assertThat(response.getCommonMovies()).containsExactly("The Matrix");
    }

    @Test
    void movieUsersSearchesGraphBySubstring() {
        when(graphStoreClient.reviewersOf("(?i).*matrix.*")).thenReturn(new MovieReviewers(
            "The Matrix",
            List.of(new Reviewer("Jessica Thompson", 95L, "An amazing journey"))
        ));

        MovieUsersResponse response = gateway.movieUsers("matrix");

        assertThat(response.getMovie()).isEqualTo("The Matrix");
        assertThat(response.getUsersCount()).isEqualTo(1);
    }

    @Test
    void userMoviesReportsRatedCount() {
        when(graphStoreClient.moviesRatedBy("(?i).*jessica.*")).thenReturn(new PersonRatings(
            "Jessica Thompson",
            null,
            1,
            List.of(new RatedMovie("The Matrix", 1999, 95L, null))
        ));

        UserMoviesResponse response = gateway.userMovies("jessica");

        assertThat(response.getUser()).isEqualTo("Jessica Thompson");
        assertThat(response.getBorn()).isNull();
        assertThat(response.getMoviesRatedCount()).isEqualTo(1);
    }

    @Test
    void healthIsDegradedWhenOneStoreIsDown() {
        when(healthProbe.check()).thenReturn(new CompositeHealth(
            StoreHealth.up(),
            StoreHealth.down("Unable to connect to localhost:7687")
        ));

        HealthResponse response = gateway.health();

        assertThat(response.getStatus()).isEqualTo("degraded");
        assertThat(response.isHealthy()).isFalse();
        assertThat(response.getMongodb().getStatus()).isEqualTo("connected");
        assertThat(response.getNeo4j().getStatus()).isEqualTo("disconnected");
        assertThat(response.getNeo4j().getError()).isEqualTo("Unable to connect to localhost:7687");
    }

    @Test
    void indexListsEveryEndpoint() {
        @SuppressWarnings("unchecked")
        Map<String, Object> endpoints = (Map<String, Object>) gateway.index().get("endpoints");

        assertThat(endpoints).containsKeys(
            "GET /movies",
            "GET /movies/search",
            "PUT /movies/{name}",
            "GET /movies/common",
            "GET /movies/{name}/users",
            "GET /users/{name}",
            "GET /health"
        );
    }

    private static void assertValidation(Runnable call) {
        assertThatThrownBy(call::run)
            .isInstanceOf(FederationException.class)
            .extracting(ex -> ((FederationException) ex).getKind())
            .isEqualTo(ErrorKind.VALIDATION);
    }
}
