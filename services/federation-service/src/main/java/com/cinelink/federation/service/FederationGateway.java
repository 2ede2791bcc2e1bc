package com.cinelink.federation.service;

import com.cinelink.federation.api.dto.CommonMoviesResponse;
import com.cinelink.federation.api.dto.HealthResponse;
import com.cinelink.federation.api.dto.MovieListResponse;
import com.cinelink.federation.api.dto.MovieSearchResponse;
import com.cinelink.federation.api.dto.MovieUpdateResponse;
import com.cinelink.federation.api.dto.MovieUsersResponse;
import com.cinelink.federation.api.dto.UserMoviesResponse;
import com.cinelink.federation.common.FederationException;
import com.cinelink.federation.common.RequestUtils;
import com.cinelink.federation.config.FederationProperties;
import com.cinelink.federation.document.DocumentStoreClient;
import com.cinelink.federation.document.MoviePage;
import com.cinelink.federation.document.MovieRecord;
import com.cinelink.federation.graph.GraphStoreClient;
import com.cinelink.federation.graph.MovieReviewers;
import com.cinelink.federation.graph.PersonRatings;
import com.cinelink.federation.health.CompositeHealth;
import com.cinelink.federation.health.HealthProbe;
import com.cinelink.federation.health.StoreHealth;
import com.cinelink.federation.match.DocumentPattern;
import com.cinelink.federation.match.MatchMode;
import com.cinelink.federation.match.MatchNormalizer;
import com.cinelink.federation.reconcile.ReconciliationEngine;
import com.cinelink.federation.reconcile.ReconciliationResult;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.springframework.stereotype.Service;

/**
 * Entry point for every HTTP operation. Store-specific work lives in the clients and
 * engines; this class only validates input and shapes responses.
 */
@Service
public class FederationGateway {
    private static final String UPDATED = "Movie updated successfully";
    private static final String UNCHANGED = "Movie matched but no field changed";

    private final DocumentStoreClient documentStoreClient;
    private final GraphStoreClient graphStoreClient;
    private final ReconciliationEngine reconciliationEngine;
    private final HealthProbe healthProbe;
    private final MatchNormalizer matchNormalizer;
    private final FederationProperties.Paging paging;

    public FederationGateway(
        DocumentStoreClient documentStoreClient,
        GraphStoreClient graphStoreClient,
        ReconciliationEngine reconciliationEngine,
        HealthProbe healthProbe,
        MatchNormalizer matchNormalizer,
        FederationProperties properties
    ) {
        this.documentStoreClient = documentStoreClient;
        this.graphStoreClient = graphStoreClient;
        this.reconciliationEngine = reconciliationEngine;
        this.healthProbe = healthProbe;
        this.matchNormalizer = matchNormalizer;
        this.paging = properties.getPaging();
    }

    public MovieListResponse listMovies(String pageParam, String limitParam) {
        int page = RequestUtils.positiveInt(pageParam, "page", 1);
        int limit = Math.min(RequestUtils.positiveInt(limitParam, "limit", paging.getDefaultLimit()), paging.getMaxLimit());
        long skip = (long) (page - 1) * limit;

        MoviePage moviePage = documentStoreClient.listPage(skip, limit);

        MovieListResponse response = new MovieListResponse();
        response.setPage(page);
        response.setLimit(limit);
        response.setTotal(moviePage.total());
        response.setCount(moviePage.records().size());
        response.setMovies(moviePage.records());
        return response;
    }

    public MovieSearchResponse searchMovies(String name, String actor) {
        String title = RequestUtils.trimToNull(name);
        String castMember = RequestUtils.trimToNull(actor);
        if (title == null && castMember == null) {
            throw FederationException.validation("At least one of 'name' or 'actor' is required");
        }
        DocumentPattern titlePattern = title == null
            ? null
            : matchNormalizer.documentPattern(title, MatchMode.SUBSTRING_ANYWHERE);
        DocumentPattern castPattern = castMember == null
            ? null
            : matchNormalizer.documentPattern(castMember, MatchMode.SUBSTRING_ANYWHERE);

        List<MovieRecord> movies = documentStoreClient.search(titlePattern, castPattern);

        MovieSearchResponse response = new MovieSearchResponse();
        response.setCount(movies.size());
        response.setMovies(movies);
        return response;
    }

    public MovieUpdateResponse updateMovie(String name, Map<String, Object> body) {
        String title = RequestUtils.require(name, "movie name");
        if (body == null || body.isEmpty()) {
            throw FederationException.validation("Request body must contain at least one field to update");
        }

        long modified = documentStoreClient.updateByTitle(
            matchNormalizer.documentPattern(title, MatchMode.EXACT_CASE_INSENSITIVE),
            body
        );

        MovieUpdateResponse response = new MovieUpdateResponse();
        response.setMessage(modified > 0 ? UPDATED : UNCHANGED);
        response.setModifiedCount(modified);
        return response;
    }

    public CommonMoviesResponse commonMovies() {
        ReconciliationResult result = reconciliationEngine.reconcile();

        CommonMoviesResponse response = new CommonMoviesResponse();
        response.setMongodbCount(result.documentCount());
        response.setNeo4jCount(result.graphCount());
        response.setCommonCount(result.commonCount());
        response.setCommonMovies(result.commonTitles());
        return response;
    }

    public MovieUsersResponse movieUsers(String name) {
        String title = RequestUtils.require(name, "movie name");
        MovieReviewers reviewers = graphStoreClient.reviewersOf(
            matchNormalizer.graphPattern(title, MatchMode.SUBSTRING_ANYWHERE)
        );

        MovieUsersResponse response = new MovieUsersResponse();
        response.setMovie(reviewers.title());
        response.setUsersCount(reviewers.reviewers().size());
        response.setUsers(reviewers.reviewers());
        return response;
    }

    public UserMoviesResponse userMovies(String name) {
        String person = RequestUtils.require(name, "user name");
        PersonRatings ratings = graphStoreClient.moviesRatedBy(
            matchNormalizer.graphPattern(person, MatchMode.SUBSTRING_ANYWHERE)
        );

        UserMoviesResponse response = new UserMoviesResponse();
        response.setUser(ratings.name());
        response.setBorn(ratings.born());
        response.setMoviesRatedCount(ratings.ratedCount());
        response.setRatedMovies(ratings.ratedMovies());
        return response;
    }

    public HealthResponse health() {
        CompositeHealth health = healthProbe.check();

        HealthResponse response = new HealthResponse();
        response.setMongodb(storeStatus(health.document()));
        response.setNeo4j(storeStatus(health.graph()));
        response.setStatus(health.healthy() ? "healthy" : "degraded");
        return response;
    }

    public Map<String, Object> index() {
        Map<String, Object> endpoints = new LinkedHashMap<>();
        endpoints.put("GET /movies", "List movies from MongoDB (page, limit)");
        endpoints.put("GET /movies/search", "Search movies by name and/or actor");
        endpoints.put("PUT /movies/{name}", "Update a movie in MongoDB by exact title");
        endpoints.put("GET /movies/common", "Titles present in both MongoDB and Neo4j");
        endpoints.put("GET /movies/{name}/users", "Users who reviewed a movie in Neo4j");
        endpoints.put("GET /users/{name}", "Movies rated by a user in Neo4j");
        endpoints.put("GET /health", "Connectivity of MongoDB and Neo4j");

        Map<String, Object> response = new LinkedHashMap<>();
        response.put("service", "cinelink federation-service");
        response.put("endpoints", endpoints);
        return response;
    }

    private static HealthResponse.StoreStatus storeStatus(StoreHealth health) {
        return new HealthResponse.StoreStatus(health.connected() ? "connected" : "disconnected", health.error());
    }
}
