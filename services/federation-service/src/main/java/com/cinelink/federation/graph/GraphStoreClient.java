package com.cinelink.federation.graph;

import com.cinelink.federation.common.FederationException;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

@Component
public class GraphStoreClient {
    private static final Logger logger = LoggerFactory.getLogger(GraphStoreClient.class);

    // OPTIONAL MATCH keeps a movie without reviews as one row whose collected entry has a null name.
    static final String REVIEWERS_OF =
        "MATCH (m:Movie) WHERE m.title =~ $pattern "
            + "WITH m ORDER BY m.title LIMIT 1 "
            + "OPTIONAL MATCH (p:Person)-[r:REVIEWED]->(m) "
            + "RETURN m.title AS movie_title, "
            + "collect({name: p.name, rating: r.rating, summary: r.summary}) AS users";

    static final String MOVIES_RATED_BY =
        "MATCH (p:Person) WHERE p.name =~ $pattern "
            + "WITH p ORDER BY p.name LIMIT 1 "
            + "OPTIONAL MATCH (p)-[r:REVIEWED]->(m:Movie) "
            + "RETURN p.name AS name, p.born AS born, "
            + "collect({title: m.title, released: m.released, rating: r.rating, summary: r.summary}) AS movies";

    static final String ALL_MOVIE_TITLES =
        "MATCH (m:Movie) WHERE m.title IS NOT NULL "
            + "RETURN DISTINCT m.title AS title LIMIT $limit";

    static final String PING = "RETURN 1 AS ok";

    private final GraphQueryExecutor executor;

    public GraphStoreClient(GraphQueryExecutor executor) {
        this.executor = executor;
    }

    public MovieReviewers reviewersOf(String titlePattern) {
        List<Map<String, Object>> rows = executor.read(REVIEWERS_OF, Map.of("pattern", titlePattern));
        if (rows.isEmpty() || rows.get(0).get("movie_title") == null) {
            throw FederationException.notFound("Movie not found in Neo4j");
        }
        Map<String, Object> row = rows.get(0);
        List<Reviewer> reviewers = new ArrayList<>();
        for (Map<?, ?> entry : entries(row.get("users"))) {
            Object name = entry.get("name");
            if (name == null) {
                continue;
            }
            reviewers.add(new Reviewer(name.toString(), number(entry.get("rating")), text(entry.get("summary"))));
        }
        String title = row.get("movie_title").toString();
        logger.debug("graph.reviewers_of title='{}' reviewers={}", title, reviewers.size());
        return new MovieReviewers(title, reviewers);
    }

    public PersonRatings moviesRatedBy(String namePattern) {
        List<Map<String, Object>> rows = executor.read(MOVIES_RATED_BY, Map.of("pattern", namePattern));
        if (rows.isEmpty() || rows.get(0).get("name") == null) {
            throw FederationException.notFound("User not found in Neo4j");
        }
        Map<String, Object> row = rows.get(0);
        List<RatedMovie> movies = new ArrayList<>();
        Set<String> distinctTitles = new HashSet<>();
        for (Map<?, ?> entry : entries(row.get("movies"))) {
            Object title = entry.get("title");
            if (title == null) {
                continue;
            }
            distinctTitles.add(title.toString());
            movies.add(new RatedMovie(
                title.toString(),
                integer(entry.get("released")),
                number(entry.get("rating")),
                text(entry.get("summary"))
            ));
        }
        return new PersonRatings(row.get("name").toString(), integer(row.get("born")), distinctTitles.size(), movies);
    }

    public Set<String> allMovieTitles(int sampleCap) {
        List<Map<String, Object>> rows = executor.read(ALL_MOVIE_TITLES, Map.of("limit", (long) sampleCap));
        Set<String> titles = new LinkedHashSet<>();
        for (Map<String, Object> row : rows) {
            Object title = row.get("title");
            if (title instanceof String value && !value.isBlank()) {
                titles.add(value);
            }
        }
        return titles;
    }

    public void ping() {
        executor.read(PING);
    }

    private static List<Map<?, ?>> entries(Object value) {
        List<Map<?, ?>> result = new ArrayList<>();
        if (value instanceof List<?> items) {
            for (Object item : items) {
                if (item instanceof Map<?, ?> map) {
                    result.add(map);
                }
            }
        }
        return result;
    }

    private static Number number(Object value) {
        return value instanceof Number number ? number : null;
    }

    private static Integer integer(Object value) {
        return value instanceof Number number ? number.intValue() : null;
    }

    private static String text(Object value) {
        return value == null ? null : value.toString();
    }
}
