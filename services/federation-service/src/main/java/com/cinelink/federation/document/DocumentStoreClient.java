package com.cinelink.federation.document;

import com.cinelink.federation.common.FederationException;
import com.cinelink.federation.config.FederationProperties;
import com.cinelink.federation.match.DocumentPattern;
import com.mongodb.MongoException;
import com.mongodb.client.result.UpdateResult;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import org.bson.Document;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.data.mongodb.core.MongoTemplate;
import org.springframework.data.mongodb.core.query.Criteria;
import org.springframework.data.mongodb.core.query.Query;
import org.springframework.data.mongodb.core.query.Update;
import org.springframework.stereotype.Component;

@Component
public class DocumentStoreClient {
    private static final Logger logger = LoggerFactory.getLogger(DocumentStoreClient.class);

    static final String FIELD_ID = "_id";
    static final String FIELD_TITLE = "title";
    static final String FIELD_CAST = "cast";
    static final String FIELD_RATING = "imdb.rating";
    static final List<String> PROJECTION = List.of(
        FIELD_TITLE,
        "year",
        "genres",
        "directors",
        FIELD_CAST,
        "plot",
        FIELD_RATING
    );
    static final Set<String> IDENTITY_FIELDS = Set.of(FIELD_ID, FIELD_TITLE);

    private final MongoTemplate mongoTemplate;
    private final String collection;
    private final int searchCap;
    private final Duration queryTimeout;

    public DocumentStoreClient(MongoTemplate mongoTemplate, FederationProperties properties) {
        this.mongoTemplate = mongoTemplate;
        this.collection = properties.getDocument().getCollection();
        this.searchCap = properties.getDocument().getSearchCap();
        this.queryTimeout = Duration.ofMillis(properties.getDocument().getQueryTimeoutMs());
    }

    public MoviePage listPage(long skip, int limit) {
        Query pageQuery = projected(new Query()).skip(skip).limit(limit);
        List<MovieRecord> records = find(pageQuery);
        long total = count(bounded(new Query()));
        logger.debug("document.list_page skip={} limit={} returned={} total={}", skip, limit, records.size(), total);
        return new MoviePage(records, total);
    }

    public List<MovieRecord> search(DocumentPattern titlePattern, DocumentPattern castPattern) {
        List<Criteria> filters = new ArrayList<>();
        if (titlePattern != null) {
            filters.add(Criteria.where(FIELD_TITLE).regex(titlePattern.regex(), titlePattern.options()));
        }
        if (castPattern != null) {
            filters.add(Criteria.where(FIELD_CAST).regex(castPattern.regex(), castPattern.options()));
        }
        if (filters.isEmpty()) {
            throw new IllegalArgumentException("search needs a title or cast pattern");
        }
        Criteria criteria = filters.size() == 1
            ? filters.get(0)
            : new Criteria().andOperator(filters.toArray(new Criteria[0]));
        List<MovieRecord> records = find(projected(new Query(criteria)).limit(searchCap));
        logger.debug("document.search filters={} returned={}", filters.size(), records.size());
        return records;
    }

    /**
     * Applies {@code fields} to the first record whose whole title matches {@code exactTitle}.
     *
     * @return the number of records actually modified, 0 when the values were already set
     * @throws FederationException VALIDATION when {@code fields} only holds identity fields,
     *     NOT_FOUND when no record matches
     */
    public long updateByTitle(DocumentPattern exactTitle, Map<String, Object> fields) {
        Map<String, Object> updatable = withoutIdentity(fields);
        if (updatable.isEmpty()) {
            throw FederationException.validation("Request body must contain a field other than title or _id");
        }
        Query query = new Query(Criteria.where(FIELD_TITLE).regex(exactTitle.regex(), exactTitle.options()));
        Update update = new Update();
        updatable.forEach(update::set);

        UpdateResult result;
        try {
            result = mongoTemplate.updateFirst(query, update, collection);
        } catch (DataAccessException | MongoException ex) {
            throw FederationException.backend(ex);
        }
        if (result.getMatchedCount() == 0) {
            throw FederationException.notFound("Movie not found in MongoDB");
        }
        logger.debug("document.update matched={} modified={}", result.getMatchedCount(), result.getModifiedCount());
        return result.getModifiedCount();
    }

    public Set<String> listAllTitles(int sampleCap) {
        Query query = bounded(new Query()).limit(sampleCap);
        query.fields().include(FIELD_TITLE).exclude(FIELD_ID);
        List<Document> documents;
        try {
            documents = mongoTemplate.find(query, Document.class, collection);
        } catch (DataAccessException | MongoException ex) {
            throw FederationException.backend(ex);
        }
        Set<String> titles = new LinkedHashSet<>();
        for (Document document : documents) {
            Object title = document.get(FIELD_TITLE);
            if (title instanceof String value && !value.isBlank()) {
                titles.add(value);
            }
        }
        return titles;
    }

    public void ping() {
        try {
            mongoTemplate.executeCommand(new Document("ping", 1));
        } catch (DataAccessException | MongoException ex) {
            throw FederationException.backend(ex);
        }
    }

    static Map<String, Object> withoutIdentity(Map<String, Object> fields) {
        Map<String, Object> copy = new LinkedHashMap<>();
        if (fields == null) {
            return copy;
        }
        fields.forEach((key, value) -> {
            if (key != null && !IDENTITY_FIELDS.contains(key)) {
                copy.put(key, value);
            }
        });
        return copy;
    }

    private List<MovieRecord> find(Query query) {
        try {
            List<Document> documents = mongoTemplate.find(query, Document.class, collection);
            List<MovieRecord> records = new ArrayList<>(documents.size());
            for (Document document : documents) {
                records.add(toRecord(document));
            }
            return records;
        } catch (DataAccessException | MongoException ex) {
            throw FederationException.backend(ex);
        }
    }

    private long count(Query query) {
        try {
            return mongoTemplate.count(query, collection);
        } catch (DataAccessException | MongoException ex) {
            throw FederationException.backend(ex);
        }
    }

    private Query projected(Query query) {
        PROJECTION.forEach(field -> query.fields().include(field));
        query.fields().exclude(FIELD_ID);
        return bounded(query);
    }

    private Query bounded(Query query) {
        return query.maxTime(queryTimeout);
    }

    static MovieRecord toRecord(Document document) {
        Object imdb = document.get("imdb");
        Double rating = null;
        if (imdb instanceof Document nested && nested.get("rating") instanceof Number value) {
            rating = value.doubleValue();
        }
        Integer year = document.get("year") instanceof Number value ? value.intValue() : null;
        Object title = document.get(FIELD_TITLE);
        Object plot = document.get("plot");
        return new MovieRecord(
            title == null ? null : title.toString(),
            year,
            strings(document.get("genres")),
            strings(document.get("directors")),
            strings(document.get(FIELD_CAST)),
            plot == null ? null : plot.toString(),
            rating
        );
    }

    private static List<String> strings(Object value) {
        if (!(value instanceof Collection<?> items)) {
            return List.of();
        }
        List<String> result = new ArrayList<>(items.size());
        for (Object item : items) {
            if (item != null) {
                result.add(item.toString());
            }
        }
        return result;
    }
}
