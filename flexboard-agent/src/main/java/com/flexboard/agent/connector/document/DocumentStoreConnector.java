package com.flexboard.agent.connector.document;

import com.flexboard.agent.config.BackendProperties;
import com.flexboard.agent.connector.Connector;
import com.flexboard.agent.error.PermanentBackendException;
import com.flexboard.agent.error.ValidationException;
import com.flexboard.agent.model.NativeResult;
import com.flexboard.agent.util.RowFlattener;
import com.mongodb.MongoException;
import com.mongodb.client.AggregateIterable;
import com.mongodb.client.FindIterable;
import com.mongodb.client.MongoCollection;
import lombok.extern.slf4j.Slf4j;
import org.bson.BSONException;
import org.bson.Document;
import org.bson.json.JsonParseException;

import java.math.BigDecimal;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.TimeUnit;

/**
 * Document-store connector over the MongoDB sync driver.
 *
 * <p>The query is a JSON document:
 * <pre>
 * {"collection": "orders", "filter": {"status": "open"}, "projection": {"_id": 0},
 *  "sort": {"createdAt": -1}, "skip": 0, "limit": 50}
 * {"collection": "orders", "pipeline": [{"$group": {"_id": "$branch", "n": {"$sum": 1}}}]}
 * </pre>
 * Parameters become equality conditions ({@code $in} for lists): merged into {@code filter}
 * for finds, prepended as a {@code $match} stage for pipelines.
 */
@Slf4j
public class DocumentStoreConnector implements Connector<DocumentStoreHandle> {

    private final int maxRows;
    private final long maxTimeMs;

    public DocumentStoreConnector(BackendProperties props, Duration requestTimeout) {
        this.maxRows = props.getMaxRows();
        this.maxTimeMs = requestTimeout.toMillis();
    }

    @Override
    public NativeResult run(DocumentStoreHandle handle, String query, Map<String, Object> params) {
        Document spec = parseQuery(query);
        Document match = paramsToFilter(params);
        String collectionName = requireCollection(spec);

        List<Document> documents;
        try {
            MongoCollection<Document> collection = handle.database().getCollection(collectionName);
            if (spec.containsKey("pipeline")) {
                documents = aggregate(handle, collection, spec, match);
            } else {
                documents = find(handle, collection, spec, match);
            }
        } catch (MongoException e) {
            log.debug("Document-store query on {} failed: {}", collectionName, e.getMessage());
            throw DocumentStoreErrors.classify(e);
        } catch (ValidationException e) {
            throw e;
        } catch (RuntimeException e) {
            throw new PermanentBackendException("Unexpected document-store failure: " + e.getMessage(), e);
        }

        List<Map<String, Object>> rows = new ArrayList<>(documents.size());
        for (Document document : documents) {
            rows.add(RowFlattener.flatten(document, DocumentValues::toJsonSafe));
        }
        return NativeResult.rowOriented(rows);
    }

    private List<Document> find(DocumentStoreHandle handle, MongoCollection<Document> collection, Document spec, Document match) {
        Document filter = optionalDocument(spec, "filter");
        Document merged = filter != null ? new Document(filter) : new Document();
        merged.putAll(match);

        FindIterable<Document> find = collection.find(handle.session(), merged)
                .maxTime(maxTimeMs, TimeUnit.MILLISECONDS);
        Document projection = optionalDocument(spec, "projection");
        if (projection != null) {
            find = find.projection(projection);
        }
        Document sort = optionalDocument(spec, "sort");
        if (sort != null) {
            find = find.sort(sort);
        }
        int skip = optionalInt(spec, "skip");
        if (skip > 0) {
            find = find.skip(skip);
        }
        int limit = effectiveLimit(optionalInt(spec, "limit"));
        if (limit > 0) {
            find = find.limit(limit);
        }
        return find.into(new ArrayList<>());
    }

    private List<Document> aggregate(DocumentStoreHandle handle, MongoCollection<Document> collection, Document spec, Document match) {
        Object raw = spec.get("pipeline");
        if (!(raw instanceof List<?> stagesRaw)) {
            throw new ValidationException("pipeline must be an array of stages");
        }
        List<Document> stages = new ArrayList<>();
        if (!match.isEmpty()) {
            stages.add(new Document("$match", match));
        }
        for (Object stage : stagesRaw) {
            if (!(stage instanceof Document document)) {
                throw new ValidationException("Every pipeline stage must be a document");
            }
            stages.add(document);
        }
        if (maxRows > 0) {
            stages.add(new Document("$limit", maxRows));
        }
        AggregateIterable<Document> aggregate = collection.aggregate(handle.session(), stages)
                .maxTime(maxTimeMs, TimeUnit.MILLISECONDS);
        return aggregate.into(new ArrayList<>());
    }

    @Override
    public boolean ping(DocumentStoreHandle handle) {
        try {
            handle.database().runCommand(handle.session(), new Document("ping", 1));
            return true;
        } catch (MongoException e) {
            log.warn("Document-store ping failed: {}", e.getMessage());
            return false;
        }
    }

    static Document parseQuery(String query) {
        try {
            return Document.parse(query);
        } catch (JsonParseException | BSONException e) {
            throw new ValidationException("Document-store query must be a JSON document: " + e.getMessage(), e);
        }
    }

    static Document paramsToFilter(Map<String, Object> params) {
        Document filter = new Document();
        for (Map.Entry<String, Object> entry : params.entrySet()) {
            String name = entry.getKey();
            if (name.startsWith("$")) {
                throw new ValidationException("Parameter name must not start with '$': " + name);
            }
            Object value = entry.getValue();
            if (value instanceof List<?> list) {
                for (Object element : list) {
                    requireScalar(name, element);
                }
                filter.put(name, new Document("$in", list));
            } else {
                requireScalar(name, value);
                filter.put(name, value);
            }
        }
        return filter;
    }

    private static void requireScalar(String name, Object value) {
        if (value == null
                || value instanceof String
                || value instanceof Boolean
                || value instanceof Integer
                || value instanceof Long
                || value instanceof Double
                || value instanceof Float
                || value instanceof Short
                || value instanceof BigDecimal) {
            return;
        }
        throw new ValidationException("Parameter " + name + " must be a scalar or a list of scalars, got "
                + value.getClass().getSimpleName());
    }

    private static String requireCollection(Document spec) {
        Object collection = spec.get("collection");
        if (!(collection instanceof String name) || name.isBlank()) {
            throw new ValidationException("Document-store query needs a \"collection\" name");
        }
        return name;
    }

    private static Document optionalDocument(Document spec, String field) {
        Object value = spec.get(field);
        if (value == null) {
            return null;
        }
        if (value instanceof Document document) {
            return document;
        }
        throw new ValidationException("\"" + field + "\" must be a JSON object");
    }

    private static int optionalInt(Document spec, String field) {
        Object value = spec.get(field);
        if (value == null) {
            return 0;
        }
        if (value instanceof Number number && number.intValue() >= 0) {
            return number.intValue();
        }
        throw new ValidationException("\"" + field + "\" must be a non-negative number");
    }

    private int effectiveLimit(int requested) {
        if (maxRows <= 0) {
            return requested;
        }
        return requested > 0 ? Math.min(requested, maxRows) : maxRows;
    }
}
