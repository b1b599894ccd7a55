package com.campusagent.backend.service;

import com.campusagent.backend.model.CatalogEntry;
import com.campusagent.backend.model.ScoredEntry;
import com.campusagent.backend.util.VectorMath;
import org.bson.Document;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.data.mongodb.core.MongoTemplate;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Approximate nearest-neighbour search through a MongoDB Atlas vector index.
 * Failures propagate so the caller can switch to the local scan.
 */
@Component
public class AtlasVectorSearchIndex implements SimilarityIndex {

    private static final Logger log = LoggerFactory.getLogger(AtlasVectorSearchIndex.class);

    private final MongoTemplate mongoTemplate;
    private final String collectionName;
    private final String indexName;
    private final String vectorPath;
    private final int numCandidates;

    public AtlasVectorSearchIndex(MongoTemplate mongoTemplate,
            @Value("${search.vector.collection:resources}") String collectionName,
            @Value("${search.vector.index-name:vector_index}") String indexName,
            @Value("${search.vector.path:embedding}") String vectorPath,
            @Value("${search.vector.num-candidates:100}") int numCandidates) {
        this.mongoTemplate = mongoTemplate;
        this.collectionName = collectionName;
        this.indexName = indexName;
        this.vectorPath = vectorPath;
        this.numCandidates = numCandidates;
    }

    @Override
    public List<ScoredEntry> search(double[] queryVector, int limit) {
        List<Document> pipeline = buildPipeline(queryVector, limit);

        List<ScoredEntry> results = mongoTemplate.getCollection(collectionName)
                .aggregate(pipeline, Document.class)
                .map(this::toScoredEntry)
                .into(new ArrayList<>());

        log.info("Vector index {} returned {} entries", indexName, results.size());

        return results.stream()
                .sorted(Comparator.comparingDouble(ScoredEntry::score).reversed())
                .limit(limit)
                .collect(Collectors.toList());
    }

    List<Document> buildPipeline(double[] queryVector, int limit) {
        Document vectorSearchStage = new Document("$vectorSearch",
                new Document()
                        .append("index", indexName)
                        .append("path", vectorPath)
                        .append("queryVector", VectorMath.toList(queryVector))
                        .append("numCandidates", Math.max(numCandidates, limit * 10))
                        .append("limit", limit));

        Document projectStage = new Document("$project",
                new Document()
                        .append("title", 1)
                        .append("description", 1)
                        .append("category", 1)
                        .append("url", 1)
                        .append("tags", 1)
                        .append("score", new Document("$meta", "vectorSearchScore")));

        return List.of(vectorSearchStage, projectStage);
    }

    ScoredEntry toScoredEntry(Document doc) {
        Object id = doc.get("_id");
        CatalogEntry entry = CatalogEntry.builder()
                .id(id != null ? id.toString() : null)
                .title(stringValue(doc, "title"))
                .description(stringValue(doc, "description"))
                .category(stringValue(doc, "category"))
                .url(stringValue(doc, "url"))
                .tags(doc.getList("tags", String.class, new ArrayList<>()))
                .build();

        Object score = doc.get("score");
        return new ScoredEntry(entry, score instanceof Number number ? number.doubleValue() : 0.0);
    }

    private static String stringValue(Document doc, String field) {
        Object value = doc.get(field);
        return value != null ? value.toString() : "";
    }
}
