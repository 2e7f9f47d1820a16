package io.agentcron.internal.mongo;

import org.bson.Document;
import org.springframework.data.mongodb.core.FindAndModifyOptions;
import org.springframework.data.mongodb.core.MongoTemplate;
import org.springframework.data.mongodb.core.query.Criteria;
import org.springframework.data.mongodb.core.query.Query;
import org.springframework.data.mongodb.core.query.Update;

import java.util.Objects;

/**
 * Hands out increasing numeric ids per sequence name.
 *
 * <p>Each call is a single {@code findAndModify} with {@code $inc} and upsert, so concurrent
 * callers (threads or processes) never receive the same value.
 */
public class MongoSequenceGenerator {

    public static final String COLLECTION = "agentcron_sequences";

    private final MongoTemplate mongoTemplate;

    public MongoSequenceGenerator(MongoTemplate mongoTemplate) {
        this.mongoTemplate = Objects.requireNonNull(mongoTemplate, "mongoTemplate must not be null");
    }

    public long next(String sequence) {
        Objects.requireNonNull(sequence, "sequence must not be null");

        Query q = new Query(Criteria.where("_id").is(sequence));
        Update u = new Update().inc("value", 1L);
        FindAndModifyOptions options = FindAndModifyOptions.options().returnNew(true).upsert(true);

        Document doc = mongoTemplate.findAndModify(q, u, options, Document.class, COLLECTION);
        if (doc == null || !(doc.get("value") instanceof Number value)) {
            throw new IllegalStateException("sequence " + sequence + " did not return a value");
        }
        return value.longValue();
    }
}
