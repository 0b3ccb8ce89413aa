package com.poc.svc.ingestion.repository;

import com.mongodb.client.model.Filters;
import com.mongodb.client.model.ReplaceOptions;
import com.mongodb.client.result.UpdateResult;
import com.poc.svc.ingestion.dto.CollectionName;
import com.poc.svc.ingestion.dto.UpsertOutcome;
import com.poc.svc.ingestion.entity.StoredDocument;
import org.bson.Document;
import org.bson.conversions.Bson;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.data.mongodb.core.MongoTemplate;
import org.springframework.stereotype.Repository;

import java.util.ArrayList;
import java.util.Date;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

@Repository
public class MongoStoredDocumentRepository implements StoredDocumentRepository {

    private final MongoTemplate mongoTemplate;

    public MongoStoredDocumentRepository(MongoTemplate mongoTemplate) {
        this.mongoTemplate = Objects.requireNonNull(mongoTemplate, "mongoTemplate must not be null");
    }

    @Override
    public UpsertOutcome upsert(StoredDocument document) {
        Objects.requireNonNull(document, "document must not be null");
        Document replacement = document.toBson();
        // 只在既有文件不比這次新時才取代；不符合時 upsert 會撞到 _id 唯一鍵
        Bson filter = Filters.and(
                Filters.eq(StoredDocument.ID, document.productCode()),
                Filters.or(
                        Filters.exists(StoredDocument.RECEIVED_AT, false),
                        Filters.lte(StoredDocument.RECEIVED_AT, Date.from(document.receivedAt()))
                )
        );
        try {
            UpdateResult result = replace(document, filter, replacement, true);
            if (result.getUpsertedId() != null) {
                return UpsertOutcome.INSERTED;
            }
            return result.getModifiedCount() > 0 ? UpsertOutcome.REPLACED : UpsertOutcome.UNCHANGED;
        } catch (DuplicateKeyException duplicateKey) {
            // 可能是較新的文件已存在，也可能是另一個 consumer 剛好同時 insert；改以非 upsert 再比對一次
            UpdateResult retried = replace(document, filter, replacement, false);
            if (retried.getMatchedCount() == 0) {
                return UpsertOutcome.STALE_SKIPPED;
            }
            return retried.getModifiedCount() > 0 ? UpsertOutcome.REPLACED : UpsertOutcome.UNCHANGED;
        }
    }

    private UpdateResult replace(StoredDocument document, Bson filter, Document replacement, boolean upsert) {
        UpdateResult result = mongoTemplate.execute(document.collection().value(),
                collection -> collection.replaceOne(filter, replacement, new ReplaceOptions().upsert(upsert)));
        if (result == null) {
            throw new IllegalStateException("replaceOne returned no result");
        }
        return result;
    }

    @Override
    public Optional<StoredDocument> findByProductCode(CollectionName collection, String productCode) {
        Document found = mongoTemplate.execute(collection.value(),
                mongoCollection -> mongoCollection.find(Filters.eq(StoredDocument.ID, productCode)).first());
        return Optional.ofNullable(found).map(document -> StoredDocument.fromBson(collection, document));
    }

    @Override
    public List<StoredDocument> findAll(CollectionName collection, Map<String, Object> equalityFilters, int limit) {
        List<Bson> conditions = new ArrayList<>();
        equalityFilters.forEach((field, value) -> conditions.add(Filters.eq(field, value)));
        Bson filter = conditions.isEmpty() ? new Document() : Filters.and(conditions);
        List<Document> documents = mongoTemplate.execute(collection.value(),
                mongoCollection -> mongoCollection.find(filter).limit(limit).into(new ArrayList<>()));
        if (documents == null) {
            return List.of();
        }
        return documents.stream()
                .map(document -> StoredDocument.fromBson(collection, document))
                .toList();
    }
}
