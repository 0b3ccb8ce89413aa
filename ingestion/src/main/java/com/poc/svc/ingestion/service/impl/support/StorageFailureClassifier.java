package com.poc.svc.ingestion.service.impl.support;

import com.mongodb.MongoBulkWriteException;
import com.mongodb.MongoExecutionTimeoutException;
import com.mongodb.MongoSocketReadTimeoutException;
import com.mongodb.MongoTimeoutException;
import com.mongodb.MongoWriteException;
import com.poc.svc.ingestion.dto.FailureReason;
import org.bson.BsonInvalidOperationException;
import org.bson.BsonMaximumSizeExceededException;
import org.bson.codecs.configuration.CodecConfigurationException;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.dao.InvalidDataAccessApiUsageException;
import org.springframework.dao.QueryTimeoutException;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.TimeoutException;

/**
 * 將 MongoDB driver / Spring Data 例外歸類為 StorageTimeout、StorageUnavailable 或 StorageConstraintViolation。
 * 檢查整條 cause chain，timeout 優先於其他分類。
 */
@Component
public class StorageFailureClassifier {

    private static final List<Class<? extends Throwable>> TIMEOUTS = List.of(
            QueryTimeoutException.class,
            MongoTimeoutException.class,
            MongoExecutionTimeoutException.class,
            MongoSocketReadTimeoutException.class,
            TimeoutException.class
    );

    private static final List<Class<? extends Throwable>> CONSTRAINT_VIOLATIONS = List.of(
            DataIntegrityViolationException.class,
            InvalidDataAccessApiUsageException.class,
            MongoWriteException.class,
            MongoBulkWriteException.class,
            BsonInvalidOperationException.class,
            BsonMaximumSizeExceededException.class,
            CodecConfigurationException.class,
            IllegalArgumentException.class
    );

    public FailureReason classify(Throwable throwable) {
        Objects.requireNonNull(throwable, "throwable must not be null");
        List<Throwable> chain = causeChain(throwable);
        if (anyInstanceOf(chain, TIMEOUTS)) {
            return FailureReason.STORAGE_TIMEOUT;
        }
        if (anyInstanceOf(chain, CONSTRAINT_VIOLATIONS)) {
            return FailureReason.STORAGE_CONSTRAINT_VIOLATION;
        }
        // 連線失敗與無法辨識的例外視為暫時性錯誤
        return FailureReason.STORAGE_UNAVAILABLE;
    }

    private boolean anyInstanceOf(List<Throwable> chain, List<Class<? extends Throwable>> types) {
        for (Throwable candidate : chain) {
            for (Class<? extends Throwable> type : types) {
                if (type.isInstance(candidate)) {
                    return true;
                }
            }
        }
        return false;
    }

    private List<Throwable> causeChain(Throwable throwable) {
        List<Throwable> chain = new ArrayList<>();
        Throwable current = throwable;
        while (current != null && !chain.contains(current)) {
            chain.add(current);
            current = current.getCause();
        }
        return chain;
    }
}
