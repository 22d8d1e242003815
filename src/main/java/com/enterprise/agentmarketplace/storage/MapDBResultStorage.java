package com.enterprise.agentmarketplace.storage;

import com.enterprise.agentmarketplace.exception.StorageException;
import com.enterprise.agentmarketplace.model.ExecutionResult;
import com.enterprise.agentmarketplace.model.TestEvidence;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import org.mapdb.DB;
import org.mapdb.DBMaker;
import org.mapdb.Serializer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.File;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.locks.ReadWriteLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;

/**
 * MapDB-based implementation of ResultStorage.
 * Results are stored as JSON documents, evidence as raw bytes keyed by file path.
 */
public class MapDBResultStorage implements ResultStorage {

    private static final Logger logger = LoggerFactory.getLogger(MapDBResultStorage.class);

    private static final String RESULT_LOCATOR_PREFIX = "mapdb:results/";
    private static final String EVIDENCE_LOCATOR_PREFIX = "mapdb:evidence/";

    private final DB db;
    private final Map<String, String> results;
    private final Map<String, byte[]> evidence;
    private final ObjectMapper objectMapper;
    private final ReadWriteLock lock;

    public MapDBResultStorage(String dbPath) {
        this.lock = new ReentrantReadWriteLock();

        this.objectMapper = new ObjectMapper();
        this.objectMapper.registerModule(new JavaTimeModule());
        this.objectMapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
        this.objectMapper.disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);

        this.db = DBMaker.fileDB(new File(dbPath))
            .fileMmapEnableIfSupported()
            .transactionEnable()
            .closeOnJvmShutdown()
            .make();

        this.results = db.hashMap("results", Serializer.STRING, Serializer.STRING).createOrOpen();
        this.evidence = db.hashMap("evidence", Serializer.STRING, Serializer.BYTE_ARRAY).createOrOpen();

        logger.info("MapDB result storage initialized at {} with {} stored results", dbPath, results.size());
    }

    @Override
    public String save(ExecutionResult result) throws StorageException {
        lock.writeLock().lock();
        try {
            results.put(result.getExecutionId(), objectMapper.writeValueAsString(result));
            db.commit();
            logger.debug("Saved result of execution {}", result.getExecutionId());
            return RESULT_LOCATOR_PREFIX + result.getExecutionId();

        } catch (JsonProcessingException e) {
            throw new StorageException("Failed to serialize result " + result.getExecutionId(), e);
        } catch (RuntimeException e) {
            db.rollback();
            throw new StorageException("Failed to save result " + result.getExecutionId(), e);
        } finally {
            lock.writeLock().unlock();
        }
    }

    @Override
    public Optional<ExecutionResult> load(String executionId) {
        lock.readLock().lock();
        try {
            String json = results.get(executionId);
            if (json == null) {
                return Optional.empty();
            }
            return Optional.of(objectMapper.readValue(json, ExecutionResult.class));

        } catch (JsonProcessingException e) {
            logger.error("Failed to deserialize stored result {}", executionId, e);
            return Optional.empty();
        } finally {
            lock.readLock().unlock();
        }
    }

    @Override
    public List<String> listExecutionIds() {
        lock.readLock().lock();
        try {
            List<String> ids = new ArrayList<>(results.keySet());
            Collections.sort(ids);
            return ids;
        } finally {
            lock.readLock().unlock();
        }
    }

    @Override
    public boolean delete(String executionId) {
        lock.writeLock().lock();
        try {
            String json = results.remove(executionId);
            if (json == null) {
                return false;
            }

            int removedEvidence = 0;
            for (String filePath : evidencePaths(json)) {
                if (evidence.remove(filePath) != null) {
                    removedEvidence++;
                }
            }
            db.commit();
            logger.info("Deleted result of execution {} and {} evidence files", executionId, removedEvidence);
            return true;

        } catch (RuntimeException e) {
            logger.error("Error deleting result {}", executionId, e);
            db.rollback();
            return false;
        } finally {
            lock.writeLock().unlock();
        }
    }

    @Override
    public String saveEvidence(TestEvidence testEvidence, byte[] content) throws StorageException {
        if (testEvidence.getFilePath() == null || testEvidence.getFilePath().isBlank()) {
            throw new StorageException("Evidence " + testEvidence.getEvidenceId() + " has no file path");
        }
        lock.writeLock().lock();
        try {
            evidence.put(testEvidence.getFilePath(), content);
            db.commit();
            return EVIDENCE_LOCATOR_PREFIX + testEvidence.getFilePath();

        } catch (RuntimeException e) {
            db.rollback();
            throw new StorageException("Failed to save evidence " + testEvidence.getFilePath(), e);
        } finally {
            lock.writeLock().unlock();
        }
    }

    @Override
    public Optional<byte[]> loadEvidence(String filePath) {
        lock.readLock().lock();
        try {
            return Optional.ofNullable(evidence.get(filePath));
        } finally {
            lock.readLock().unlock();
        }
    }

    @Override
    public StorageStatistics getStatistics() {
        lock.readLock().lock();
        try {
            long resultBytes = results.values().stream()
                .mapToLong(json -> json.getBytes(StandardCharsets.UTF_8).length)
                .sum();
            long evidenceBytes = evidence.values().stream()
                .mapToLong(content -> content.length)
                .sum();
            return new StorageStatistics(results.size(), resultBytes, evidenceBytes, evidence.size());
        } finally {
            lock.readLock().unlock();
        }
    }

    /**
     * Close the storage and release resources.
     */
    @Override
    public void close() {
        lock.writeLock().lock();
        try {
            if (!db.isClosed()) {
                db.close();
                logger.info("Result storage closed");
            }
        } catch (RuntimeException e) {
            logger.error("Error closing result storage", e);
        } finally {
            lock.writeLock().unlock();
        }
    }

    private List<String> evidencePaths(String json) {
        try {
            ExecutionResult stored = objectMapper.readValue(json, ExecutionResult.class);
            List<String> paths = new ArrayList<>();
            for (TestEvidence item : stored.getEvidences()) {
                if (item.getFilePath() != null) {
                    paths.add(item.getFilePath());
                }
            }
            return paths;
        } catch (JsonProcessingException e) {
            logger.warn("Stored result is unreadable, its evidence is left in place", e);
            return List.of();
        }
    }
}
