package com.enterprise.agentmarketplace.storage;

import com.enterprise.agentmarketplace.exception.StorageException;
import com.enterprise.agentmarketplace.model.ExecutionResult;
import com.enterprise.agentmarketplace.model.TestEvidence;

import java.util.List;
import java.util.Optional;

/**
 * Persistent store for terminal execution results and their evidence blobs.
 */
public interface ResultStorage extends AutoCloseable {

    /**
     * Saves (or replaces) a result.
     *
     * @param result the terminal result to store
     * @return locator of the stored result
     * @throws StorageException if the result cannot be serialized or written
     */
    String save(ExecutionResult result) throws StorageException;

    /**
     * Loads a previously saved result.
     *
     * @param executionId the execution id
     * @return the result, or empty if none was saved or it cannot be read
     */
    Optional<ExecutionResult> load(String executionId);

    /**
     * Ids of all stored results, sorted.
     */
    List<String> listExecutionIds();

    /**
     * Deletes a result together with the evidence blobs it references.
     *
     * @return true if a result was removed
     */
    boolean delete(String executionId);

    /**
     * Stores the content of one evidence artifact under its file path.
     *
     * @return locator of the stored blob
     * @throws StorageException if the blob cannot be written
     */
    String saveEvidence(TestEvidence evidence, byte[] content) throws StorageException;

    Optional<byte[]> loadEvidence(String filePath);

    StorageStatistics getStatistics();

    @Override
    void close();
}
