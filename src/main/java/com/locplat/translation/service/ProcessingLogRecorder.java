package com.locplat.translation.service;

import com.locplat.translation.model.FieldProcessingLog;
import com.locplat.translation.repository.FieldProcessingLogRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Persists one monitoring row per extraction or translation run. Failing to write
 * the row never fails the run itself.
 */
@Service
public class ProcessingLogRecorder {

    private static final Logger logger = LoggerFactory.getLogger(ProcessingLogRecorder.class);

    private final FieldProcessingLogRepository logRepository;

    public ProcessingLogRecorder(FieldProcessingLogRepository logRepository) {
        this.logRepository = logRepository;
    }

    public void recordSuccess(String clientId, String collection, String operation, int fieldsProcessed,
                              long processingTimeMs) {
        record(clientId, collection, operation, true, null, fieldsProcessed, processingTimeMs);
    }

    public void recordFailure(String clientId, String collection, String operation, String errorMessage,
                              long processingTimeMs) {
        record(clientId, collection, operation, false, errorMessage, 0, processingTimeMs);
    }

    private void record(String clientId, String collection, String operation, boolean success,
                        String errorMessage, int fieldsProcessed, long processingTimeMs) {
        try {
            FieldProcessingLog entry = new FieldProcessingLog();
            entry.setClientId(clientId);
            entry.setCollectionName(collection);
            entry.setOperationType(operation);
            entry.setSuccess(success);
            entry.setErrorMessage(errorMessage);
            entry.setFieldsProcessed(fieldsProcessed);
            entry.setProcessingTimeMs(processingTimeMs);
            logRepository.save(entry);
        } catch (RuntimeException e) {
            logger.error("Failed to log {} operation for {}/{}: {}", operation, clientId, collection, e.getMessage());
        }
    }
}
