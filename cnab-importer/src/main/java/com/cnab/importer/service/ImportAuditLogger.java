package com.cnab.importer.service;

import com.cnab.importer.entity.UserLogEntity;
import com.cnab.importer.repository.UserLogRepository;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.TransactionDefinition;
import org.springframework.transaction.support.TransactionTemplate;

/**
 * Appends the "file uploaded" entry to the user audit log.
 *
 * <p>The entry is written in its own transaction after the batch has committed. Failures are
 * logged and reported through the return value only; they never undo the import.
 */
@Slf4j
@Component
public class ImportAuditLogger {

    static final String UPLOAD_MESSAGE = "User %d uploaded file %s.";

    private final UserLogRepository userLogRepository;
    private final TransactionTemplate transactionTemplate;

    public ImportAuditLogger(UserLogRepository userLogRepository, PlatformTransactionManager transactionManager) {
        this.userLogRepository = userLogRepository;
        this.transactionTemplate = new TransactionTemplate(transactionManager);
        this.transactionTemplate.setPropagationBehavior(TransactionDefinition.PROPAGATION_REQUIRES_NEW);
    }

    /**
     * @return {@code true} if the entry was stored
     */
    public boolean recordUpload(long userId, String fileName) {
        String message = UPLOAD_MESSAGE.formatted(userId, fileName);
        try {
            transactionTemplate.executeWithoutResult(status ->
                    userLogRepository.save(new UserLogEntity(userId, message)));
            log.info(message);
            return true;
        } catch (RuntimeException e) {
            log.warn("Could not write audit entry '{}': {}", message, e.getMessage(), e);
            return false;
        }
    }
}
