package com.cnab.importer.batch;

import com.cnab.importer.repository.TransactionTypeRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

/**
 * Reads the active transaction types into a {@link TransactionTypeCatalog}.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class TransactionTypeCatalogLoader {

    private final TransactionTypeRepository transactionTypeRepository;

    @Transactional(readOnly = true)
    public TransactionTypeCatalog load() {
        TransactionTypeCatalog catalog =
                TransactionTypeCatalog.fromEntities(transactionTypeRepository.findByActiveTrueOrderByIdAsc());

        if (!catalog.ambiguousCodes().isEmpty()) {
            // Lowest id wins until the catalog is cleaned up.
            log.warn("Transaction type codes {} are shared by several active rows; using the lowest id for each",
                    catalog.ambiguousCodes());
        }
        log.debug("Loaded {} active transaction types", catalog.size());
        return catalog;
    }
}
