package com.cnab.importer.batch;

import com.cnab.importer.entity.TransactionTypeEntity;

import java.util.Collection;
import java.util.Collections;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;

/**
 * Immutable snapshot of the active transaction-type catalog, taken once per import.
 *
 * <p>Maps each durable identifier to its business code and answers the reverse question:
 * which identifier does a given code stand for. When several active rows share a code, the
 * row with the lowest id wins; such codes are reported by {@link #ambiguousCodes()}.
 */
public final class TransactionTypeCatalog {

    private final Map<Long, Integer> codesById;
    private final Map<Integer, Long> idsByCode;
    private final Set<Integer> ambiguousCodes;

    private TransactionTypeCatalog(Map<Long, Integer> codesById) {
        Map<Integer, Long> byCode = new LinkedHashMap<>();
        Set<Integer> ambiguous = new TreeSet<>();
        codesById.entrySet().stream()
                .sorted(Map.Entry.comparingByKey())
                .forEach(e -> {
                    if (byCode.putIfAbsent(e.getValue(), e.getKey()) != null) {
                        ambiguous.add(e.getValue());
                    }
                });
        this.codesById = Collections.unmodifiableMap(new LinkedHashMap<>(codesById));
        this.idsByCode = Collections.unmodifiableMap(byCode);
        this.ambiguousCodes = Collections.unmodifiableSet(ambiguous);
    }

    /**
     * Builds a catalog from an id → business-code mapping.
     */
    public static TransactionTypeCatalog of(Map<Long, Integer> codesById) {
        return new TransactionTypeCatalog(codesById);
    }

    /**
     * Builds a catalog from catalog rows, keeping only the active ones.
     */
    public static TransactionTypeCatalog fromEntities(Collection<TransactionTypeEntity> types) {
        Map<Long, Integer> codes = new LinkedHashMap<>();
        types.stream()
                .filter(TransactionTypeEntity::isActive)
                .sorted(Comparator.comparing(TransactionTypeEntity::getId))
                .forEach(t -> codes.put(t.getId(), t.getTypeCode()));
        return new TransactionTypeCatalog(codes);
    }

    public static TransactionTypeCatalog empty() {
        return new TransactionTypeCatalog(Map.of());
    }

    /**
     * @return the durable id for {@code typeCode}, or empty when no active row carries it
     */
    public Optional<Long> resolve(int typeCode) {
        return Optional.ofNullable(idsByCode.get(typeCode));
    }

    public Map<Long, Integer> codesById() {
        return codesById;
    }

    /** Business codes carried by more than one active row. */
    public Set<Integer> ambiguousCodes() {
        return ambiguousCodes;
    }

    public int size() {
        return codesById.size();
    }
}
