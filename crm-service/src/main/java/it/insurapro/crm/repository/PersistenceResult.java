package it.insurapro.crm.repository;

import lombok.Builder;
import lombok.Value;

/**
 * Counts reported by a save or load of the data files.
 */
@Value
@Builder
public class PersistenceResult {

    boolean completed;
    int customerCount;
    int interactionCount;

    // load only
    int malformedLines;
    int duplicateCustomers;
    int orphanInteractions;

    /**
     * A source file was missing or unreadable. Normal on first run.
     */
    public static PersistenceResult noData() {
        return PersistenceResult.builder().completed(false).build();
    }
}
