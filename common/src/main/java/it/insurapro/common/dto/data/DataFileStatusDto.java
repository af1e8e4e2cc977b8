package it.insurapro.common.dto.data;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Outcome of a save or load of the two data files.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class DataFileStatusDto {

    private boolean success;
    private String message;

    private String customersFile;
    private String interactionsFile;

    // Counts
    private int customerCount;
    private int interactionCount;
    private int malformedLines;         // load only
    private int duplicateCustomers;     // load only
    private int orphanInteractions;     // load only
}
