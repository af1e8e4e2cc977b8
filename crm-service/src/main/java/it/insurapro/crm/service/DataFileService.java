package it.insurapro.crm.service;

import it.insurapro.common.dto.data.DataFileStatusDto;
import it.insurapro.crm.repository.CustomerStore;
import it.insurapro.crm.repository.PersistenceResult;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Saves and loads the store to and from the configured data files.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class DataFileService {

    private final CustomerStore customerStore;

    @Value("${crm.data.customers-file:data/customers.txt}")
    private String customersFile;

    @Value("${crm.data.interactions-file:data/interactions.txt}")
    private String interactionsFile;

    /**
     * Write the whole store, replacing both files.
     */
    public DataFileStatusDto save() {
        PersistenceResult result = customerStore.save(Path.of(customersFile), Path.of(interactionsFile));

        return baseStatus(result)
                .success(true)
                .message("Data saved successfully")
                .build();
    }

    /**
     * Replace the store with the file contents.
     * Missing files are reported as "no data", not as an error.
     */
    public DataFileStatusDto load() {
        PersistenceResult result = customerStore.load(Path.of(customersFile), Path.of(interactionsFile));

        if (!result.isCompleted()) {
            return baseStatus(result)
                    .success(false)
                    .message("No existing data found")
                    .build();
        }

        return baseStatus(result)
                .success(true)
                .message("Data loaded successfully")
                .malformedLines(result.getMalformedLines())
                .duplicateCustomers(result.getDuplicateCustomers())
                .orphanInteractions(result.getOrphanInteractions())
                .build();
    }

    /**
     * True if either data file is present on disk, readable or not.
     */
    public boolean dataFilesExist() {
        return Files.exists(Path.of(customersFile)) || Files.exists(Path.of(interactionsFile));
    }

    /**
     * Create the parent directories of both data files if missing.
     */
    public void ensureDataDirectories() {
        createParent(Path.of(customersFile));
        createParent(Path.of(interactionsFile));
    }

    private void createParent(Path file) {
        Path parent = file.toAbsolutePath().getParent();
        if (parent == null || Files.isDirectory(parent)) {
            return;
        }
        try {
            Files.createDirectories(parent);
            log.info("Created data directory {}", parent);
        } catch (IOException e) {
            log.warn("Could not create data directory {}: {}", parent, e.getMessage());
        }
    }

    private DataFileStatusDto.DataFileStatusDtoBuilder baseStatus(PersistenceResult result) {
        return DataFileStatusDto.builder()
                .customersFile(customersFile)
                .interactionsFile(interactionsFile)
                .customerCount(result.getCustomerCount())
                .interactionCount(result.getInteractionCount());
    }
}
