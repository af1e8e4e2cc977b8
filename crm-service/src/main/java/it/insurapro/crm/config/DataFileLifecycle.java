package it.insurapro.crm.config;

import it.insurapro.common.dto.data.DataFileStatusDto;
import it.insurapro.common.exception.DataPersistenceException;
import it.insurapro.crm.service.DataFileService;
import jakarta.annotation.PreDestroy;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.stereotype.Component;

/**
 * Loads the data files at startup and saves them again at shutdown.
 *
 * If the files exist but could not be loaded at startup, the shutdown save is
 * skipped: the in-memory store does not reflect them and would overwrite them.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class DataFileLifecycle implements ApplicationRunner {

    private final DataFileService dataFileService;

    @Value("${crm.data.load-on-startup:true}")
    private boolean loadOnStartup;

    @Value("${crm.data.save-on-shutdown:true}")
    private boolean saveOnShutdown;

    private volatile boolean startupLoadFailed;

    @Override
    public void run(ApplicationArguments args) {
        dataFileService.ensureDataDirectories();

        if (!loadOnStartup) {
            return;
        }

        DataFileStatusDto status = dataFileService.load();
        if (status.isSuccess()) {
            log.info("Data loaded: {} customers, {} interactions",
                    status.getCustomerCount(), status.getInteractionCount());
        } else if (dataFileService.dataFilesExist()) {
            startupLoadFailed = true;
            log.error("Data files exist but could not be loaded. Auto-save on shutdown is disabled.");
        } else {
            log.info("No existing data found. Starting with an empty customer list.");
        }
    }

    @PreDestroy
    public void saveOnShutdown() {
        if (!saveOnShutdown) {
            return;
        }
        if (startupLoadFailed) {
            log.warn("Skipping auto-save: data files were not loaded at startup");
            return;
        }
        try {
            DataFileStatusDto status = dataFileService.save();
            log.info("Auto-saved {} customers before shutdown", status.getCustomerCount());
        } catch (DataPersistenceException e) {
            log.error("Auto-save on shutdown failed: {}", e.getMessage(), e);
        }
    }
}
