package it.insurapro.crm.service;

import it.insurapro.common.dto.data.DataFileStatusDto;
import it.insurapro.crm.codec.RecordCodec;
import it.insurapro.crm.model.Customer;
import it.insurapro.crm.model.Interaction;
import it.insurapro.crm.model.InteractionKind;
import it.insurapro.crm.repository.CustomerStore;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.springframework.test.util.ReflectionTestUtils;

import java.nio.file.Files;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.*;

class DataFileServiceTest {

    @TempDir
    Path tempDir;

    private CustomerStore store;
    private DataFileService service;

    @BeforeEach
    void setUp() {
        store = new CustomerStore(new RecordCodec());
        service = newService(store);
    }

    private DataFileService newService(CustomerStore customerStore) {
        DataFileService dataFileService = new DataFileService(customerStore);
        ReflectionTestUtils.setField(dataFileService, "customersFile",
                tempDir.resolve("data").resolve("customers.txt").toString());
        ReflectionTestUtils.setField(dataFileService, "interactionsFile",
                tempDir.resolve("data").resolve("interactions.txt").toString());
        return dataFileService;
    }

    @Test
    void load_ShouldReportNoDataOnFirstRun() {
        DataFileStatusDto status = service.load();

        assertFalse(status.isSuccess());
        assertEquals(0, status.getCustomerCount());
    }

    @Test
    void ensureDataDirectories_ShouldCreateParentDirectory() {
        service.ensureDataDirectories();

        assertTrue(Files.isDirectory(tempDir.resolve("data")));
    }

    @Test
    void saveThenLoad_ShouldRestoreExampleScenario() {
        store.add(new Customer("Anna", "Rossi", "a@x.it", "000", "Via Roma", "RSSANN80A01H501Z", "01/01/1980"));
        Interaction checkup = new Interaction("01/06/2024", "10:00", InteractionKind.APPOINTMENT,
                "Checkup", "Luigi", "Booked");
        store.addInteraction("RSSANN80A01H501Z", checkup);
        service.ensureDataDirectories();

        DataFileStatusDto saved = service.save();
        assertTrue(saved.isSuccess());
        assertEquals(1, saved.getCustomerCount());
        assertEquals(1, saved.getInteractionCount());

        CustomerStore freshStore = new CustomerStore(new RecordCodec());
        DataFileStatusDto loaded = newService(freshStore).load();

        assertTrue(loaded.isSuccess());
        assertEquals(1, loaded.getCustomerCount());
        assertEquals(0, loaded.getMalformedLines());
        Customer anna = freshStore.getByTaxCode("RSSANN80A01H501Z");
        assertEquals("Anna Rossi", anna.getFullName());
        assertEquals("Via Roma", anna.getAddress());
        assertEquals(1, anna.getInteractionCount());
        assertEquals(checkup, anna.getInteractions().get(0));
    }
}
