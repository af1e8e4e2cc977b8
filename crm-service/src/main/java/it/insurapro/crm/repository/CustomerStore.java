package it.insurapro.crm.repository;

import it.insurapro.common.dto.customer.CustomerUpdateRequest;
import it.insurapro.common.exception.DataPersistenceException;
import it.insurapro.common.exception.DuplicateResourceException;
import it.insurapro.common.exception.MalformedRecordException;
import it.insurapro.common.exception.ResourceNotFoundException;
import it.insurapro.common.exception.ValidationException;
import it.insurapro.crm.codec.OwnedInteraction;
import it.insurapro.crm.codec.RecordCodec;
import it.insurapro.crm.model.Customer;
import it.insurapro.crm.model.Interaction;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Repository;

import java.io.BufferedReader;
import java.io.BufferedWriter;
import java.io.IOException;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.OptionalInt;
import java.util.function.Consumer;

import static it.insurapro.common.util.FieldSanitizer.hasText;

/**
 * In-memory store of customers and their interactions, persisted to two flat files.
 *
 * Data access only - NO business logic here.
 *
 * Customers are kept in insertion order and are unique by tax code. Lookups are
 * linear scans. Every public method runs under this object's monitor, and
 * customers handed out are detached copies, so callers never see a mutation
 * half-way through.
 */
@Slf4j
@Repository
@RequiredArgsConstructor
public class CustomerStore {

    private final RecordCodec codec;

    private final List<Customer> customers = new ArrayList<>();

    /**
     * Append a customer.
     *
     * @throws ValidationException if the tax code is empty
     * @throws DuplicateResourceException if the tax code is already present
     */
    public synchronized void add(Customer customer) {
        if (!hasText(customer.getTaxCode())) {
            throw new ValidationException("taxCode", "Tax code is required");
        }
        if (indexOf(customer.getTaxCode()) >= 0) {
            throw new DuplicateResourceException("Customer", customer.getTaxCode());
        }
        customers.add(customer.copy());
        log.debug("Customer {} added at position {}", customer.getTaxCode(), customers.size() - 1);
    }

    /**
     * Position of the first customer with the given tax code.
     */
    public synchronized OptionalInt findByTaxCode(String taxCode) {
        int index = indexOf(taxCode);
        return index < 0 ? OptionalInt.empty() : OptionalInt.of(index);
    }

    /**
     * Position of the first customer whose first and last name both match exactly.
     */
    public synchronized OptionalInt findByName(String firstName, String lastName) {
        for (int i = 0; i < customers.size(); i++) {
            Customer customer = customers.get(i);
            if (customer.getFirstName().equals(firstName) && customer.getLastName().equals(lastName)) {
                return OptionalInt.of(i);
            }
        }
        return OptionalInt.empty();
    }

    public synchronized Customer get(int position) {
        if (position < 0 || position >= customers.size()) {
            throw new ResourceNotFoundException("Customer position", String.valueOf(position));
        }
        return customers.get(position).copy();
    }

    public synchronized Customer getByTaxCode(String taxCode) {
        return require(taxCode).copy();
    }

    public synchronized int size() {
        return customers.size();
    }

    /**
     * Detached copies of all customers, in store order.
     */
    public synchronized List<Customer> snapshot() {
        List<Customer> copies = new ArrayList<>(customers.size());
        for (Customer customer : customers) {
            copies.add(customer.copy());
        }
        return copies;
    }

    /**
     * Overwrite the fields that carry text. Null or empty means "keep".
     * The tax code never changes.
     */
    public synchronized Customer update(String taxCode, CustomerUpdateRequest changes) {
        Customer customer = require(taxCode);

        applyIfPresent(changes.getFirstName(), customer::setFirstName);
        applyIfPresent(changes.getLastName(), customer::setLastName);
        applyIfPresent(changes.getEmail(), customer::setEmail);
        applyIfPresent(changes.getPhone(), customer::setPhone);
        applyIfPresent(changes.getAddress(), customer::setAddress);
        applyIfPresent(changes.getBirthDate(), customer::setBirthDate);

        return customer.copy();
    }

    /**
     * Remove a customer together with all of its interactions.
     */
    public synchronized Customer remove(String taxCode) {
        int index = indexOf(taxCode);
        if (index < 0) {
            throw new ResourceNotFoundException("Customer", taxCode);
        }
        Customer removed = customers.remove(index);
        log.debug("Customer {} removed with {} interactions", taxCode, removed.getInteractionCount());
        return removed;
    }

    /**
     * @return position of the new interaction in the customer's list
     */
    public synchronized int addInteraction(String taxCode, Interaction interaction) {
        Customer customer = require(taxCode);
        customer.addInteraction(interaction);
        return customer.getInteractionCount() - 1;
    }

    public synchronized Interaction removeInteraction(String taxCode, int position) {
        Customer customer = require(taxCode);
        if (position < 0 || position >= customer.getInteractionCount()) {
            throw new ResourceNotFoundException(String.format(
                    "Interaction not found at position %d for customer %s", position, taxCode));
        }
        return customer.removeInteraction(position);
    }

    /**
     * Write all customers to the first file and all interactions to the second,
     * truncating both. The two writes are independent: a failure on the second
     * file leaves the first one already rewritten.
     *
     * @throws DataPersistenceException if either file cannot be opened or written
     */
    public synchronized PersistenceResult save(Path customersFile, Path interactionsFile) {
        int interactionCount = 0;

        try (BufferedWriter customerWriter = openForWrite(customersFile);
             BufferedWriter interactionWriter = openForWrite(interactionsFile)) {

            for (Customer customer : customers) {
                customerWriter.write(codec.encodeCustomer(customer));
                customerWriter.write('\n');
            }

            for (Customer customer : customers) {
                for (Interaction interaction : customer.getInteractions()) {
                    interactionWriter.write(codec.encodeInteraction(customer.getTaxCode(), interaction));
                    interactionWriter.write('\n');
                    interactionCount++;
                }
            }
        } catch (IOException e) {
            log.error("Error writing data files {} / {}: {}", customersFile, interactionsFile, e.getMessage());
            throw new DataPersistenceException(customersFile + ", " + interactionsFile, e.getMessage(), e);
        }

        log.info("Saved {} customers and {} interactions", customers.size(), interactionCount);

        return PersistenceResult.builder()
                .completed(true)
                .customerCount(customers.size())
                .interactionCount(interactionCount)
                .build();
    }

    /**
     * Replace the whole dataset with the content of the two files.
     *
     * Returns {@link PersistenceResult#noData()} and leaves the store untouched if
     * either file is missing or unreadable. Blank lines are skipped, malformed
     * lines and repeated tax codes are dropped, and interactions whose tax code
     * matches no loaded customer are dropped as orphans.
     */
    public synchronized PersistenceResult load(Path customersFile, Path interactionsFile) {
        if (!Files.isReadable(customersFile) || !Files.isReadable(interactionsFile)) {
            log.info("Data files not found ({}, {})", customersFile, interactionsFile);
            return PersistenceResult.noData();
        }

        List<Customer> loaded = new ArrayList<>();
        int malformed = 0;
        int duplicates = 0;
        int orphans = 0;
        int interactionCount = 0;

        try (BufferedReader customerReader = openForRead(customersFile);
             BufferedReader interactionReader = openForRead(interactionsFile)) {

            String line;
            int lineNumber = 0;
            while ((line = customerReader.readLine()) != null) {
                lineNumber++;
                if (line.isEmpty()) {
                    continue;
                }
                try {
                    Customer customer = codec.decodeCustomer(line);
                    if (indexOf(loaded, customer.getTaxCode()) >= 0) {
                        log.warn("{}:{} repeats tax code {}, skipped", customersFile, lineNumber, customer.getTaxCode());
                        duplicates++;
                        continue;
                    }
                    loaded.add(customer);
                } catch (MalformedRecordException e) {
                    log.debug("{}:{} skipped: {}", customersFile, lineNumber, e.getMessage());
                    malformed++;
                }
            }

            lineNumber = 0;
            while ((line = interactionReader.readLine()) != null) {
                lineNumber++;
                if (line.isEmpty()) {
                    continue;
                }
                try {
                    OwnedInteraction owned = codec.decodeInteraction(line);
                    int owner = indexOf(loaded, owned.getTaxCode());
                    if (owner < 0) {
                        log.debug("{}:{} references unknown customer {}, dropped",
                                interactionsFile, lineNumber, owned.getTaxCode());
                        orphans++;
                        continue;
                    }
                    loaded.get(owner).addInteraction(owned.getInteraction());
                    interactionCount++;
                } catch (MalformedRecordException e) {
                    log.debug("{}:{} skipped: {}", interactionsFile, lineNumber, e.getMessage());
                    malformed++;
                }
            }

        } catch (IOException e) {
            log.warn("Error reading data files {} / {}: {}", customersFile, interactionsFile, e.getMessage());
            return PersistenceResult.noData();
        }

        customers.clear();
        customers.addAll(loaded);

        log.info("Loaded {} customers and {} interactions (malformed: {}, duplicates: {}, orphans: {})",
                loaded.size(), interactionCount, malformed, duplicates, orphans);

        return PersistenceResult.builder()
                .completed(true)
                .customerCount(loaded.size())
                .interactionCount(interactionCount)
                .malformedLines(malformed)
                .duplicateCustomers(duplicates)
                .orphanInteractions(orphans)
                .build();
    }

    private Customer require(String taxCode) {
        int index = indexOf(taxCode);
        if (index < 0) {
            throw new ResourceNotFoundException("Customer", taxCode);
        }
        return customers.get(index);
    }

    private int indexOf(String taxCode) {
        return indexOf(customers, taxCode);
    }

    private static int indexOf(List<Customer> list, String taxCode) {
        for (int i = 0; i < list.size(); i++) {
            if (list.get(i).getTaxCode().equals(taxCode)) {
                return i;
            }
        }
        return -1;
    }

    private static void applyIfPresent(String value, Consumer<String> setter) {
        if (hasText(value)) {
            setter.accept(value);
        }
    }

    // Undecodable bytes become U+FFFD instead of failing the whole read
    private static BufferedReader openForRead(Path file) throws IOException {
        return new BufferedReader(new InputStreamReader(Files.newInputStream(file), StandardCharsets.UTF_8));
    }

    private static BufferedWriter openForWrite(Path file) {
        try {
            return Files.newBufferedWriter(file, StandardCharsets.UTF_8);
        } catch (IOException e) {
            log.error("Cannot open {} for writing: {}", file, e.getMessage());
            throw new DataPersistenceException(file.toString(), e.getMessage(), e);
        }
    }
}
