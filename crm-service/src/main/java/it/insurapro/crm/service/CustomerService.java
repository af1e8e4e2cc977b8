package it.insurapro.crm.service;

import it.insurapro.common.dto.customer.CustomerDto;
import it.insurapro.common.dto.customer.CustomerMatchDto;
import it.insurapro.common.dto.customer.CustomerUpdateRequest;
import it.insurapro.common.exception.ResourceNotFoundException;
import it.insurapro.common.exception.ValidationException;
import it.insurapro.common.util.FieldSanitizer;
import it.insurapro.crm.mapper.CustomerMapper;
import it.insurapro.crm.model.Customer;
import it.insurapro.crm.query.CustomerQueryEngine;
import it.insurapro.crm.repository.CustomerStore;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.stream.Collectors;

/**
 * Service for customer records.
 *
 * ALL business logic for customer management is here.
 * Controllers only delegate to this service.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class CustomerService {

    private final CustomerStore customerStore;
    private final CustomerQueryEngine queryEngine;
    private final CustomerMapper customerMapper;

    /**
     * Get all customers in insertion order.
     */
    public List<CustomerDto> getAllCustomers() {
        log.debug("Fetching all customers");
        return customerStore.snapshot().stream()
                .map(customerMapper::toDto)
                .collect(Collectors.toList());
    }

    /**
     * Get a customer with its interactions.
     */
    public CustomerDto getCustomer(String taxCode) {
        log.debug("Fetching customer by tax code: {}", taxCode);
        return customerMapper.toDetailedDto(customerStore.getByTaxCode(taxCode));
    }

    /**
     * Find the first customer with exactly this first and last name.
     */
    public CustomerDto findByName(String firstName, String lastName) {
        int position = customerStore.findByName(firstName, lastName)
                .orElseThrow(() -> new ResourceNotFoundException("Customer", firstName + " " + lastName));
        return customerMapper.toDetailedDto(customerStore.get(position));
    }

    public CustomerDto createCustomer(CustomerDto customerDto) {
        validateCustomer(customerDto);

        Customer customer = customerMapper.toCustomer(customerDto);
        customerStore.add(customer);

        log.info("Added customer {} ({})", customer.getFullName(), customer.getTaxCode());
        return customerMapper.toDto(customer);
    }

    /**
     * Partial update: only non-empty fields replace the stored values.
     */
    public CustomerDto updateCustomer(String taxCode, CustomerUpdateRequest changes) {
        checkStorable("firstName", changes.getFirstName());
        checkStorable("lastName", changes.getLastName());
        checkStorable("email", changes.getEmail());
        checkStorable("phone", changes.getPhone());
        checkStorable("address", changes.getAddress());
        checkStorable("birthDate", changes.getBirthDate());

        Customer updated = customerStore.update(taxCode, changes);

        log.info("Updated customer {}", taxCode);
        return customerMapper.toDto(updated);
    }

    /**
     * Delete a customer and all of its interactions.
     */
    public void deleteCustomer(String taxCode) {
        Customer removed = customerStore.remove(taxCode);
        log.info("Deleted customer {} ({}) and {} interactions",
                removed.getFullName(), taxCode, removed.getInteractionCount());
    }

    public List<CustomerMatchDto> searchCustomers(String term) {
        log.debug("Searching customers for '{}'", term);
        return queryEngine.searchCustomers(term)
                .map(customerMapper::toDto)
                .collect(Collectors.toList());
    }

    private void validateCustomer(CustomerDto dto) {
        if (dto.getTaxCode() == null || dto.getTaxCode().isBlank()) {
            throw new ValidationException("taxCode", "Tax code is required");
        }
        checkStorable("firstName", dto.getFirstName());
        checkStorable("lastName", dto.getLastName());
        checkStorable("email", dto.getEmail());
        checkStorable("phone", dto.getPhone());
        checkStorable("address", dto.getAddress());
        checkStorable("taxCode", dto.getTaxCode());
        checkStorable("birthDate", dto.getBirthDate());
    }

    static void checkStorable(String field, String value) {
        if (!FieldSanitizer.isStorable(value)) {
            throw new ValidationException(field,
                    "must not contain '" + FieldSanitizer.SEPARATOR + "' or line breaks");
        }
    }
}
