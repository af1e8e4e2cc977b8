package it.insurapro.crm.controller;

import it.insurapro.common.dto.ApiResponse;
import it.insurapro.common.dto.customer.CustomerDto;
import it.insurapro.common.dto.customer.CustomerMatchDto;
import it.insurapro.common.dto.customer.CustomerUpdateRequest;
import it.insurapro.crm.service.CustomerService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;

/**
 * REST Controller for customer records.
 *
 * IMPORTANT: Controllers contain NO business logic.
 * All logic is delegated to CustomerService.
 */
@RestController
@RequestMapping("/api/customers")
@RequiredArgsConstructor
@Tag(name = "Customers", description = "Customer records management")
public class CustomerController {

    private final CustomerService customerService;

    @GetMapping
    @Operation(summary = "Get all customers")
    public ResponseEntity<ApiResponse<List<CustomerDto>>> getAllCustomers() {
        return ResponseEntity.ok(ApiResponse.success(customerService.getAllCustomers()));
    }

    @GetMapping("/{taxCode}")
    @Operation(summary = "Get customer by tax code, with interactions")
    public ResponseEntity<ApiResponse<CustomerDto>> getCustomer(@PathVariable String taxCode) {
        return ResponseEntity.ok(ApiResponse.success(customerService.getCustomer(taxCode)));
    }

    @GetMapping("/by-name")
    @Operation(summary = "Find customer by exact first and last name")
    public ResponseEntity<ApiResponse<CustomerDto>> findByName(
            @RequestParam String firstName,
            @RequestParam String lastName) {
        return ResponseEntity.ok(ApiResponse.success(customerService.findByName(firstName, lastName)));
    }

    @GetMapping("/search")
    @Operation(summary = "Search customers by name, email, phone or tax code")
    public ResponseEntity<ApiResponse<List<CustomerMatchDto>>> searchCustomers(@RequestParam String term) {
        return ResponseEntity.ok(ApiResponse.success(customerService.searchCustomers(term)));
    }

    @PostMapping
    @Operation(summary = "Add a new customer")
    public ResponseEntity<ApiResponse<CustomerDto>> createCustomer(@Valid @RequestBody CustomerDto customerDto) {
        CustomerDto created = customerService.createCustomer(customerDto);
        return ResponseEntity
                .status(HttpStatus.CREATED)
                .body(ApiResponse.success(created, "Customer added successfully"));
    }

    @PutMapping("/{taxCode}")
    @Operation(summary = "Update customer fields (empty fields are left unchanged)")
    public ResponseEntity<ApiResponse<CustomerDto>> updateCustomer(
            @PathVariable String taxCode,
            @RequestBody CustomerUpdateRequest request) {
        CustomerDto updated = customerService.updateCustomer(taxCode, request);
        return ResponseEntity.ok(ApiResponse.success(updated, "Customer updated successfully"));
    }

    @DeleteMapping("/{taxCode}")
    @Operation(summary = "Delete customer and all its interactions")
    public ResponseEntity<ApiResponse<Void>> deleteCustomer(@PathVariable String taxCode) {
        customerService.deleteCustomer(taxCode);
        return ResponseEntity.ok(ApiResponse.success(null, "Customer deleted successfully"));
    }
}
