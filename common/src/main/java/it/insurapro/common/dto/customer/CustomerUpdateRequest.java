package it.insurapro.common.dto.customer;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Partial update of a customer.
 *
 * Null or empty fields leave the stored value unchanged, so a field can be
 * replaced but never cleared. The tax code is not updatable.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CustomerUpdateRequest {

    private String firstName;
    private String lastName;
    private String email;
    private String phone;
    private String address;
    private String birthDate;
}
