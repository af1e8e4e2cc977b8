package it.insurapro.common.dto.customer;

import com.fasterxml.jackson.annotation.JsonInclude;
import it.insurapro.common.dto.interaction.InteractionDto;
import jakarta.validation.constraints.NotBlank;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * DTO for customer records.
 *
 * Used both as the create payload and as the read model.
 * Interactions are only filled in on single-customer reads.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class CustomerDto {

    private String firstName;
    private String lastName;
    private String email;
    private String phone;
    private String address;

    /**
     * Natural key. Opaque, no format check.
     */
    @NotBlank(message = "Tax code is required")
    private String taxCode;

    /**
     * DD/MM/YYYY, stored as typed.
     */
    private String birthDate;

    private Integer interactionCount;
    private List<InteractionDto> interactions;
}
