package it.insurapro.common.dto.interaction;

import com.fasterxml.jackson.annotation.JsonInclude;
import jakarta.validation.constraints.NotBlank;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * DTO for a customer interaction (appointment, contract, call...).
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class InteractionDto {

    /**
     * Position within the owning customer's list. Read-only.
     */
    private Integer position;

    @NotBlank(message = "Date is required")
    private String date;        // DD/MM/YYYY

    @NotBlank(message = "Time is required")
    private String time;        // HH:MM

    /**
     * Display name: Appointment, Contract, Call, Email or Other.
     * Anything else is stored as Other.
     */
    private String kind;

    private String description;
    private String agent;
    private String outcome;
}
