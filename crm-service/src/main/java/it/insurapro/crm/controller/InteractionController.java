package it.insurapro.crm.controller;

import it.insurapro.common.dto.ApiResponse;
import it.insurapro.common.dto.interaction.InteractionDto;
import it.insurapro.common.dto.interaction.InteractionMatchDto;
import it.insurapro.crm.service.InteractionService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;

/**
 * REST Controller for customer interactions.
 */
@RestController
@RequestMapping("/api")
@RequiredArgsConstructor
@Tag(name = "Interactions", description = "Appointments, contracts, calls and other customer contacts")
public class InteractionController {

    private final InteractionService interactionService;

    @GetMapping("/customers/{taxCode}/interactions")
    @Operation(summary = "Get interactions of a customer")
    public ResponseEntity<ApiResponse<List<InteractionDto>>> getInteractions(@PathVariable String taxCode) {
        return ResponseEntity.ok(ApiResponse.success(interactionService.getInteractions(taxCode)));
    }

    @PostMapping("/customers/{taxCode}/interactions")
    @Operation(summary = "Add an interaction to a customer")
    public ResponseEntity<ApiResponse<InteractionDto>> addInteraction(
            @PathVariable String taxCode,
            @Valid @RequestBody InteractionDto interactionDto) {
        InteractionDto created = interactionService.addInteraction(taxCode, interactionDto);
        return ResponseEntity
                .status(HttpStatus.CREATED)
                .body(ApiResponse.success(created, "Interaction added successfully"));
    }

    @DeleteMapping("/customers/{taxCode}/interactions/{position}")
    @Operation(summary = "Remove an interaction by position")
    public ResponseEntity<ApiResponse<Void>> removeInteraction(
            @PathVariable String taxCode,
            @PathVariable int position) {
        interactionService.removeInteraction(taxCode, position);
        return ResponseEntity.ok(ApiResponse.success(null, "Interaction removed successfully"));
    }

    @GetMapping("/interactions/search")
    @Operation(summary = "Search interactions of all customers")
    public ResponseEntity<ApiResponse<List<InteractionMatchDto>>> searchInteractions(@RequestParam String term) {
        return ResponseEntity.ok(ApiResponse.success(interactionService.searchInteractions(term)));
    }
}
