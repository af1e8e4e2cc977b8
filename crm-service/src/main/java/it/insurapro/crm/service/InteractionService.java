package it.insurapro.crm.service;

import it.insurapro.common.dto.interaction.InteractionDto;
import it.insurapro.common.dto.interaction.InteractionMatchDto;
import it.insurapro.common.exception.ValidationException;
import it.insurapro.common.util.DateTimeValidator;
import it.insurapro.crm.mapper.CustomerMapper;
import it.insurapro.crm.model.Interaction;
import it.insurapro.crm.query.CustomerQueryEngine;
import it.insurapro.crm.repository.CustomerStore;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.stream.Collectors;

import static it.insurapro.crm.service.CustomerService.checkStorable;

/**
 * Service for customer interactions.
 *
 * Date and time formats are checked here, before the interaction is built.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class InteractionService {

    private final CustomerStore customerStore;
    private final CustomerQueryEngine queryEngine;
    private final CustomerMapper customerMapper;

    public List<InteractionDto> getInteractions(String taxCode) {
        log.debug("Fetching interactions for customer {}", taxCode);
        return customerMapper.toInteractionDtos(customerStore.getByTaxCode(taxCode).getInteractions());
    }

    public InteractionDto addInteraction(String taxCode, InteractionDto interactionDto) {
        validateInteraction(interactionDto);

        Interaction interaction = customerMapper.toInteraction(interactionDto);
        int position = customerStore.addInteraction(taxCode, interaction);

        log.info("Added {} interaction for customer {} at position {}",
                interaction.getKind().getDisplayName(), taxCode, position);
        return customerMapper.toDto(interaction, position);
    }

    /**
     * Remove by position; later interactions shift down by one.
     */
    public void removeInteraction(String taxCode, int position) {
        Interaction removed = customerStore.removeInteraction(taxCode, position);
        log.info("Removed {} interaction of {} from customer {}",
                removed.getKind().getDisplayName(), removed.getDate(), taxCode);
    }

    public List<InteractionMatchDto> searchInteractions(String term) {
        log.debug("Searching interactions for '{}'", term);
        return queryEngine.searchInteractions(term)
                .map(customerMapper::toDto)
                .collect(Collectors.toList());
    }

    private void validateInteraction(InteractionDto dto) {
        if (!DateTimeValidator.isValidDate(dto.getDate())) {
            throw new ValidationException("date", "Expected format DD/MM/YYYY");
        }
        if (!DateTimeValidator.isValidTime(dto.getTime())) {
            throw new ValidationException("time", "Expected format HH:MM");
        }
        checkStorable("description", dto.getDescription());
        checkStorable("agent", dto.getAgent());
        checkStorable("outcome", dto.getOutcome());
    }
}
