package it.insurapro.crm.mapper;

import it.insurapro.common.dto.customer.CustomerDto;
import it.insurapro.common.dto.customer.CustomerMatchDto;
import it.insurapro.common.dto.interaction.InteractionDto;
import it.insurapro.common.dto.interaction.InteractionMatchDto;
import it.insurapro.crm.model.Customer;
import it.insurapro.crm.model.Interaction;
import it.insurapro.crm.model.InteractionKind;
import it.insurapro.crm.query.CustomerMatch;
import it.insurapro.crm.query.InteractionMatch;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * Conversions between the record model and the API DTOs.
 */
@Component
public class CustomerMapper {

    public Customer toCustomer(CustomerDto dto) {
        return Customer.builder()
                .firstName(dto.getFirstName())
                .lastName(dto.getLastName())
                .email(dto.getEmail())
                .phone(dto.getPhone())
                .address(dto.getAddress())
                .taxCode(dto.getTaxCode())
                .birthDate(dto.getBirthDate())
                .build();
    }

    /**
     * Summary view: interaction count only.
     */
    public CustomerDto toDto(Customer customer) {
        return baseDto(customer).build();
    }

    /**
     * Full view including the interaction list.
     */
    public CustomerDto toDetailedDto(Customer customer) {
        return baseDto(customer)
                .interactions(toInteractionDtos(customer.getInteractions()))
                .build();
    }

    public Interaction toInteraction(InteractionDto dto) {
        return Interaction.builder()
                .date(dto.getDate())
                .time(dto.getTime())
                .kind(InteractionKind.fromDisplayName(dto.getKind()))
                .description(dto.getDescription())
                .agent(dto.getAgent())
                .outcome(dto.getOutcome())
                .build();
    }

    public InteractionDto toDto(Interaction interaction, int position) {
        return InteractionDto.builder()
                .position(position)
                .date(interaction.getDate())
                .time(interaction.getTime())
                .kind(interaction.getKind().getDisplayName())
                .description(interaction.getDescription())
                .agent(interaction.getAgent())
                .outcome(interaction.getOutcome())
                .build();
    }

    public List<InteractionDto> toInteractionDtos(List<Interaction> interactions) {
        List<InteractionDto> dtos = new ArrayList<>(interactions.size());
        for (int i = 0; i < interactions.size(); i++) {
            dtos.add(toDto(interactions.get(i), i));
        }
        return dtos;
    }

    public CustomerMatchDto toDto(CustomerMatch match) {
        return CustomerMatchDto.builder()
                .position(match.getPosition())
                .customer(toDto(match.getCustomer()))
                .build();
    }

    public InteractionMatchDto toDto(InteractionMatch match) {
        return InteractionMatchDto.builder()
                .customerPosition(match.getCustomerPosition())
                .taxCode(match.getCustomer().getTaxCode())
                .customerName(match.getCustomer().getFullName())
                .interactionPosition(match.getInteractionPosition())
                .interaction(toDto(match.getInteraction(), match.getInteractionPosition()))
                .build();
    }

    private CustomerDto.CustomerDtoBuilder baseDto(Customer customer) {
        return CustomerDto.builder()
                .firstName(customer.getFirstName())
                .lastName(customer.getLastName())
                .email(customer.getEmail())
                .phone(customer.getPhone())
                .address(customer.getAddress())
                .taxCode(customer.getTaxCode())
                .birthDate(customer.getBirthDate())
                .interactionCount(customer.getInteractionCount());
    }
}
