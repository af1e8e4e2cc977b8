package it.insurapro.common.dto.interaction;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * One interaction search hit, with the owning customer for context.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class InteractionMatchDto {

    private int customerPosition;
    private String taxCode;
    private String customerName;
    private int interactionPosition;
    private InteractionDto interaction;
}
