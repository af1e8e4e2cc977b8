package it.insurapro.common.dto.customer;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * One customer search hit with its position in the store.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CustomerMatchDto {

    private int position;
    private CustomerDto customer;
}
