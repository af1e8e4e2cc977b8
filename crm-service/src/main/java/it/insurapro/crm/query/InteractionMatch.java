package it.insurapro.crm.query;

import it.insurapro.crm.model.Customer;
import it.insurapro.crm.model.Interaction;
import lombok.Value;

/**
 * Interaction hit with both positions: the owner's in the store and the
 * interaction's in the owner's list.
 */
@Value
public class InteractionMatch {
    int customerPosition;
    Customer customer;
    int interactionPosition;
    Interaction interaction;
}
