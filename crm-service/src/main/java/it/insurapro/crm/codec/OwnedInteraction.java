package it.insurapro.crm.codec;

import it.insurapro.crm.model.Interaction;
import lombok.Value;

/**
 * A decoded interaction line: the interaction plus the tax code of the
 * customer it belongs to.
 */
@Value
public class OwnedInteraction {
    String taxCode;
    Interaction interaction;
}
