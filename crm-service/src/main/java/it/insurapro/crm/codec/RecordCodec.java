package it.insurapro.crm.codec;

import it.insurapro.common.exception.MalformedRecordException;
import it.insurapro.crm.model.Customer;
import it.insurapro.crm.model.Interaction;
import it.insurapro.crm.model.InteractionKind;
import org.springframework.stereotype.Component;

import java.util.regex.Pattern;

import static it.insurapro.common.util.FieldSanitizer.SEPARATOR;

/**
 * Line codec for the two data files.
 *
 * Customers file:    firstName|lastName|email|phone|address|taxCode|birthDate
 * Interactions file: taxCode|date|time|kind|description|agent|outcome
 *
 * No header, no escaping. A value containing '|' shifts the field count and the
 * line is rejected as malformed on decode.
 */
@Component
public class RecordCodec {

    public static final int CUSTOMER_FIELDS = 7;
    public static final int INTERACTION_FIELDS = 7;

    private static final Pattern SPLITTER = Pattern.compile(Pattern.quote(String.valueOf(SEPARATOR)));
    private static final String DELIMITER = String.valueOf(SEPARATOR);

    public String encodeCustomer(Customer customer) {
        return String.join(DELIMITER,
                customer.getFirstName(),
                customer.getLastName(),
                customer.getEmail(),
                customer.getPhone(),
                customer.getAddress(),
                customer.getTaxCode(),
                customer.getBirthDate());
    }

    /**
     * @throws MalformedRecordException unless the line has exactly 7 fields
     */
    public Customer decodeCustomer(String line) {
        String[] fields = split(line);
        if (fields.length != CUSTOMER_FIELDS) {
            throw new MalformedRecordException("customer", CUSTOMER_FIELDS, fields.length);
        }

        return Customer.builder()
                .firstName(fields[0])
                .lastName(fields[1])
                .email(fields[2])
                .phone(fields[3])
                .address(fields[4])
                .taxCode(fields[5])
                .birthDate(fields[6])
                .build();
    }

    public String encodeInteraction(String taxCode, Interaction interaction) {
        return String.join(DELIMITER,
                taxCode,
                interaction.getDate(),
                interaction.getTime(),
                interaction.getKind().getDisplayName(),
                interaction.getDescription(),
                interaction.getAgent(),
                interaction.getOutcome());
    }

    /**
     * Unknown kind names decode as {@link InteractionKind#OTHER}; that is not an error.
     *
     * @throws MalformedRecordException unless the line has exactly 7 fields
     */
    public OwnedInteraction decodeInteraction(String line) {
        String[] fields = split(line);
        if (fields.length != INTERACTION_FIELDS) {
            throw new MalformedRecordException("interaction", INTERACTION_FIELDS, fields.length);
        }

        Interaction interaction = Interaction.builder()
                .date(fields[1])
                .time(fields[2])
                .kind(InteractionKind.fromDisplayName(fields[3]))
                .description(fields[4])
                .agent(fields[5])
                .outcome(fields[6])
                .build();

        return new OwnedInteraction(fields[0], interaction);
    }

    // -1 keeps trailing empty fields: "a|b||||" is 6 fields, not 2
    private static String[] split(String line) {
        return SPLITTER.split(line, -1);
    }
}
