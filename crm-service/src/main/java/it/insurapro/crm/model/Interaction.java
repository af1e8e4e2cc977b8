package it.insurapro.crm.model;

import lombok.Builder;
import lombok.Value;

import java.util.Locale;

import static it.insurapro.common.util.FieldSanitizer.nullToEmpty;

/**
 * A single dated contact with a customer.
 *
 * Immutable. It has no identity of its own: it is addressed by its position in
 * the owning customer's list.
 */
@Value
public class Interaction {

    String date;        // DD/MM/YYYY
    String time;        // HH:MM
    InteractionKind kind;
    String description;
    String agent;
    String outcome;

    @Builder
    public Interaction(String date, String time, InteractionKind kind,
                       String description, String agent, String outcome) {
        this.date = nullToEmpty(date);
        this.time = nullToEmpty(time);
        this.kind = kind == null ? InteractionKind.OTHER : kind;
        this.description = nullToEmpty(description);
        this.agent = nullToEmpty(agent);
        this.outcome = nullToEmpty(outcome);
    }

    /**
     * Substring search. Description, agent, outcome and kind ignore case;
     * date and time are matched as typed.
     */
    public boolean matches(String term) {
        String raw = nullToEmpty(term);
        String needle = raw.toLowerCase(Locale.ROOT);

        return containsIgnoreCase(description, needle)
                || containsIgnoreCase(agent, needle)
                || containsIgnoreCase(outcome, needle)
                || containsIgnoreCase(kind.getDisplayName(), needle)
                || date.contains(raw)
                || time.contains(raw);
    }

    private static boolean containsIgnoreCase(String field, String lowerNeedle) {
        return field.toLowerCase(Locale.ROOT).contains(lowerNeedle);
    }
}
