package it.insurapro.crm.model;

/**
 * Kind of contact recorded for a customer.
 *
 * The display name is what gets written to the interactions file, so it must
 * stay stable across releases.
 */
public enum InteractionKind {
    APPOINTMENT("Appointment"),
    CONTRACT("Contract"),
    CALL("Call"),
    EMAIL("Email"),
    OTHER("Other");

    private final String displayName;

    InteractionKind(String displayName) {
        this.displayName = displayName;
    }

    public String getDisplayName() {
        return displayName;
    }

    /**
     * Exact, case-sensitive lookup by display name.
     * Unknown or null values map to {@link #OTHER}.
     */
    public static InteractionKind fromDisplayName(String displayName) {
        for (InteractionKind kind : values()) {
            if (kind.displayName.equals(displayName)) {
                return kind;
            }
        }
        return OTHER;
    }
}
