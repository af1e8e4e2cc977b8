package it.insurapro.crm.model;

import lombok.AccessLevel;
import lombok.Builder;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.Setter;
import lombok.ToString;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Locale;

import static it.insurapro.common.util.FieldSanitizer.nullToEmpty;

/**
 * Customer record, identified by its tax code.
 *
 * Owns its interactions: they live in this object's list and go away with it.
 * Two customers are equal when their tax codes are equal.
 */
@Getter
@EqualsAndHashCode(onlyExplicitlyIncluded = true)
@ToString(exclude = "interactions")
public class Customer {

    @Setter
    private String firstName;
    @Setter
    private String lastName;
    @Setter
    private String email;
    @Setter
    private String phone;
    @Setter
    private String address;

    @EqualsAndHashCode.Include
    private final String taxCode;

    @Setter
    private String birthDate;   // DD/MM/YYYY

    @Getter(AccessLevel.NONE)
    private final List<Interaction> interactions = new ArrayList<>();

    @Builder
    public Customer(String firstName, String lastName, String email, String phone,
                    String address, String taxCode, String birthDate) {
        this.firstName = nullToEmpty(firstName);
        this.lastName = nullToEmpty(lastName);
        this.email = nullToEmpty(email);
        this.phone = nullToEmpty(phone);
        this.address = nullToEmpty(address);
        this.taxCode = nullToEmpty(taxCode);
        this.birthDate = nullToEmpty(birthDate);
    }

    public String getFullName() {
        return firstName + " " + lastName;
    }

    /**
     * Read-only view, in insertion order.
     */
    public List<Interaction> getInteractions() {
        return Collections.unmodifiableList(interactions);
    }

    public int getInteractionCount() {
        return interactions.size();
    }

    public void addInteraction(Interaction interaction) {
        interactions.add(interaction);
    }

    /**
     * Remove by position; later interactions shift down by one.
     *
     * @throws IndexOutOfBoundsException if position is outside [0, count)
     */
    public Interaction removeInteraction(int position) {
        return interactions.remove(position);
    }

    /**
     * Substring search. Names, email and phone ignore case; the tax code is
     * matched as typed.
     */
    public boolean matches(String term) {
        String raw = nullToEmpty(term);
        String needle = raw.toLowerCase(Locale.ROOT);

        return firstName.toLowerCase(Locale.ROOT).contains(needle)
                || lastName.toLowerCase(Locale.ROOT).contains(needle)
                || email.toLowerCase(Locale.ROOT).contains(needle)
                || phone.toLowerCase(Locale.ROOT).contains(needle)
                || taxCode.contains(raw);
    }

    /**
     * Detached copy with its own interaction list.
     * Interactions are immutable and shared.
     */
    public Customer copy() {
        Customer copy = new Customer(firstName, lastName, email, phone, address, taxCode, birthDate);
        copy.interactions.addAll(interactions);
        return copy;
    }
}
