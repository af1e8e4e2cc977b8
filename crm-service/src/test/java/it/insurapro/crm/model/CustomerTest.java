package it.insurapro.crm.model;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class CustomerTest {

    private Customer mario() {
        return new Customer("Mario", "Bianchi", "mario.bianchi@mail.it", "3331234567",
                "Via Po 3", "BNCMRA75C10F205X", "10/03/1975");
    }

    @Test
    void builder_ShouldDefaultMissingFieldsToEmpty() {
        Customer customer = Customer.builder().taxCode("TAXCODE1").build();

        assertEquals("", customer.getFirstName());
        assertEquals("", customer.getLastName());
        assertEquals("", customer.getEmail());
        assertEquals("", customer.getPhone());
        assertEquals("", customer.getAddress());
        assertEquals("", customer.getBirthDate());
        assertEquals("TAXCODE1", customer.getTaxCode());
        assertTrue(customer.getInteractions().isEmpty());
    }

    @Test
    void getFullName_ShouldJoinWithSingleSpace() {
        assertEquals("Mario Bianchi", mario().getFullName());
        assertEquals(" ", Customer.builder().taxCode("X").build().getFullName());
    }

    @Test
    void equals_ShouldOnlyCompareTaxCode() {
        Customer other = Customer.builder().firstName("Someone").taxCode("BNCMRA75C10F205X").build();

        assertEquals(mario(), other);
        assertEquals(mario().hashCode(), other.hashCode());
        assertNotEquals(mario(), Customer.builder().firstName("Mario").lastName("Bianchi").taxCode("OTHER").build());
    }

    @Test
    void matches_ShouldIgnoreCaseOnNamesEmailAndPhone() {
        Customer customer = mario();

        assertTrue(customer.matches("mario"));
        assertTrue(customer.matches("MARIO"));
        assertTrue(customer.matches("bianchi"));
        assertTrue(customer.matches("MAIL.IT"));
        assertTrue(customer.matches("1234"));
    }

    @Test
    void matches_ShouldBeCaseSensitiveOnTaxCode() {
        Customer customer = mario();

        assertTrue(customer.matches("C10F205"));
        assertFalse(customer.matches("c10f205"));
    }

    @Test
    void matches_ShouldNotSearchAddressOrBirthDate() {
        Customer customer = mario();

        assertFalse(customer.matches("Via Po"));
        assertFalse(customer.matches("10/03/1975"));
    }

    @Test
    void removeInteraction_ShouldShiftLaterPositions() {
        Customer customer = mario();
        Interaction first = Interaction.builder().description("first").build();
        Interaction second = Interaction.builder().description("second").build();
        Interaction third = Interaction.builder().description("third").build();
        customer.addInteraction(first);
        customer.addInteraction(second);
        customer.addInteraction(third);

        assertSame(second, customer.removeInteraction(1));

        assertEquals(2, customer.getInteractionCount());
        assertSame(third, customer.getInteractions().get(1));
    }

    @Test
    void getInteractions_ShouldBeReadOnly() {
        Customer customer = mario();

        assertThrows(UnsupportedOperationException.class,
                () -> customer.getInteractions().add(Interaction.builder().build()));
    }

    @Test
    void copy_ShouldDetachInteractionList() {
        Customer original = mario();
        original.addInteraction(Interaction.builder().description("call").build());

        Customer copy = original.copy();
        copy.addInteraction(Interaction.builder().description("email").build());
        copy.setEmail("changed@mail.it");

        assertEquals(1, original.getInteractionCount());
        assertEquals("mario.bianchi@mail.it", original.getEmail());
        assertEquals(2, copy.getInteractionCount());
    }
}
