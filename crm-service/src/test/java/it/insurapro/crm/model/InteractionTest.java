package it.insurapro.crm.model;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class InteractionTest {

    private Interaction checkup() {
        return new Interaction("01/06/2024", "10:00", InteractionKind.APPOINTMENT,
                "Annual Checkup", "Luigi Verdi", "Booked");
    }

    @Test
    void builder_ShouldDefaultToEmptyFieldsAndOtherKind() {
        Interaction interaction = Interaction.builder().build();

        assertEquals("", interaction.getDate());
        assertEquals("", interaction.getTime());
        assertEquals(InteractionKind.OTHER, interaction.getKind());
        assertEquals("", interaction.getDescription());
        assertEquals("", interaction.getAgent());
        assertEquals("", interaction.getOutcome());
    }

    @Test
    void matches_ShouldIgnoreCaseOnTextFields() {
        Interaction interaction = checkup();

        assertTrue(interaction.matches("checkup"));
        assertTrue(interaction.matches("LUIGI"));
        assertTrue(interaction.matches("booked"));
    }

    @Test
    void matches_ShouldSearchKindDisplayName() {
        assertTrue(checkup().matches("appointment"));
        assertFalse(checkup().matches("contract"));
    }

    @Test
    void matches_ShouldFindDateAndTime() {
        assertTrue(checkup().matches("06/2024"));
        assertTrue(checkup().matches("10:00"));
        assertFalse(checkup().matches("11:00"));
    }

    @Test
    void equals_ShouldCompareAllFields() {
        assertEquals(checkup(), checkup());
        assertNotEquals(checkup(), Interaction.builder()
                .date("01/06/2024").time("10:00").kind(InteractionKind.CALL)
                .description("Annual Checkup").agent("Luigi Verdi").outcome("Booked")
                .build());
    }

    @Test
    void fromDisplayName_ShouldMapExactNamesAndDefaultToOther() {
        assertEquals(InteractionKind.APPOINTMENT, InteractionKind.fromDisplayName("Appointment"));
        assertEquals(InteractionKind.CONTRACT, InteractionKind.fromDisplayName("Contract"));
        assertEquals(InteractionKind.CALL, InteractionKind.fromDisplayName("Call"));
        assertEquals(InteractionKind.EMAIL, InteractionKind.fromDisplayName("Email"));
        assertEquals(InteractionKind.OTHER, InteractionKind.fromDisplayName("Other"));

        assertEquals(InteractionKind.OTHER, InteractionKind.fromDisplayName("call"));
        assertEquals(InteractionKind.OTHER, InteractionKind.fromDisplayName("Telefonata"));
        assertEquals(InteractionKind.OTHER, InteractionKind.fromDisplayName(null));
    }
}
