package me.chatrelay.bot.routing;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ClauseTurnCombinerTest {

    private ClauseTurnCombiner combiner;

    @BeforeEach
    void setUp() {
        combiner = new ClauseTurnCombiner();
    }

    @Test
    void shouldReturnEmptyStringForNoFragments() {
        assertEquals("", combiner.combine(List.of()));
        assertEquals("", combiner.combine(null));
    }

    @Test
    void shouldReturnSingleFragmentUnchanged() {
        assertEquals("  hola  ", combiner.combine(List.of("  hola  ")));
    }

    @Test
    void shouldJoinFragmentsWithSingleSpaceInArrivalOrder() {
        String combined = combiner.combine(List.of("hola", "necesito un kinesiólogo", "en Puerto Montt"));

        assertEquals("hola necesito un kinesiólogo en Puerto Montt", combined);
    }

    @Test
    void shouldJoinFragmentEndingInConnectorWithNextFragment() {
        String combined = combiner.combine(List.of("busco cardiólogo en", "Santiago", "gracias"));

        assertEquals("busco cardiólogo en Santiago gracias", combined);
    }

    @Test
    void shouldKeepDuplicateFragments() {
        assertEquals("hola hola hola", combiner.combine(List.of("hola", "hola", "hola")));
    }

    @Test
    void shouldTrimFragmentsWhenCombining() {
        assertEquals("uno dos", combiner.combine(List.of(" uno ", "dos\n")));
    }

    @ParameterizedTest
    @ValueSource(strings = { "hola", "Hola!", "¡Buenas tardes!", "gracias.", "Muchas gracias", "thanks" })
    void shouldRecognizeGreetings(String text) {
        assertTrue(combiner.isGreeting(text));
    }

    @ParameterizedTest
    @ValueSource(strings = { "hola necesito ayuda", "", "cardiólogo" })
    void shouldNotTreatOtherTextAsGreeting(String text) {
        assertFalse(combiner.isGreeting(text));
    }

    @Test
    void shouldDetectTrailingConnector() {
        assertTrue(combiner.endsWithConnector("necesito un médico en"));
        assertTrue(combiner.endsWithConnector("para la..."));
        assertFalse(combiner.endsWithConnector("necesito un médico"));
        assertFalse(combiner.endsWithConnector("   "));
    }
}
