package hydrocascade.domain.routing;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class RoutingLinkTest {

    // Desagüe del embalse de aguas arriba = 10·paso
    private final OutflowLookup lookup = (id, step) -> 10.0 * step;

    @Test
    @DisplayName("Entrega el desagüe de aguas arriba retrasado τ pasos")
    void contributionAt_shouldDelayByTravelTime() {
        RoutingLink link = new RoutingLink("A", "B", 2, 0.0, 0.0);

        assertEquals(0.0, link.contributionAt(2, lookup));
        assertEquals(30.0, link.contributionAt(5, lookup));
    }

    @Test
    @DisplayName("Antes de que exista historia entrega el caudal de calentamiento más el aporte lateral")
    void contributionAt_shouldUseWarmUpBeforeHistory() {
        RoutingLink link = new RoutingLink("A", "B", 3, 5.0, 40.0);

        assertEquals(45.0, link.contributionAt(0, lookup));
        assertEquals(45.0, link.contributionAt(2, lookup));
        // Con historia el calentamiento deja de aplicarse, el aporte lateral no
        assertEquals(5.0 + 10.0, link.contributionAt(4, lookup));
    }

    @Test
    @DisplayName("Un tránsito nulo es instantáneo; uno negativo es inválido")
    void travelTimeValidation() {
        assertTrue(new RoutingLink("A", "B", 0, 0.0, 0.0).isInstantaneous());
        assertFalse(new RoutingLink("A", "B", 1, 0.0, 0.0).isInstantaneous());
        assertThrows(IllegalArgumentException.class, () -> new RoutingLink("A", "B", -1, 0.0, 0.0));
    }
}
