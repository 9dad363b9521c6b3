package civilzones.domain.flood;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class FloodResultTest {

    @ParameterizedTest(name = "{0} ahogados -> {1}")
    @CsvSource({
            "0, MINOR",
            "20, MINOR",
            "21, SEVERE",
            "100, SEVERE",
            "101, CATASTROPHE"
    })
    @DisplayName("Severidad: umbrales estrictos de 20 y 100 ahogados")
    void severity_shouldFollowPopulationThresholds(long drowned, FloodSeverity expected) {
        FloodResult result = FloodResult.builder()
                .destroyedStructures(List.of())
                .populationDrowned(drowned)
                .seaLevel(3.0)
                .build();

        assertEquals(expected, result.severity());
    }

    @Test
    @DisplayName("Resultado vacío: sin pérdidas ni cambios de terreno")
    void empty_shouldHaveNoLossesOrChanges() {
        FloodResult result = FloodResult.empty(2.5);

        assertFalse(result.hasLosses());
        assertFalse(result.hasTileChanges());
        assertEquals(2.5, result.seaLevel(), 0.0);
    }

    @Test
    @DisplayName("Inmutabilidad: la lista de estructuras destruidas es una copia")
    void destroyedStructures_shouldBeCopied() {
        List<DestroyedStructure> structures = new ArrayList<>();
        structures.add(new DestroyedStructure(1, 1, "WELL", 0));
        FloodResult result = FloodResult.builder()
                .tilesFlooded(1)
                .destroyedStructures(structures)
                .seaLevel(3.0)
                .build();

        structures.clear();

        assertEquals(1, result.destroyedStructures().size());
        assertTrue(result.hasLosses());
        assertTrue(result.hasTileChanges());
    }

    @Test
    @DisplayName("Validación: la población ahogada no puede ser negativa")
    void negativePopulation_shouldBeRejected() {
        assertThrows(IllegalArgumentException.class, () -> FloodResult.builder()
                .destroyedStructures(List.of())
                .populationDrowned(-1)
                .build());
    }
}
