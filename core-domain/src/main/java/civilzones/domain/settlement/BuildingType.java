package civilzones.domain.settlement;

import lombok.Getter;
import lombok.RequiredArgsConstructor;

/**
 * Tipos de edificio del asentamiento con el lado de su huella en casillas.
 */
@Getter
@RequiredArgsConstructor
public enum BuildingType {
    WELL(1),
    RESIDENTIAL(2),
    COMMERCIAL(1),
    INDUSTRIAL(1),
    STORAGE(2),
    HUNTING_GROUND(2);

    private final int footprintSize;
}
