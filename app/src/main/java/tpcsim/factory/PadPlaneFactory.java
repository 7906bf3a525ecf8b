package tpcsim.factory;

import lombok.extern.slf4j.Slf4j;
import tpcsim.domain.event.HitPattern;
import tpcsim.domain.pad.RectangularPadPlane;

/**
 * Fábrica de planos de pads regulares.
 * <p>
 * Centra la malla sobre el eje del haz (x = y = 0) y comprueba que todos los pads sean
 * direccionables por el patrón de impactos.
 */
@Slf4j
public class PadPlaneFactory {

    /**
     * Crea una malla cuadrada de {@code padsPerSide x padsPerSide} pads centrada en el origen.
     *
     * @param padSize     Lado de cada pad [m].
     * @param padsPerSide Número de pads por lado.
     * @return Plano de pads inmutable.
     * @throws IllegalArgumentException si la malla no cabe en el patrón de impactos.
     */
    public RectangularPadPlane createCenteredGrid(double padSize, int padsPerSide) {
        return createCenteredGrid(padSize, padsPerSide, padsPerSide);
    }

    public RectangularPadPlane createCenteredGrid(double padSize, int columns, int rows) {
        if ((long) columns * rows > HitPattern.CAPACITY) {
            throw new IllegalArgumentException(String.format(
                    "Una malla de %d x %d pads supera la capacidad del patrón de impactos (%d).",
                    columns, rows, HitPattern.CAPACITY));
        }
        double minX = -columns * padSize / 2;
        double minY = -rows * padSize / 2;
        RectangularPadPlane plane = new RectangularPadPlane(minX, minY, padSize, columns, rows);
        log.info("Plano de pads creado: {} x {} pads de {} m.", columns, rows, padSize);
        return plane;
    }
}
