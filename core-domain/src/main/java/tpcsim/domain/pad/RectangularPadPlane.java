package tpcsim.domain.pad;

import lombok.Getter;

/**
 * Plano de pads con una malla regular de pads cuadrados.
 * <p>
 * Los pads se numeran por filas: {@code pad = fila * columnas + columna}, empezando en la
 * esquina (minX, minY). Es inmutable y por tanto seguro para uso concurrente.
 */
@Getter
public final class RectangularPadPlane implements PadPlane {

    private final double minX;
    private final double minY;
    private final double padSize;
    private final int columns;
    private final int rows;

    /**
     * @param minX    Coordenada x del borde izquierdo de la malla [m].
     * @param minY    Coordenada y del borde inferior de la malla [m].
     * @param padSize Lado de cada pad [m] (> 0).
     * @param columns Número de columnas (> 0).
     * @param rows    Número de filas (> 0).
     */
    public RectangularPadPlane(double minX, double minY, double padSize, int columns, int rows) {
        if (padSize <= 0) {
            throw new IllegalArgumentException("El tamaño de pad debe ser positivo.");
        }
        if (columns <= 0 || rows <= 0) {
            throw new IllegalArgumentException("La malla debe tener al menos una fila y una columna.");
        }
        if ((long) columns * rows > NO_PAD) {
            throw new IllegalArgumentException("La malla no puede tener más de " + NO_PAD + " pads.");
        }
        this.minX = minX;
        this.minY = minY;
        this.padSize = padSize;
        this.columns = columns;
        this.rows = rows;
    }

    public int getPadCount() {
        return columns * rows;
    }

    @Override
    public int getPadNumberFromCoordinates(double x, double y) {
        if (!Double.isFinite(x) || !Double.isFinite(y)) {
            return NO_PAD;
        }
        double col = Math.floor((x - minX) / padSize);
        double row = Math.floor((y - minY) / padSize);
        if (col < 0 || col >= columns || row < 0 || row >= rows) {
            return NO_PAD;
        }
        return (int) row * columns + (int) col;
    }

    @Override
    public double[] getPadCenter(int padNumber) {
        if (padNumber < 0 || padNumber >= getPadCount()) {
            throw new IllegalArgumentException("El pad " + padNumber + " no existe en esta malla.");
        }
        int row = padNumber / columns;
        int col = padNumber % columns;
        return new double[]{
                minX + (col + 0.5) * padSize,
                minY + (row + 0.5) * padSize
        };
    }
}
