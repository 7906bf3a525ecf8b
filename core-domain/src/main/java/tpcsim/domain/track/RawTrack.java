package tpcsim.domain.track;

import lombok.Builder;

import java.util.Arrays;
import java.util.Objects;

/**
 * Representación de una traza en el espacio "crudo" del detector.
 * <p>
 * Cada fila es un punto de ionización ya descalibrado: coordenadas (x, y) en el plano de pads,
 * coordenada temporal en time buckets y número de electrones asociados. Es la entrada directa
 * del binning por pads.
 *
 * @param x          Coordenada x en el plano de pads [m].
 * @param y          Coordenada y en el plano de pads [m].
 * @param timeBucket Coordenada temporal [time buckets].
 * @param electrons  Número de electrones (o fracción, tras la difusión) del punto.
 */
@Builder
public record RawTrack(
        double[] x,
        double[] y,
        double[] timeBucket,
        double[] electrons
) {

    public RawTrack {
        Objects.requireNonNull(x, "El array x no puede ser nulo.");
        Objects.requireNonNull(y, "El array y no puede ser nulo.");
        Objects.requireNonNull(timeBucket, "El array de time buckets no puede ser nulo.");
        Objects.requireNonNull(electrons, "El array de electrones no puede ser nulo.");

        int length = x.length;
        if (y.length != length || timeBucket.length != length || electrons.length != length) {
            throw new IllegalArgumentException("Todas las columnas de la traza cruda deben tener la misma longitud.");
        }

        x = x.clone();
        y = y.clone();
        timeBucket = timeBucket.clone();
        electrons = electrons.clone();
    }

    /**
     * Construye la traza cruda a partir de una matriz N x 3 (x, y, tb) y el vector de electrones.
     */
    public static RawTrack fromColumns(double[][] positions, double[] electrons) {
        Objects.requireNonNull(positions, "La matriz de posiciones no puede ser nula.");
        int n = positions.length;
        double[] x = new double[n];
        double[] y = new double[n];
        double[] tb = new double[n];
        for (int i = 0; i < n; i++) {
            x[i] = positions[i][0];
            y[i] = positions[i][1];
            tb[i] = positions[i][2];
        }
        return new RawTrack(x, y, tb, electrons);
    }

    public int getRowCount() {
        return x.length;
    }

    public double getXAt(int row) {
        return x[row];
    }

    public double getYAt(int row) {
        return y[row];
    }

    public double getTimeBucketAt(int row) {
        return timeBucket[row];
    }

    public double getElectronsAt(int row) {
        return electrons[row];
    }

    /**
     * Matriz N x 4 con filas (x, y, timeBucket, electrones).
     */
    public double[][] toMatrix() {
        double[][] matrix = new double[x.length][];
        for (int i = 0; i < x.length; i++) {
            matrix[i] = new double[]{x[i], y[i], timeBucket[i], electrons[i]};
        }
        return matrix;
    }

    @Override
    public double[] x() {
        return x.clone();
    }

    @Override
    public double[] y() {
        return y.clone();
    }

    @Override
    public double[] timeBucket() {
        return timeBucket.clone();
    }

    @Override
    public double[] electrons() {
        return electrons.clone();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        RawTrack that = (RawTrack) o;
        return Arrays.equals(x, that.x) &&
                Arrays.equals(y, that.y) &&
                Arrays.equals(timeBucket, that.timeBucket) &&
                Arrays.equals(electrons, that.electrons);
    }

    @Override
    public int hashCode() {
        int result = Arrays.hashCode(x);
        result = 31 * result + Arrays.hashCode(y);
        result = 31 * result + Arrays.hashCode(timeBucket);
        result = 31 * result + Arrays.hashCode(electrons);
        return result;
    }
}
