package tpcsim.domain.track;

import lombok.Builder;

import java.util.Arrays;
import java.util.Objects;

/**
 * Traza simulada tal y como la entrega el integrador de trayectorias.
 * <p>
 * Cada fila corresponde a un paso de la integración: posición física (x, y, z) en metros,
 * tiempo de vuelo y energía acumulada de la partícula. Las posiciones y las energías
 * siempre van emparejadas 1:1.
 *
 * @param positions Matriz N x 3 con las posiciones (x, y, z) [m].
 * @param times     Tiempo asociado a cada paso [s].
 * @param energies  Energía de la partícula en cada paso [MeV/u].
 */
@Builder
public record Track(
        double[][] positions,
        double[] times,
        double[] energies
) {

    public Track {
        Objects.requireNonNull(positions, "La matriz de posiciones no puede ser nula.");
        Objects.requireNonNull(energies, "El vector de energías no puede ser nulo.");
        if (times == null) {
            times = new double[positions.length];
        }
        if (energies.length != positions.length || times.length != positions.length) {
            throw new IllegalArgumentException(String.format(
                    "Dimensiones inconsistentes: %d posiciones, %d tiempos, %d energías.",
                    positions.length, times.length, energies.length));
        }

        double[][] copy = new double[positions.length][];
        for (int i = 0; i < positions.length; i++) {
            if (positions[i] == null || positions[i].length != 3) {
                throw new IllegalArgumentException("La fila " + i + " de posiciones debe tener 3 columnas (x, y, z).");
            }
            copy[i] = positions[i].clone();
        }
        positions = copy;
        times = times.clone();
        energies = energies.clone();
    }

    /**
     * Crea una traza sin información temporal.
     */
    public static Track of(double[][] positions, double[] energies) {
        return new Track(positions, null, energies);
    }

    public int getPointCount() {
        return positions.length;
    }

    public boolean isEmpty() {
        return positions.length == 0;
    }

    /**
     * Copia de la matriz de posiciones N x 3.
     */
    public double[][] getPositionMatrix() {
        double[][] copy = new double[positions.length][];
        for (int i = 0; i < positions.length; i++) {
            copy[i] = positions[i].clone();
        }
        return copy;
    }

    /**
     * Copia del vector de energías.
     */
    public double[] getEnergyVector() {
        return energies.clone();
    }

    /**
     * Matriz combinada con filas (x, y, z, tiempo, energía).
     */
    public double[][] getMatrix() {
        double[][] matrix = new double[positions.length][5];
        for (int i = 0; i < positions.length; i++) {
            matrix[i][0] = positions[i][0];
            matrix[i][1] = positions[i][1];
            matrix[i][2] = positions[i][2];
            matrix[i][3] = times[i];
            matrix[i][4] = energies[i];
        }
        return matrix;
    }

    @Override
    public double[][] positions() {
        return getPositionMatrix();
    }

    @Override
    public double[] times() {
        return times.clone();
    }

    @Override
    public double[] energies() {
        return energies.clone();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        Track that = (Track) o;
        return Arrays.deepEquals(positions, that.positions) &&
                Arrays.equals(times, that.times) &&
                Arrays.equals(energies, that.energies);
    }

    @Override
    public int hashCode() {
        int result = Arrays.deepHashCode(positions);
        result = 31 * result + Arrays.hashCode(times);
        result = 31 * result + Arrays.hashCode(energies);
        return result;
    }
}
