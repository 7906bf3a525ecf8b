package tpcsim.physics.minimizer;

import java.util.Arrays;
import java.util.Objects;

/**
 * Métrica de discrepancia entre una traza simulada y los datos experimentales.
 * <p>
 * Para cada punto experimental se busca el punto simulado más cercano y se guarda la
 * diferencia al cuadrado columna a columna. Los puntos simulados con valores no finitos
 * (simulaciones divergentes) nunca se eligen como vecino.
 */
public final class TrackDeviations {

    /**
     * Prohibido construir esta clase utilidad
     */
    private TrackDeviations() {
    }

    /**
     * Calcula la matriz de desviaciones, con una fila por punto experimental.
     * <p>
     * Si la traza simulada no tiene ningún punto finito, la fila correspondiente queda a NaN.
     *
     * @param simTrack Matriz M x C de la traza simulada.
     * @param expData  Matriz K x C de los datos experimentales.
     * @return Matriz K x C de diferencias al cuadrado respecto al vecino más cercano.
     */
    public static double[][] findDeviations(double[][] simTrack, double[][] expData) {
        Objects.requireNonNull(simTrack, "La traza simulada no puede ser nula.");
        Objects.requireNonNull(expData, "Los datos experimentales no pueden ser nulos.");

        double[][] devs = new double[expData.length][];
        for (int i = 0; i < expData.length; i++) {
            double[] exp = expData[i];
            double[] nearest = null;
            double bestDistance = Double.POSITIVE_INFINITY;

            for (double[] sim : simTrack) {
                if (sim.length != exp.length) {
                    throw new IllegalArgumentException(String.format(
                            "Columnas incompatibles: simulación %d, datos %d.", sim.length, exp.length));
                }
                double distance = 0;
                for (int c = 0; c < exp.length; c++) {
                    double d = sim[c] - exp[c];
                    distance += d * d;
                }
                // NaN nunca es menor: los puntos divergentes se ignoran
                if (distance < bestDistance) {
                    bestDistance = distance;
                    nearest = sim;
                }
            }

            double[] row = new double[exp.length];
            if (nearest == null) {
                Arrays.fill(row, Double.NaN);
            } else {
                for (int c = 0; c < exp.length; c++) {
                    double d = nearest[c] - exp[c];
                    row[c] = d * d;
                }
            }
            devs[i] = row;
        }
        return devs;
    }

    /**
     * Elimina los valores no finitos (NaN e infinitos) de un vector.
     */
    public static double[] dropNaNs(double[] data) {
        Objects.requireNonNull(data, "El vector no puede ser nulo.");
        return Arrays.stream(data).filter(Double::isFinite).toArray();
    }

    /**
     * Reduce la matriz de desviaciones a un coste escalar: media de las sumas por fila,
     * ignorando las filas no finitas.
     *
     * @return El coste, o {@code +Infinity} si ninguna fila es finita.
     */
    public static double score(double[][] deviations) {
        double[] rowSums = new double[deviations.length];
        for (int i = 0; i < deviations.length; i++) {
            rowSums[i] = Arrays.stream(deviations[i]).sum();
        }
        double[] finite = dropNaNs(rowSums);
        if (finite.length == 0) {
            return Double.POSITIVE_INFINITY;
        }
        return Arrays.stream(finite).sum() / finite.length;
    }
}
