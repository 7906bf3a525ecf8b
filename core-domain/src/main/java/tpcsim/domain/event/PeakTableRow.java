package tpcsim.domain.event;

/**
 * Fila de la tabla de picos de un evento simulado.
 *
 * @param padCenterX Coordenada x del centro del pad [m].
 * @param padCenterY Coordenada y del centro del pad [m].
 * @param centroid   Centroide del pico ponderado por carga [time buckets].
 * @param amplitude  Amplitud máxima de la señal del pad.
 * @param padNumber  Identificador del pad.
 */
public record PeakTableRow(
        double padCenterX,
        double padCenterY,
        double centroid,
        double amplitude,
        int padNumber
) {

    /**
     * La fila como array (x, y, centroide, amplitud, pad).
     */
    public double[] toArray() {
        return new double[]{padCenterX, padCenterY, centroid, amplitude, padNumber};
    }
}
