package tpcsim.physics.model;

import tpcsim.config.DriftVelocity;
import tpcsim.domain.track.Track;

import java.util.Objects;

/**
 * Transformaciones entre el espacio físico de la cámara y el espacio crudo del detector.
 * <p>
 * Espacio físico: (x, y, z) en metros, con z la distancia de deriva. Espacio crudo: (x, y)
 * en el plano de pads y la coordenada temporal en time buckets. Unidades asumidas: posiciones
 * en metros, velocidad de deriva en cm/µs y reloj en Hz; el factor {@code clock * 1e-4}
 * convierte cm/µs en metros por time bucket.
 * <p>
 * Todas las funciones son puras y thread-safe.
 */
public final class CoordinateTransform {

    private static final double UNIT_FACTOR = 1e-4;

    /**
     * Prohibido construir esta clase utilidad
     */
    private CoordinateTransform() {
    }

    /**
     * Convierte posiciones crudas (x, y, tb) en posiciones físicas (x, y, z).
     *
     * @param pos   Matriz N x 3 en espacio crudo.
     * @param vd    Velocidad de deriva [cm/µs].
     * @param clock Frecuencia de muestreo [Hz].
     * @return Nueva matriz N x 3 en espacio físico.
     */
    public static double[][] calibrate(double[][] pos, DriftVelocity vd, double clock) {
        validateMatrix(pos);
        Objects.requireNonNull(vd, "La velocidad de deriva no puede ser nula.");
        final double scale = clock * UNIT_FACTOR;
        final double[] v = vd.toArray();

        double[][] result = new double[pos.length][3];
        for (int i = 0; i < pos.length; i++) {
            double tb = pos[i][2];
            for (int c = 0; c < 3; c++) {
                result[i][c] = pos[i][c] + tb * -v[c] / scale;
            }
            // La coordenada z resultante es la distancia de deriva neta
            result[i][2] -= tb;
        }
        return result;
    }

    public static double[][] calibrate(Track track, DriftVelocity vd, double clock) {
        return calibrate(track.getPositionMatrix(), vd, clock);
    }

    /**
     * Convierte posiciones físicas (x, y, z) en posiciones crudas (x, y, tb).
     * <p>
     * El time bucket de cada punto es {@code z * clock * 1e-4 / (-vd_z) + offset}. Después
     * se proyectan x e y con el mismo desplazamiento por bucket que usa {@link #calibrate}.
     *
     * @param pos    Matriz N x 3 en espacio físico [m].
     * @param vd     Velocidad de deriva [cm/µs]. Su componente z no puede ser nula.
     * @param clock  Frecuencia de muestreo [Hz].
     * @param offset Desplazamiento temporal de toda la traza [time buckets].
     * @return Nueva matriz N x 3 en espacio crudo.
     * @throws IllegalArgumentException si la componente z de la velocidad es degenerada.
     */
    public static double[][] uncalibrate(double[][] pos, DriftVelocity vd, double clock, int offset) {
        validateMatrix(pos);
        Objects.requireNonNull(vd, "La velocidad de deriva no puede ser nula.");
        if (!vd.hasUsableDriftComponent()) {
            throw new IllegalArgumentException("No se puede descalibrar con una velocidad de deriva z degenerada: " + vd.z());
        }
        final double scale = clock * UNIT_FACTOR;
        final double[] v = vd.toArray();

        double[][] result = new double[pos.length][3];
        for (int i = 0; i < pos.length; i++) {
            double tb = pos[i][2] * scale / (-v[2]) + offset;
            result[i][0] = pos[i][0] - tb * -v[0] / scale;
            result[i][1] = pos[i][1] - tb * -v[1] / scale;
            result[i][2] = tb;
        }
        return result;
    }

    public static double[][] uncalibrate(double[][] pos, DriftVelocity vd, double clock) {
        return uncalibrate(pos, vd, clock, 0);
    }

    public static double[][] uncalibrate(Track track, DriftVelocity vd, double clock, int offset) {
        return uncalibrate(track.getPositionMatrix(), vd, clock, offset);
    }

    /**
     * Deshace la inclinación de montaje del detector y recentra la traza.
     * <p>
     * Rota todos los puntos {@code -tilt} radianes alrededor del eje x y desplaza y en
     * {@code -tan(tilt)}: la rotación se hace respecto a la Micromegas, situada a 1 m del eje.
     *
     * @param pos  Matriz N x 3 [m].
     * @param tilt Ángulo de inclinación [rad].
     * @return Nueva matriz N x 3.
     */
    public static double[][] unTiltAndRecenter(double[][] pos, double tilt) {
        validateMatrix(pos);
        final double cos = Math.cos(-tilt);
        final double sin = Math.sin(-tilt);
        final double recenter = Math.tan(tilt);

        double[][] result = new double[pos.length][3];
        for (int i = 0; i < pos.length; i++) {
            double y = pos[i][1];
            double z = pos[i][2];
            result[i][0] = pos[i][0];
            result[i][1] = cos * y - sin * z - recenter;
            result[i][2] = sin * y + cos * z;
        }
        return result;
    }

    private static void validateMatrix(double[][] pos) {
        Objects.requireNonNull(pos, "La matriz de posiciones no puede ser nula.");
        for (int i = 0; i < pos.length; i++) {
            if (pos[i] == null || pos[i].length < 3) {
                throw new IllegalArgumentException("La fila " + i + " debe tener al menos 3 columnas.");
            }
        }
    }
}
