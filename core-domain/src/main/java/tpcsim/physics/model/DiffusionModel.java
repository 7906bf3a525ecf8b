package tpcsim.physics.model;

import tpcsim.domain.track.RawTrack;

import java.util.Objects;

/**
 * Modelo de difusión transversal de la nube de electrones.
 * <p>
 * Cada punto de ionización se sustituye por 9 clones: el original, con el 40% de la carga,
 * y 8 vecinos desplazados en las direcciones cardinales y diagonales, con el resto repartido
 * a partes iguales. El desplazamiento es {@code diffusionSigma} (o {@code diffusionSigma * sqrt(2)}
 * en las diagonales) multiplicado por la raíz de la coordenada temporal del punto, ya que la
 * dispersión crece con la raíz de la longitud de deriva.
 * <p>
 * Orden de salida: filas [0, N) son los originales escalados; después 8 bloques contiguos
 * de N filas, uno por dirección, en el orden E, O, N, S, NE, SE, NO, SO.
 */
public class DiffusionModel {

    /**
     * Fracción de la carga que conserva el punto original.
     */
    public static final double CENTER_FRACTION = 0.4;

    /**
     * Número de clones desplazados por cada punto original.
     */
    public static final int NEIGHBOR_COUNT = 8;

    /**
     * Fracción de la carga de cada clon desplazado.
     */
    public static final double NEIGHBOR_FRACTION = (1 - CENTER_FRACTION) / NEIGHBOR_COUNT;

    private final double[][] offsets;

    public DiffusionModel(double diffusionSigma) {
        if (diffusionSigma < 0) {
            throw new IllegalArgumentException("La sigma de difusión no puede ser negativa.");
        }
        final double s = diffusionSigma;
        final double d = diffusionSigma * Math.sqrt(2);
        this.offsets = new double[][]{
                {s, 0},     // Este
                {-s, 0},    // Oeste
                {0, s},     // Norte
                {0, -s},    // Sur
                {d, d},     // Noreste
                {d, -d},    // Sureste
                {-d, d},    // Noroeste
                {-d, -d}    // Suroeste
        };
    }

    /**
     * Expande cada fila de la traza en sus 9 clones difundidos.
     *
     * @param track Traza cruda con N filas.
     * @return Nueva traza con 9N filas.
     */
    public RawTrack diffuseElectrons(RawTrack track) {
        Objects.requireNonNull(track, "La traza a difundir no puede ser nula.");
        final int n = track.getRowCount();
        final int total = n * (NEIGHBOR_COUNT + 1);

        double[] x = new double[total];
        double[] y = new double[total];
        double[] tb = new double[total];
        double[] electrons = new double[total];

        for (int i = 0; i < n; i++) {
            x[i] = track.getXAt(i);
            y[i] = track.getYAt(i);
            tb[i] = track.getTimeBucketAt(i);
            electrons[i] = track.getElectronsAt(i) * CENTER_FRACTION;
        }

        for (int k = 0; k < NEIGHBOR_COUNT; k++) {
            final int firstRow = n * (k + 1);
            for (int i = 0; i < n; i++) {
                final int row = firstRow + i;
                final double spread = Math.sqrt(track.getTimeBucketAt(i));
                x[row] = track.getXAt(i) + offsets[k][0] * spread;
                y[row] = track.getYAt(i) + offsets[k][1] * spread;
                tb[row] = track.getTimeBucketAt(i);
                electrons[row] = track.getElectronsAt(i) * NEIGHBOR_FRACTION;
            }
        }

        return new RawTrack(x, y, tb, electrons);
    }
}
