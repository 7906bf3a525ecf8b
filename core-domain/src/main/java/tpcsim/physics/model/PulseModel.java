package tpcsim.physics.model;

import tpcsim.domain.event.SimulatedEvent;

/**
 * Forma analítica del pulso de la electrónica para una avalancha.
 * <p>
 * La respuesta impulsional es {@code A * exp(-3t) * sin(t) * t^3 / 0.044}, con
 * {@code t = (i - offset) / (shape * clock)}. El factor 0.044 normaliza el máximo del
 * pulso a la amplitud A. El seno se aproxima con los 4 primeros términos de su serie
 * de Taylor: sólo es preciso para t pequeño, pero la exponencial anula el pulso mucho
 * antes de que el error sea relevante.
 */
public final class PulseModel {

    private static final double NORMALIZATION = 0.044;

    /**
     * Prohibido construir esta clase utilidad
     */
    private PulseModel() {
    }

    /**
     * Genera un pulso de {@value SimulatedEvent#WAVEFORM_LENGTH} muestras.
     *
     * @param amplitude Amplitud del pulso (escala linealmente).
     * @param shape     Tiempo de conformado [s]. Debe ser compatible en unidades con el reloj.
     * @param clock     Frecuencia de muestreo [Hz].
     * @param offset    Instante de llegada [time buckets]. Las muestras anteriores a
     *                  {@code ceil(offset)} son cero.
     * @return Vector denso con el pulso.
     */
    public static double[] elecPulse(double amplitude, double shape, double clock, double offset) {
        double[] result = new double[SimulatedEvent.WAVEFORM_LENGTH];

        final double s = shape * clock;
        // Un offset negativo empieza la síntesis en la primera muestra
        final double firstPoint = Math.max(0.0, Math.ceil(offset));
        if (firstPoint >= result.length) {
            return result;
        }

        for (int i = (int) firstPoint; i < result.length; i++) {
            double t = (i - offset) / s;
            result[i] = amplitude * Math.exp(-3 * t) * approxSin(t) * t * t * t / NORMALIZATION;
        }
        return result;
    }

    /**
     * Onda cuadrada de altura {@code height} en {@code [leftEdge, leftEdge + width)},
     * recortada a {@code size}. Se usa para caracterizar la respuesta de la electrónica.
     */
    public static double[] squareWave(int size, int leftEdge, int width, double height) {
        if (size < 0 || leftEdge < 0 || width < 0) {
            throw new IllegalArgumentException("Los parámetros de la onda cuadrada no pueden ser negativos.");
        }
        double[] result = new double[size];
        for (int i = leftEdge; i < leftEdge + width && i < size; i++) {
            result[i] = height;
        }
        return result;
    }

    static double approxSin(double t) {
        double t3 = t * t * t;
        double t5 = t3 * t * t;
        double t7 = t5 * t * t;
        return t - t3 / 6 + t5 / 120 - t7 / 5040;
    }
}
