package tpcsim.physics.model;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import tpcsim.domain.event.SimulatedEvent;

import static org.junit.jupiter.api.Assertions.*;

class PulseModelTest {

    // Parámetros típicos: 280 ns de conformado a 12.5 MHz -> 3.5 buckets
    private static final double SHAPE = 280e-9;
    private static final double CLOCK = 12.5e6;

    @Test
    @DisplayName("Onda cuadrada: altura constante en [leftEdge, leftEdge + width)")
    void squareWave_shouldFillWindow() {
        double[] wave = PulseModel.squareWave(10, 2, 3, 5.0);

        assertArrayEquals(new double[]{0, 0, 5, 5, 5, 0, 0, 0, 0, 0}, wave);
    }

    @Test
    @DisplayName("Onda cuadrada: la ventana se recorta al tamaño del vector")
    void squareWave_shouldClipAtSize() {
        double[] wave = PulseModel.squareWave(10, 8, 5, 1.0);

        assertArrayEquals(new double[]{0, 0, 0, 0, 0, 0, 0, 0, 1, 1}, wave);
    }

    @Test
    @DisplayName("Pulso: longitud fija de 512 y ceros antes de ceil(offset)")
    void elecPulse_shouldBeZeroBeforeOffset() {
        double offset = 100.3;

        double[] pulse = PulseModel.elecPulse(10.0, SHAPE, CLOCK, offset);

        assertEquals(SimulatedEvent.WAVEFORM_LENGTH, pulse.length);
        for (int i = 0; i <= 100; i++) {
            assertEquals(0.0, pulse[i], "La muestra " + i + " es anterior al offset.");
        }
        assertTrue(pulse[101] > 0, "El pulso debe empezar en ceil(offset).");
    }

    @Test
    @DisplayName("Pulso: el máximo muestreado se aproxima a la amplitud (normalización 0.044)")
    void elecPulse_peakShouldMatchAmplitude() {
        double amplitude = 250.0;

        double[] pulse = PulseModel.elecPulse(amplitude, SHAPE, CLOCK, 50.0);

        double max = 0;
        int maxIdx = 0;
        for (int i = 0; i < pulse.length; i++) {
            if (pulse[i] > max) {
                max = pulse[i];
                maxIdx = i;
            }
        }
        assertEquals(amplitude, max, amplitude * 0.05);
        assertTrue(maxIdx > 50 && maxIdx < 60, "El máximo debe llegar pocos buckets después del offset: " + maxIdx);
    }

    @Test
    @DisplayName("Pulso: la amplitud escala linealmente")
    void elecPulse_shouldScaleLinearly() {
        double[] single = PulseModel.elecPulse(1.0, SHAPE, CLOCK, 20.5);
        double[] triple = PulseModel.elecPulse(3.0, SHAPE, CLOCK, 20.5);

        for (int i = 0; i < single.length; i++) {
            assertEquals(3.0 * single[i], triple[i], 1e-12);
        }
    }

    @Test
    @DisplayName("Pulso: un offset fuera de la ventana produce un vector nulo")
    void elecPulse_offsetBeyondWindow_shouldBeEmpty() {
        double[] pulse = PulseModel.elecPulse(5.0, SHAPE, CLOCK, 600);

        for (double v : pulse) {
            assertEquals(0.0, v);
        }
    }

    @Test
    @DisplayName("Seno aproximado: coincide con Math.sin en la zona relevante del pulso")
    void approxSin_shouldMatchSinForSmallArguments() {
        for (double t = 0; t <= 1.5; t += 0.1) {
            assertEquals(Math.sin(t), PulseModel.approxSin(t), 1e-3);
        }
    }
}
