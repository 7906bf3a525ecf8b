package tpcsim.physics.simulator;

import lombok.extern.slf4j.Slf4j;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import tpcsim.config.EventGeneratorConfig;
import tpcsim.config.EventGeneratorConfig.NegativeChargePolicy;
import tpcsim.config.EventGeneratorConfig.OverflowPolicy;
import tpcsim.domain.event.HitPattern;
import tpcsim.domain.event.Peak;
import tpcsim.domain.event.PeakTableRow;
import tpcsim.domain.event.SimulatedEvent;
import tpcsim.domain.pad.PadPlane;
import tpcsim.domain.pad.RectangularPadPlane;
import tpcsim.domain.track.RawTrack;
import tpcsim.domain.track.Track;
import tpcsim.factory.PadPlaneFactory;
import tpcsim.physics.model.PhysicalConstants;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.anyDouble;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.Mockito.*;

@Slf4j
@ExtendWith(MockitoExtension.class)
class EventGeneratorTest {

    // Centro del pad (10, 10) de una malla 20 x 20 de 1 cm centrada en el origen
    private static final double PAD_X = 0.005;
    private static final double PAD_Y = 0.005;

    @Mock
    private PadPlane blindPlane;

    private RectangularPadPlane pads;
    private EventGeneratorConfig config;
    private EventGenerator generator;

    // Dos pasos en el mismo punto: 0 electrones en el primero y 152 en el segundo
    private double[][] singlePadPositions;
    private double[] singlePadEnergies;

    @BeforeEach
    void setUp() {
        pads = new PadPlaneFactory().createCenteredGrid(0.01, 20);
        config = EventGeneratorConfig.getTestingDetector();
        generator = new EventGenerator(pads, config);

        singlePadPositions = new double[][]{
                {PAD_X, PAD_Y, 1.0},
                {PAD_X, PAD_Y, 1.0}
        };
        singlePadEnergies = new double[]{1.0, 0.999};
    }

    @Test
    @DisplayName("Factor de conversión: ganancia Micromegas * e / ganancia electrónica * 4096")
    void conversionFactor_shouldMatchFormula() {
        double expected = 1000 * PhysicalConstants.ELEMENTARY_CHARGE / 120e-15 * 4096;

        assertEquals(expected, generator.conversionFactor(), 1e-12);
    }

    @Test
    @DisplayName("prepareTrack: 9N filas en espacio crudo con el time bucket de la deriva")
    void prepareTrack_shouldUncalibrateAndDiffuse() {
        RawTrack raw = generator.prepareTrack(singlePadPositions, singlePadEnergies);

        assertEquals(18, raw.getRowCount());
        double expectedTb = 1.0 * config.clock() * 1e-4 / 5.2;
        for (int i = 0; i < raw.getRowCount(); i++) {
            assertEquals(expectedTb, raw.getTimeBucketAt(i), 1e-9);
        }
        // Fila 1 es el segundo punto original con el 40% de sus 152 electrones
        assertEquals(152 * 0.4, raw.getElectronsAt(1), 1e-9);
    }

    @Test
    @DisplayName("prepareTrack: posiciones y energías de distinta longitud se rechazan")
    void prepareTrack_withMismatchedInputs_shouldThrow() {
        assertThrows(IllegalArgumentException.class,
                () -> generator.prepareTrack(singlePadPositions, new double[]{1.0}));
    }

    @Test
    @DisplayName("Evento de un pad: todos los clones caen en el mismo pad")
    void makeEvent_singlePad_shouldProduceOneWaveform() {
        SimulatedEvent event = generator.makeEvent(singlePadPositions, singlePadEnergies);

        int expectedPad = pads.getPadNumberFromCoordinates(PAD_X, PAD_Y);
        assertEquals(1, event.getPadCount());
        assertTrue(event.containsPad(expectedPad));
        assertFalse(event.hasOverflow());

        double[] signal = event.getSignal(expectedPad).orElseThrow();
        assertEquals(SimulatedEvent.WAVEFORM_LENGTH, signal.length);

        // La última fila difundida (clon SO del segundo punto) no se procesa
        double processedElectrons = 152 * (1 - 0.6 / 8);
        double amplitude = generator.conversionFactor() * processedElectrons;
        double max = 0;
        for (double v : signal) max = Math.max(max, v);
        log.info("Máximo de la señal: {} (amplitud nominal {})", max, amplitude);
        assertEquals(amplitude, max, amplitude * 0.05);
    }

    @Test
    @DisplayName("Centinela: ningún evento contiene el pad NO_PAD")
    void makeEvent_shouldNeverContainSentinelPad() {
        double[][] positions = {
                {0.5, 0.5, 1.0},      // Fuera de la malla
                {PAD_X, PAD_Y, 1.0},
                {0.5, 0.5, 1.0},
                {-0.03, 0.02, 0.8}
        };
        double[] energies = {2.0, 1.998, 1.995, 1.99};

        SimulatedEvent event = generator.makeEvent(positions, energies);

        assertFalse(event.containsPad(PadPlane.NO_PAD));
        assertFalse(event.isEmpty());
    }

    @Test
    @DisplayName("Sobrecarga con Track: mismo evento que con posiciones y energías")
    void makeEvent_trackOverload_shouldMatch() {
        Track track = Track.of(singlePadPositions, singlePadEnergies);

        SimulatedEvent fromTrack = generator.makeEvent(track);
        SimulatedEvent fromArrays = generator.makeEvent(singlePadPositions, singlePadEnergies);

        assertEquals(fromArrays.getPadNumbers(), fromTrack.getPadNumbers());
        for (int pad : fromArrays.getPadNumbers()) {
            assertArrayEquals(fromArrays.getSignal(pad).orElseThrow(), fromTrack.getSignal(pad).orElseThrow());
        }
    }

    @Test
    @DisplayName("Vacío: si ningún punto cae en un pad el resultado es vacío, no un error")
    void makeEvent_noPadHit_shouldReturnEmptyResults() {
        when(blindPlane.getPadNumberFromCoordinates(anyDouble(), anyDouble())).thenReturn(PadPlane.NO_PAD);
        EventGenerator blindGenerator = new EventGenerator(blindPlane, config);

        assertTrue(blindGenerator.makeEvent(singlePadPositions, singlePadEnergies).isEmpty());
        assertTrue(blindGenerator.makePeaksTableFromSimulation(singlePadPositions, singlePadEnergies).isEmpty());
        assertEquals(0.0, blindGenerator.makeHitPattern(singlePadPositions, singlePadEnergies).getTotalCharge());
        for (double v : blindGenerator.makeMeshSignal(singlePadPositions, singlePadEnergies)) {
            assertEquals(0.0, v);
        }
        verify(blindPlane, never()).getPadCenter(anyInt());
    }

    @Test
    @DisplayName("Tabla de picos: la amplitud coincide con el máximo de la forma de onda")
    void makePeaksTable_amplitudeShouldMatchWaveformMax() {
        SimulatedEvent event = generator.makeEvent(singlePadPositions, singlePadEnergies);
        List<PeakTableRow> table = generator.makePeaksTableFromSimulation(singlePadPositions, singlePadEnergies);

        assertEquals(1, table.size());
        PeakTableRow row = table.get(0);
        double[] signal = event.getSignal(row.padNumber()).orElseThrow();
        double max = 0;
        for (double v : signal) max = Math.max(max, v);

        assertEquals(max, row.amplitude(), 1e-12);
        assertArrayEquals(pads.getPadCenter(row.padNumber()), new double[]{row.padCenterX(), row.padCenterY()}, 1e-12);
        assertArrayEquals(new double[]{row.padCenterX(), row.padCenterY(), row.centroid(), row.amplitude(), row.padNumber()},
                row.toArray());

        double tb = 1.0 * config.clock() * 1e-4 / 5.2;
        assertTrue(row.centroid() > tb && row.centroid() < tb + 10,
                "El centroide debe quedar justo después de la llegada: " + row.centroid());
    }

    @Test
    @DisplayName("Picos: (argmax, floor(max)) por pad")
    void makePeaks_shouldSummarizeEachWaveform() {
        SimulatedEvent event = generator.makeEvent(singlePadPositions, singlePadEnergies);
        Map<Integer, Peak> peaks = generator.makePeaksFromSimulation(Track.of(singlePadPositions, singlePadEnergies));

        assertEquals(event.getPadNumbers(), peaks.keySet());
        peaks.forEach((pad, peak) -> {
            double[] signal = event.getSignal(pad).orElseThrow();
            assertEquals((long) Math.floor(signal[peak.timeBucket()]), peak.amplitude());
            for (double v : signal) {
                assertTrue(v <= signal[peak.timeBucket()]);
            }
        });
    }

    @Test
    @DisplayName("Señal de malla: suma elemento a elemento de todas las señales de pad")
    void makeMeshSignal_shouldSumAllPads() {
        double[][] positions = {
                {PAD_X, PAD_Y, 1.0},
                {PAD_X, PAD_Y, 0.98},
                {0.035, -0.025, 0.6},
                {0.035, -0.025, 0.59}
        };
        double[] energies = {2.0, 1.997, 1.99, 1.985};

        SimulatedEvent event = generator.makeEvent(positions, energies);
        double[] mesh = generator.makeMeshSignal(positions, energies);

        assertTrue(event.getPadCount() > 1);
        double[] expected = new double[SimulatedEvent.WAVEFORM_LENGTH];
        for (double[] signal : event.getSignals().values()) {
            for (int i = 0; i < expected.length; i++) expected[i] += signal[i];
        }
        assertArrayEquals(expected, mesh, 1e-9);
    }

    @Test
    @DisplayName("Patrón de impactos: misma carga total que los electrones procesados por makeEvent")
    void makeHitPattern_shouldAgreeWithEventPads() {
        double[][] positions = {
                {PAD_X, PAD_Y, 1.0},
                {PAD_X, PAD_Y, 0.98},
                {0.035, -0.025, 0.6},
                {0.035, -0.025, 0.59}
        };
        double[] energies = {2.0, 1.997, 1.99, 1.985};

        SimulatedEvent event = generator.makeEvent(positions, energies);
        HitPattern hits = generator.makeHitPattern(positions, energies);
        RawTrack raw = generator.prepareTrack(positions, energies);

        double expectedTotal = 0;
        for (int i = 0; i < raw.getRowCount() - 1; i++) {
            if (pads.getPadNumberFromCoordinates(raw.getXAt(i), raw.getYAt(i)) != PadPlane.NO_PAD) {
                expectedTotal += generator.conversionFactor() * raw.getElectronsAt(i);
            }
        }
        assertEquals(expectedTotal, hits.getTotalCharge(), expectedTotal * 1e-12);

        for (int pad = 0; pad < HitPattern.CAPACITY; pad++) {
            if (hits.getChargeAt(pad) > 0) {
                assertTrue(event.containsPad(pad), "El pad " + pad + " tiene carga pero no señal.");
            }
        }
        assertEquals(event.getOverflowCount(), hits.overflowCount());
    }

    @Test
    @DisplayName("Última fila: con includeLastDiffusedRow se procesa toda la carga")
    void makeHitPattern_includeLastRow_shouldCollectAllCharge() {
        EventGenerator full = generator.withConfig(config.withIncludeLastDiffusedRow(true));

        HitPattern legacy = generator.makeHitPattern(singlePadPositions, singlePadEnergies);
        HitPattern complete = full.makeHitPattern(singlePadPositions, singlePadEnergies);

        double conv = generator.conversionFactor();
        assertEquals(conv * 152 * (1 - 0.075), legacy.getTotalCharge(), 1e-9);
        assertEquals(conv * 152, complete.getTotalCharge(), 1e-9);
    }

    @Test
    @DisplayName("Ventana temporal con DROP: los puntos tardíos se descartan y se contabilizan")
    void makeEvent_overflowWithDrop_shouldReportStatus() {
        // z = 2.5 m -> tb ~ 601 > 511
        double[][] late = {{PAD_X, PAD_Y, 2.5}, {PAD_X, PAD_Y, 2.5}};

        SimulatedEvent event = generator.makeEvent(late, singlePadEnergies);
        HitPattern hits = generator.makeHitPattern(late, singlePadEnergies);

        assertTrue(event.hasOverflow());
        assertEquals(17, event.getOverflowCount());
        assertEquals(17, hits.overflowCount());
        assertEquals(0.0, hits.getTotalCharge());
        // El pad existe pero sin señal, y la tabla de picos lo descarta
        for (double v : event.getSignals().values().iterator().next()) {
            assertEquals(0.0, v);
        }
        assertTrue(generator.makePeaksTableFromSimulation(late, singlePadEnergies).isEmpty());
    }

    @Test
    @DisplayName("Ventana temporal con FAIL: se lanza TimeBucketOverflowException")
    void makeEvent_overflowWithFail_shouldThrow() {
        EventGenerator strict = generator.withConfig(config.withOverflowPolicy(OverflowPolicy.FAIL));
        double[][] late = {{PAD_X, PAD_Y, 2.5}, {PAD_X, PAD_Y, 2.5}};

        TimeBucketOverflowException ex = assertThrows(TimeBucketOverflowException.class,
                () -> strict.makeEvent(late, singlePadEnergies));
        assertTrue(ex.getTimeBucket() > SimulatedEvent.LAST_TIME_BUCKET);
        assertThrows(TimeBucketOverflowException.class, () -> strict.makeHitPattern(late, singlePadEnergies));
    }

    @Test
    @DisplayName("Energía creciente con REJECT: la traza se rechaza antes de simular")
    void makeEvent_risingEnergyWithReject_shouldThrow() {
        EventGenerator strict = generator.withConfig(config.withNegativeChargePolicy(NegativeChargePolicy.REJECT));

        assertThrows(IllegalArgumentException.class,
                () -> strict.makeEvent(singlePadPositions, new double[]{1.0, 1.01}));
    }

    @Test
    @DisplayName("Inmutabilidad: withConfig no altera el generador original")
    void withConfig_shouldNotMutateOriginal() {
        EventGenerator tilted = generator.withConfig(config.withTilt(0.05));

        assertEquals(0.0, generator.getConfig().tilt());
        assertEquals(0.05, tilted.getConfig().tilt());
    }
}
