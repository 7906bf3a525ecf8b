package tpcsim.physics.simulator;

import lombok.Getter;
import lombok.extern.slf4j.Slf4j;
import tpcsim.config.EventGeneratorConfig;
import tpcsim.config.EventGeneratorConfig.OverflowPolicy;
import tpcsim.domain.event.HitPattern;
import tpcsim.domain.event.Peak;
import tpcsim.domain.event.PeakTableRow;
import tpcsim.domain.event.SimulatedEvent;
import tpcsim.domain.pad.PadPlane;
import tpcsim.domain.track.RawTrack;
import tpcsim.domain.track.Track;
import tpcsim.physics.model.CoordinateTransform;
import tpcsim.physics.model.DiffusionModel;
import tpcsim.physics.model.ElectronCountModel;
import tpcsim.physics.model.PhysicalConstants;
import tpcsim.physics.model.PulseModel;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.TreeMap;

/**
 * Generador de eventos: convierte una traza simulada en la lectura digitalizada del detector.
 * <p>
 * Responsabilidades:
 * 1. Corregir la inclinación, descalibrar al espacio crudo y calcular los electrones por paso.
 * 2. Difundir cada punto en su estencil de 9 clones.
 * 3. Asignar cada clon a un pad y sintetizar las formas de onda, tablas de picos,
 *    señal de malla y patrón de impactos.
 * <p>
 * Es inmutable: la configuración se fija en la construcción y el plano de pads es de sólo
 * lectura, de modo que una misma instancia puede usarse desde varios hilos.
 */
@Slf4j
public class EventGenerator {

    /**
     * Escala de ADC: 1 V a la salida del preamplificador satura los 4096 canales.
     */
    private static final double ADC_FULL_SCALE = 4096;

    /**
     * Fracción del máximo por encima de la cual una muestra pertenece al pico.
     */
    private static final double PEAK_THRESHOLD_FRACTION = 0.3;

    /**
     * Carga mínima del pico para que el pad aparezca en la tabla.
     */
    private static final double MIN_PEAK_CHARGE = 1e-3;

    private final PadPlane pads;
    @Getter
    private final EventGeneratorConfig config;

    private final DiffusionModel diffusionModel;
    private final ElectronCountModel electronCountModel;

    public EventGenerator(PadPlane pads, EventGeneratorConfig config) {
        this.pads = Objects.requireNonNull(pads, "El plano de pads no puede ser nulo.");
        this.config = Objects.requireNonNull(config, "La configuración no puede ser nula.");
        this.diffusionModel = new DiffusionModel(config.diffusionSigma());
        this.electronCountModel = new ElectronCountModel(
                config.massNumber(), config.ionizationEnergy(), config.negativeChargePolicy());
        log.debug("EventGenerator inicializado. (Overflow: {}, Carga negativa: {})",
                config.overflowPolicy(), config.negativeChargePolicy());
    }

    /**
     * Devuelve un generador nuevo con otra configuración y el mismo plano de pads.
     */
    public EventGenerator withConfig(EventGeneratorConfig newConfig) {
        return new EventGenerator(pads, newConfig);
    }

    // --- PREPARACIÓN DE LA TRAZA ---

    public double[] numElec(double[] energies) {
        return electronCountModel.numElec(energies);
    }

    public RawTrack diffuseElectrons(RawTrack track) {
        return diffusionModel.diffuseElectrons(track);
    }

    /**
     * Lleva la traza física al espacio crudo del detector y la difunde.
     *
     * @param pos Matriz N x 3 de posiciones físicas [m].
     * @param en  Energía acumulada en cada paso [MeV/u].
     * @return Traza cruda difundida con 9N filas (x, y, tb, electrones).
     */
    public RawTrack prepareTrack(double[][] pos, double[] en) {
        Objects.requireNonNull(pos, "La matriz de posiciones no puede ser nula.");
        Objects.requireNonNull(en, "El vector de energías no puede ser nulo.");
        if (pos.length != en.length) {
            throw new IllegalArgumentException(String.format(
                    "Posiciones (%d) y energías (%d) deben tener el mismo número de filas.", pos.length, en.length));
        }

        double[][] untilted = CoordinateTransform.unTiltAndRecenter(pos, config.tilt());
        double[][] uncalibrated = CoordinateTransform.uncalibrate(untilted, config.driftVelocity(), config.clock());
        RawTrack raw = RawTrack.fromColumns(uncalibrated, numElec(en));

        return diffuseElectrons(raw);
    }

    /**
     * Factor que convierte electrones primarios en amplitud en canales de ADC.
     * <p>
     * La ganancia Micromegas da los electrones secundarios, la carga elemental los pasa a
     * culombios y la ganancia de la electrónica a voltios tras el preamplificador.
     */
    public double conversionFactor() {
        return config.micromegasGain() * PhysicalConstants.ELEMENTARY_CHARGE / config.electronicsGain() * ADC_FULL_SCALE;
    }

    // --- EVENTOS ---

    public SimulatedEvent makeEvent(Track track) {
        return makeEvent(track.getPositionMatrix(), track.getEnergyVector());
    }

    /**
     * Simula la lectura completa del detector para una traza.
     *
     * @return Señales por pad y número de puntos descartados por la ventana temporal.
     * @throws TimeBucketOverflowException si un punto sale de la ventana y la política es {@code FAIL}.
     */
    public SimulatedEvent makeEvent(double[][] pos, double[] en) {
        RawTrack uncal = prepareTrack(pos, en);
        SimulatedEvent.Accumulator event = SimulatedEvent.accumulator();

        final double convFactor = conversionFactor();
        final int rowLimit = processedRowCount(uncal);

        for (int i = 0; i < rowLimit; i++) {
            int pad = pads.getPadNumberFromCoordinates(uncal.getXAt(i), uncal.getYAt(i));
            if (pad == PadPlane.NO_PAD) {
                continue;
            }
            // La señal del pad existe desde su primera contribución, aunque ésta se descarte
            event.getOrCreateSignal(pad);

            double offset = uncal.getTimeBucketAt(i);
            if (isOutOfWindow(offset)) {
                event.recordOverflow();
                continue;
            }

            double[] pulse = PulseModel.elecPulse(convFactor * uncal.getElectronsAt(i), config.shape(), config.clock(), offset);
            event.addPulse(pad, pulse);
        }

        SimulatedEvent result = event.build();
        if (result.hasOverflow()) {
            log.debug("{} puntos descartados por superar el time bucket {}.", result.getOverflowCount(), SimulatedEvent.LAST_TIME_BUCKET);
        }
        return result;
    }

    /**
     * Reduce cada forma de onda a su máximo (time bucket, amplitud truncada).
     */
    public Map<Integer, Peak> makePeaksFromSimulation(Track track) {
        return makePeaksFromSimulation(track.getPositionMatrix(), track.getEnergyVector());
    }

    public Map<Integer, Peak> makePeaksFromSimulation(double[][] pos, double[] en) {
        SimulatedEvent event = makeEvent(pos, en);

        Map<Integer, Peak> result = new TreeMap<>();
        event.getSignals().forEach((pad, signal) -> {
            int maxTb = argMax(signal);
            result.put(pad, new Peak(maxTb, (long) Math.floor(signal[maxTb])));
        });
        return result;
    }

    public List<PeakTableRow> makePeaksTableFromSimulation(Track track) {
        return makePeaksTableFromSimulation(track.getPositionMatrix(), track.getEnergyVector());
    }

    /**
     * Construye la tabla de picos: una fila por pad con el centroide del pico ponderado por carga.
     * <p>
     * Sólo cuentan las muestras por encima del 30% del máximo del pad. Si su suma no llega
     * a 1e-3 el pad se descarta.
     */
    public List<PeakTableRow> makePeaksTableFromSimulation(double[][] pos, double[] en) {
        SimulatedEvent event = makeEvent(pos, en);
        List<PeakTableRow> rows = new ArrayList<>();

        event.getSignals().forEach((pad, signal) -> {
            double maxVal = signal[argMax(signal)];
            double threshold = PEAK_THRESHOLD_FRACTION * maxVal;

            double total = 0;
            double weighted = 0;
            for (int tb = 0; tb < signal.length; tb++) {
                if (signal[tb] > threshold) {
                    total += signal[tb];
                    weighted += tb * signal[tb];
                }
            }
            if (total < MIN_PEAK_CHARGE) {
                return;
            }

            double[] center = pads.getPadCenter(pad);
            rows.add(new PeakTableRow(center[0], center[1], weighted / total, maxVal, pad));
        });

        return rows;
    }

    public double[] makeMeshSignal(Track track) {
        return makeMeshSignal(track.getPositionMatrix(), track.getEnergyVector());
    }

    /**
     * Suma de todas las señales de pad, como la vería el electrodo de malla.
     */
    public double[] makeMeshSignal(double[][] pos, double[] en) {
        SimulatedEvent event = makeEvent(pos, en);
        double[] mesh = new double[SimulatedEvent.WAVEFORM_LENGTH];
        for (double[] signal : event.getSignals().values()) {
            for (int i = 0; i < mesh.length; i++) {
                mesh[i] += signal[i];
            }
        }
        return mesh;
    }

    /**
     * Carga total por pad, sin sintetizar formas de onda.
     * <p>
     * Aplica la misma política de ventana temporal y de última fila que {@link #makeEvent}.
     *
     * @throws IllegalStateException si el plano de pads devuelve un pad fuera de la capacidad.
     */
    public HitPattern makeHitPattern(double[][] pos, double[] en) {
        RawTrack uncal = prepareTrack(pos, en);
        double[] hits = new double[HitPattern.CAPACITY];
        int overflowCount = 0;

        final double convFactor = conversionFactor();
        final int rowLimit = processedRowCount(uncal);

        for (int i = 0; i < rowLimit; i++) {
            int pad = pads.getPadNumberFromCoordinates(uncal.getXAt(i), uncal.getYAt(i));
            if (pad == PadPlane.NO_PAD) {
                continue;
            }
            if (pad < 0 || pad >= HitPattern.CAPACITY) {
                throw new IllegalStateException("El pad " + pad + " supera la capacidad del patrón de impactos.");
            }
            if (isOutOfWindow(uncal.getTimeBucketAt(i))) {
                overflowCount++;
                continue;
            }
            hits[pad] += convFactor * uncal.getElectronsAt(i);
        }

        return new HitPattern(hits, overflowCount);
    }

    public HitPattern makeHitPattern(Track track) {
        return makeHitPattern(track.getPositionMatrix(), track.getEnergyVector());
    }

    // --- HELPERS ---

    private int processedRowCount(RawTrack uncal) {
        int rows = uncal.getRowCount();
        // Por convención heredada la última fila difundida no se procesa
        return config.includeLastDiffusedRow() ? rows : Math.max(rows - 1, 0);
    }

    private boolean isOutOfWindow(double timeBucket) {
        if (timeBucket <= SimulatedEvent.LAST_TIME_BUCKET) {
            return false;
        }
        if (config.overflowPolicy() == OverflowPolicy.FAIL) {
            throw new TimeBucketOverflowException(timeBucket);
        }
        return true;
    }

    private static int argMax(double[] signal) {
        int best = 0;
        for (int i = 1; i < signal.length; i++) {
            if (signal[i] > signal[best]) {
                best = i;
            }
        }
        return best;
    }
}
