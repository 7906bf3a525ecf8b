package tpcsim.domain.event;

import tpcsim.domain.pad.PadPlane;

import java.util.Collections;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeMap;

/**
 * Lectura completa simulada del detector: una forma de onda de 512 time buckets por pad.
 * <p>
 * Además de las señales, guarda el estado de la generación: cuántos puntos se descartaron
 * por caer fuera de la ventana temporal. Así el llamador puede distinguir "sin señal" de
 * "señal recortada por la ventana".
 * <p>
 * Las instancias son inmutables; se construyen con un {@link Accumulator}.
 */
public final class SimulatedEvent {

    /**
     * Longitud fija de cada forma de onda [time buckets].
     */
    public static final int WAVEFORM_LENGTH = 512;

    /**
     * Último time bucket válido de la ventana.
     */
    public static final int LAST_TIME_BUCKET = WAVEFORM_LENGTH - 1;

    private final Map<Integer, double[]> signals;
    private final int overflowCount;

    private SimulatedEvent(Map<Integer, double[]> signals, int overflowCount) {
        this.signals = signals;
        this.overflowCount = overflowCount;
    }

    public static Accumulator accumulator() {
        return new Accumulator();
    }

    public static SimulatedEvent empty() {
        return new SimulatedEvent(Collections.emptyMap(), 0);
    }

    public Set<Integer> getPadNumbers() {
        return Collections.unmodifiableSet(signals.keySet());
    }

    public int getPadCount() {
        return signals.size();
    }

    public boolean isEmpty() {
        return signals.isEmpty();
    }

    public boolean containsPad(int padNumber) {
        return signals.containsKey(padNumber);
    }

    /**
     * Copia de la forma de onda del pad, si el pad recibió alguna contribución.
     */
    public Optional<double[]> getSignal(int padNumber) {
        double[] signal = signals.get(padNumber);
        return signal == null ? Optional.empty() : Optional.of(signal.clone());
    }

    /**
     * Copia de todas las señales, ordenadas por número de pad.
     */
    public Map<Integer, double[]> getSignals() {
        Map<Integer, double[]> copy = new TreeMap<>();
        signals.forEach((pad, signal) -> copy.put(pad, signal.clone()));
        return copy;
    }

    /**
     * Número de puntos descartados por superar el último time bucket.
     */
    public int getOverflowCount() {
        return overflowCount;
    }

    public boolean hasOverflow() {
        return overflowCount > 0;
    }

    /**
     * Acumulador mutable de señales por pad. No es thread-safe: se usa dentro de una
     * única llamada de generación.
     */
    public static final class Accumulator {

        private final Map<Integer, double[]> signals = new TreeMap<>();
        private int overflowCount;

        private Accumulator() {
        }

        /**
         * Devuelve la señal del pad, creándola a cero la primera vez que se solicita.
         *
         * @throws IllegalArgumentException si se pide el pad centinela.
         */
        public double[] getOrCreateSignal(int padNumber) {
            if (padNumber == PadPlane.NO_PAD) {
                throw new IllegalArgumentException("El pad centinela no puede tener señal asociada.");
            }
            return signals.computeIfAbsent(padNumber, pad -> new double[WAVEFORM_LENGTH]);
        }

        /**
         * Suma elemento a elemento un pulso sobre la señal del pad.
         */
        public void addPulse(int padNumber, double[] pulse) {
            double[] signal = getOrCreateSignal(padNumber);
            int n = Math.min(signal.length, pulse.length);
            for (int i = 0; i < n; i++) {
                signal[i] += pulse[i];
            }
        }

        public void recordOverflow() {
            overflowCount++;
        }

        public SimulatedEvent build() {
            Map<Integer, double[]> frozen = new TreeMap<>();
            signals.forEach((pad, signal) -> frozen.put(pad, signal.clone()));
            return new SimulatedEvent(Collections.unmodifiableMap(frozen), overflowCount);
        }
    }
}
