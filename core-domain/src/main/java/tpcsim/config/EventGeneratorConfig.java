package tpcsim.config;

import lombok.Builder;
import lombok.With;

import java.util.Objects;

/**
 * Objeto de valor inmutable con todos los parámetros físicos del generador de eventos.
 * <p>
 * Agrupa las propiedades del gas, de la amplificación y de la electrónica de lectura.
 * No se modifica nunca en caliente: para cambiar un parámetro se construye una copia con
 * los métodos {@code withXxx(...)}, de modo que un mismo generador puede evaluarse desde
 * varios hilos a la vez sin sincronización.
 *
 * @param driftVelocity          Velocidad de deriva de los electrones [cm/µs].
 * @param massNumber             Número másico de la partícula (la energía se expresa en MeV/u).
 * @param ionizationEnergy       Energía media para crear un par electrón-ion en el gas [eV].
 * @param micromegasGain         Ganancia de la etapa de amplificación Micromegas (adimensional).
 * @param electronicsGain        Ganancia del preamplificador [C/V].
 * @param tilt                   Inclinación de montaje del detector respecto al haz [rad].
 * @param diffusionSigma         Desviación característica de la difusión transversal, escalada
 *                               con la raíz de la coordenada temporal de cada punto.
 * @param clock                  Frecuencia de muestreo de la electrónica [Hz].
 * @param shape                  Tiempo de conformado del pulso [s]. {@code shape * clock} da el
 *                               ancho del pulso en time buckets.
 * @param overflowPolicy         Qué hacer con los puntos que caen fuera de la ventana de 512 buckets.
 * @param negativeChargePolicy   Qué hacer si la energía sube entre dos pasos de la traza.
 * @param includeLastDiffusedRow Si es {@code true} se procesa también la última fila difundida,
 *                               que por defecto se descarta.
 */
@Builder
@With
public record EventGeneratorConfig(
        DriftVelocity driftVelocity,
        int massNumber,
        double ionizationEnergy,
        double micromegasGain,
        double electronicsGain,
        double tilt,
        double diffusionSigma,
        double clock,
        double shape,
        OverflowPolicy overflowPolicy,
        NegativeChargePolicy negativeChargePolicy,
        boolean includeLastDiffusedRow
) {

    public EventGeneratorConfig {
        Objects.requireNonNull(driftVelocity, "La velocidad de deriva no puede ser nula.");
        if (!driftVelocity.hasUsableDriftComponent()) {
            throw new IllegalArgumentException("La componente z de la velocidad de deriva no puede ser nula: " + driftVelocity.z());
        }
        if (massNumber <= 0) {
            throw new IllegalArgumentException("El número másico debe ser positivo.");
        }
        if (!Double.isFinite(ionizationEnergy) || ionizationEnergy <= 0) {
            throw new IllegalArgumentException("La energía de ionización debe ser positiva.");
        }
        if (!Double.isFinite(electronicsGain) || electronicsGain <= 0) {
            throw new IllegalArgumentException("La ganancia de la electrónica debe ser positiva.");
        }
        if (!Double.isFinite(micromegasGain) || micromegasGain < 0) {
            throw new IllegalArgumentException("La ganancia Micromegas no puede ser negativa.");
        }
        if (!Double.isFinite(diffusionSigma) || diffusionSigma < 0) {
            throw new IllegalArgumentException("La sigma de difusión no puede ser negativa.");
        }
        if (!Double.isFinite(clock) || !Double.isFinite(shape) || clock <= 0 || shape <= 0) {
            throw new IllegalArgumentException("El reloj de muestreo y el tiempo de conformado deben ser positivos.");
        }

        if (!Double.isFinite(tilt)) {
            throw new IllegalArgumentException("La inclinación debe ser un valor finito.");
        }

        // Valores por defecto: mismo comportamiento que la versión heredada
        if (overflowPolicy == null) overflowPolicy = OverflowPolicy.DROP;
        if (negativeChargePolicy == null) negativeChargePolicy = NegativeChargePolicy.PROPAGATE;
    }

    /**
     * Política para los puntos cuyo time bucket supera la ventana de lectura.
     */
    public enum OverflowPolicy {
        /**
         * Se descarta el punto y se contabiliza en el estado del resultado.
         */
        DROP,
        /**
         * Se aborta la generación del evento lanzando una excepción.
         */
        FAIL
    }

    /**
     * Política para conteos de electrones negativos (energía creciente a lo largo de la traza).
     */
    public enum NegativeChargePolicy {
        /**
         * Se propaga el valor negativo como amplitud negativa (comportamiento heredado).
         */
        PROPAGATE,
        /**
         * Se recorta a cero.
         */
        CLAMP_TO_ZERO,
        /**
         * Se rechaza la traza con un error de dominio.
         */
        REJECT
    }

    public static EventGeneratorConfig getTestingDetector() {
        return EventGeneratorConfig.builder()
                .driftVelocity(new DriftVelocity(0.0, 0.0, -5.2))
                .massNumber(4)
                .ionizationEnergy(26.2)
                .micromegasGain(1000)
                .electronicsGain(120e-15)
                .tilt(0.0)
                .diffusionSigma(1e-4)
                .clock(12.5e6)
                .shape(280e-9)
                .overflowPolicy(OverflowPolicy.DROP)
                .negativeChargePolicy(NegativeChargePolicy.PROPAGATE)
                .includeLastDiffusedRow(false)
                .build();
    }
}
