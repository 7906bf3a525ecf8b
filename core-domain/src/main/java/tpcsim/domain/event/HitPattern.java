package tpcsim.domain.event;

import java.util.Arrays;
import java.util.Objects;

/**
 * Patrón de impactos: carga total depositada en cada pad, sin estructura temporal.
 *
 * @param charges       Vector denso indexado por número de pad, de longitud {@link #CAPACITY}.
 * @param overflowCount Puntos descartados por caer fuera de la ventana temporal.
 */
public record HitPattern(double[] charges, int overflowCount) {

    /**
     * Capacidad fija del vector (número máximo de pads direccionables).
     */
    public static final int CAPACITY = 10240;

    public HitPattern {
        Objects.requireNonNull(charges, "El vector de cargas no puede ser nulo.");
        if (charges.length != CAPACITY) {
            throw new IllegalArgumentException("El patrón de impactos debe tener exactamente " + CAPACITY + " entradas.");
        }
        charges = charges.clone();
    }

    public double getChargeAt(int padNumber) {
        if (padNumber < 0 || padNumber >= CAPACITY) {
            throw new IndexOutOfBoundsException("El pad " + padNumber + " está fuera de los límites [0, " + (CAPACITY - 1) + "].");
        }
        return charges[padNumber];
    }

    public double getTotalCharge() {
        return Arrays.stream(charges).sum();
    }

    @Override
    public double[] charges() {
        return charges.clone();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        HitPattern that = (HitPattern) o;
        return overflowCount == that.overflowCount && Arrays.equals(charges, that.charges);
    }

    @Override
    public int hashCode() {
        return 31 * Arrays.hashCode(charges) + overflowCount;
    }
}
