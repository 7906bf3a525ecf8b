package tpcsim.physics.model;

/**
 * Constantes físicas usadas por la simulación.
 */
public final class PhysicalConstants {

    /**
     * Carga elemental [C].
     */
    public static final double ELEMENTARY_CHARGE = 1.602176565e-19;

    private PhysicalConstants() {
    }
}
