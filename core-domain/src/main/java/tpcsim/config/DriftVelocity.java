package tpcsim.config;

/**
 * Vector de velocidad de deriva de los electrones de ionización dentro de la cámara.
 * <p>
 * Las componentes se expresan en cm/µs. La componente z es la que relaciona la distancia
 * de deriva con el tiempo de llegada al plano de pads, por lo que no puede ser nula.
 *
 * @param x Componente transversal x [cm/µs].
 * @param y Componente transversal y [cm/µs].
 * @param z Componente longitudinal [cm/µs]. Normalmente negativa (deriva hacia el plano de pads).
 */
public record DriftVelocity(double x, double y, double z) {

    /**
     * Por debajo de este valor absoluto la componente z se considera degenerada.
     */
    public static final double MIN_ABS_Z = 1e-12;

    /**
     * Indica si la componente z permite convertir distancias de deriva en time buckets.
     */
    public boolean hasUsableDriftComponent() {
        return Double.isFinite(z) && Math.abs(z) >= MIN_ABS_Z;
    }

    /**
     * Devuelve las componentes como array (x, y, z).
     */
    public double[] toArray() {
        return new double[]{x, y, z};
    }
}
