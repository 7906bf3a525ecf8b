package tpcsim.physics.i;

import tpcsim.domain.track.Track;

/**
 * Contrato del integrador de trayectorias.
 * <p>
 * A partir de un vector de condiciones iniciales (posición, energía, ángulos...) produce la
 * traza simulada de la partícula. Las implementaciones deben poder invocarse desde varios
 * hilos a la vez, porque el minimizador evalúa candidatos en paralelo.
 */
@FunctionalInterface
public interface ITracker {

    /**
     * @param parameters Vector de condiciones iniciales de la partícula.
     * @return La traza simulada. Una traza vacía indica que la integración no produjo puntos.
     */
    Track trackParticle(double[] parameters);
}
