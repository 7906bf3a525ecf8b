package tpcsim.domain.pad;

/**
 * Contrato de la geometría del plano de pads.
 * <p>
 * Traduce coordenadas continuas del plano de lectura a un identificador de pad discreto
 * y devuelve el centro geométrico de cada pad. Las implementaciones deben ser de sólo
 * lectura, ya que se comparten entre todos los hilos de simulación.
 */
public interface PadPlane {

    /**
     * Identificador centinela: el punto no cae sobre ningún pad.
     */
    int NO_PAD = 20000;

    /**
     * Devuelve el pad que contiene el punto (x, y), o {@link #NO_PAD}.
     *
     * @param x Coordenada x en el plano de pads [m].
     * @param y Coordenada y en el plano de pads [m].
     */
    int getPadNumberFromCoordinates(double x, double y);

    /**
     * Devuelve el centro del pad como array (x, y) [m].
     *
     * @throws IllegalArgumentException si el pad no existe.
     */
    double[] getPadCenter(int padNumber);
}
