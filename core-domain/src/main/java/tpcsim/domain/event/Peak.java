package tpcsim.domain.event;

/**
 * Resumen con pérdida de la forma de onda de un pad: posición y valor de su máximo.
 *
 * @param timeBucket Time bucket donde la señal alcanza su máximo.
 * @param amplitude  Valor del máximo, truncado hacia abajo.
 */
public record Peak(int timeBucket, long amplitude) {
}
