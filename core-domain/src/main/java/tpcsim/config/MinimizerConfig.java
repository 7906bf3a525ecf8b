package tpcsim.config;

import com.fasterxml.jackson.annotation.JsonIgnore;
import lombok.Builder;
import lombok.Value;
import lombok.With;
import lombok.extern.jackson.Jacksonized;

import java.util.Arrays;

/**
 * Parámetros de ejecución del minimizador Monte Carlo que no cambian entre llamadas.
 * <p>
 * El número de iteraciones, de candidatos y el factor de reducción se pasan en cada
 * llamada a {@code minimize}; aquí sólo viven los límites del espacio de parámetros,
 * la semilla y los recursos de cómputo.
 */
@Value
@Builder
@With
@Jacksonized
public class MinimizerConfig {

    /**
     * Límite inferior de cada dimensión del vector de parámetros.
     */
    double[] lowerBounds;

    /**
     * Límite superior de cada dimensión del vector de parámetros.
     */
    double[] upperBounds;

    /**
     * Semilla del generador de candidatos. Cada llamada a {@code minimize} parte de ella,
     * de modo que las mismas entradas producen siempre el mismo ajuste.
     */
    long seed;

    /**
     * Número de núcleos CPU a utilizar para evaluar candidatos en paralelo.
     */
    int cpuProcessorCount;

    @JsonIgnore
    public int getDimension() {
        return lowerBounds.length;
    }

    /**
     * Configuración sin límites efectivos para un espacio de {@code dimension} parámetros.
     */
    public static MinimizerConfig unbounded(int dimension, long seed) {
        double[] mins = new double[dimension];
        double[] maxes = new double[dimension];
        Arrays.fill(mins, Double.NEGATIVE_INFINITY);
        Arrays.fill(maxes, Double.POSITIVE_INFINITY);
        return MinimizerConfig.builder()
                .lowerBounds(mins)
                .upperBounds(maxes)
                .seed(seed)
                .cpuProcessorCount(Runtime.getRuntime().availableProcessors())
                .build();
    }
}
