package tpcsim.domain.simulation;

import com.fasterxml.jackson.annotation.JsonIgnore;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

/**
 * Resultado de una ejecución completa del minimizador Monte Carlo.
 */
@Value
@Builder
@Jacksonized
public class MinimizationResult {

    /**
     * Mejor vector de parámetros encontrado.
     */
    double[] bestParameters;

    /**
     * Coste del mejor vector de parámetros.
     */
    double bestScore;

    /**
     * Traza simulada del mejor candidato en espacio crudo (x, y, tb).
     */
    double[][] bestSimulatedTrack;

    /**
     * Desviaciones del mejor candidato frente a los datos reales, una fila por punto.
     */
    double[][] bestDeviations;

    /**
     * Centro retenido al final de cada ronda.
     */
    double[][] roundBestParameters;

    /**
     * Coste del centro retenido al final de cada ronda (no creciente).
     */
    double[] roundScores;

    /**
     * Sigma usada en cada ronda.
     */
    double[][] roundSigmas;

    /**
     * Número total de trazas simuladas.
     */
    int evaluatedCandidates;

    /**
     * Tiempo de cómputo en milisegundos.
     */
    long executionTime;

    @JsonIgnore
    public int getIterationCount() {
        return roundScores.length;
    }
}
