package tpcsim.physics.minimizer;

import lombok.Getter;
import lombok.RequiredArgsConstructor;
import tpcsim.domain.track.Track;

import java.util.concurrent.Callable;

/**
 * Tarea que evalúa un único candidato del minimizador: integra la traza, la lleva al
 * espacio crudo y calcula su desviación frente a los datos reales.
 * Está diseñada para ejecutarse en un pool de hilos; no comparte estado mutable con
 * otras tareas.
 */
@Getter
@RequiredArgsConstructor
public class CandidateEvaluationTask implements Callable<CandidateEvaluationTask> {

    // --- Entradas para la tarea ---
    private final int candidateIndex;
    private final double[] parameters;
    private final double[][] trueValues;
    private final MonteCarloMinimizer minimizer; // Solo lectura (compartido)

    // --- Resultados de la tarea ---
    private double[][] simulatedTrack;
    private double[][] deviations;
    private double score = Double.POSITIVE_INFINITY;

    @Override
    public CandidateEvaluationTask call() {
        Track track = minimizer.getTracker().trackParticle(parameters.clone());

        // Una integración sin puntos es el peor candidato posible
        if (track == null || track.isEmpty()) {
            this.simulatedTrack = new double[0][];
            this.deviations = new double[0][];
            this.score = Double.POSITIVE_INFINITY;
            return this;
        }

        this.simulatedTrack = minimizer.prepareSimulatedTrackMatrix(track);
        this.deviations = TrackDeviations.findDeviations(simulatedTrack, trueValues);
        this.score = TrackDeviations.score(deviations);
        return this;
    }
}
