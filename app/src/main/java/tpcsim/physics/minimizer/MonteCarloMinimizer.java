package tpcsim.physics.minimizer;

import lombok.Getter;
import lombok.extern.slf4j.Slf4j;
import tpcsim.config.EventGeneratorConfig;
import tpcsim.config.MinimizerConfig;
import tpcsim.domain.simulation.MinimizationResult;
import tpcsim.domain.track.Track;
import tpcsim.physics.i.ITracker;
import tpcsim.physics.model.CoordinateTransform;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Objects;
import java.util.Random;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;

/**
 * Minimizador Monte Carlo para ajustar trazas simuladas a datos experimentales.
 * <p>
 * Búsqueda estocástica local con vecindario decreciente:
 * 1. Alrededor del centro actual se generan {@code numPts} candidatos, perturbando cada
 *    dimensión de forma independiente y recortando a los límites de la configuración.
 * 2. Cada candidato se simula y se puntúa en paralelo (pool de hilos).
 * 3. Tras la barrera, el mejor candidato sustituye al centro si mejora su coste.
 * 4. La sigma se multiplica por el factor de reducción y se repite.
 * <p>
 * Es un descenso local: depende del centro y sigma iniciales y puede quedarse en un mínimo
 * local. No hay criterio de parada salvo el número fijo de iteraciones.
 */
@Slf4j
public class MonteCarloMinimizer implements AutoCloseable {

    @Getter
    private final ITracker tracker;
    private final EventGeneratorConfig detectorConfig;
    private final MinimizerConfig config;
    private final ExecutorService threadPool;

    // Copias propias: los arrays de la configuración son mutables desde fuera
    private final double[] lowerBounds;
    private final double[] upperBounds;

    public MonteCarloMinimizer(ITracker tracker, EventGeneratorConfig detectorConfig, MinimizerConfig config) {
        this.tracker = Objects.requireNonNull(tracker, "El integrador de trayectorias no puede ser nulo.");
        this.detectorConfig = Objects.requireNonNull(detectorConfig, "La configuración del detector no puede ser nula.");
        this.config = Objects.requireNonNull(config, "La configuración del minimizador no puede ser nula.");
        this.lowerBounds = Objects.requireNonNull(config.getLowerBounds(), "Los límites inferiores no pueden ser nulos.").clone();
        this.upperBounds = Objects.requireNonNull(config.getUpperBounds(), "Los límites superiores no pueden ser nulos.").clone();
        validateBounds(lowerBounds, upperBounds);

        this.threadPool = Executors.newFixedThreadPool(Math.max(config.getCpuProcessorCount(), 1));
        log.info("MonteCarloMinimizer inicializado. (Dimensiones: {}, Hilos: {})",
                lowerBounds.length, Math.max(config.getCpuProcessorCount(), 1));
    }

    /**
     * Genera {@code numSets} candidatos alrededor de {@code ctr}.
     * <p>
     * Cada dimensión i se muestrea de forma uniforme en {@code [ctr_i - sigma_i/2, ctr_i + sigma_i/2]}
     * y se recorta a {@code [mins_i, maxes_i]}. Una dimensión con sigma 0 queda fija en el centro.
     *
     * @return Matriz numSets x D, una fila por candidato.
     */
    public static double[][] makeParams(double[] ctr, double[] sigma, int numSets,
                                        double[] mins, double[] maxes, Random random) {
        Objects.requireNonNull(ctr, "El centro no puede ser nulo.");
        Objects.requireNonNull(sigma, "La sigma no puede ser nula.");
        int dim = ctr.length;
        if (sigma.length != dim || mins.length != dim || maxes.length != dim) {
            throw new IllegalArgumentException("Centro, sigma y límites deben tener la misma dimensión.");
        }
        if (numSets < 0) {
            throw new IllegalArgumentException("El número de candidatos no puede ser negativo.");
        }

        double[][] params = new double[numSets][dim];
        for (int d = 0; d < dim; d++) {
            for (int k = 0; k < numSets; k++) {
                double value = ctr[d];
                if (sigma[d] != 0) {
                    value = ctr[d] + random.nextDouble() * sigma[d] - sigma[d] / 2;
                }
                params[k][d] = Math.min(Math.max(value, mins[d]), maxes[d]);
            }
        }
        return params;
    }

    /**
     * Lleva la traza simulada al espacio crudo (x, y, tb) con la misma cadena de calibración
     * que el generador de eventos.
     */
    public double[][] prepareSimulatedTrackMatrix(Track track) {
        double[][] untilted = CoordinateTransform.unTiltAndRecenter(track.getPositionMatrix(), detectorConfig.tilt());
        return CoordinateTransform.uncalibrate(untilted, detectorConfig.driftVelocity(), detectorConfig.clock());
    }

    /**
     * Simula un único vector de parámetros y devuelve su coste frente a los datos reales.
     */
    public double runTrack(double[] parameters, double[][] trueValues) {
        return new CandidateEvaluationTask(0, parameters, trueValues, this).call().getScore();
    }

    /**
     * Ejecuta la minimización completa.
     *
     * @param center0    Centro inicial del espacio de parámetros.
     * @param sigma0     Anchura inicial de la perturbación por dimensión.
     * @param trueValues Datos reales en espacio crudo, una fila (x, y, tb) por punto.
     * @param numIters   Número de rondas.
     * @param numPts     Candidatos por ronda.
     * @param redFactor  Factor de reducción de sigma por ronda, en (0, 1].
     * @return Mejor vector, su traza y el histórico de cada ronda.
     */
    public MinimizationResult minimize(double[] center0, double[] sigma0, double[][] trueValues,
                                       int numIters, int numPts, double redFactor) {
        Objects.requireNonNull(center0, "El centro inicial no puede ser nulo.");
        Objects.requireNonNull(sigma0, "La sigma inicial no puede ser nula.");
        Objects.requireNonNull(trueValues, "Los datos reales no pueden ser nulos.");
        if (center0.length != lowerBounds.length || sigma0.length != lowerBounds.length) {
            throw new IllegalArgumentException(String.format(
                    "Dimensión incompatible: centro %d, sigma %d, límites %d.",
                    center0.length, sigma0.length, lowerBounds.length));
        }
        if (numIters < 0 || numPts <= 0) {
            throw new IllegalArgumentException("Se necesita al menos un candidato por ronda y un número de rondas no negativo.");
        }
        if (!(redFactor > 0 && redFactor <= 1)) {
            throw new IllegalArgumentException("El factor de reducción debe estar en (0, 1]: " + redFactor);
        }

        long startTime = System.currentTimeMillis();
        double[] sigma = sigma0.clone();
        // Generador nuevo en cada llamada: misma semilla y mismas entradas dan el mismo ajuste
        Random random = new Random(config.getSeed());

        // El centro inicial también compite: el coste retenido nunca empeora
        CandidateEvaluationTask best = new CandidateEvaluationTask(-1, center0.clone(), trueValues, this).call();
        int evaluated = 1;

        double[][] roundParams = new double[numIters][];
        double[] roundScores = new double[numIters];
        double[][] roundSigmas = new double[numIters][];

        for (int iter = 0; iter < numIters; iter++) {
            double[][] params = makeParams(best.getParameters(), sigma, numPts,
                    lowerBounds, upperBounds, random);

            List<CandidateEvaluationTask> tasks = new ArrayList<>(numPts);
            for (int i = 0; i < numPts; i++) {
                tasks.add(new CandidateEvaluationTask(i, params[i], trueValues, this));
            }

            CandidateEvaluationTask roundBest = evaluateRound(tasks);
            evaluated += numPts;

            if (roundBest.getScore() < best.getScore()) {
                best = roundBest;
            }

            roundParams[iter] = best.getParameters().clone();
            roundScores[iter] = best.getScore();
            roundSigmas[iter] = sigma.clone();
            log.debug("Ronda {}/{}: coste {} (sigma[0] = {})", iter + 1, numIters, best.getScore(),
                    sigma.length > 0 ? sigma[0] : Double.NaN);

            for (int d = 0; d < sigma.length; d++) {
                sigma[d] *= redFactor;
            }
        }

        long execTime = System.currentTimeMillis() - startTime;
        log.info("Minimización completada en {} ms: {} rondas, {} trazas, coste final {}",
                execTime, numIters, evaluated, best.getScore());

        return MinimizationResult.builder()
                .bestParameters(best.getParameters().clone())
                .bestScore(best.getScore())
                .bestSimulatedTrack(best.getSimulatedTrack())
                .bestDeviations(best.getDeviations())
                .roundBestParameters(roundParams)
                .roundScores(roundScores)
                .roundSigmas(roundSigmas)
                .evaluatedCandidates(evaluated)
                .executionTime(execTime)
                .build();
    }

    // --- HELPERS ---

    private CandidateEvaluationTask evaluateRound(List<CandidateEvaluationTask> tasks) {
        List<Future<CandidateEvaluationTask>> futures;
        try {
            futures = threadPool.invokeAll(tasks);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new RuntimeException("Minimización interrumpida.", e);
        }

        CandidateEvaluationTask roundBest = null;
        for (int i = 0; i < futures.size(); i++) {
            CandidateEvaluationTask task;
            try {
                task = futures.get(i).get();
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new RuntimeException("Minimización interrumpida.", e);
            } catch (ExecutionException e) {
                throw new RuntimeException("Error evaluando el candidato " + i, e.getCause());
            }
            if (roundBest == null || task.getScore() < roundBest.getScore()) {
                roundBest = task;
            }
        }
        return roundBest;
    }

    private static void validateBounds(double[] mins, double[] maxes) {
        if (mins.length != maxes.length) {
            throw new IllegalArgumentException("Los límites inferiores y superiores deben tener la misma dimensión.");
        }
        for (int d = 0; d < mins.length; d++) {
            if (mins[d] > maxes[d]) {
                throw new IllegalArgumentException(String.format(
                        "Límites inválidos en la dimensión %d: [%s, %s]", d, mins[d], maxes[d]));
            }
        }
        log.debug("Límites de parámetros: min={}, max={}", Arrays.toString(mins), Arrays.toString(maxes));
    }

    @Override
    public void close() {
        if (threadPool != null && !threadPool.isShutdown()) {
            threadPool.shutdown();
        }
        log.info("MonteCarloMinimizer cerrado.");
    }
}
