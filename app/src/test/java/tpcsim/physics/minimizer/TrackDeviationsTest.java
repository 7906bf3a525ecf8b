package tpcsim.physics.minimizer;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.lang.reflect.Constructor;
import java.lang.reflect.Modifier;

import static org.junit.jupiter.api.Assertions.*;

class TrackDeviationsTest {

    @Test
    @DisplayName("El constructor de la clase de utilidad debe ser privado")
    void testConstructorIsPrivate() throws Exception {
        Constructor<TrackDeviations> constructor = TrackDeviations.class.getDeclaredConstructor();
        assertTrue(Modifier.isPrivate(constructor.getModifiers()));
    }

    @Test
    @DisplayName("Vecino más cercano: cada punto experimental usa su punto simulado más próximo")
    void findDeviations_shouldUseNearestNeighbour() {
        double[][] sim = {{0, 0, 0}, {10, 10, 10}};
        double[][] exp = {{1, 0, 0}, {9, 10, 12}};

        double[][] devs = TrackDeviations.findDeviations(sim, exp);

        assertArrayEquals(new double[]{1, 0, 0}, devs[0]);
        assertArrayEquals(new double[]{1, 0, 4}, devs[1]);
    }

    @Test
    @DisplayName("NaN: los puntos simulados divergentes nunca se eligen como vecino")
    void findDeviations_shouldSkipNaNRows() {
        double[][] sim = {{Double.NaN, 0, 0}, {2, 0, 0}};
        double[][] exp = {{0, 0, 0}};

        double[][] devs = TrackDeviations.findDeviations(sim, exp);

        assertArrayEquals(new double[]{4, 0, 0}, devs[0]);
    }

    @Test
    @DisplayName("NaN: sin ningún punto simulado finito la fila queda a NaN y el coste es +Infinity")
    void findDeviations_allNaN_shouldGiveInfiniteScore() {
        double[][] sim = {{Double.NaN, Double.NaN, Double.NaN}};
        double[][] exp = {{0, 0, 0}, {1, 1, 1}};

        double[][] devs = TrackDeviations.findDeviations(sim, exp);

        for (double[] row : devs) {
            for (double v : row) {
                assertTrue(Double.isNaN(v));
            }
        }
        assertEquals(Double.POSITIVE_INFINITY, TrackDeviations.score(devs));
    }

    @Test
    @DisplayName("Validación: columnas incompatibles se rechazan")
    void findDeviations_columnMismatch_shouldThrow() {
        assertThrows(IllegalArgumentException.class,
                () -> TrackDeviations.findDeviations(new double[][]{{0, 0}}, new double[][]{{0, 0, 0}}));
    }

    @Test
    @DisplayName("Coste: media de las sumas por fila ignorando las filas no finitas")
    void score_shouldAverageFiniteRows() {
        double[][] devs = {
                {1, 0, 0},
                {1, 1, 1},
                {Double.NaN, Double.NaN, Double.NaN}
        };

        assertEquals(2.0, TrackDeviations.score(devs), 1e-12);
        assertEquals(Double.POSITIVE_INFINITY, TrackDeviations.score(new double[0][]));
    }

    @Test
    @DisplayName("dropNaNs: elimina NaN e infinitos conservando el orden")
    void dropNaNs_shouldKeepOnlyFiniteValues() {
        double[] data = {1.0, Double.NaN, 2.0, Double.POSITIVE_INFINITY, 3.0};

        assertArrayEquals(new double[]{1.0, 2.0, 3.0}, TrackDeviations.dropNaNs(data));
    }
}
