package tpcsim.physics.model;

import lombok.extern.slf4j.Slf4j;
import tpcsim.config.EventGeneratorConfig.NegativeChargePolicy;

import java.util.Objects;

/**
 * Convierte la energía acumulada de una traza en electrones de ionización por paso.
 * <p>
 * Para el paso i (i >= 1): {@code floor(-(E[i] - E[i-1]) * 1e6 * A / W)}, con E en MeV/u,
 * A el número másico y W la energía de ionización en eV. El primer paso no tiene diferencia
 * previa y vale siempre 0.
 */
@Slf4j
public class ElectronCountModel {

    private static final double MEV_TO_EV = 1e6;

    private final int massNumber;
    private final double ionizationEnergy;
    private final NegativeChargePolicy negativeChargePolicy;

    public ElectronCountModel(int massNumber, double ionizationEnergy, NegativeChargePolicy negativeChargePolicy) {
        if (ionizationEnergy <= 0) {
            throw new IllegalArgumentException("La energía de ionización debe ser positiva.");
        }
        this.massNumber = massNumber;
        this.ionizationEnergy = ionizationEnergy;
        this.negativeChargePolicy = Objects.requireNonNull(negativeChargePolicy, "La política de carga negativa no puede ser nula.");
    }

    /**
     * Calcula el número de electrones de cada paso de la traza.
     *
     * @param energies Energía acumulada en cada paso [MeV/u]. Se espera no creciente.
     * @return Vector con el mismo número de elementos; el primero es siempre 0.
     * @throws IllegalArgumentException si la energía sube y la política es {@code REJECT}.
     */
    public double[] numElec(double[] energies) {
        Objects.requireNonNull(energies, "El vector de energías no puede ser nulo.");
        double[] result = new double[energies.length];
        int negativeSteps = 0;

        for (int i = 1; i < energies.length; i++) {
            double previous = energies[i - 1] * MEV_TO_EV * massNumber;
            double current = energies[i] * MEV_TO_EV * massNumber;
            double count = Math.floor(-(current - previous) / ionizationEnergy);

            if (count < 0) {
                negativeSteps++;
                switch (negativeChargePolicy) {
                    case REJECT:
                        throw new IllegalArgumentException(String.format(
                                "La energía aumenta entre los pasos %d y %d (%.6f -> %.6f MeV/u).",
                                i - 1, i, energies[i - 1], energies[i]));
                    case CLAMP_TO_ZERO:
                        count = 0;
                        break;
                    case PROPAGATE:
                    default:
                        break;
                }
            }
            result[i] = count;
        }

        if (negativeSteps > 0) {
            log.warn("La energía aumenta en {} pasos de la traza (política {}).", negativeSteps, negativeChargePolicy);
        }
        return result;
    }
}
