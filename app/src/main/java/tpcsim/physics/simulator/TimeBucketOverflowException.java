package tpcsim.physics.simulator;

import lombok.Getter;

/**
 * Se lanza cuando un punto de la traza llega después del último time bucket de la ventana
 * de lectura y la política de desbordamiento es {@code FAIL}.
 */
@Getter
public class TimeBucketOverflowException extends RuntimeException {

    private final double timeBucket;

    public TimeBucketOverflowException(double timeBucket) {
        super("Desbordamiento de time bucket: " + timeBucket);
        this.timeBucket = timeBucket;
    }
}
