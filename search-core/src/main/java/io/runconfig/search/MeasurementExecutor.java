package io.runconfig.search;

/**
 * Runs the benchmarking tool against a generated configuration.
 */
@FunctionalInterface
public interface MeasurementExecutor {

    /**
     * Measures a run configuration.
     *
     * @param runConfig Configuration to deploy and measure
     * @return Measurement of every model, or null if the measurement failed
     */
    RunMeasurement measure(RunConfig runConfig);
}
