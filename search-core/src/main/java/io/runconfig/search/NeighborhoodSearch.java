package io.runconfig.search;

import io.runconfig.search.constraint.ConstraintEvaluator;
import io.runconfig.search.constraint.ModelConstraints;
import io.runconfig.search.space.Coordinate;
import io.runconfig.search.space.DimensionSet;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Hill-climbing driver for a {@link QuickSearchEngine}.
 *
 * <p>Measures the default configuration and the starting coordinate, then repeatedly
 * measures at least {@code minInitialized} unvisited neighbors of the current home
 * coordinate and moves home to the best of them. The walk stops when no neighbor beats
 * home, the neighborhood is exhausted, or the measurement budget runs out.</p>
 *
 * <p>Coordinates that resolve to an already-measured run configuration (same variants
 * and same benchmarking parameters) reuse the earlier measurement instead of calling
 * the executor again.</p>
 */
public class NeighborhoodSearch {

    private static final Logger log = LoggerFactory.getLogger(NeighborhoodSearch.class);

    private final QuickSearchEngine engine;
    private final MeasurementExecutor executor;
    private final List<ModelConstraints> constraints;
    private final int maxMeasurements;

    private final Map<String, MeasuredConfig> byRepresentation = new HashMap<>();
    private final Set<Coordinate> visited = new HashSet<>();
    private final List<MeasuredConfig> measured = new ArrayList<>();
    private int measurementsTaken;

    /**
     * @param engine Engine to drive; must still be in its default phase
     * @param executor Runs the measurements
     * @param constraints Constraints per model, in model order
     * @param maxMeasurements Upper bound on executor calls
     */
    public NeighborhoodSearch(QuickSearchEngine engine, MeasurementExecutor executor,
                              List<ModelConstraints> constraints, int maxMeasurements) {
        this.engine = Objects.requireNonNull(engine, "engine cannot be null");
        this.executor = Objects.requireNonNull(executor, "executor cannot be null");
        this.constraints = constraints != null ? List.copyOf(constraints) : List.of();
        if (maxMeasurements < 1) throw new IllegalArgumentException("maxMeasurements must be >= 1");
        this.maxMeasurements = maxMeasurements;
    }

    public SearchOutcome run() {
        if (!engine.isDefaultPhase()) {
            throw new IllegalStateException("engine has already been stepped");
        }

        MeasuredConfig best = record(null, engine.next());

        SearchConfig searchConfig = engine.getSearchConfig();
        DimensionSet dimensions = searchConfig.dimensions();
        Coordinate home = engine.getStartingCoordinate();
        MeasuredConfig homeResult = hasBudget() ? measureAt(home) : null;
        best = pick(best, homeResult);

        int steps = 0;
        while (hasBudget()) {
            List<MeasuredConfig> candidates = new ArrayList<>();
            for (Coordinate neighbor : home.neighborsWithinRadius(searchConfig.radius())) {
                if (candidates.size() >= searchConfig.minInitialized() || !hasBudget()) {
                    break;
                }
                if (visited.contains(neighbor) || !dimensions.isWithinBounds(neighbor)) {
                    continue;
                }
                MeasuredConfig result = measureAt(neighbor);
                if (result != null) {
                    candidates.add(result);
                }
            }
            if (candidates.isEmpty()) {
                log.info("Neighborhood of {} exhausted", home);
                break;
            }

            MeasuredConfig stepBest = null;
            for (MeasuredConfig candidate : candidates) {
                stepBest = pick(stepBest, candidate);
            }
            best = pick(best, stepBest);

            if (homeResult != null && !stepBest.isBetterThan(homeResult)) {
                log.info("No neighbor of {} improves on it after {} step(s)", home, steps);
                break;
            }
            home = stepBest.coordinate();
            homeResult = stepBest;
            steps++;
            log.info("Step {}: moved to {} ({})", steps, home, stepBest.runConfig());
        }

        log.info("Quick search finished: {} measurement(s), best {}", measurementsTaken,
            best != null ? best.runConfig() : "none");
        return new SearchOutcome(best, measured, steps);
    }

    private boolean hasBudget() {
        return measurementsTaken < maxMeasurements;
    }

    private static MeasuredConfig pick(MeasuredConfig current, MeasuredConfig candidate) {
        if (candidate == null) return current;
        return candidate.isBetterThan(current) ? candidate : current;
    }

    private MeasuredConfig measureAt(Coordinate coordinate) {
        visited.add(coordinate);
        engine.setCoordinateToMeasure(coordinate);
        return record(coordinate, engine.next());
    }

    private MeasuredConfig record(Coordinate coordinate, RunConfig runConfig) {
        // Variant names alone miss concurrency, which lives in the benchmarking parameters
        String key = runConfig.representation();
        MeasuredConfig previous = byRepresentation.get(key);
        if (previous != null) {
            log.debug("{} resolves to already measured {}", coordinate, key);
            return new MeasuredConfig(coordinate, previous.runConfig(), previous.measurement(),
                previous.feasible(), previous.infeasibilityScore());
        }

        measurementsTaken++;
        RunMeasurement measurement = executor.measure(runConfig);
        if (measurement == null) {
            log.warn("Measurement failed for {}", runConfig.representation());
            return null;
        }

        boolean feasible = ConstraintEvaluator.satisfies(constraints, measurement);
        double score = ConstraintEvaluator.infeasibilityScore(constraints, measurement);
        MeasuredConfig result = new MeasuredConfig(coordinate, runConfig, measurement, feasible, score);
        byRepresentation.put(key, result);
        measured.add(result);
        log.debug("Measured {}: feasible={} score={}", runConfig, feasible, score);
        return result;
    }
}
