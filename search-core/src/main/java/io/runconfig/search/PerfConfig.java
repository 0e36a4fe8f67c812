package io.runconfig.search;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Benchmarking parameters for one model of a run configuration.
 *
 * <p>Always carries {@code model-name}, {@code batch-size} (fixed at 1) and
 * {@code concurrency-range}; pass-through flags follow and cannot override them.</p>
 */
public final class PerfConfig {

    private static final Logger log = LoggerFactory.getLogger(PerfConfig.class);

    public static final String MODEL_NAME = "model-name";
    public static final String BATCH_SIZE = "batch-size";
    public static final String CONCURRENCY_RANGE = "concurrency-range";

    /** Client-side batch unit sent with every request */
    public static final int FIXED_BATCH_SIZE = 1;

    private final Map<String, Object> parameters;

    PerfConfig(String variantName, int concurrency, Map<String, Object> flags) {
        Map<String, Object> params = new LinkedHashMap<>();
        params.put(MODEL_NAME, variantName);
        params.put(BATCH_SIZE, FIXED_BATCH_SIZE);
        params.put(CONCURRENCY_RANGE, concurrency);
        flags.forEach((key, value) -> {
            if (params.containsKey(key)) {
                log.warn("Ignoring flag '{}' for {}: the search controls it", key, variantName);
            } else {
                params.put(key, value);
            }
        });
        this.parameters = Collections.unmodifiableMap(params);
    }

    public Object get(String key) {
        return parameters.get(key);
    }

    public int getConcurrency() {
        return (Integer) parameters.get(CONCURRENCY_RANGE);
    }

    public String getModelName() {
        return (String) parameters.get(MODEL_NAME);
    }

    public Map<String, Object> toMap() {
        return parameters;
    }

    /**
     * Renders the parameters as benchmarking tool arguments, e.g.
     * {@code -m resnet_config_0 -b 1 --concurrency-range=16 --percentile=96}.
     */
    public String representation() {
        StringBuilder sb = new StringBuilder();
        sb.append("-m ").append(parameters.get(MODEL_NAME));
        sb.append(" -b ").append(parameters.get(BATCH_SIZE));
        parameters.forEach((key, value) -> {
            if (key.equals(MODEL_NAME) || key.equals(BATCH_SIZE) || value == null) {
                return;
            }
            if (Boolean.TRUE.equals(value)) {
                sb.append(" --").append(key);
            } else if (!Boolean.FALSE.equals(value)) {
                sb.append(" --").append(key).append('=').append(value);
            }
        });
        return sb.toString();
    }

    @Override
    public String toString() {
        return representation();
    }
}
