/*
 * © Copyright Databand.ai, an IBM Company 2022
 */

package io.tabula.config;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collections;
import java.util.Map;
import java.util.Optional;
import java.util.stream.Collectors;

import static io.tabula.TabulaPropertyNames.TABULA__CORE__VERBOSE;
import static io.tabula.TabulaPropertyNames.TABULA__DISPLAY__MAX_ROWS;
import static io.tabula.TabulaPropertyNames.TABULA__MERGE__LEFT_SUFFIX;
import static io.tabula.TabulaPropertyNames.TABULA__MERGE__RIGHT_SUFFIX;

/**
 * Tabula configuration.
 */
public class TabulaConfig implements PropertiesSource {

    private static final Logger LOG = LoggerFactory.getLogger(TabulaConfig.class);

    private static final int MAX_ROWS_DEFAULT = 10;
    private static final String LEFT_SUFFIX_DEFAULT = "_x";
    private static final String RIGHT_SUFFIX_DEFAULT = "_y";

    private static volatile TabulaConfig global;

    private final Map<String, String> props;

    /**
     * Default override order, from higher priority to lowest:
     * 1. Process environment variables
     * 2. Java process system properties
     */
    public TabulaConfig() {
        this(
            new Env(
                new JavaOpts()
            )
        );
    }

    public TabulaConfig(PropertiesSource props) {
        this.props = props.values();
    }

    /**
     * Process-wide configuration used by operations that take no explicit config.
     *
     * @return lazily built default configuration
     */
    public static TabulaConfig global() {
        TabulaConfig current = global;
        if (current == null) {
            synchronized (TabulaConfig.class) {
                if (global == null) {
                    global = new TabulaConfig();
                    LOG.debug("Tabula configuration loaded: {}", global);
                }
                current = global;
            }
        }
        return current;
    }

    public static void setGlobal(TabulaConfig config) {
        synchronized (TabulaConfig.class) {
            global = config;
        }
    }

    public int displayMaxRows() {
        int maxRows = getInteger(TABULA__DISPLAY__MAX_ROWS, MAX_ROWS_DEFAULT);
        if (maxRows < 0) {
            LOG.error("Negative value {} for {}. Returning default value {}", maxRows, TABULA__DISPLAY__MAX_ROWS, MAX_ROWS_DEFAULT);
            return MAX_ROWS_DEFAULT;
        }
        return maxRows;
    }

    public String mergeLeftSuffix() {
        return props.getOrDefault(TABULA__MERGE__LEFT_SUFFIX, LEFT_SUFFIX_DEFAULT);
    }

    public String mergeRightSuffix() {
        return props.getOrDefault(TABULA__MERGE__RIGHT_SUFFIX, RIGHT_SUFFIX_DEFAULT);
    }

    public boolean isVerbose() {
        return isTrue(TABULA__CORE__VERBOSE);
    }

    protected Integer getInteger(String key, Integer defaultValue) {
        String value = props.get(key);
        if (value == null) {
            return defaultValue;
        }
        try {
            return Integer.parseInt(value.trim());
        } catch (NumberFormatException e) {
            LOG.error("Unable to read integer value from {}. Returning default value {}", value, defaultValue);
            return defaultValue;
        }
    }

    protected final boolean isTrue(String key) {
        return Boolean.TRUE.toString().equalsIgnoreCase(props.get(key));
    }

    @Override
    public Map<String, String> values() {
        return Collections.unmodifiableMap(props);
    }

    @Override
    public Optional<String> getValue(String key) {
        return Optional.ofNullable(props.get(key));
    }

    @Override
    public String toString() {
        if (props == null || props.isEmpty()) {
            return "{}";
        }
        return "\n" + props.keySet().stream()
            .filter(key -> key.startsWith("tabula"))
            .map(key -> key + "=" + props.get(key))
            .collect(Collectors.joining("\n"));
    }
}
