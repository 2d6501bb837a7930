/*
 * © Copyright Databand.ai, an IBM Company 2022
 */

package io.tabula.config;

import java.util.Collections;
import java.util.HashMap;
import java.util.Map;
import java.util.Optional;

/**
 * In-memory properties source, used as the bottom layer and in tests.
 */
public class SimpleProps implements PropertiesSource {

    private final Map<String, String> props;

    public SimpleProps(Map<String, String> props) {
        this.props = new HashMap<>(props);
    }

    public SimpleProps() {
        this.props = Collections.emptyMap();
    }

    @Override
    public Map<String, String> values() {
        return Collections.unmodifiableMap(props);
    }

    @Override
    public Optional<String> getValue(String key) {
        return Optional.ofNullable(props.get(key));
    }

}
