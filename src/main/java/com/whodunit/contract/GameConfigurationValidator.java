package com.whodunit.contract;

import com.whodunit.logic.AtomSpace;
import org.springframework.stereotype.Component;

import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Rejects configurations the engine cannot turn into a puzzle. Runs before
 * any atom is allocated.
 */
@Component
public class GameConfigurationValidator {

    static final String KILLER_SUFFIX = "is_killer";

    public void validate(GameConfiguration configuration) {
        requireNonNull(configuration, "configuration is required");

        List<String> names = configuration.names();
        requireDistinctValues(names, "names");
        if (names.size() < 2) {
            throw new ConfigurationException("names must contain at least 2 entries, got " + names.size());
        }

        // value -> category, to catch two categories sharing one atom key
        Map<String, AttributeCategory> owners = new HashMap<>();
        for (AttributeCategory category : AttributeCategory.values()) {
            List<String> values = configuration.valuesOf(category);
            String field = category.getValue();
            if (values.isEmpty()) {
                throw new ConfigurationException(field + " must contain at least 1 value");
            }
            requireDistinctValues(values, field);

            for (String value : values) {
                if (KILLER_SUFFIX.equals(value)) {
                    throw new ConfigurationException(field + " must not contain the reserved value " + KILLER_SUFFIX);
                }
                AttributeCategory previous = owners.putIfAbsent(value, category);
                if (previous != null) {
                    throw new ConfigurationException("value '" + value + "' appears in both "
                        + previous.getValue() + " and " + field);
                }
            }
        }

        requireDistinctAtomKeys(configuration);
    }

    /**
     * Atom keys join person and value with an underscore, so names or values
     * containing one can collide, e.g. {@code A} + {@code x_red} and
     * {@code A_x} + {@code red}.
     */
    private void requireDistinctAtomKeys(GameConfiguration configuration) {
        // key -> the fact that produced it first
        Map<String, String> facts = new HashMap<>();
        for (String name : configuration.names()) {
            for (AttributeCategory category : AttributeCategory.values()) {
                for (String value : configuration.valuesOf(category)) {
                    requireUnusedKey(facts, AtomSpace.attributeKey(name, value), name + " has " + value);
                }
            }
            requireUnusedKey(facts, AtomSpace.killerKey(name), name + " is the killer");
        }
    }

    private void requireUnusedKey(Map<String, String> facts, String key, String fact) {
        String previous = facts.putIfAbsent(key, fact);
        if (previous != null) {
            throw new ConfigurationException("atom key '" + key + "' is shared by '"
                + previous + "' and '" + fact + "'");
        }
    }

    private void requireDistinctValues(List<String> values, String field) {
        Set<String> seen = new HashSet<>();
        for (String value : values) {
            requireString(value, field + " must not contain blank entries");
            if (!seen.add(value)) {
                throw new ConfigurationException(field + " contains duplicate entry: " + value);
            }
        }
    }

    private void requireString(String value, String message) {
        if (value == null || value.isBlank()) {
            throw new ConfigurationException(message);
        }
    }

    private void requireNonNull(Object value, String message) {
        if (value == null) {
            throw new ConfigurationException(message);
        }
    }
}
