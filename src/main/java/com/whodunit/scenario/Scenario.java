package com.whodunit.scenario;

import com.whodunit.contract.PersonActivity;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Hidden ground truth of one game: every person's activity and the killer.
 */
public record Scenario(
    String killer,
    Map<String, PersonActivity> groundTruth
) {

    public Scenario {
        if (!groundTruth.containsKey(killer)) {
            throw new IllegalArgumentException("killer " + killer + " has no ground truth entry");
        }
        groundTruth = Collections.unmodifiableMap(new LinkedHashMap<>(groundTruth));
    }

    public PersonActivity activityOf(String person) {
        PersonActivity activity = groundTruth.get(person);
        if (activity == null) {
            throw new IllegalArgumentException("unknown person: " + person);
        }
        return activity;
    }

    public boolean isKiller(String person) {
        return killer.equals(person);
    }

    /** Everyone except the killer, in configuration order. */
    public List<String> innocents() {
        return groundTruth.keySet().stream().filter(name -> !isKiller(name)).toList();
    }
}
