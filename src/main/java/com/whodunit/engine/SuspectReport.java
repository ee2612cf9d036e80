package com.whodunit.engine;

import java.util.List;

/**
 * People for whom "is the killer" is still consistent with the knowledge
 * base, in configuration order.
 */
public record SuspectReport(List<String> suspects) {

    public SuspectReport {
        suspects = List.copyOf(suspects);
    }

    public int count() {
        return suspects.size();
    }

    public boolean isConverged() {
        return suspects.size() == 1;
    }
}
