package com.whodunit.render;

import com.whodunit.contract.AttributeCategory;
import com.whodunit.contract.GameRecord;
import com.whodunit.contract.PersonActivity;
import com.whodunit.contract.PropositionData;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Display strings for propositions and scenarios. Pure functions of the
 * record; no engine state is involved.
 */
public final class PropositionRenderer {

    private PropositionRenderer() {
    }

    public static String render(PropositionData data) {
        if (data instanceof PropositionData.Statement s) {
            return s.person() + " was with " + s.value();
        }
        if (data instanceof PropositionData.Disjunction d) {
            return "(" + d.person1() + " with " + d.val1() + ") OR (" + d.person2() + " with " + d.val2() + ")";
        }
        if (data instanceof PropositionData.AlibiImplication a) {
            return "If " + a.person() + " was with " + a.value() + ", then " + a.person() + " is not the killer";
        }
        if (data instanceof PropositionData.CompoundDisjunction c) {
            return "(" + c.person1() + " with " + c.mat1() + ") OR ("
                + c.person2() + " with " + c.food2() + " and " + c.inst2() + ")";
        }
        PropositionData.DirectElimination e = (PropositionData.DirectElimination) data;
        return e.person() + " was with " + e.value() + " (alibi: not the killer)";
    }

    /** One numbered line per accepted proposition. */
    public static List<String> renderPropositions(GameRecord record) {
        List<String> lines = new ArrayList<>();
        int index = 1;
        for (PropositionData data : record.propositions()) {
            lines.add(index++ + ". " + render(data));
        }
        return lines;
    }

    /** One line per person with the killer marked, in configuration order. */
    public static List<String> renderScenario(GameRecord record) {
        List<String> lines = new ArrayList<>();
        for (Map.Entry<String, PersonActivity> entry : record.groundTruth().entrySet()) {
            String marker = entry.getKey().equals(record.killer()) ? "[killer]" : "[innocent]";
            lines.add(marker + " " + entry.getKey() + ": " + describe(entry.getValue()));
        }
        return lines;
    }

    private static String describe(PersonActivity activity) {
        List<String> parts = new ArrayList<>();
        for (AttributeCategory category : AttributeCategory.values()) {
            parts.add(category.getValue() + "=" + activity.valueOf(category));
        }
        return String.join(", ", parts);
    }
}
