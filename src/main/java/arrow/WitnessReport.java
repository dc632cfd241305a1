/*++
Copyright (c) 2026 The arrow-theorem Authors

Module Name:

    WitnessReport.java

Abstract:

    Arrow's theorem encoding: diagnosis of a satisfying model

Author:

    arrow-theorem developers 2026-10-18

Notes:

--*/

package arrow;

import java.util.Collections;
import java.util.List;

public final class WitnessReport
{
    private final int inspectedStates;
    private final List<String> violations;
    private final List<Integer> dictators;

    WitnessReport(int inspectedStates, List<String> violations,
            List<Integer> dictators)
    {
        this.inspectedStates = inspectedStates;
        this.violations = Collections.unmodifiableList(violations);
        this.dictators = Collections.unmodifiableList(dictators);
    }

    public int getInspectedStates()
    {
        return inspectedStates;
    }

    /**
     * Human readable descriptions of every failed order property.
     **/
    public List<String> getViolations()
    {
        return violations;
    }

    /**
     * Agents whose order equals the welfare order in every inspected state.
     **/
    public List<Integer> getDictators()
    {
        return dictators;
    }

    public boolean isWellFormed()
    {
        return violations.isEmpty();
    }

    @Override
    public String toString()
    {
        StringBuilder sb = new StringBuilder();
        sb.append("inspected ").append(inspectedStates).append(" states, ");
        sb.append(violations.isEmpty() ? "all orders strict and total"
                : violations.size() + " order violations");
        sb.append(", dictators ").append(dictators);
        for (String v : violations)
            sb.append("\n  ").append(v);
        return sb.toString();
    }
}
