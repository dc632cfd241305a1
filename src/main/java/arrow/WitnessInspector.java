/*++
Copyright (c) 2026 The arrow-theorem Authors

Module Name:

    WitnessInspector.java

Abstract:

    Arrow's theorem encoding: model checking of a satisfying assignment
    on the seeded states

Author:

    arrow-theorem developers 2026-10-18

Notes:

--*/

package arrow;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

import com.microsoft.z3.BoolExpr;
import com.microsoft.z3.Model;

import arrow.logic.Range;
import arrow.logic.Relations;
import arrow.seed.SeedState;

/**
 * Evaluates {@code p} and {@code w} in a model on every seeded state and
 * checks that each is a strict total order over the alternatives. Also
 * reports agents that act as dictators on the seeded states.
 **/
public final class WitnessInspector
{
    private final Relations rel;
    private final int[] agents;
    private final int[] alternatives;
    private final List<SeedState> states;

    public WitnessInspector(Relations relations, Range agents,
            Range alternatives, List<SeedState> states)
    {
        this.rel = relations;
        this.agents = agents.values();
        this.alternatives = alternatives.values();
        this.states = states;
    }

    public static WitnessInspector of(ArrowQuery query)
    {
        return new WitnessInspector(query.getRelations(), query.getSeeder()
                .getAgents(), query.getSeeder().getAlternatives(), query
                .getSeeder().seed());
    }

    public WitnessReport inspect(Model model)
    {
        List<String> violations = new ArrayList<String>();
        boolean[] dictator = new boolean[agents.length];
        Arrays.fill(dictator, true);

        for (SeedState st : states)
        {
            int s = st.getId();
            boolean[][] social = new boolean[alternatives.length][alternatives.length];
            for (int i = 0; i < alternatives.length; i++)
                for (int j = 0; j < alternatives.length; j++)
                    social[i][j] = holds(model, rel.ranks(alternatives[i],
                            alternatives[j], s));
            checkOrder("w", s, social, violations);

            for (int k = 0; k < agents.length; k++)
            {
                boolean[][] individual = new boolean[alternatives.length][alternatives.length];
                for (int i = 0; i < alternatives.length; i++)
                    for (int j = 0; j < alternatives.length; j++)
                        individual[i][j] = holds(model, rel.prefers(agents[k],
                                alternatives[i], alternatives[j], s));
                checkOrder("p of agent " + agents[k], s, individual,
                        violations);
                if (dictator[k] && !Arrays.deepEquals(individual, social))
                    dictator[k] = false;
            }
        }

        List<Integer> dictators = new ArrayList<Integer>();
        for (int k = 0; k < agents.length; k++)
            if (dictator[k])
                dictators.add(agents[k]);
        return new WitnessReport(states.size(), violations, dictators);
    }

    private static boolean holds(Model model, BoolExpr atom)
    {
        return model.eval(atom, true).isTrue();
    }

    private void checkOrder(String owner, int state, boolean[][] r,
            List<String> out)
    {
        int n = alternatives.length;
        for (int i = 0; i < n; i++)
        {
            if (r[i][i])
                out.add(owner + " in state " + state + ": reflexive at "
                        + alternatives[i]);
            for (int j = 0; j < n; j++)
            {
                if (i == j)
                    continue;
                if (i < j && !r[i][j] && !r[j][i])
                    out.add(owner + " in state " + state
                            + ": incomparable " + alternatives[i] + ", "
                            + alternatives[j]);
                if (i < j && r[i][j] && r[j][i])
                    out.add(owner + " in state " + state
                            + ": not antisymmetric on " + alternatives[i]
                            + ", " + alternatives[j]);
                for (int k = 0; k < n; k++)
                    if (r[i][j] && r[j][k] && !r[i][k] && i != k)
                        out.add(owner + " in state " + state
                                + ": not transitive on " + alternatives[i]
                                + ", " + alternatives[j] + ", "
                                + alternatives[k]);
            }
        }
    }
}
