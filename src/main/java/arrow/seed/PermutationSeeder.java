/*++
Copyright (c) 2026 The arrow-theorem Authors

Module Name:

    PermutationSeeder.java

Abstract:

    Arrow's theorem encoding: one state per combination of agent
    orderings

Author:

    arrow-theorem developers 2026-10-18

Notes:

    Two agents over three alternatives give 3! x 3! = 36 states.

--*/

package arrow.seed;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import arrow.logic.Range;

/**
 * Seeds every profile over agents {@code 1..n} and alternatives
 * {@code 1..m}: {@code (m!)^n} states numbered from {@code firstState}. The
 * last agent's ordering varies fastest.
 **/
public final class PermutationSeeder implements ProfileSeeder
{
    public static final int DEFAULT_FIRST_STATE = 1;

    private final int agents;
    private final int alternatives;
    private final int firstState;

    private List<SeedState> seeded;

    public PermutationSeeder(int agents, int alternatives)
    {
        this(agents, alternatives, DEFAULT_FIRST_STATE);
    }

    public PermutationSeeder(int agents, int alternatives, int firstState)
    {
        if (agents < 1)
            throw new IllegalArgumentException("at least one agent is required");
        if (alternatives < 1)
            throw new IllegalArgumentException("at least one alternative is required");
        this.agents = agents;
        this.alternatives = alternatives;
        this.firstState = firstState;
    }

    @Override
    public List<SeedState> seed()
    {
        if (seeded == null)
            seeded = Collections.unmodifiableList(enumerate());
        return seeded;
    }

    @Override
    public Range getAgents()
    {
        return Range.of(1, agents);
    }

    @Override
    public Range getAlternatives()
    {
        return Range.of(1, alternatives);
    }

    @Override
    public Range getStates()
    {
        return Range.of(firstState, firstState + profileCount() - 1);
    }

    /**
     * {@code (m!)^n}
     **/
    public int profileCount()
    {
        long orders = 1;
        for (int i = 2; i <= alternatives; i++)
            orders *= i;
        long res = 1;
        for (int i = 0; i < agents; i++)
        {
            res *= orders;
            if (res > Integer.MAX_VALUE)
                throw new IllegalStateException("too many profiles for "
                        + agents + " agents and " + alternatives
                        + " alternatives");
        }
        return (int) res;
    }

    private List<SeedState> enumerate()
    {
        List<Integer> alts = new ArrayList<Integer>();
        for (int a = 1; a <= alternatives; a++)
            alts.add(a);
        List<List<Integer>> orders = Permutations.of(alts);

        List<SeedState> res = new ArrayList<SeedState>(profileCount());
        int[] choice = new int[agents];
        int state = firstState;
        while (true)
        {
            Map<Integer, List<Integer>> rankings = new LinkedHashMap<Integer, List<Integer>>();
            for (int x = 0; x < agents; x++)
                rankings.put(x + 1, orders.get(choice[x]));
            res.add(new SeedState(state++, new Profile(rankings)));

            // odometer step, last agent fastest
            int pos = agents - 1;
            while (pos >= 0 && ++choice[pos] == orders.size())
                choice[pos--] = 0;
            if (pos < 0)
                return res;
        }
    }
}
