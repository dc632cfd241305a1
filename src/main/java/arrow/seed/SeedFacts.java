/*++
Copyright (c) 2026 The arrow-theorem Authors

Module Name:

    SeedFacts.java

Abstract:

    Arrow's theorem encoding: ground p facts for seeded states

Author:

    arrow-theorem developers 2026-10-18

Notes:

--*/

package arrow.seed;

import java.util.ArrayList;
import java.util.List;

import com.microsoft.z3.BoolExpr;
import com.microsoft.z3.Context;

import arrow.logic.Relations;

public final class SeedFacts
{
    private SeedFacts()
    {
    }

    /**
     * One {@code p(agent, better, worse, state)} atom per comparison of the
     * state's profile.
     **/
    public static List<BoolExpr> facts(Relations relations, SeedState state)
    {
        List<BoolExpr> res = new ArrayList<BoolExpr>();
        for (Profile.Preference pref : state.getProfile().preferences())
            res.add(relations.prefers(pref.getAgent(), pref.getBetter(),
                    pref.getWorse(), state.getId()));
        return res;
    }

    /**
     * The conjunction of the facts of all {@code states}.
     **/
    public static BoolExpr conjunction(Relations relations,
            List<SeedState> states)
    {
        Context ctx = relations.getContext();
        List<BoolExpr> all = new ArrayList<BoolExpr>();
        for (SeedState s : states)
            all.addAll(facts(relations, s));
        return ctx.mkAnd(all.toArray(new BoolExpr[0]));
    }
}
