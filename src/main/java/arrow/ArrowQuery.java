/*++
Copyright (c) 2026 The arrow-theorem Authors

Module Name:

    ArrowQuery.java

Abstract:

    Arrow's theorem encoding: composition of all sentences and the
    single satisfiability check

Author:

    arrow-theorem developers 2026-10-18

Notes:

--*/

package arrow;

import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

import com.microsoft.z3.BoolExpr;
import com.microsoft.z3.Context;
import com.microsoft.z3.Log;
import com.microsoft.z3.Solver;
import com.microsoft.z3.Status;

import arrow.axioms.Axiom;
import arrow.logic.Binder;
import arrow.logic.Range;
import arrow.logic.Relations;
import arrow.logic.Universe;
import arrow.seed.PermutationSeeder;
import arrow.seed.ProfileSeeder;
import arrow.seed.SeedFacts;

/**
 * The conjunction of the selected axioms and the seed facts, all built over
 * one {@link Relations} instance, checked once.
 **/
public final class ArrowQuery
{
    public static final String SEED_STATES = "seed-states";

    public static final int DEFAULT_AGENTS = 2;
    public static final int DEFAULT_ALTERNATIVES = 3;

    private final Context ctx;
    private final CheckSettings settings;
    private final ProfileSeeder seeder;
    private final Set<Axiom> axioms;
    private final Relations relations;
    private final Universe universe;
    private final Binder binder;

    private Map<String, BoolExpr> sentences;

    /**
     * All axioms over the 36 profiles of two agents and three alternatives.
     **/
    public ArrowQuery(Context ctx, CheckSettings settings)
    {
        this(ctx, settings, new PermutationSeeder(DEFAULT_AGENTS,
                DEFAULT_ALTERNATIVES), EnumSet.allOf(Axiom.class));
    }

    public ArrowQuery(Context ctx, CheckSettings settings,
            ProfileSeeder seeder, Set<Axiom> axioms)
    {
        this(ctx, settings, seeder, axioms, new Relations(ctx));
    }

    private ArrowQuery(Context ctx, CheckSettings settings,
            ProfileSeeder seeder, Set<Axiom> axioms, Relations relations)
    {
        this.ctx = ctx;
        this.settings = settings;
        this.seeder = seeder;
        this.axioms = axioms.isEmpty() ? EnumSet.noneOf(Axiom.class)
                : EnumSet.copyOf(axioms);
        this.relations = relations;
        this.universe = universeFor(settings, seeder);
        this.binder = settings.binder(ctx);
    }

    /**
     * Agents and alternatives are those of the seeder. States are unbounded
     * under the symbolic encoding and the seeded ones under the grounded
     * encoding.
     **/
    static Universe universeFor(CheckSettings settings, ProfileSeeder seeder)
    {
        Universe u = new Universe(seeder.getAgents(),
                seeder.getAlternatives(), seeder.getStates());
        if (settings.getEncoding() == CheckSettings.Encoding.SYMBOLIC)
            return u.withStates(Range.unbounded());
        return u;
    }

    /**
     * The same query without {@code axiom}, over fresh declarations.
     **/
    public ArrowQuery without(Axiom axiom)
    {
        EnumSet<Axiom> rest = axioms.isEmpty() ? EnumSet.noneOf(Axiom.class)
                : EnumSet.copyOf(axioms);
        rest.remove(axiom);
        return new ArrowQuery(ctx, settings, seeder, rest);
    }

    public Set<Axiom> getAxioms()
    {
        return Collections.unmodifiableSet(axioms);
    }

    public Relations getRelations()
    {
        return relations;
    }

    public Universe getUniverse()
    {
        return universe;
    }

    public ProfileSeeder getSeeder()
    {
        return seeder;
    }

    /**
     * Named sentences in assertion order: the selected axioms, then the
     * seed facts.
     **/
    public Map<String, BoolExpr> sentences()
    {
        if (sentences == null)
        {
            Map<String, BoolExpr> res = new LinkedHashMap<String, BoolExpr>();
            for (Axiom a : axioms)
                res.put(a.getLabel(), a.build(relations, universe, binder));
            res.put(SEED_STATES,
                    SeedFacts.conjunction(relations, seeder.seed()));
            sentences = Collections.unmodifiableMap(res);
        }
        return sentences;
    }

    /**
     * The single formula the check decides.
     **/
    public BoolExpr compose()
    {
        return ctx.mkAnd(sentences().values().toArray(new BoolExpr[0]));
    }

    /**
     * Asserts every sentence under a tracking literal of the same name and
     * calls the solver once. A timeout gives {@link Verdict#unknown}.
     * 
     * @throws com.microsoft.z3.Z3Exception on solver failure
     **/
    public Verdict check()
    {
        Solver s = ctx.mkSolver();
        s.setParameters(settings.solverParams(ctx));

        Map<BoolExpr, String> trackers = new LinkedHashMap<BoolExpr, String>();
        for (Map.Entry<String, BoolExpr> e : sentences().entrySet())
        {
            BoolExpr tracker = ctx.mkBoolConst(e.getKey());
            trackers.put(tracker, e.getKey());
            s.assertAndTrack(e.getValue(), tracker);
            if (Log.isOpen())
                Log.append("assert " + e.getKey());
        }

        if (Log.isOpen())
            Log.append("check " + settings);
        Status q = s.check();

        switch (q)
        {
        case UNSATISFIABLE:
            List<String> core = new ArrayList<String>();
            for (BoolExpr c : s.getUnsatCore())
            {
                String name = trackers.get(c);
                core.add(name != null ? name : c.toString());
            }
            return Verdict.unsatisfiable(core);
        case SATISFIABLE:
            return Verdict.satisfiable(settings.isModelGeneration() ? s
                    .getModel() : null);
        case UNKNOWN:
        default:
            return Verdict.unknown(s.getReasonUnknown());
        }
    }
}
