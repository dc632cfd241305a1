/*++
Copyright (c) 2026 The arrow-theorem Authors

Module Name:

    SwapTransitionTest.java

Abstract:

    The swap function exchanges two alternatives in one agent's ranking
    and leaves everything else alone

Author:

    arrow-theorem developers 2026-10-18

Notes:

    Frame and inversion cases are grounded over state 0, so the queries
    are quantifier free.

--*/

package arrow.axioms;

import static org.assertj.core.api.Assertions.assertThat;

import java.util.List;

import com.microsoft.z3.BoolExpr;
import com.microsoft.z3.Context;
import com.microsoft.z3.IntExpr;
import com.microsoft.z3.Params;
import com.microsoft.z3.Solver;
import com.microsoft.z3.Status;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import arrow.ArrowQuery;
import arrow.logic.Binder;
import arrow.logic.Range;
import arrow.logic.Relations;
import arrow.logic.Universe;
import arrow.seed.PermutationSeeder;
import arrow.seed.SeedFacts;
import arrow.seed.SeedState;

class SwapTransitionTest
{
    private Context ctx;
    private Relations rel;

    @BeforeEach
    void setUp()
    {
        ctx = new Context();
        rel = new Relations(ctx);
    }

    @AfterEach
    void tearDown()
    {
        ctx.close();
    }

    private Status check(BoolExpr... assertions)
    {
        Solver s = ctx.mkSolver();
        s.add(assertions);
        return s.check();
    }

    private BoolExpr groundedSwap(Universe u)
    {
        return new SwapTransition(rel, u, Binder.grounded(ctx)).build();
    }

    private static Universe atStateZero(int alternatives)
    {
        return new Universe(Range.of(1, 2), Range.of(1, alternatives),
                Range.single(0));
    }

    @Test
    void swappingTwiceRestoresTheOrder()
    {
        Universe u = new Universe(Range.of(1, 2), Range.of(1, 3),
                Range.unbounded());
        BoolExpr swap = new SwapTransition(rel, u, Binder.symbolic(ctx)).build();

        IntExpr x = ctx.mkIntConst("x0");
        IntExpr a = ctx.mkIntConst("a0");
        IntExpr b = ctx.mkIntConst("b0");
        IntExpr s = ctx.mkIntConst("s0");
        IntExpr twice = rel.swap(x, a, b, rel.swap(x, a, b, s));
        BoolExpr guards = ctx.mkAnd(u.getAgents().guard(ctx, x),
                u.getAlternatives().guard(ctx, a),
                u.getAlternatives().guard(ctx, b));

        assertThat(check(swap, guards, ctx.mkNot(ctx.mkIff(
                rel.prefers(x, a, b, twice), rel.prefers(x, a, b, s)))))
                .isEqualTo(Status.UNSATISFIABLE);
    }

    /**
     * Quantified swap and linearity over unbounded states, one seeded
     * state: the successor cannot keep the old order of the swapped pair.
     **/
    @Test
    void symbolicSwapInvertsASeededPair()
    {
        Universe u = new Universe(Range.of(1, 2), Range.of(1, 3),
                Range.unbounded());
        Binder binder = Binder.symbolic(ctx);
        SeedState first = new PermutationSeeder(2, 3).seed().get(0);

        Solver s = ctx.mkSolver();
        Params p = ctx.mkParams();
        p.add("timeout", 30000);
        s.setParameters(p);
        s.add(new SwapTransition(rel, u, binder).build(),
                new Linearity(rel, u, binder).build(),
                SeedFacts.conjunction(rel, List.of(first)),
                rel.prefers(1, 1, 2, rel.swap(1, 1, 2, first.getId())));

        assertThat(s.check()).isEqualTo(Status.UNSATISFIABLE);
    }

    @Test
    void groundedSwapIsSatisfiable()
    {
        assertThat(check(groundedSwap(atStateZero(4))))
                .isEqualTo(Status.SATISFIABLE);
    }

    @Test
    void otherAgentsKeepTheirPreferences()
    {
        IntExpr t = rel.swap(1, 3, 4, 0);
        assertThat(check(groundedSwap(atStateZero(4)), rel.prefers(2, 3, 4, 0),
                ctx.mkNot(rel.prefers(2, 3, 4, t))))
                .isEqualTo(Status.UNSATISFIABLE);
    }

    @Test
    void disjointPairsKeepTheirOrder()
    {
        IntExpr t = rel.swap(1, 3, 4, 0);
        assertThat(check(groundedSwap(atStateZero(4)), rel.prefers(1, 1, 2, 0),
                ctx.mkNot(rel.prefers(1, 1, 2, t))))
                .isEqualTo(Status.UNSATISFIABLE);
        assertThat(check(groundedSwap(atStateZero(4)),
                ctx.mkNot(rel.prefers(1, 2, 1, 0)), rel.prefers(1, 2, 1, t)))
                .isEqualTo(Status.UNSATISFIABLE);
    }

    @Test
    void theActingAgentInvertsTheSwappedPair()
    {
        Universe u = atStateZero(3);
        BoolExpr lin = new Linearity(rel, u, Binder.grounded(ctx)).build();
        assertThat(check(groundedSwap(u), lin, rel.prefers(1, 1, 2, 0),
                rel.prefers(1, 1, 2, rel.swap(1, 1, 2, 0))))
                .isEqualTo(Status.UNSATISFIABLE);
    }

    /** 1 > 2 > 3 with 1 and 3 exchanged is 3 > 2 > 1. */
    @Test
    void aNonAdjacentSwapExchangesPositions()
    {
        IntExpr t = rel.swap(1, 1, 3, 0);
        BoolExpr before = ctx.mkAnd(rel.prefers(1, 1, 2, 0),
                rel.prefers(1, 2, 3, 0), rel.prefers(1, 1, 3, 0));
        BoolExpr after = ctx.mkAnd(rel.prefers(1, 3, 2, t),
                rel.prefers(1, 2, 1, t), rel.prefers(1, 3, 1, t));

        assertThat(check(groundedSwap(atStateZero(3)), before,
                ctx.mkNot(after))).isEqualTo(Status.UNSATISFIABLE);
    }

    @Test
    void swapIsConsistentWithLinearityAndTheSeededStates()
    {
        PermutationSeeder seeder = new PermutationSeeder(
                ArrowQuery.DEFAULT_AGENTS, ArrowQuery.DEFAULT_ALTERNATIVES);
        Universe u = new Universe(seeder.getAgents(), seeder.getAlternatives(),
                seeder.getStates());
        Binder binder = Binder.grounded(ctx);

        assertThat(check(new SwapTransition(rel, u, binder).build(),
                new Linearity(rel, u, binder).build(),
                SeedFacts.conjunction(rel, seeder.seed())))
                .isEqualTo(Status.SATISFIABLE);
    }
}
