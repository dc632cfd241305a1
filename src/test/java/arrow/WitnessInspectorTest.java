/*++
Copyright (c) 2026 The arrow-theorem Authors

Module Name:

    WitnessInspectorTest.java

Abstract:

    Inspecting the model found without non-dictatorship

Author:

    arrow-theorem developers 2026-10-18

Notes:

--*/

package arrow;

import static org.assertj.core.api.Assertions.assertThat;

import java.util.List;
import java.util.Map;

import com.microsoft.z3.Context;
import com.microsoft.z3.Model;
import com.microsoft.z3.Solver;
import com.microsoft.z3.Status;
import org.junit.jupiter.api.Test;

import arrow.axioms.Axiom;
import arrow.logic.Range;
import arrow.logic.Relations;
import arrow.seed.Profile;
import arrow.seed.SeedState;

class WitnessInspectorTest
{
    private static final CheckSettings GROUNDED = CheckSettings.defaults()
            .withEncoding(CheckSettings.Encoding.GROUNDED);

    @Test
    void survivingModelHasExactlyOneDictator()
    {
        try (Context ctx = new Context(GROUNDED.contextConfig()))
        {
            ArrowQuery q = new ArrowQuery(ctx, GROUNDED)
                    .without(Axiom.NON_DICTATORSHIP);
            Verdict v = q.check();
            assertThat(v.isSatisfiable()).isTrue();

            WitnessReport r = WitnessInspector.of(q).inspect(v.getModel());
            assertThat(r.getInspectedStates()).isEqualTo(36);
            assertThat(r.isWellFormed()).as(r.toString()).isTrue();
            assertThat(r.getDictators()).hasSize(1);
            assertThat(r.toString()).contains("all orders strict and total");
        }
    }

    @Test
    void reportsBrokenOrders()
    {
        try (Context ctx = new Context())
        {
            Relations rel = new Relations(ctx);
            SeedState st = new SeedState(1, new Profile(Map.of(1,
                    List.of(1, 2), 2, List.of(2, 1))));
            Solver s = ctx.mkSolver();
            // agent 1 holds 1 > 2, agent 2 nothing, welfare both ways
            s.add(rel.prefers(1, 1, 2, 1), ctx.mkNot(rel.prefers(1, 2, 1, 1)),
                    ctx.mkNot(rel.prefers(2, 1, 2, 1)),
                    ctx.mkNot(rel.prefers(2, 2, 1, 1)), rel.ranks(1, 2, 1),
                    rel.ranks(2, 1, 1));
            for (int a = 1; a <= 2; a++)
            {
                s.add(ctx.mkNot(rel.ranks(a, a, 1)));
                for (int x = 1; x <= 2; x++)
                    s.add(ctx.mkNot(rel.prefers(x, a, a, 1)));
            }
            assertThat(s.check()).isEqualTo(Status.SATISFIABLE);
            Model m = s.getModel();

            WitnessReport r = new WitnessInspector(rel, Range.of(1, 2),
                    Range.of(1, 2), List.of(st)).inspect(m);
            assertThat(r.isWellFormed()).isFalse();
            assertThat(r.getViolations()).anyMatch(v -> v.startsWith("w"))
                    .anyMatch(v -> v.startsWith("p of agent 2"))
                    .noneMatch(v -> v.startsWith("p of agent 1"));
            assertThat(r.getDictators()).isEmpty();
        }
    }
}
