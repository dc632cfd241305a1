/*++
Copyright (c) 2026 The arrow-theorem Authors

Module Name:

    RangeTest.java

Abstract:

    Tests for integer ranges and their guards

Author:

    arrow-theorem developers 2026-10-18

Notes:

--*/

package arrow.logic;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.microsoft.z3.BoolExpr;
import com.microsoft.z3.Context;
import com.microsoft.z3.IntExpr;
import com.microsoft.z3.Solver;
import com.microsoft.z3.Status;
import org.junit.jupiter.api.Test;

class RangeTest
{
    @Test
    void boundedRangeEnumeratesItsMembers()
    {
        Range r = Range.of(2, 5);
        assertThat(r.isBounded()).isTrue();
        assertThat(r.size()).isEqualTo(4);
        assertThat(r.values()).containsExactly(2, 3, 4, 5);
        assertThat(r.contains(5)).isTrue();
        assertThat(r.contains(6)).isFalse();
        assertThat(r).hasToString("[2..5]");
    }

    @Test
    void singleRangeHasOneValue()
    {
        assertThat(Range.single(7).values()).containsExactly(7);
        assertThat(Range.single(7)).isEqualTo(Range.of(7, 7));
    }

    @Test
    void emptyRangeIsRejected()
    {
        assertThatThrownBy(() -> Range.of(3, 2))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void unboundedRangeContainsEverythingButCannotEnumerate()
    {
        Range r = Range.unbounded();
        assertThat(r.isBounded()).isFalse();
        assertThat(r.contains(Integer.MIN_VALUE)).isTrue();
        assertThat(r).isNotEqualTo(Range.of(1, 3));
        assertThatThrownBy(r::values).isInstanceOf(IllegalStateException.class);
        assertThatThrownBy(r::getLow).isInstanceOf(IllegalStateException.class);
    }

    /** The guard admits exactly the members of the range. */
    @Test
    void guardAdmitsOnlyMembers()
    {
        try (Context ctx = new Context())
        {
            IntExpr v = ctx.mkIntConst("v");
            BoolExpr guard = Range.of(1, 3).guard(ctx, v);

            Solver s = ctx.mkSolver();
            s.add(guard);
            assertThat(s.check(ctx.mkEq(v, ctx.mkInt(4))))
                    .isEqualTo(Status.UNSATISFIABLE);
            assertThat(s.check(ctx.mkEq(v, ctx.mkInt(3))))
                    .isEqualTo(Status.SATISFIABLE);
            assertThat(Range.unbounded().guard(ctx, v).isTrue()).isTrue();
        }
    }
}
