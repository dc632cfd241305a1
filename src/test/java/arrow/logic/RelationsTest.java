/*++
Copyright (c) 2026 The arrow-theorem Authors

Module Name:

    RelationsTest.java

Abstract:

    Tests for the shared relation declarations

Author:

    arrow-theorem developers 2026-10-18

Notes:

--*/

package arrow.logic;

import static org.assertj.core.api.Assertions.assertThat;

import com.microsoft.z3.BoolExpr;
import com.microsoft.z3.Context;
import com.microsoft.z3.IntExpr;
import org.junit.jupiter.api.Test;

class RelationsTest
{
    @Test
    void declaresPWAndSwap()
    {
        try (Context ctx = new Context())
        {
            Relations rel = new Relations(ctx);

            assertThat(rel.getPreference().getName().toString()).isEqualTo("p");
            assertThat(rel.getPreference().getDomainSize()).isEqualTo(4);
            assertThat(rel.getPreference().getRange()).isEqualTo(ctx.getBoolSort());
            assertThat(rel.getWelfare().getName().toString()).isEqualTo("w");
            assertThat(rel.getWelfare().getDomainSize()).isEqualTo(3);
            assertThat(rel.getSwap().getName().toString()).isEqualTo("swap");
            assertThat(rel.getSwap().getRange()).isEqualTo(ctx.getIntSort());
        }
    }

    @Test
    void integerShortcutsBuildTheSameTerms()
    {
        try (Context ctx = new Context())
        {
            Relations rel = new Relations(ctx);

            assertThat(rel.prefers(1, 2, 3, 4)).isEqualTo(rel.prefers(
                    ctx.mkInt(1), ctx.mkInt(2), ctx.mkInt(3), ctx.mkInt(4)));
            assertThat(rel.ranks(2, 1, 9)).isEqualTo(
                    rel.ranks(ctx.mkInt(2), ctx.mkInt(1), ctx.mkInt(9)));
            assertThat(rel.swap(1, 1, 2, 3).getFuncDecl()).isEqualTo(rel.getSwap());
        }
    }

    @Test
    void preferenceAtASuccessorState()
    {
        try (Context ctx = new Context())
        {
            Relations rel = new Relations(ctx);
            IntExpr t = rel.swap(1, 3, 4, 0);
            BoolExpr atSuccessor = rel.prefers(2, 3, 4, t);

            assertThat(atSuccessor).isEqualTo(rel.prefers(ctx.mkInt(2),
                    ctx.mkInt(3), ctx.mkInt(4), t));
            assertThat(atSuccessor.getArgs()[3]).isEqualTo(t);
        }
    }
}
