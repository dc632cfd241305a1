/*++
Copyright (c) 2026 The arrow-theorem Authors

Module Name:

    Relations.java

Abstract:

    Arrow's theorem encoding: the shared declarations of p, w and swap

Author:

    arrow-theorem developers 2026-10-18

Notes:

    All builders of one check must use the same instance.

--*/

package arrow.logic;

import com.microsoft.z3.BoolExpr;
import com.microsoft.z3.BoolSort;
import com.microsoft.z3.Context;
import com.microsoft.z3.FuncDecl;
import com.microsoft.z3.IntExpr;
import com.microsoft.z3.IntSort;
import com.microsoft.z3.Sort;

/**
 * Uninterpreted symbols over the integers.
 * <ul>
 * <li>{@code p(agent, a, b, state)}: in {@code state}, {@code agent}
 * strictly prefers {@code a} over {@code b}.</li>
 * <li>{@code w(a, b, state)}: in {@code state}, the social welfare ranking
 * puts {@code a} above {@code b}.</li>
 * <li>{@code swap(agent, a, b, state)}: the state reached from
 * {@code state} when {@code agent} inverts its order of {@code a} and
 * {@code b}.</li>
 * </ul>
 **/
public final class Relations
{
    private final Context ctx;
    private final FuncDecl<BoolSort> preference;
    private final FuncDecl<BoolSort> welfare;
    private final FuncDecl<IntSort> swap;

    public Relations(Context ctx)
    {
        this.ctx = ctx;
        IntSort i = ctx.getIntSort();
        this.preference = ctx.mkFuncDecl("p", new Sort[] { i, i, i, i },
                ctx.getBoolSort());
        this.welfare = ctx.mkFuncDecl("w", new Sort[] { i, i, i },
                ctx.getBoolSort());
        this.swap = ctx.mkFuncDecl("swap", new Sort[] { i, i, i, i }, i);
    }

    public Context getContext()
    {
        return ctx;
    }

    public FuncDecl<BoolSort> getPreference()
    {
        return preference;
    }

    public FuncDecl<BoolSort> getWelfare()
    {
        return welfare;
    }

    public FuncDecl<IntSort> getSwap()
    {
        return swap;
    }

    /**
     * {@code p(agent, a, b, state)}
     **/
    public BoolExpr prefers(IntExpr agent, IntExpr a, IntExpr b, IntExpr state)
    {
        return (BoolExpr) preference.apply(agent, a, b, state);
    }

    public BoolExpr prefers(int agent, int a, int b, int state)
    {
        return prefers(ctx.mkInt(agent), ctx.mkInt(a), ctx.mkInt(b),
                ctx.mkInt(state));
    }

    /**
     * {@code p(agent, a, b, state)} at a state term such as a swap successor.
     **/
    public BoolExpr prefers(int agent, int a, int b, IntExpr state)
    {
        return prefers(ctx.mkInt(agent), ctx.mkInt(a), ctx.mkInt(b), state);
    }

    /**
     * {@code w(a, b, state)}
     **/
    public BoolExpr ranks(IntExpr a, IntExpr b, IntExpr state)
    {
        return (BoolExpr) welfare.apply(a, b, state);
    }

    public BoolExpr ranks(int a, int b, int state)
    {
        return ranks(ctx.mkInt(a), ctx.mkInt(b), ctx.mkInt(state));
    }

    /**
     * {@code swap(agent, a, b, state)}
     **/
    public IntExpr swap(IntExpr agent, IntExpr a, IntExpr b, IntExpr state)
    {
        return (IntExpr) swap.apply(agent, a, b, state);
    }

    public IntExpr swap(int agent, int a, int b, int state)
    {
        return swap(ctx.mkInt(agent), ctx.mkInt(a), ctx.mkInt(b),
                ctx.mkInt(state));
    }
}
