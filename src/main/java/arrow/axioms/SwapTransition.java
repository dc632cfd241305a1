/*++
Copyright (c) 2026 The arrow-theorem Authors

Module Name:

    SwapTransition.java

Abstract:

    Arrow's theorem encoding: successor-state axiom of swap

Author:

    arrow-theorem developers 2026-10-18

Notes:

    swap(y, a1, b1, s) exchanges the positions of a1 and b1 in the
    ranking of agent y, so the resulting order stays a strict total
    order. Every case below is a guarded biconditional; none of them
    asserts anything about the source state.

--*/

package arrow.axioms;

import java.util.List;

import com.microsoft.z3.BoolExpr;
import com.microsoft.z3.IntExpr;

import arrow.logic.Binder;
import arrow.logic.Relations;
import arrow.logic.Universe;

/**
 * The effect of {@code swap} on {@code p}. Writing {@code t} for
 * {@code swap(y, a1, b1, s)}:
 * 
 * <pre>
 * forall x, a, b, s.  p(x,a,b,swap(x,a,b,s)) = p(x,b,a,s)
 * forall x, y, a, b, a1, b1, s.
 *     (x != y or {a,b} disjoint from {a1,b1})    implies p(x,a,b,t) = p(x,a,b,s)
 *     (x = y, a = b1, b = a1)                    implies p(x,a,b,t) = p(x,b,a,s)
 *     (x = y, a = a1, b != b1, b != a)           implies p(x,a,b,t) = p(x,b1,b,s)
 *     (x = y, b = b1, a != a1, a != b)           implies p(x,a,b,t) = p(x,a,a1,s)
 *     (x = y, a = b1, b != a1, b != a)           implies p(x,a,b,t) = p(x,a1,b,s)
 *     (x = y, b = a1, a != b1, a != b)           implies p(x,a,b,t) = p(x,a,b1,s)
 * </pre>
 **/
public final class SwapTransition extends AxiomBuilder
{
    public SwapTransition(Relations relations, Universe universe,
            Binder binder)
    {
        super(relations, universe, binder);
    }

    @Override
    public BoolExpr build()
    {
        return and(basicEffect(), successor());
    }

    /**
     * The acting agent's order of the swapped pair is inverted.
     **/
    BoolExpr basicEffect()
    {
        List<Binder.Var> vars = List.of(universe.agent("x"),
                universe.alternative("a"), universe.alternative("b"),
                universe.state("s"));
        return binder.forAll(vars, v -> {
            IntExpr x = v[0], a = v[1], b = v[2], s = v[3];
            return iff(rel.prefers(x, a, b, rel.swap(x, a, b, s)),
                    rel.prefers(x, b, a, s));
        });
    }

    /**
     * The frame condition and the cases where the queried pair shares an
     * alternative with the swapped pair.
     **/
    BoolExpr successor()
    {
        List<Binder.Var> vars = List.of(universe.agent("x"),
                universe.agent("y"), universe.alternative("a"),
                universe.alternative("b"), universe.alternative("a1"),
                universe.alternative("b1"), universe.state("s"));
        return binder.forAll(vars, v -> {
            IntExpr x = v[0], y = v[1], a = v[2], b = v[3], a1 = v[4], b1 = v[5], s = v[6];
            BoolExpr after = rel.prefers(x, a, b, rel.swap(y, a1, b1, s));
            BoolExpr same = eq(x, y);
            return and(
                    implies(or(neq(x, y), disjoint(a, b, a1, b1)),
                            iff(after, rel.prefers(x, a, b, s))),
                    implies(and(same, eq(a, b1), eq(b, a1)),
                            iff(after, rel.prefers(x, b, a, s))),
                    implies(and(same, eq(a, a1), neq(b, b1), neq(b, a)),
                            iff(after, rel.prefers(x, b1, b, s))),
                    implies(and(same, eq(b, b1), neq(a, a1), neq(a, b)),
                            iff(after, rel.prefers(x, a, a1, s))),
                    implies(and(same, eq(a, b1), neq(b, a1), neq(b, a)),
                            iff(after, rel.prefers(x, a1, b, s))),
                    implies(and(same, eq(b, a1), neq(a, b1), neq(a, b)),
                            iff(after, rel.prefers(x, a, b1, s))));
        });
    }

    private BoolExpr disjoint(IntExpr a, IntExpr b, IntExpr a1, IntExpr b1)
    {
        return and(neq(a, a1), neq(a, b1), neq(b, a1), neq(b, b1));
    }
}
