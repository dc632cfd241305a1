/*++
Copyright (c) 2026 The arrow-theorem Authors

Module Name:

    Linearity.java

Abstract:

    Arrow's theorem encoding: individual and social preferences are
    strict total orders

Author:

    arrow-theorem developers 2026-10-18

Notes:

--*/

package arrow.axioms;

import java.util.List;

import com.microsoft.z3.BoolExpr;
import com.microsoft.z3.IntExpr;

import arrow.logic.Binder;
import arrow.logic.Relations;
import arrow.logic.Universe;

/**
 * For every state, {@code p(x, ., ., s)} for each agent {@code x} and
 * {@code w(., ., s)} are total, irreflexive, antisymmetric and transitive:
 * 
 * <pre>
 * forall x, a, b, c, s.
 *     (p(x,a,b,s) or p(x,b,a,s) or a = b) and not p(x,a,a,s)
 *     and not (p(x,a,b,s) and p(x,b,a,s))
 *     and (p(x,a,b,s) and p(x,b,c,s) implies p(x,a,c,s))
 * </pre>
 * 
 * and the same for {@code w} without the agent.
 **/
public final class Linearity extends AxiomBuilder
{
    public Linearity(Relations relations, Universe universe, Binder binder)
    {
        super(relations, universe, binder);
    }

    @Override
    public BoolExpr build()
    {
        return and(individual(), social());
    }

    BoolExpr individual()
    {
        List<Binder.Var> vars = List.of(universe.agent("x"),
                universe.alternative("a"), universe.alternative("b"),
                universe.alternative("c"), universe.state("s"));
        return binder.forAll(vars, v -> {
            IntExpr x = v[0], a = v[1], b = v[2], c = v[3], s = v[4];
            BoolExpr ab = rel.prefers(x, a, b, s);
            BoolExpr ba = rel.prefers(x, b, a, s);
            return and(or(ab, ba, eq(a, b)),
                    not(rel.prefers(x, a, a, s)),
                    not(and(ab, ba)),
                    implies(and(ab, rel.prefers(x, b, c, s)),
                            rel.prefers(x, a, c, s)));
        });
    }

    BoolExpr social()
    {
        List<Binder.Var> vars = List.of(universe.alternative("a"),
                universe.alternative("b"), universe.alternative("c"),
                universe.state("s"));
        return binder.forAll(vars, v -> {
            IntExpr a = v[0], b = v[1], c = v[2], s = v[3];
            BoolExpr ab = rel.ranks(a, b, s);
            BoolExpr ba = rel.ranks(b, a, s);
            return and(or(ab, ba, eq(a, b)),
                    not(rel.ranks(a, a, s)),
                    not(and(ab, ba)),
                    implies(and(ab, rel.ranks(b, c, s)), rel.ranks(a, c, s)));
        });
    }
}
