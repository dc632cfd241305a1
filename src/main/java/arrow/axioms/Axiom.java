/*++
Copyright (c) 2026 The arrow-theorem Authors

Module Name:

    Axiom.java

Abstract:

    Arrow's theorem encoding: the universal sentences of a check

Author:

    arrow-theorem developers 2026-10-18

Notes:

--*/

package arrow.axioms;

import com.microsoft.z3.BoolExpr;

import arrow.logic.Binder;
import arrow.logic.Relations;
import arrow.logic.Universe;

/**
 * The sentences a check can include, in assertion order.
 **/
public enum Axiom
{
    LINEARITY("linearity", Linearity::new),
    INDEPENDENCE_OF_PROFILE("independence-of-profile", IndependenceOfProfile::new),
    UNANIMITY("unanimity", Unanimity::new),
    NON_DICTATORSHIP("non-dictatorship", NonDictatorship::new),
    IIA("iia", IndependenceOfIrrelevantAlternatives::new),
    SWAP_TRANSITION("swap-transition", SwapTransition::new);

    @FunctionalInterface
    interface Factory
    {
        AxiomBuilder create(Relations relations, Universe universe,
                Binder binder);
    }

    private final String label;
    private final Factory factory;

    Axiom(String label, Factory factory)
    {
        this.label = label;
        this.factory = factory;
    }

    public String getLabel()
    {
        return label;
    }

    public AxiomBuilder builder(Relations relations, Universe universe,
            Binder binder)
    {
        return factory.create(relations, universe, binder);
    }

    public BoolExpr build(Relations relations, Universe universe,
            Binder binder)
    {
        return builder(relations, universe, binder).build();
    }
}
