/*++
Copyright (c) 2026 The arrow-theorem Authors

Module Name:

    ProfileSeeder.java

Abstract:

    Arrow's theorem encoding: source of concrete base states

Author:

    arrow-theorem developers 2026-10-18

Notes:

--*/

package arrow.seed;

import java.util.List;

import arrow.logic.Range;

/**
 * Produces the concrete profiles asserted as ground facts. The universal
 * axioms only see the ranges, so a seeder can be swapped without touching
 * them.
 **/
public interface ProfileSeeder
{
    /**
     * The seeded states, with distinct consecutive identifiers.
     **/
    List<SeedState> seed();

    Range getAgents();

    Range getAlternatives();

    /**
     * The identifiers {@link #seed()} allocates.
     **/
    Range getStates();
}
