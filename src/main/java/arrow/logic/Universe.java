/*++
Copyright (c) 2026 The arrow-theorem Authors

Module Name:

    Universe.java

Abstract:

    Arrow's theorem encoding: the agent, alternative and state ranges
    every sentence is relativized to

Author:

    arrow-theorem developers 2026-10-18

Notes:

    Agents and alternatives are normally bounded by the seeded
    population; over unbounded agents unanimity never fires and the
    theorem does not bind.

--*/

package arrow.logic;

/**
 * Ranges for the three kinds of domain element.
 **/
public final class Universe
{
    private final Range agents;
    private final Range alternatives;
    private final Range states;

    public Universe(Range agents, Range alternatives, Range states)
    {
        if (agents == null || alternatives == null || states == null)
            throw new IllegalArgumentException("ranges must not be null");
        this.agents = agents;
        this.alternatives = alternatives;
        this.states = states;
    }

    /**
     * Agents, alternatives and states all range over the integer line.
     **/
    public static Universe unbounded()
    {
        return new Universe(Range.unbounded(), Range.unbounded(),
                Range.unbounded());
    }

    public Universe withStates(Range states)
    {
        return new Universe(agents, alternatives, states);
    }

    public Range getAgents()
    {
        return agents;
    }

    public Range getAlternatives()
    {
        return alternatives;
    }

    public Range getStates()
    {
        return states;
    }

    public Binder.Var agent(String name)
    {
        return new Binder.Var(name, agents);
    }

    public Binder.Var alternative(String name)
    {
        return new Binder.Var(name, alternatives);
    }

    public Binder.Var state(String name)
    {
        return new Binder.Var(name, states);
    }

    @Override
    public String toString()
    {
        return "agents " + agents + ", alternatives " + alternatives
                + ", states " + states;
    }
}
