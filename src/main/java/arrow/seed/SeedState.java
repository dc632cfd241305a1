/*++
Copyright (c) 2026 The arrow-theorem Authors

Module Name:

    SeedState.java

Abstract:

    Arrow's theorem encoding: a state identifier pinned to a profile

Author:

    arrow-theorem developers 2026-10-18

Notes:

--*/

package arrow.seed;

public final class SeedState
{
    private final int id;
    private final Profile profile;

    public SeedState(int id, Profile profile)
    {
        this.id = id;
        this.profile = profile;
    }

    public int getId()
    {
        return id;
    }

    public Profile getProfile()
    {
        return profile;
    }

    @Override
    public String toString()
    {
        return "state " + id + " " + profile;
    }
}
