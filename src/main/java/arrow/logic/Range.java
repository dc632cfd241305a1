/*++
Copyright (c) 2026 The arrow-theorem Authors

Module Name:

    Range.java

Abstract:

    Arrow's theorem encoding: integer intervals that quantified
    variables are relativized to

Author:

    arrow-theorem developers 2026-10-18

Notes:

--*/

package arrow.logic;

import com.microsoft.z3.BoolExpr;
import com.microsoft.z3.Context;
import com.microsoft.z3.IntExpr;

/**
 * An inclusive interval of integers, or the whole integer line.
 **/
public final class Range
{
    private static final Range UNBOUNDED = new Range(0, -1, false);

    private final int low;
    private final int high;
    private final boolean bounded;

    private Range(int low, int high, boolean bounded)
    {
        this.low = low;
        this.high = high;
        this.bounded = bounded;
    }

    /**
     * The interval {@code [low, high]}.
     * 
     * @throws IllegalArgumentException if {@code low > high}
     **/
    public static Range of(int low, int high)
    {
        if (low > high)
            throw new IllegalArgumentException("empty range [" + low + ".."
                    + high + "]");
        return new Range(low, high, true);
    }

    public static Range single(int value)
    {
        return of(value, value);
    }

    /**
     * The unbounded integer line. Only a symbolic binder can quantify over
     * it.
     **/
    public static Range unbounded()
    {
        return UNBOUNDED;
    }

    public boolean isBounded()
    {
        return bounded;
    }

    public int getLow()
    {
        requireBounded();
        return low;
    }

    public int getHigh()
    {
        requireBounded();
        return high;
    }

    public int size()
    {
        requireBounded();
        return high - low + 1;
    }

    public boolean contains(int value)
    {
        return !bounded || (low <= value && value <= high);
    }

    /**
     * The members of the range in ascending order.
     * 
     * @throws IllegalStateException if the range is unbounded
     **/
    public int[] values()
    {
        requireBounded();
        int[] res = new int[size()];
        for (int i = 0; i < res.length; i++)
            res[i] = low + i;
        return res;
    }

    /**
     * Membership of {@code v} as a formula: {@code low <= v <= high}, an
     * equality for singletons, and {@code true} for the unbounded range.
     **/
    public BoolExpr guard(Context ctx, IntExpr v)
    {
        if (!bounded)
            return ctx.mkTrue();
        if (low == high)
            return ctx.mkEq(v, ctx.mkInt(low));
        return ctx.mkAnd(ctx.mkLe(ctx.mkInt(low), v),
                ctx.mkLe(v, ctx.mkInt(high)));
    }

    private void requireBounded()
    {
        if (!bounded)
            throw new IllegalStateException("range is unbounded");
    }

    @Override
    public boolean equals(Object o)
    {
        if (this == o)
            return true;
        if (!(o instanceof Range))
            return false;
        Range other = (Range) o;
        if (!bounded || !other.bounded)
            return bounded == other.bounded;
        return low == other.low && high == other.high;
    }

    @Override
    public int hashCode()
    {
        return bounded ? 31 * low + high : -1;
    }

    @Override
    public String toString()
    {
        return bounded ? "[" + low + ".." + high + "]" : "Int";
    }
}
