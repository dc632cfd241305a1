/*++
Copyright (c) 2026 The arrow-theorem Authors

Module Name:

    Permutations.java

Abstract:

    Arrow's theorem encoding: enumeration of orderings

Author:

    arrow-theorem developers 2026-10-18

Notes:

--*/

package arrow.seed;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * All orderings of a list, in the lexicographic order of positions
 * ({@code [1,2,3]} yields 123, 132, 213, 231, 312, 321).
 **/
public final class Permutations
{
    private Permutations()
    {
    }

    public static <T> List<List<T>> of(List<T> items)
    {
        List<List<T>> res = new ArrayList<List<T>>();
        permute(new ArrayList<T>(items), new ArrayList<T>(), res);
        return res;
    }

    private static <T> void permute(List<T> remaining, List<T> prefix,
            List<List<T>> out)
    {
        if (remaining.isEmpty())
        {
            out.add(Collections.unmodifiableList(new ArrayList<T>(prefix)));
            return;
        }
        for (int i = 0; i < remaining.size(); i++)
        {
            T head = remaining.remove(i);
            prefix.add(head);
            permute(remaining, prefix, out);
            prefix.remove(prefix.size() - 1);
            remaining.add(i, head);
        }
    }
}
