/*++
Copyright (c) 2026 The arrow-theorem Authors

Module Name:

    Profile.java

Abstract:

    Arrow's theorem encoding: one strict ranking per agent

Author:

    arrow-theorem developers 2026-10-18

Notes:

--*/

package arrow.seed;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * A preference profile: for each agent, its ranking of the alternatives
 * from most to least preferred.
 **/
public final class Profile
{
    /**
     * A single strict comparison {@code agent} prefers {@code better} over
     * {@code worse}.
     **/
    public static final class Preference
    {
        private final int agent;
        private final int better;
        private final int worse;

        public Preference(int agent, int better, int worse)
        {
            this.agent = agent;
            this.better = better;
            this.worse = worse;
        }

        public int getAgent()
        {
            return agent;
        }

        public int getBetter()
        {
            return better;
        }

        public int getWorse()
        {
            return worse;
        }

        @Override
        public boolean equals(Object o)
        {
            if (!(o instanceof Preference))
                return false;
            Preference other = (Preference) o;
            return agent == other.agent && better == other.better
                    && worse == other.worse;
        }

        @Override
        public int hashCode()
        {
            return (agent * 31 + better) * 31 + worse;
        }

        @Override
        public String toString()
        {
            return better + " >_" + agent + " " + worse;
        }
    }

    private final Map<Integer, List<Integer>> rankings;

    public Profile(Map<Integer, List<Integer>> rankings)
    {
        Map<Integer, List<Integer>> copy = new LinkedHashMap<Integer, List<Integer>>();
        for (Map.Entry<Integer, List<Integer>> e : rankings.entrySet())
        {
            List<Integer> ranking = e.getValue();
            if (ranking.size() != ranking.stream().distinct().count())
                throw new IllegalArgumentException("ranking of agent "
                        + e.getKey() + " repeats an alternative: " + ranking);
            copy.put(e.getKey(),
                    Collections.unmodifiableList(new ArrayList<Integer>(ranking)));
        }
        this.rankings = Collections.unmodifiableMap(copy);
    }

    public Set<Integer> getAgents()
    {
        return rankings.keySet();
    }

    public List<Integer> getRanking(int agent)
    {
        List<Integer> r = rankings.get(agent);
        if (r == null)
            throw new IllegalArgumentException("no ranking for agent " + agent);
        return r;
    }

    public boolean prefers(int agent, int a, int b)
    {
        List<Integer> r = getRanking(agent);
        int ia = r.indexOf(a);
        int ib = r.indexOf(b);
        return ia >= 0 && ib >= 0 && ia < ib;
    }

    /**
     * Every comparison implied by the rankings: for each agent, one
     * preference per pair of positions {@code i < j}.
     **/
    public List<Preference> preferences()
    {
        List<Preference> res = new ArrayList<Preference>();
        for (Map.Entry<Integer, List<Integer>> e : rankings.entrySet())
        {
            List<Integer> r = e.getValue();
            for (int i = 0; i < r.size(); i++)
                for (int j = i + 1; j < r.size(); j++)
                    res.add(new Preference(e.getKey(), r.get(i), r.get(j)));
        }
        return res;
    }

    @Override
    public boolean equals(Object o)
    {
        return o instanceof Profile && rankings.equals(((Profile) o).rankings);
    }

    @Override
    public int hashCode()
    {
        return rankings.hashCode();
    }

    @Override
    public String toString()
    {
        return rankings.toString();
    }
}
