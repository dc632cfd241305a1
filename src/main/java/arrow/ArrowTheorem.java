/*++
Copyright (c) 2026 The arrow-theorem Authors

Module Name:

    ArrowTheorem.java

Abstract:

    Arrow's theorem encoding: entry point

Author:

    arrow-theorem developers 2026-10-18

Notes:

    Takes no arguments. Builds the default query, checks it once and
    prints the verdict.

--*/

package arrow;

import java.io.PrintStream;
import java.util.EnumSet;
import java.util.Set;

import com.microsoft.z3.Context;
import com.microsoft.z3.Log;
import com.microsoft.z3.Version;

import arrow.axioms.Axiom;
import arrow.seed.PermutationSeeder;

public final class ArrowTheorem
{
    private ArrowTheorem()
    {
    }

    public static Verdict run(CheckSettings settings, PrintStream out)
    {
        return run(settings, EnumSet.allOf(Axiom.class), out);
    }

    /**
     * Checks {@code axioms} plus the seeded states under {@code settings}
     * and reports to {@code out}. Solver failures propagate.
     **/
    public static Verdict run(CheckSettings settings, Set<Axiom> axioms,
            PrintStream out)
    {
        boolean logging = openLog(settings, out);
        try (Context ctx = new Context(settings.contextConfig()))
        {
            out.println("Arrow's theorem (" + settings + ")");
            ArrowQuery query = new ArrowQuery(ctx, settings,
                    new PermutationSeeder(ArrowQuery.DEFAULT_AGENTS,
                            ArrowQuery.DEFAULT_ALTERNATIVES), axioms);
            out.println("Universe: " + query.getUniverse());
            out.println("Sentences: " + query.sentences().keySet());

            Verdict verdict = query.check();
            out.println(verdict.describe());
            if (verdict.isSatisfiable())
                report(query, verdict, out);
            return verdict;
        } finally
        {
            if (logging)
                Log.close();
        }
    }

    private static boolean openLog(CheckSettings settings, PrintStream out)
    {
        String file = settings.getInteractionLog();
        if (file == null)
            return false;
        if (Log.open(file))
            return true;
        Log.close();
        out.println("Could not open interaction log " + file);
        return false;
    }

    private static void report(ArrowQuery query, Verdict verdict,
            PrintStream out)
    {
        if (query.getAxioms().contains(Axiom.NON_DICTATORSHIP))
            out.println("Modeling defect: the theorem predicts no model for "
                    + query.getAxioms());
        if (verdict.getModel() == null)
            return;
        out.println("Witness: "
                + WitnessInspector.of(query).inspect(verdict.getModel()));
        out.println("Model:\n" + verdict.getWitness());
    }

    public static void main(String[] args)
    {
        System.out.print("Z3 Full Version: ");
        System.out.println(Version.getString());
        run(CheckSettings.defaults(), System.out);
    }
}
