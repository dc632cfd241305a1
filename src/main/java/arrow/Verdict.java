/*++
Copyright (c) 2026 The arrow-theorem Authors

Module Name:

    Verdict.java

Abstract:

    Arrow's theorem encoding: outcome of the satisfiability check

Author:

    arrow-theorem developers 2026-10-18

Notes:

    The model is only usable while its Context is open; the witness
    text is captured when the verdict is created.

--*/

package arrow;

import java.util.Collections;
import java.util.List;

import com.microsoft.z3.Model;
import com.microsoft.z3.Status;

/**
 * One of satisfiable (with model), unsatisfiable (with the names of the
 * sentences in the unsat core) or unknown (with the solver's reason).
 **/
public final class Verdict
{
    private final Status status;
    private final Model model;
    private final String witness;
    private final List<String> core;
    private final String reasonUnknown;

    private Verdict(Status status, Model model, List<String> core,
            String reasonUnknown)
    {
        this.status = status;
        this.model = model;
        this.witness = model != null ? model.toString() : null;
        this.core = core;
        this.reasonUnknown = reasonUnknown;
    }

    /**
     * @param model the witness, null when model generation is off
     **/
    public static Verdict satisfiable(Model model)
    {
        return new Verdict(Status.SATISFIABLE, model,
                Collections.<String> emptyList(), null);
    }

    public static Verdict unsatisfiable(List<String> core)
    {
        return new Verdict(Status.UNSATISFIABLE, null,
                Collections.unmodifiableList(core), null);
    }

    public static Verdict unknown(String reason)
    {
        return new Verdict(Status.UNKNOWN, null,
                Collections.<String> emptyList(), reason);
    }

    public Status getStatus()
    {
        return status;
    }

    public boolean isSatisfiable()
    {
        return status == Status.SATISFIABLE;
    }

    public boolean isUnsatisfiable()
    {
        return status == Status.UNSATISFIABLE;
    }

    public boolean isUnknown()
    {
        return status == Status.UNKNOWN;
    }

    /**
     * Unsatisfiability is what the theorem predicts for the full axiom set.
     **/
    public boolean isExpected()
    {
        return isUnsatisfiable();
    }

    public Model getModel()
    {
        return model;
    }

    public String getWitness()
    {
        return witness;
    }

    public List<String> getCore()
    {
        return core;
    }

    public String getReasonUnknown()
    {
        return reasonUnknown;
    }

    public String describe()
    {
        switch (status)
        {
        case UNSATISFIABLE:
            return "unsat: the axioms are jointly inconsistent, core " + core;
        case SATISFIABLE:
            return "sat: the axioms admit a model";
        case UNKNOWN:
        default:
            return "unknown: " + reasonUnknown;
        }
    }

    @Override
    public String toString()
    {
        return describe();
    }
}
