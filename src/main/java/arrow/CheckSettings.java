/*++
Copyright (c) 2026 The arrow-theorem Authors

Module Name:

    CheckSettings.java

Abstract:

    Arrow's theorem encoding: context and solver configuration of a
    check

Author:

    arrow-theorem developers 2026-10-18

Notes:

--*/

package arrow;

import java.util.HashMap;
import java.util.Map;

import com.microsoft.z3.Context;
import com.microsoft.z3.Params;

import arrow.logic.Binder;

/**
 * Immutable settings. {@link #contextConfig()} is handed to
 * {@code new Context(cfg)}, {@link #solverParams(Context)} to the solver.
 **/
public final class CheckSettings
{
    /**
     * How quantified sentences reach the solver.
     **/
    public enum Encoding
    {
        /**
         * Closed quantifiers; state variables range over all integers.
         **/
        SYMBOLIC,

        /**
         * Every quantifier expanded over the seeded agents, alternatives
         * and states.
         **/
        GROUNDED
    }

    public static final int DEFAULT_TIMEOUT_MILLIS = 60000;

    private final Encoding encoding;
    private final int timeoutMillis;
    private final boolean modelGeneration;
    private final String interactionLog;

    private CheckSettings(Encoding encoding, int timeoutMillis,
            boolean modelGeneration, String interactionLog)
    {
        this.encoding = encoding;
        this.timeoutMillis = timeoutMillis;
        this.modelGeneration = modelGeneration;
        this.interactionLog = interactionLog;
    }

    /**
     * Grounded encoding, 60 second timeout, models on, no interaction log.
     **/
    public static CheckSettings defaults()
    {
        return new CheckSettings(Encoding.GROUNDED, DEFAULT_TIMEOUT_MILLIS,
                true, null);
    }

    public CheckSettings withEncoding(Encoding encoding)
    {
        if (encoding == null)
            throw new IllegalArgumentException("encoding must not be null");
        return new CheckSettings(encoding, timeoutMillis, modelGeneration,
                interactionLog);
    }

    /**
     * @throws IllegalArgumentException if {@code timeoutMillis} is not
     *         positive
     **/
    public CheckSettings withTimeoutMillis(int timeoutMillis)
    {
        if (timeoutMillis <= 0)
            throw new IllegalArgumentException("timeout must be positive: "
                    + timeoutMillis);
        return new CheckSettings(encoding, timeoutMillis, modelGeneration,
                interactionLog);
    }

    public CheckSettings withModelGeneration(boolean modelGeneration)
    {
        return new CheckSettings(encoding, timeoutMillis, modelGeneration,
                interactionLog);
    }

    /**
     * @param interactionLog file for the Z3 interaction log, or null for
     *        none
     **/
    public CheckSettings withInteractionLog(String interactionLog)
    {
        return new CheckSettings(encoding, timeoutMillis, modelGeneration,
                interactionLog);
    }

    public Encoding getEncoding()
    {
        return encoding;
    }

    public int getTimeoutMillis()
    {
        return timeoutMillis;
    }

    public boolean isModelGeneration()
    {
        return modelGeneration;
    }

    public String getInteractionLog()
    {
        return interactionLog;
    }

    public Map<String, String> contextConfig()
    {
        HashMap<String, String> cfg = new HashMap<String, String>();
        cfg.put("model", Boolean.toString(modelGeneration));
        return cfg;
    }

    public Params solverParams(Context ctx)
    {
        Params p = ctx.mkParams();
        p.add("timeout", timeoutMillis);
        return p;
    }

    public Binder binder(Context ctx)
    {
        switch (encoding)
        {
        case SYMBOLIC:
            return Binder.symbolic(ctx);
        case GROUNDED:
        default:
            return Binder.grounded(ctx);
        }
    }

    @Override
    public String toString()
    {
        return "encoding=" + encoding + ", timeout=" + timeoutMillis
                + "ms, model=" + modelGeneration
                + (interactionLog != null ? ", log=" + interactionLog : "");
    }
}
