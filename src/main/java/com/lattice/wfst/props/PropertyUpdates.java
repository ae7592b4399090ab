package com.lattice.wfst.props;

import static com.lattice.wfst.props.Properties.*;

import com.lattice.wfst.api.Arc;

/**
 * Property transitions for single mutations of a mutable FST.
 *
 * <p>
 * Each method takes the property word before the mutation and returns the
 * word after it. Results are conservative: a property that the mutation may
 * have changed is forgotten, never guessed.
 */
public final class PropertyUpdates {

    /** Known values a new start state cannot change. */
    static final long SET_START_PROPERTIES = BINARY_PROPERTIES
            | ACCEPTOR | NOT_ACCEPTOR | I_DETERMINISTIC | NON_I_DETERMINISTIC
            | O_DETERMINISTIC | NON_O_DETERMINISTIC | EPSILONS | NO_EPSILONS
            | I_EPSILONS | NO_I_EPSILONS | O_EPSILONS | NO_O_EPSILONS
            | I_LABEL_SORTED | NOT_I_LABEL_SORTED | O_LABEL_SORTED | NOT_O_LABEL_SORTED
            | WEIGHTED | UNWEIGHTED | CYCLIC | ACYCLIC | TOP_SORTED | NOT_TOP_SORTED
            | CO_ACCESSIBLE | NOT_CO_ACCESSIBLE | WEIGHTED_CYCLES | UNWEIGHTED_CYCLES;

    /** Known values a new final weight cannot change (weightedness handled apart). */
    static final long SET_FINAL_PROPERTIES = BINARY_PROPERTIES
            | ACCEPTOR | NOT_ACCEPTOR | I_DETERMINISTIC | NON_I_DETERMINISTIC
            | O_DETERMINISTIC | NON_O_DETERMINISTIC | EPSILONS | NO_EPSILONS
            | I_EPSILONS | NO_I_EPSILONS | O_EPSILONS | NO_O_EPSILONS
            | I_LABEL_SORTED | NOT_I_LABEL_SORTED | O_LABEL_SORTED | NOT_O_LABEL_SORTED
            | CYCLIC | ACYCLIC | INITIAL_CYCLIC | INITIAL_ACYCLIC | TOP_SORTED | NOT_TOP_SORTED
            | ACCESSIBLE | NOT_ACCESSIBLE | WEIGHTED_CYCLES | UNWEIGHTED_CYCLES;

    /** Known values an isolated new state cannot change. */
    static final long ADD_STATE_PROPERTIES = BINARY_PROPERTIES
            | ACCEPTOR | NOT_ACCEPTOR | I_DETERMINISTIC | NON_I_DETERMINISTIC
            | O_DETERMINISTIC | NON_O_DETERMINISTIC | EPSILONS | NO_EPSILONS
            | I_EPSILONS | NO_I_EPSILONS | O_EPSILONS | NO_O_EPSILONS
            | I_LABEL_SORTED | NOT_I_LABEL_SORTED | O_LABEL_SORTED | NOT_O_LABEL_SORTED
            | WEIGHTED | UNWEIGHTED | CYCLIC | ACYCLIC | INITIAL_CYCLIC | INITIAL_ACYCLIC
            | TOP_SORTED | NOT_TOP_SORTED | WEIGHTED_CYCLES | UNWEIGHTED_CYCLES;

    /** Known values a new arc cannot falsify. */
    static final long ADD_ARC_PROPERTIES = BINARY_PROPERTIES
            | ACCEPTOR | NOT_ACCEPTOR | NON_I_DETERMINISTIC | NON_O_DETERMINISTIC
            | EPSILONS | NO_EPSILONS | I_EPSILONS | NO_I_EPSILONS | O_EPSILONS | NO_O_EPSILONS
            | I_LABEL_SORTED | NOT_I_LABEL_SORTED | O_LABEL_SORTED | NOT_O_LABEL_SORTED
            | WEIGHTED | UNWEIGHTED | CYCLIC | INITIAL_CYCLIC | TOP_SORTED | NOT_TOP_SORTED
            | ACCESSIBLE | CO_ACCESSIBLE | WEIGHTED_CYCLES;

    /** Known values that removing states or arcs cannot falsify. */
    static final long DELETE_PROPERTIES = BINARY_PROPERTIES
            | ACCEPTOR | I_DETERMINISTIC | O_DETERMINISTIC
            | NO_EPSILONS | NO_I_EPSILONS | NO_O_EPSILONS
            | I_LABEL_SORTED | O_LABEL_SORTED | UNWEIGHTED
            | ACYCLIC | INITIAL_ACYCLIC | TOP_SORTED | UNWEIGHTED_CYCLES;

    private PropertyUpdates() {
    }

    public static long setStart(long inprops) {
        long outprops = inprops & SET_START_PROPERTIES;
        // An acyclic FST is acyclic at any start.
        if ((inprops & ACYCLIC) != 0)
            outprops |= INITIAL_ACYCLIC;
        return outprops;
    }

    /**
     * @param oldWeighted True if the previous final weight was neither zero
     *                    nor one.
     * @param newWeighted True if the new final weight is neither zero nor one.
     */
    public static long setFinal(long inprops, boolean oldWeighted, boolean newWeighted) {
        long outprops = inprops & (SET_FINAL_PROPERTIES | WEIGHTED | UNWEIGHTED);
        if (oldWeighted)
            outprops &= ~WEIGHTED;
        if (newWeighted) {
            outprops |= WEIGHTED;
            outprops &= ~UNWEIGHTED;
        }
        return outprops;
    }

    public static long addState(long inprops) {
        return (inprops & ADD_STATE_PROPERTIES) | NOT_ACCESSIBLE | NOT_CO_ACCESSIBLE;
    }

    /**
     * @param state    Source state of the new arc.
     * @param arc      The new arc.
     * @param prevArc  The arc stored before it on the same state, or null.
     * @param weighted True if the arc weight is neither zero nor one.
     */
    public static long addArc(long inprops, int state, Arc<?> arc, Arc<?> prevArc, boolean weighted) {
        long outprops = inprops;
        if (arc.ilabel() != arc.olabel()) {
            outprops |= NOT_ACCEPTOR;
            outprops &= ~ACCEPTOR;
        }
        if (arc.isInputEpsilon()) {
            outprops |= I_EPSILONS;
            outprops &= ~NO_I_EPSILONS;
            if (arc.isOutputEpsilon()) {
                outprops |= EPSILONS;
                outprops &= ~NO_EPSILONS;
            }
        }
        if (arc.isOutputEpsilon()) {
            outprops |= O_EPSILONS;
            outprops &= ~NO_O_EPSILONS;
        }
        if (prevArc != null) {
            if (prevArc.ilabel() > arc.ilabel()) {
                outprops |= NOT_I_LABEL_SORTED;
                outprops &= ~I_LABEL_SORTED;
            }
            if (prevArc.olabel() > arc.olabel()) {
                outprops |= NOT_O_LABEL_SORTED;
                outprops &= ~O_LABEL_SORTED;
            }
        }
        if (weighted) {
            outprops |= WEIGHTED;
            outprops &= ~UNWEIGHTED;
        }
        if (arc.nextState() <= state) {
            outprops |= NOT_TOP_SORTED;
            outprops &= ~TOP_SORTED;
        }
        if (arc.nextState() == state) {
            outprops |= CYCLIC;
            outprops &= ~ACYCLIC;
        }
        outprops &= ADD_ARC_PROPERTIES | ACYCLIC;
        if ((outprops & TOP_SORTED) != 0)
            outprops |= ACYCLIC | INITIAL_ACYCLIC;
        else
            outprops &= ~ACYCLIC;
        return outprops;
    }

    public static long deleteStates(long inprops) {
        return inprops & DELETE_PROPERTIES;
    }

    /** Every state removed: only the binary bits carry over. */
    public static long deleteAllStates(long inprops) {
        return (inprops & BINARY_PROPERTIES) | NULL_PROPERTIES;
    }

    public static long deleteArcs(long inprops) {
        return inprops & DELETE_PROPERTIES;
    }
}
