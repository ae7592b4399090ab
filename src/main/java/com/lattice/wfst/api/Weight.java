package com.lattice.wfst.api;

/**
 * An opaque semiring value carried on arcs and final states.
 *
 * <p>
 * The core never adds or multiplies weights. It only needs to compare them
 * for equality (implementations must override {@code equals}/{@code hashCode})
 * and to persist them, which is the job of the matching {@link WeightType}.
 */
public interface Weight {

    /** Name of the semiring this value belongs to, e.g. "tropical". */
    String typeName();
}
