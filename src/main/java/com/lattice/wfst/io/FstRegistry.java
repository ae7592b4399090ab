package com.lattice.wfst.io;

import com.lattice.wfst.api.WeightType;
import com.lattice.wfst.weight.Log64Weight;
import com.lattice.wfst.weight.LogWeight;
import com.lattice.wfst.weight.TropicalWeight;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;

/**
 * Registry mapping encoding names to {@link FstFactory}s and arc type names to
 * {@link WeightType}s.
 *
 * <p>
 * A new registry starts with every {@link FstType} and the built-in arc types
 * ("standard", "log", "log64"); further encodings are added with
 * {@link #registerFactory(FstFactory)}. The shared
 * {@link #defaultRegistry()} is locked against registration.
 */
public final class FstRegistry {
    private static final FstRegistry DEFAULT = new FstRegistry().lock();

    private final Map<String, FstFactory> factories = new LinkedHashMap<>();
    private final Map<String, WeightType<?>> arcTypes = new LinkedHashMap<>();
    private boolean locked;

    public FstRegistry() {
        registerBuiltIns();
    }

    public static FstRegistry defaultRegistry() {
        return DEFAULT;
    }

    public FstRegistry registerFactory(FstFactory factory) {
        checkUnlocked();
        factories.put(factory.type(), factory);
        return this;
    }

    public FstRegistry registerArcType(WeightType<?> weightType) {
        checkUnlocked();
        arcTypes.put(weightType.arcType(), weightType);
        return this;
    }

    /** Returns the factory for an encoding name, or null if unknown. */
    public FstFactory factory(String fstType) {
        return factories.get(fstType);
    }

    /** Returns the weight type for an arc type name, or null if unknown. */
    public WeightType<?> weightType(String arcType) {
        return arcTypes.get(arcType);
    }

    public Set<String> fstTypes() {
        return Collections.unmodifiableSet(factories.keySet());
    }

    public Set<String> arcTypes() {
        return Collections.unmodifiableSet(arcTypes.keySet());
    }

    private FstRegistry lock() {
        locked = true;
        return this;
    }

    private void checkUnlocked() {
        if (locked)
            throw new IllegalStateException("The default FST registry cannot be modified; create a new FstRegistry");
    }

    // ── Built-ins ───────────────────────────────────────────────────

    private void registerBuiltIns() {
        for (FstType type : FstType.values())
            factories.put(type.typeName(), type.newFactory());
        arcTypes.put(TropicalWeight.TYPE.arcType(), TropicalWeight.TYPE);
        arcTypes.put(LogWeight.TYPE.arcType(), LogWeight.TYPE);
        arcTypes.put(Log64Weight.TYPE.arcType(), Log64Weight.TYPE);
    }
}
