package com.lattice.wfst.api;

import com.lattice.wfst.io.FstError;
import com.lattice.wfst.io.FstFormatException;
import com.lattice.wfst.io.FstInput;
import com.lattice.wfst.io.FstOutput;

import java.io.IOException;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Bidirectional map between integer labels and symbol strings.
 *
 * <p>
 * Only the binary form embedded in FST files is supported here, so a table
 * read with an FST is written back unchanged.
 */
public final class SymbolTable {
    public static final int MAGIC_NUMBER = 2125658996;
    public static final long NO_SYMBOL = -1;

    private final String name;
    private final Map<String, Long> symbolToKey = new LinkedHashMap<>();
    private final Map<Long, String> keyToSymbol = new HashMap<>();
    private long availableKey;

    public SymbolTable(String name) {
        this.name = name;
    }

    public String name() {
        return name;
    }

    /** Adds a symbol under the next available key, or returns its existing key. */
    public long addSymbol(String symbol) {
        Long key = symbolToKey.get(symbol);
        if (key != null)
            return key;
        return addSymbol(symbol, availableKey);
    }

    public long addSymbol(String symbol, long key) {
        Long existing = symbolToKey.get(symbol);
        if (existing != null)
            return existing;
        symbolToKey.put(symbol, key);
        keyToSymbol.put(key, symbol);
        if (key >= availableKey)
            availableKey = key + 1;
        return key;
    }

    /** Returns the key of a symbol, or {@link #NO_SYMBOL}. */
    public long find(String symbol) {
        Long key = symbolToKey.get(symbol);
        return key == null ? NO_SYMBOL : key;
    }

    /** Returns the symbol of a key, or null. */
    public String find(long key) {
        return keyToSymbol.get(key);
    }

    public int numSymbols() {
        return symbolToKey.size();
    }

    public long availableKey() {
        return availableKey;
    }

    public SymbolTable copy() {
        SymbolTable copy = new SymbolTable(name);
        symbolToKey.forEach(copy::addSymbol);
        copy.availableKey = availableKey;
        return copy;
    }

    public static SymbolTable read(FstInput in, String source) throws IOException {
        int magic = in.readInt();
        if (magic != MAGIC_NUMBER)
            throw new FstFormatException(FstError.READ_FAILED,
                    "Bad symbol table in " + source + ". Magic number not matched. Got: " + magic);
        SymbolTable table = new SymbolTable(in.readString());
        long available = in.readLong();
        long size = in.readLong();
        if (size < 0)
            throw new FstFormatException(FstError.READ_FAILED,
                    "Negative symbol table size " + size + " in " + source);
        for (long i = 0; i < size; i++) {
            String symbol = in.readString();
            long key = in.readLong();
            table.addSymbol(symbol, key);
        }
        table.availableKey = available;
        return table;
    }

    public void write(FstOutput out) throws IOException {
        out.writeInt(MAGIC_NUMBER);
        out.writeString(name);
        out.writeLong(availableKey);
        out.writeLong(symbolToKey.size());
        for (Map.Entry<String, Long> e : symbolToKey.entrySet()) {
            out.writeString(e.getKey());
            out.writeLong(e.getValue());
        }
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof SymbolTable other))
            return false;
        return name.equals(other.name) && availableKey == other.availableKey
                && symbolToKey.equals(other.symbolToKey);
    }

    @Override
    public int hashCode() {
        return Objects.hash(name, availableKey, symbolToKey);
    }

    @Override
    public String toString() {
        return "SymbolTable[" + name + ", " + numSymbols() + " symbols]";
    }
}
