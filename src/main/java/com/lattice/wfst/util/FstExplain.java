package com.lattice.wfst.util;

import com.lattice.wfst.api.Arc;
import com.lattice.wfst.api.Fst;
import com.lattice.wfst.api.Weight;
import com.lattice.wfst.props.Properties;
import com.lattice.wfst.script.FstClass;

/**
 * Diagnostic rendering of an FST: a summary, a per-state dump and a Mermaid
 * diagram.
 *
 * <p>
 * <b>Usage:</b> debugging sessions and DEBUG logs. Output is for humans, not
 * a parse format, and walks every state and arc.
 */
public final class FstExplain {

    private FstExplain() {
    }

    public static String explain(FstClass fst) {
        return explain(fst.getFst());
    }

    /** Summary followed by every state. */
    public static String explain(Fst<?> fst) {
        return summary(fst) + dumpStates(fst);
    }

    public static String summary(Fst<?> fst) {
        StringBuilder sb = new StringBuilder(256);
        sb.append("FST type: ").append(fst.type()).append('\n')
                .append("  Arc type: ").append(fst.arcType()).append('\n')
                .append("  Start: ").append(fst.start()).append('\n')
                .append("  States: ").append(fst.numStates()).append('\n')
                .append("  Arcs: ").append(fst.numArcsTotal()).append('\n');
        if (fst.inputSymbols() != null)
            sb.append("  Input symbols: ").append(fst.inputSymbols().name()).append('\n');
        if (fst.outputSymbols() != null)
            sb.append("  Output symbols: ").append(fst.outputSymbols().name()).append('\n');
        sb.append("  Properties: ").append(Properties.toString(fst.properties(Properties.FST_PROPERTIES, false)))
                .append('\n');
        return sb.toString();
    }

    public static String dumpStates(Fst<?> fst) {
        return dump(fst);
    }

    private static <W extends Weight> String dump(Fst<W> fst) {
        StringBuilder sb = new StringBuilder(1024);
        for (int s = 0; s < fst.numStates(); s++) {
            sb.append("  [").append(s).append(']');
            if (s == fst.start())
                sb.append(" (START)");
            if (fst.isFinal(s))
                sb.append(" final=").append(fst.finalWeight(s));
            sb.append('\n');
            for (Arc<W> arc : fst.arcs(s)) {
                sb.append("    ").append(arc.ilabel()).append(':').append(arc.olabel())
                        .append('/').append(arc.weight()).append(" -> ").append(arc.nextState()).append('\n');
            }
        }
        return sb.toString();
    }

    /** Mermaid JS diagram, suitable for embedding in Markdown. */
    public static String toMermaid(Fst<?> fst) {
        return mermaid(fst);
    }

    private static <W extends Weight> String mermaid(Fst<W> fst) {
        StringBuilder sb = new StringBuilder(1024);
        sb.append("graph LR;\n");
        for (int s = 0; s < fst.numStates(); s++) {
            sb.append("  s").append(s);
            if (fst.isFinal(s))
                sb.append("((").append(s).append("))");
            else
                sb.append('(').append(s).append(')');
            sb.append(";\n");
        }
        for (int s = 0; s < fst.numStates(); s++) {
            for (Arc<W> arc : fst.arcs(s)) {
                sb.append("  s").append(s).append(" -->|\"").append(arc.ilabel()).append(':').append(arc.olabel())
                        .append('/').append(arc.weight()).append("\"| s").append(arc.nextState()).append(";\n");
            }
        }
        if (fst.start() != Fst.NO_STATE_ID)
            sb.append("  style s").append(fst.start()).append(" stroke-width:3px;\n");
        return sb.toString();
    }
}
