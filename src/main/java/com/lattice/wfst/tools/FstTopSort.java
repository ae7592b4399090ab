package com.lattice.wfst.tools;

import com.lattice.wfst.io.FstRegistry;
import com.lattice.wfst.script.FstClass;
import com.lattice.wfst.script.FstScripts;
import com.lattice.wfst.script.FstScripts.TopSortResult;

import java.io.InputStream;
import java.io.OutputStream;

import lombok.extern.log4j.Log4j2;

/**
 * Topologically sorts an FST.
 *
 * <pre>
 *   fsttopsort [config flags] [in.fst [out.fst]]
 * </pre>
 *
 * A cyclic input is written back unchanged with a warning. Exits 1 only if
 * the command line is unusable or the FST cannot be read.
 */
@Log4j2
public final class FstTopSort {
    static final String USAGE = "Topologically sorts an acyclic FST.\n\n"
            + "  Usage: fsttopsort [in.fst [out.fst]]\n";

    private FstTopSort() {
    }

    public static void main(String[] args) {
        System.exit(run(args, System.in, System.out));
    }

    public static int run(String[] args, InputStream stdin, OutputStream stdout) {
        ToolArgs targs = ToolArgs.parse(args, USAGE);
        if (targs == null)
            return 1;

        FstClass ifst = targs.readInput(stdin, FstRegistry.defaultRegistry());
        if (ifst == null)
            return 1;

        TopSortResult result = FstScripts.topSort(ifst);
        if (!result.acyclic())
            log.warn("fsttopsort: Input FST is cyclic");
        // The sorted (or untouched) FST is written either way; a failed write is logged only.
        targs.writeOutput(result.fst(), stdout);
        return 0;
    }
}
