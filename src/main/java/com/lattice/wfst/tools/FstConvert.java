package com.lattice.wfst.tools;

import com.lattice.wfst.io.FstRegistry;
import com.lattice.wfst.script.FstClass;
import com.lattice.wfst.script.FstScripts;
import com.lattice.wfst.util.FstExplain;

import java.io.InputStream;
import java.io.OutputStream;

import lombok.extern.log4j.Log4j2;

/**
 * Converts an FST to another encoding.
 *
 * <pre>
 *   fstconvert [--fst_type=vector] [config flags] [in.fst [out.fst]]
 * </pre>
 *
 * An absent or "-" input reads standard input; an absent output writes
 * standard output. Exits 1 if the FST cannot be read, converted or written.
 */
@Log4j2
public final class FstConvert {
    static final String USAGE = "Converts an FST to another type.\n\n"
            + "  Usage: fstconvert [--fst_type=vector] [in.fst [out.fst]]\n";

    private FstConvert() {
    }

    public static void main(String[] args) {
        System.exit(run(args, System.in, System.out));
    }

    public static int run(String[] args, InputStream stdin, OutputStream stdout) {
        ToolArgs targs = ToolArgs.parse(args, USAGE, "fst_type");
        if (targs == null)
            return 1;
        String fstType = targs.flag("fst_type", "vector");

        FstClass ifst = targs.readInput(stdin, FstRegistry.defaultRegistry());
        if (ifst == null)
            return 1;

        FstClass ofst = ifst;
        if (!ifst.fstType().equals(fstType)) {
            ofst = FstScripts.convert(ifst, fstType);
            if (ofst == null)
                return 1;
        } else {
            log.debug("Input is already of type {}; writing it unchanged", fstType);
        }
        if (log.isDebugEnabled())
            log.debug("Converted FST:\n{}", FstExplain.summary(ofst.getFst()));
        return targs.writeOutput(ofst, stdout) ? 0 : 1;
    }
}
