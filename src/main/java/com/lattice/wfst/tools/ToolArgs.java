package com.lattice.wfst.tools;

import com.lattice.wfst.config.FstConfig;
import com.lattice.wfst.io.FstFiles;
import com.lattice.wfst.io.FstRegistry;
import com.lattice.wfst.script.FstClass;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.util.List;
import java.util.Set;

import lombok.extern.log4j.Log4j2;

/**
 * Command line shared by the tools: config flags, tool flags and an optional
 * {@code [in.fst [out.fst]]} pair.
 */
@Log4j2
final class ToolArgs {
    private final FstConfig.ParsedArgs parsed;
    private final String inName;
    private final String outName;

    private ToolArgs(FstConfig.ParsedArgs parsed, String inName, String outName) {
        this.parsed = parsed;
        this.inName = inName;
        this.outName = outName;
    }

    /**
     * Parses {@code args} and applies the verbosity flag. Returns null, after
     * printing {@code usage} or logging the cause, if the command line is
     * unusable.
     */
    static ToolArgs parse(String[] args, String usage, String... toolFlags) {
        FstConfig.ParsedArgs parsed;
        try {
            parsed = FstConfig.parseArgs(args);
        } catch (IOException | IllegalArgumentException e) {
            log.error("Bad command line: {}", e.getMessage());
            return null;
        }
        if (parsed.flags().containsKey("help")) {
            System.err.print(usage);
            return null;
        }
        Set<String> known = Set.of(toolFlags);
        for (String flag : parsed.flags().keySet())
            if (!known.contains(flag))
                log.warn("Ignoring unknown flag --{}", flag);
        List<String> positional = parsed.positional();
        if (positional.size() > 2) {
            System.err.print(usage);
            return null;
        }
        parsed.config().applyVerbosity();
        String in = positional.size() > 0 && !positional.get(0).equals("-") ? positional.get(0) : "";
        String out = positional.size() > 1 && !positional.get(1).equals("-") ? positional.get(1) : "";
        return new ToolArgs(parsed, in, out);
    }

    FstConfig config() {
        return parsed.config();
    }

    String flag(String name, String def) {
        return parsed.flag(name, def);
    }

    /** Reads the input file, or {@code stdin} if none was named. */
    FstClass readInput(InputStream stdin, FstRegistry registry) {
        if (inName.isEmpty())
            return FstClass.read(stdin, FstFiles.STDIN_NAME, config(), registry);
        return FstClass.read(inName, config(), registry);
    }

    /** Writes to the output file, or {@code stdout} if none was named. */
    boolean writeOutput(FstClass fst, OutputStream stdout) {
        if (outName.isEmpty())
            return fst.write(stdout, FstFiles.STDOUT_NAME);
        return fst.write(outName);
    }
}
