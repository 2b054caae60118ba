package com.regvm.runtime;

import com.regvm.vm.LengthPrefixMode;
import com.regvm.vm.RegVM;
import com.regvm.vm.VMException;
import com.regvm.vm.Value;
import com.regvm.vm.trace.ConsoleTracePrinter;

import java.io.IOException;
import java.io.PrintStream;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Command-line entry point: runs a raw bytecode file against a fresh {@link RhinoHost}.
 */
public class RegVMRunner {

    public static final int EXIT_OK = 0;
    public static final int EXIT_ERROR = 1;
    public static final int EXIT_USAGE = 2;

    private static final String USAGE =
        "Usage: RegVMRunner <file> [--trace] [--legacy-length] [--step-limit=N]";

    public static void main(String[] args) {
        System.exit(run(args, System.out, System.err));
    }

    /**
     * Run with the given arguments and streams.
     * @return The process exit code
     */
    public static int run(String[] args, PrintStream out, PrintStream err) {
        String file = null;
        boolean trace = false;
        boolean legacyLength = false;
        int stepLimit = 0;

        for (String arg : args) {
            if (arg.equals("--trace")) {
                trace = true;
            } else if (arg.equals("--legacy-length")) {
                legacyLength = true;
            } else if (arg.startsWith("--step-limit=")) {
                try {
                    stepLimit = Integer.parseInt(arg.substring("--step-limit=".length()));
                } catch (NumberFormatException e) {
                    stepLimit = -1;
                }
                if (stepLimit < 0) {
                    err.println("Invalid step limit: " + arg);
                    err.println(USAGE);
                    return EXIT_USAGE;
                }
            } else if (arg.startsWith("--") || file != null) {
                err.println("Unexpected argument: " + arg);
                err.println(USAGE);
                return EXIT_USAGE;
            } else {
                file = arg;
            }
        }
        if (file == null) {
            err.println(USAGE);
            return EXIT_USAGE;
        }

        byte[] bytecode;
        try {
            bytecode = Files.readAllBytes(Path.of(file));
        } catch (IOException e) {
            err.println("Error reading " + file + ": " + e.getMessage());
            return EXIT_ERROR;
        }

        RegVM vm = new RegVM(new RhinoHost().bindings());
        vm.setStepLimit(stepLimit);
        if (legacyLength) {
            vm.setLengthPrefixMode(LengthPrefixMode.LEGACY_SHORT_CIRCUIT);
        }
        if (trace) {
            vm.setTraceListener(new ConsoleTracePrinter(out));
        }
        vm.init(bytecode);

        try {
            Value result = vm.run();
            out.println(result.toStr());
            return EXIT_OK;
        } catch (VMException e) {
            err.println("Error [" + e.getKind() + "]: " + e.getMessage());
            return EXIT_ERROR;
        }
    }
}
