package com.viffx.WhileLang;

import com.viffx.WhileLang.Compiler.Compiler;
import com.viffx.WhileLang.Compiler.ParseResult;
import com.viffx.WhileLang.Utils.AstPrinter;
import com.viffx.WhileLang.Utils.Logging;

import java.io.IOException;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * Compiles while programs and prints their trees.
 * <p>
 * Usage: {@code Main [-v] [file ...]}. Without files the demo programs are compiled.
 * {@code -v} traces every shift and reduction on standard error.
 */
public class Main {
    static final List<String> DEMO_PROGRAMS = List.of(
            "while (x < V) y := I done",
            "while (a = I) b := X done; while (n > III) m := a done"
    );

    public static void main(String[] args) throws IOException {
        Logging.initFormat();
        List<String> files = new ArrayList<>();
        for (String arg : args) {
            if (arg.equals("-v")) Logging.enableTrace();
            else files.add(arg);
        }

        Compiler compiler = new Compiler();
        boolean ok = true;
        if (files.isEmpty()) {
            for (int i = 0; i < DEMO_PROGRAMS.size(); i++) {
                System.out.println("=== Test " + (i + 1) + " ===");
                ok &= report(compiler.compile(DEMO_PROGRAMS.get(i)));
            }
        } else {
            for (String file : files) {
                System.out.println("=== " + file + " ===");
                try (Reader reader = Files.newBufferedReader(Path.of(file), StandardCharsets.UTF_8)) {
                    ok &= report(compiler.compile(reader));
                }
            }
        }
        System.exit(ok ? 0 : 1);
    }

    private static boolean report(ParseResult result) {
        if (result instanceof ParseResult.Success success) {
            AstPrinter.print(success.root(), System.out);
            System.out.println();
            return true;
        }
        ParseResult.Failure failure = (ParseResult.Failure) result;
        System.out.println(failure.error().message());
        System.out.println();
        return false;
    }
}
