package com.viffx.WhileLang.Compiler;

import com.viffx.WhileLang.Grammar.Token;
import org.jetbrains.annotations.NotNull;

import java.io.IOException;
import java.io.Reader;
import java.io.StringReader;
import java.io.UncheckedIOException;
import java.util.List;
import java.util.Objects;
import java.util.logging.Logger;

/**
 * Lexes and parses a program in one call.
 * <p>
 * A lexical error is passed through as a {@link ParseError.LexicalError} and the parser
 * is never run on a partial token sequence.
 */
public class Compiler {
    private static final Logger LOGGER = Logger.getLogger(Compiler.class.getName());

    // Parser
    public final Parser parser;

    public Compiler() {
        this(new Parser());
    }

    public Compiler(@NotNull Parser parser) {
        this.parser = Objects.requireNonNull(parser, "parser cannot be null");
    }

    public @NotNull ParseResult compile(@NotNull String source) {
        try {
            return compile(new StringReader(source));
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }

    /**
     * Compiles the program read from {@code source}.
     *
     * @param source the program text; it is read to the end but not closed
     * @return the tree, or the lexical, syntax or table error that stopped compilation
     * @throws IOException if reading the source fails
     */
    public @NotNull ParseResult compile(@NotNull Reader source) throws IOException {
        try {
            List<Token> tokens = new Lexer(source).tokenize();
            LOGGER.fine(() -> "Lexed " + tokens.size() + " tokens");
            return parser.parse(tokens);
        } catch (LexicalException e) {
            LOGGER.fine(e::getMessage);
            return ParseResult.failure(e.toError());
        }
    }
}
