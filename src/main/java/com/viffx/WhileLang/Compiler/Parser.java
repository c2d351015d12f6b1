package com.viffx.WhileLang.Compiler;

import com.viffx.WhileLang.Grammar.Grammar;
import com.viffx.WhileLang.Grammar.Production;
import com.viffx.WhileLang.Grammar.Token;
import com.viffx.WhileLang.Grammar.WhileGrammar;
import com.viffx.WhileLang.Symbols.AstNode;
import com.viffx.WhileLang.Symbols.Terminal;
import org.jetbrains.annotations.NotNull;

import java.util.List;
import java.util.Objects;
import java.util.logging.Level;
import java.util.logging.Logger;

import static com.viffx.WhileLang.Compiler.ParseError.InternalError.Kind.*;

/**
 * Table driven shift-reduce parser.
 * <p>
 * The parser keeps no state between calls; every {@link #parse(List)} works on a fresh
 * {@link ParserState}, so one instance may be used from several threads at once.
 * Failures are returned, never thrown.
 */
public class Parser {
    private static final Logger LOGGER = Logger.getLogger(Parser.class.getName());

    // ====== INSTANCE FIELDS ====== //
    private final Grammar grammar;
    private final ParseTable table;

    // ====== CONSTRUCTORS ====== //
    public Parser() {
        this(WhileGrammar.GRAMMAR, WhileParseTable.TABLE);
    }

    public Parser(@NotNull Grammar grammar, @NotNull ParseTable table) {
        this.grammar = Objects.requireNonNull(grammar, "grammar cannot be null");
        this.table = Objects.requireNonNull(table, "table cannot be null");
    }

    // ====== PUBLIC API ====== //
    /**
     * Parses a token sequence.
     *
     * @param tokens the tokens to parse; the last one, and only the last one, must be {@link Terminal#END}
     * @return the root of the tree, or the first syntax or table error met
     * @throws IllegalArgumentException if {@code tokens} is not terminated by exactly one END token
     */
    public @NotNull ParseResult parse(@NotNull List<Token> tokens) {
        checkTokens(tokens);
        ParserState state = new ParserState(0);

        // === Core parser driver ===
        while (true) {
            int top = state.topState();
            Token current = state.position() < tokens.size() ? tokens.get(state.position()) : tokens.get(tokens.size() - 1);
            Action action = table.action(top, current.kind());
            if (action == null) {
                return syntaxError(current, top);
            }

            switch (action.type()) {
                case SHIFT -> shift(state, current, action.data());
                case REDUCE -> {
                    ParseError error = reduce(state, action.data());
                    if (error != null) return fail(error);
                }
                case ACCEPT -> {
                    return accept(state);
                }
            }
            onStep(state);
        }
    }

    // ====== API HOOKS ====== //
    /**
     * Called after every shift and every completed reduction.
     *
     * <p>Subclasses can override this to observe the stacks, for example to trace a parse.
     * The state must not be retained beyond the call.
     */
    protected void onStep(@NotNull ParserState state) {}

    // ====== UTILITY METHODS FOR LR ACTIONS ====== //
    private void shift(ParserState state, Token current, int target) {
        LOGGER.fine(() -> "Shift: " + current + " -> " + target);
        state.shift(target, AstNode.leaf(AstNode.TOKEN, current.text()));
    }

    /**
     * Pops the right hand side of a production, builds its node and follows the goto transition.
     *
     * @return {@code null} on success, otherwise the table error that stopped the reduction
     */
    private ParseError reduce(ParserState state, int index) {
        if (!grammar.hasProduction(index)) {
            return new ParseError.InternalError(UNKNOWN_PRODUCTION, state.topState(),
                    "state " + state.topState() + " reduces by unknown production " + index);
        }
        Production production = grammar.production(index);
        if (!state.canPop(production.arity())) {
            return new ParseError.InternalError(STACK_UNDERFLOW, state.topState(),
                    "cannot pop " + production.arity() + " values for " + production + " from " + state);
        }

        List<AstNode> children = state.pop(production.arity());
        AstNode node = grammar.build(production, children);

        int exposed = state.topState();
        Integer target = table.gotoState(exposed, production.lhs());
        if (target == null) {
            return new ParseError.InternalError(MISSING_GOTO, exposed,
                    "state " + exposed + " has no goto for " + production.lhs());
        }
        state.push(target, node);
        LOGGER.fine(() -> "Reduce: " + production + " -> " + target);
        return null;
    }

    private ParseResult accept(ParserState state) {
        int values = state.valueDepth();
        if (values == 1) {
            LOGGER.fine("Accept");
            return ParseResult.success(state.peekValue());
        }
        ParseError.InternalError.Kind kind = values == 0 ? NO_ROOT_AT_ACCEPT : MULTIPLE_ROOTS_AT_ACCEPT;
        return fail(new ParseError.InternalError(kind, state.topState(),
                values + " values left on the stack at accept in state " + state.topState()));
    }

    private ParseResult syntaxError(Token current, int state) {
        return fail(new ParseError.SyntaxError(current, state, table.expected(state)));
    }

    private static ParseResult fail(ParseError error) {
        Level level = error instanceof ParseError.InternalError ? Level.WARNING : Level.FINE;
        LOGGER.log(level, error::message);
        return ParseResult.failure(error);
    }

    private static void checkTokens(List<Token> tokens) {
        Objects.requireNonNull(tokens, "tokens cannot be null");
        if (tokens.isEmpty()) {
            throw new IllegalArgumentException("The token sequence must end with " + Terminal.END);
        }
        for (int i = 0; i < tokens.size(); i++) {
            boolean last = i == tokens.size() - 1;
            if ((tokens.get(i).kind() == Terminal.END) != last) {
                throw new IllegalArgumentException(last
                        ? "The token sequence must end with " + Terminal.END
                        : "Unexpected " + Terminal.END + " before the end of the token sequence at " + i);
            }
        }
    }
}
