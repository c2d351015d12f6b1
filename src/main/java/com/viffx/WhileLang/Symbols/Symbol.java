package com.viffx.WhileLang.Symbols;

/**
 * A grammar symbol. Implemented by {@link Terminal} and {@link NonTerminal}.
 */
public sealed interface Symbol permits Terminal, NonTerminal {
    /**
     * Returns the name used when a production is rendered.
     *
     * @return the display name of the symbol
     */
    String value();
}
