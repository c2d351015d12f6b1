package com.viffx.WhileLang.Compiler;

import com.viffx.WhileLang.Grammar.Token;
import com.viffx.WhileLang.Symbols.Terminal;
import com.viffx.WhileLang.Utils.LexicalCharacterBuffer;
import org.jetbrains.annotations.NotNull;

import java.io.IOException;
import java.io.Reader;
import java.io.StringReader;
import java.io.UncheckedIOException;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import static com.viffx.WhileLang.Symbols.Terminal.*;

/**
 * Splits source text into tokens.
 * <p>
 * A word starts with a letter and continues with letters and digits. {@code while} and
 * {@code done} are keywords, a word made only of {@code I}, {@code V} and {@code X} is a
 * Roman numeral and every other word is an identifier. Classification is case-sensitive.
 */
public class Lexer {
    private static final Map<String, Terminal> KEYWORDS = Map.of(
            "while", WHILE,
            "done", DONE
    );

    private final LexicalCharacterBuffer buffer;
    private int index = 0;
    private boolean finished = false;

    public Lexer(@NotNull Reader source) throws IOException {
        buffer = new LexicalCharacterBuffer(source) {
            @Override
            public void onNextChar() {
                index++;
            }
        };
    }

    /**
     * Tokenizes a whole string.
     *
     * @param source the program text
     * @return the tokens, terminated by exactly one {@link Terminal#END}
     * @throws LexicalException at the first character that starts no token
     */
    public static List<Token> tokenize(@NotNull String source) throws LexicalException {
        try {
            return new Lexer(new StringReader(source)).tokenize();
        } catch (IOException e) {
            // StringReader does not fail
            throw new UncheckedIOException(e);
        }
    }

    /**
     * Reads every remaining token.
     *
     * @return the tokens, terminated by exactly one {@link Terminal#END}
     * @throws IOException      if the underlying reader fails
     * @throws LexicalException at the first character that starts no token
     */
    public List<Token> tokenize() throws IOException, LexicalException {
        List<Token> tokens = new ArrayList<>();
        Token token;
        do {
            token = next();
            tokens.add(token);
        } while (token.kind() != END);
        return tokens;
    }

    // Gets the next token. END is returned once; asking again is an error.
    public Token next() throws IOException, LexicalException {
        if (finished) throw new IllegalStateException("The end of input was already returned");

        // Skip any white space
        while (!buffer.eof() && isWhitespace(buffer.crntChar())) {
            buffer.nextChar();
        }

        // Never process past the end of the source
        if (buffer.eof()) {
            finished = true;
            return Token.end(index);
        }

        int start = index;
        char c = buffer.crntChar();
        return switch (c) {
            case ';' -> single(SEMICOLON, start);
            case '(' -> single(LPAREN, start);
            case ')' -> single(RPAREN, start);
            case '<' -> single(LESS, start);
            case '>' -> single(GREATER, start);
            case '=' -> single(EQUAL, start);
            case ':' -> {
                if (!buffer.hasPeek() || buffer.peekChar() != '=') throw new LexicalException(start, c);
                buffer.nextChar();
                buffer.nextChar();
                yield new Token(ASSIGN, ":=", start);
            }
            default -> {
                if (!isLetter(c)) throw new LexicalException(start, c);
                yield word(start);
            }
        };
    }

    private Token single(Terminal kind, int start) throws IOException {
        String text = String.valueOf(buffer.crntChar());
        buffer.nextChar();
        return new Token(kind, text, start);
    }

    private Token word(int start) throws IOException {
        StringBuilder builder = new StringBuilder();
        do {
            builder.append(buffer.crntChar());
            buffer.nextChar();
        } while (!buffer.eof() && isLetterOrDigit(buffer.crntChar()));

        String word = builder.toString();
        Terminal keyword = KEYWORDS.get(word);
        if (keyword != null) return new Token(keyword, word, start);
        return new Token(isRomanNumeral(word) ? ROMAN_NUMERAL : IDENTIFIER, word, start);
    }

    // Only ASCII letters, digits and whitespace belong to the language
    static boolean isLetter(char c) {
        return c >= 'a' && c <= 'z' || c >= 'A' && c <= 'Z';
    }

    static boolean isLetterOrDigit(char c) {
        return isLetter(c) || c >= '0' && c <= '9';
    }

    static boolean isWhitespace(char c) {
        return c == ' ' || c == '\t' || c == '\n' || c == '\r' || c == '\f' || c == '\u000B';
    }

    static boolean isRomanNumeral(String word) {
        if (word.isEmpty()) return false;
        for (int i = 0; i < word.length(); i++) {
            char c = word.charAt(i);
            if (c != 'I' && c != 'V' && c != 'X') return false;
        }
        return true;
    }
}
