package json.tree;

import java.io.IOException;
import java.io.Reader;
import java.io.UncheckedIOException;
import java.util.Objects;
import java.util.logging.Logger;

/// Turns a character stream into {@link Token}s, one per {@link #nextToken()} call.
///
/// The lexer owns its reader and consumes it forward-only, keeping at most one
/// character of lookahead. It does no escape processing and no numeric
/// validation:
/// - a string literal runs to the next `"`, backslashes included verbatim
/// - a number literal is the longest run of `-`, digits and `.`
/// - `true` and `false` must be spelled out; `n` is followed by three skipped
///   characters unless {@link JsonReadOptions#strictNullLiteral()} is set
final class JsonLexer {

    private static final Logger LOG = Logger.getLogger(JsonLexer.class.getName());

    private static final int EOF = -1;
    private static final int NONE = -2;

    private final Reader in;
    private final JsonReadOptions options;
    private int lookahead = NONE;

    JsonLexer(Reader in, JsonReadOptions options) {
        this.in = Objects.requireNonNull(in, "in must not be null");
        this.options = Objects.requireNonNull(options, "options must not be null");
    }

    /// {@return the next token, or an `END_OF_INPUT` token once the stream is exhausted}
    /// @throws JsonLexException if the next character cannot start a token
    /// @throws UncheckedIOException if the reader fails
    Token nextToken() {
        int c = read();
        while (options.whitespace().isWhitespace(c)) {
            c = read();
        }
        final Token token = switch (c) {
            case EOF -> Token.END;
            case '{' -> Token.OBJECT_OPEN;
            case '}' -> Token.OBJECT_CLOSE;
            case '[' -> Token.LIST_OPEN;
            case ']' -> Token.LIST_CLOSE;
            case ':' -> Token.COLON;
            case ',' -> Token.COMMA;
            case '"' -> stringLiteral();
            case '-', '0', '1', '2', '3', '4', '5', '6', '7', '8', '9' -> numberLiteral((char) c);
            case 'f' -> keyword('f', "alse", Token.FALSE);
            case 't' -> keyword('t', "rue", Token.TRUE);
            case 'n' -> nullLiteral();
            default -> throw new JsonLexException((char) c);
        };
        LOG.finer(() -> "token " + token.kind() + " " + token.text());
        return token;
    }

    private Token stringLiteral() {
        final var sb = new StringBuilder();
        int c = read();
        while (c != '"') {
            if (c == EOF) {
                throw new JsonLexException("Unterminated string literal", "\"" + sb);
            }
            sb.append((char) c);
            c = read();
        }
        return new Token(Token.Kind.STRING_LIT, sb.toString());
    }

    private Token numberLiteral(char first) {
        final var sb = new StringBuilder().append(first);
        while (isNumberChar(peek())) {
            sb.append((char) read());
        }
        return new Token(Token.Kind.NUMBER_LIT, sb.toString());
    }

    private static boolean isNumberChar(int c) {
        return c == '-' || c == '.' || (c >= '0' && c <= '9');
    }

    private Token keyword(char first, String rest, Token token) {
        final var sb = new StringBuilder().append(first);
        for (int i = 0; i < rest.length(); i++) {
            final int c = read();
            if (c == EOF) {
                break;
            }
            sb.append((char) c);
        }
        if (!sb.substring(1).equals(rest)) {
            throw new JsonLexException("Invalid literal", sb.toString());
        }
        return token;
    }

    private Token nullLiteral() {
        if (options.strictNullLiteral()) {
            return keyword('n', "ull", Token.NULL);
        }
        // legacy behaviour: skip three characters whatever they are
        int skipped = 0;
        while (skipped < 3 && read() != EOF) {
            skipped++;
        }
        return Token.NULL;
    }

    private int peek() {
        if (lookahead == NONE) {
            lookahead = readRaw();
        }
        return lookahead;
    }

    private int read() {
        if (lookahead != NONE) {
            final int c = lookahead;
            // EOF stays sticky
            lookahead = c == EOF ? EOF : NONE;
            return c;
        }
        return readRaw();
    }

    private int readRaw() {
        try {
            return in.read();
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }
}
