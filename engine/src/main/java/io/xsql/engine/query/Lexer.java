package io.xsql.engine.query;

/**
 * XSQL lexer with SavePoint backtracking.
 *
 * Features:
 * - SavePoint for backtracking: mark(), reset()
 * - FNV-1a hash for O(1) keyword lookup
 * - single or double quoted strings with doubled-quote and backslash escapes
 * - identifiers may contain '-' so attribute names like data-id stay whole
 */
public final class Lexer {

    private final String text;
    private int pos;
    private char ch;

    // Current token state
    private Token token;
    private String stringVal;
    private long hash;
    private int tokenPos;

    public Lexer(String query) {
        this.text = query;
        this.pos = 0;
        this.ch = pos < text.length() ? text.charAt(pos) : '\0';
        nextToken();
    }

    // ==================== SavePoint for Backtracking ====================

    public record SavePoint(int pos, Token token, String stringVal, long hash, int tokenPos) {}

    public SavePoint mark() {
        return new SavePoint(pos, token, stringVal, hash, tokenPos);
    }

    public void reset(SavePoint sp) {
        this.pos = sp.pos;
        this.token = sp.token;
        this.stringVal = sp.stringVal;
        this.hash = sp.hash;
        this.tokenPos = sp.tokenPos;
        this.ch = pos < text.length() ? text.charAt(pos) : '\0';
    }

    // ==================== Token Access ====================

    public Token token() {
        return token;
    }

    public String stringVal() {
        return stringVal;
    }

    public int tokenPos() {
        return tokenPos;
    }

    public String text() {
        return text;
    }

    /**
     * Describes the current token for diagnostics, e.g. {@code identifier 'href'}.
     */
    public String describe() {
        if (token == Token.EOF) {
            return token.describe();
        }
        if (token == Token.STRING) {
            return "string literal '" + stringVal + "'";
        }
        if (stringVal != null) {
            return token.describe() + " '" + stringVal + "'";
        }
        return token.describe();
    }

    // ==================== Scanning ====================

    public void nextToken() {
        skipWhitespaceAndComments();

        tokenPos = pos;
        stringVal = null;
        hash = 0;

        if (pos >= text.length()) {
            token = Token.EOF;
            return;
        }

        if (isIdentifierStart(ch)) {
            scanIdentifier();
            return;
        }

        if (ch == '\'' || ch == '"') {
            scanString(ch);
            return;
        }

        if (isDigit(ch) || (ch == '-' && isDigit(peek()))) {
            scanNumber();
            return;
        }

        scanOperator();
    }

    private void scanIdentifier() {
        int start = pos;
        long h = Token.FNV_OFFSET;

        while (isIdentifierPart(ch) && !(ch == '-' && peek() == '-')) {
            char c = ch;
            if (c >= 'A' && c <= 'Z') {
                c = (char) (c + 32); // lowercase for hash
            }
            h ^= c;
            h *= Token.FNV_PRIME;
            advance();
        }

        stringVal = text.substring(start, pos);
        hash = h;

        Token kw = Token.keyword(h);
        token = (kw != null && kw.name().equalsIgnoreCase(stringVal)) ? kw : Token.IDENTIFIER;
    }

    private void scanString(char quote) {
        int start = pos;
        advance(); // opening quote
        StringBuilder sb = new StringBuilder();

        while (true) {
            if (pos >= text.length()) {
                throw new LexException("Unterminated string literal", start, quote);
            }
            if (ch == quote) {
                if (peek() == quote) {
                    sb.append(quote);
                    advance();
                    advance();
                    continue;
                }
                advance(); // closing quote
                break;
            }
            if (ch == '\\' && pos + 1 < text.length()) {
                advance();
                switch (ch) {
                    case 'n' -> sb.append('\n');
                    case 't' -> sb.append('\t');
                    case 'r' -> sb.append('\r');
                    default -> sb.append(ch);
                }
                advance();
                continue;
            }
            sb.append(ch);
            advance();
        }

        stringVal = sb.toString();
        token = Token.STRING;
    }

    private void scanNumber() {
        int start = pos;
        boolean isDecimal = false;

        if (ch == '-') advance();
        while (isDigit(ch)) advance();

        if (ch == '.' && isDigit(peek())) {
            isDecimal = true;
            advance(); // .
            while (isDigit(ch)) advance();
        }

        stringVal = text.substring(start, pos);
        token = isDecimal ? Token.DECIMAL : Token.INTEGER;
    }

    private void scanOperator() {
        switch (ch) {
            case '(' -> { advance(); token = Token.LPAREN; }
            case ')' -> { advance(); token = Token.RPAREN; }
            case ',' -> { advance(); token = Token.COMMA; }
            case ';' -> { advance(); token = Token.SEMICOLON; }
            case '.' -> { advance(); token = Token.DOT; }
            case '*' -> { advance(); token = Token.STAR; }
            case '~' -> { advance(); token = Token.TILDE; }
            case '=' -> { advance(); token = Token.EQ; }
            case '<' -> {
                if (peek() == '>') {
                    advance();
                    advance();
                    token = Token.NE;
                } else {
                    throw new LexException("Unexpected character: <", pos, ch);
                }
            }
            case '!' -> {
                if (peek() == '=') {
                    advance();
                    advance();
                    token = Token.NE;
                } else {
                    throw new LexException("Expected = after !", pos, ch);
                }
            }
            default -> throw new LexException("Unexpected character: " + ch, pos, ch);
        }
    }

    // ==================== Helpers ====================

    private void advance() {
        pos++;
        ch = pos < text.length() ? text.charAt(pos) : '\0';
    }

    private char peek() {
        return pos + 1 < text.length() ? text.charAt(pos + 1) : '\0';
    }

    private void skipWhitespaceAndComments() {
        while (true) {
            while (pos < text.length() && Character.isWhitespace(ch)) advance();

            if (ch == '-' && peek() == '-') {
                while (pos < text.length() && ch != '\n') advance();
            } else {
                break;
            }
        }
    }

    private static boolean isIdentifierStart(char c) {
        return (c >= 'a' && c <= 'z') || (c >= 'A' && c <= 'Z') || c == '_';
    }

    private static boolean isIdentifierPart(char c) {
        return isIdentifierStart(c) || isDigit(c) || c == '-';
    }

    private static boolean isDigit(char c) {
        return c >= '0' && c <= '9';
    }
}
