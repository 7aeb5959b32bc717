package com.randomtable.engine.runtime;

import java.util.ArrayList;
import java.util.List;

import com.randomtable.debug.Debug;
import com.randomtable.engine.dice.DiceRoller;

/**
 * Integer arithmetic for {@code {{math:...}}}.
 *
 * <pre>
 * expr    → term (('+'|'-') term)*
 * term    → factor (('*'|'/') factor)*
 * factor  → '-' factor | '(' expr ')' | primary
 * primary → number | $var | $var.@prop[.@prop...] | @name[.prop] | dice:XdY
 * </pre>
 *
 * Division truncates toward zero; division by zero gives 0. Unresolvable operands
 * coerce to 0 with a warning. Structural errors and results outside the int range
 * make {@link #evaluate} return null.
 */
public final class MathEvaluator {

    private static final String TAG = "Math";

    enum TokenType { NUMBER, OPERATOR, LEFT_PAREN, RIGHT_PAREN, VARIABLE, PLACEHOLDER, CAPTURE_ACCESS, DICE, EOF }

    static final class Token {
        final TokenType type;
        final String lexeme;
        final long number;
        final List<String> properties; // CAPTURE_ACCESS only

        Token(TokenType type, String lexeme, long number, List<String> properties) {
            this.type = type;
            this.lexeme = lexeme;
            this.number = number;
            this.properties = properties;
        }

        @Override
        public String toString() {
            return type + " " + lexeme;
        }
    }

    private final DiceRoller dice;

    public MathEvaluator(DiceRoller dice) {
        this.dice = dice;
    }

    /** Value of {@code expr}, or null if it cannot be parsed. */
    public Integer evaluate(String expr, GenerationContext context) {
        try {
            List<Token> tokens = new Lexer(expr).tokenize();
            long result = new Parser(tokens, context).parse();
            return Math.toIntExact(result);
        } catch (RuntimeException e) {
            Debug.get().w(TAG, "Math evaluation error: " + expr + " (" + e.getMessage() + ")");
            return null;
        }
    }

    /**
     * Leading-integer parse: optional whitespace and sign, then digits; anything
     * after the digits is ignored. Null when there are no digits.
     */
    public static Long parseLeadingInt(String s) {
        if (s == null) return null;
        int i = 0;
        int n = s.length();
        while (i < n && Character.isWhitespace(s.charAt(i))) i++;
        boolean negative = false;
        if (i < n && (s.charAt(i) == '+' || s.charAt(i) == '-')) {
            negative = s.charAt(i) == '-';
            i++;
        }
        int digitsStart = i;
        long value = 0;
        while (i < n && Character.isDigit(s.charAt(i))) {
            value = value * 10 + (s.charAt(i) - '0');
            i++;
        }
        if (i == digitsStart) return null;
        return negative ? -value : value;
    }

    // ===================== LEXER =====================

    static final class Lexer {
        private final String source;
        private final List<Token> tokens = new ArrayList<>();
        private int start = 0;
        private int current = 0;

        Lexer(String source) {
            this.source = source;
        }

        List<Token> tokenize() {
            while (!isAtEnd()) {
                start = current;
                scanToken();
            }
            tokens.add(new Token(TokenType.EOF, "", 0, null));
            return tokens;
        }

        private void scanToken() {
            char c = advance();
            if (Character.isWhitespace(c)) return;

            if (isDigit(c)) {
                while (isDigit(peek())) advance();
                String text = source.substring(start, current);
                tokens.add(new Token(TokenType.NUMBER, text, Long.parseLong(text), null));
                return;
            }

            switch (c) {
                case '+': case '-': case '*': case '/':
                    tokens.add(new Token(TokenType.OPERATOR, String.valueOf(c), 0, null));
                    return;
                case '(':
                    tokens.add(new Token(TokenType.LEFT_PAREN, "(", 0, null));
                    return;
                case ')':
                    tokens.add(new Token(TokenType.RIGHT_PAREN, ")", 0, null));
                    return;
                case '$':
                    variable();
                    return;
                case '@':
                    while (isWord(peek()) || peek() == '.') advance();
                    tokens.add(new Token(TokenType.PLACEHOLDER, source.substring(start + 1, current), 0, null));
                    return;
                default:
                    break;
            }

            if (c == 'd' && source.startsWith("ice:", current)) {
                current += 4;
                int exprStart = current;
                while (!isAtEnd() && !isDiceTerminator(peek())) advance();
                tokens.add(new Token(TokenType.DICE, source.substring(exprStart, current), 0, null));
            }
            // anything else is skipped
        }

        private void variable() {
            while (isWord(peek())) advance();
            String name = source.substring(start + 1, current);

            List<String> properties = new ArrayList<>();
            while (peek() == '.' && peekNext() == '@') {
                current += 2;
                int propStart = current;
                while (isWord(peek())) advance();
                if (current > propStart) properties.add(source.substring(propStart, current));
            }

            if (!properties.isEmpty()) {
                tokens.add(new Token(TokenType.CAPTURE_ACCESS, name, 0, properties));
            } else {
                tokens.add(new Token(TokenType.VARIABLE, name, 0, null));
            }
        }

        private boolean isAtEnd() { return current >= source.length(); }
        private char advance() { return source.charAt(current++); }
        private char peek() { return isAtEnd() ? '\0' : source.charAt(current); }
        private char peekNext() { return current + 1 >= source.length() ? '\0' : source.charAt(current + 1); }

        private static boolean isDigit(char c) { return c >= '0' && c <= '9'; }
        private static boolean isWord(char c) { return Character.isLetterOrDigit(c) && c < 128 || c == '_'; }
        private static boolean isDiceTerminator(char c) {
            return Character.isWhitespace(c) || c == '+' || c == '-' || c == '*' || c == '/' || c == '(' || c == ')';
        }
    }

    // ===================== PARSER =====================

    private final class Parser {
        private final List<Token> tokens;
        private final GenerationContext context;
        private int current = 0;

        Parser(List<Token> tokens, GenerationContext context) {
            this.tokens = tokens;
            this.context = context;
        }

        long parse() {
            long result = expression();
            if (!isAtEnd()) {
                throw new RuntimeException("Unexpected token: " + peek().lexeme);
            }
            return result;
        }

        private long expression() {
            long left = term();
            while (matchOperator('+', '-')) {
                char op = previous().lexeme.charAt(0);
                long right = term();
                left = op == '+' ? Math.addExact(left, right) : Math.subtractExact(left, right);
            }
            return left;
        }

        private long term() {
            long left = factor();
            while (matchOperator('*', '/')) {
                char op = previous().lexeme.charAt(0);
                long right = factor();
                if (op == '*') {
                    left = Math.multiplyExact(left, right);
                } else if (right == 0) {
                    Debug.get().w(TAG, "Division by zero in math expression, returning 0");
                    left = 0;
                } else {
                    left = left / right; // Java long division truncates toward zero
                }
            }
            return left;
        }

        private long factor() {
            if (matchOperator('-')) {
                return Math.negateExact(factor());
            }
            if (match(TokenType.LEFT_PAREN)) {
                long result = expression();
                consume(TokenType.RIGHT_PAREN, "Expect ')' after expression.");
                return result;
            }
            return primary();
        }

        private long primary() {
            if (isAtEnd()) throw new RuntimeException("Unexpected end of expression");
            Token token = advance();
            switch (token.type) {
                case NUMBER:
                    return token.number;
                case VARIABLE:
                    return coerce(context.resolveVariable(token.lexeme), "$" + token.lexeme);
                case PLACEHOLDER: {
                    String[] parts = token.lexeme.split("\\.", -1);
                    String prop = parts.length > 1 ? parts[1] : null;
                    return coerce(context.getPlaceholder(parts[0], prop), "@" + token.lexeme);
                }
                case DICE:
                    return dice.roll(token.lexeme, context.config().maxExplodingDice).total;
                case CAPTURE_ACCESS:
                    return captureAccess(token.lexeme, token.properties);
                default:
                    throw new RuntimeException("Unexpected token type: " + token.type);
            }
        }

        private long captureAccess(String varName, List<String> properties) {
            CaptureItem item = context.getSharedVariable(varName);
            if (item == null) {
                Debug.get().w(TAG, "Capture variable not found: $" + varName);
                return 0;
            }
            String path = "$" + varName;
            for (int i = 0; i < properties.size(); i++) {
                path += ".@" + properties.get(i);
                Object value = item.sets.get(properties.get(i));
                if (value == null) {
                    Debug.get().w(TAG, "Property not found: " + path);
                    return 0;
                }
                if (i == properties.size() - 1) {
                    return coerce(CaptureItem.textOf(value), path);
                }
                if (!(value instanceof CaptureItem)) {
                    Debug.get().w(TAG, "Cannot chain through string property: " + path);
                    return 0;
                }
                item = (CaptureItem) value;
            }
            return 0;
        }

        private long coerce(String value, String source) {
            if (value == null) {
                Debug.get().w(TAG, "Undefined value for " + source + ", using 0");
                return 0;
            }
            Long n = parseLeadingInt(value);
            if (n == null) {
                Debug.get().w(TAG, "Non-numeric value \"" + value + "\" for " + source + ", using 0");
                return 0;
            }
            return n;
        }

        private boolean matchOperator(char... ops) {
            if (peek().type != TokenType.OPERATOR) return false;
            char c = peek().lexeme.charAt(0);
            for (char op : ops) {
                if (c == op) {
                    advance();
                    return true;
                }
            }
            return false;
        }

        private boolean match(TokenType type) {
            if (peek().type != type) return false;
            advance();
            return true;
        }

        private Token consume(TokenType type, String message) {
            if (peek().type == type) return advance();
            throw new RuntimeException(message);
        }

        private Token advance() {
            if (!isAtEnd()) current++;
            return previous();
        }

        private boolean isAtEnd() { return peek().type == TokenType.EOF; }
        private Token peek() { return tokens.get(current); }
        private Token previous() { return tokens.get(current - 1); }
    }
}
