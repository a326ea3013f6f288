package com.checklist.rule.expression;

import com.checklist.exception.LexException;
import com.checklist.rule.BooleanLiteral;
import com.checklist.rule.CeeScore;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import static com.checklist.rule.expression.RuleSyntax.*;

/**
 * Tokenizer for scoring and skip rules.
 * Converts input string into a sequence of tokens ending with {@link TokenType#EOF}.
 */
public final class RuleTokenizer {

    private final String input;
    private final int length;
    private int pos;

    public RuleTokenizer(String input) {
        this.input = input;
        this.length = input.length();
        this.pos = 0;
    }

    /**
     * Tokenize the input string.
     *
     * @return Unmodifiable list of tokens
     */
    public List<Token> tokenize() {
        List<Token> tokens = new ArrayList<>();

        while (!isAtEnd()) {
            char c = peek();

            if (isWhitespace(c)) {
                advance();
                continue;
            }

            int start = pos;

            switch (c) {
                case Operators.COMMA -> {
                    advance();
                    tokens.add(new Token(TokenType.COMMA, ",", null, start));
                }
                case Operators.SEMI -> {
                    advance();
                    tokens.add(new Token(TokenType.SEMI, ";", null, start));
                }
                case Operators.MINUS -> {
                    advance();
                    tokens.add(new Token(TokenType.RANGE, "-", null, start));
                }
                case Operators.HASH -> {
                    advance();
                    tokens.add(new Token(TokenType.SELECTION, "#", null, start));
                }
                case Operators.PERCENT -> {
                    advance();
                    tokens.add(new Token(TokenType.PERCENT, "%", null, start));
                }
                case Operators.EQUALS -> {
                    advance();
                    if (match(Operators.LESS)) {
                        tokens.add(new Token(TokenType.LE, "=<", null, start));
                    } else {
                        tokens.add(new Token(TokenType.EQUAL, "=", null, start));
                    }
                }
                case Operators.GREATER -> {
                    advance();
                    if (match(Operators.EQUALS)) {
                        tokens.add(new Token(TokenType.GE, ">=", null, start));
                    } else {
                        tokens.add(new Token(TokenType.GT, ">", null, start));
                    }
                }
                case Operators.LESS -> {
                    advance();
                    tokens.add(new Token(TokenType.LT, "<", null, start));
                }
                case Operators.GREATER_OR_EQUAL -> {
                    advance();
                    tokens.add(new Token(TokenType.GE, String.valueOf(c), null, start));
                }
                case Operators.LESS_OR_EQUAL -> {
                    advance();
                    tokens.add(new Token(TokenType.LE, String.valueOf(c), null, start));
                }
                default -> {
                    if (isLetter(c)) {
                        tokens.add(readWord());
                    } else if (isDigit(c)) {
                        tokens.add(readDigits());
                    } else {
                        throw new LexException(input, start, c);
                    }
                }
            }
        }

        tokens.add(new Token(TokenType.EOF, "", null, pos));
        return Collections.unmodifiableList(tokens);
    }

    private Token readWord() {
        int start = pos;

        // Q5 is a question reference, not the word "Q" followed by digits
        if (peek() == QUESTION_PREFIX && pos + 1 < length && isDigit(input.charAt(pos + 1))) {
            advance();
            int number = scanInt(pos);
            if (isAtEnd() || !isLetter(peek())) {
                return new Token(TokenType.QUESTION, input.substring(start, pos), number, start);
            }
            pos = start;
        }

        while (!isAtEnd() && (isLetter(peek()) || isDigit(peek()))) {
            advance();
        }

        String text = input.substring(start, pos);
        TokenType keywordType = KEYWORDS.get(text);
        if (keywordType == null) {
            return new Token(TokenType.WORD, text, null, start);
        }

        Object literal = switch (keywordType) {
            case BOOLEAN -> BooleanLiteral.fromSymbol(text).orElseThrow();
            case CEE_SCORE -> CeeScore.fromLabel(text).orElseThrow();
            default -> null;
        };
        return new Token(keywordType, text, literal, start);
    }

    private Token readDigits() {
        int start = pos;
        int value = scanInt(start);
        return new Token(TokenType.DIGITS, input.substring(start, pos), value, start);
    }

    private int scanInt(int start) {
        while (!isAtEnd() && isDigit(peek())) {
            advance();
        }
        String digits = input.substring(start, pos);
        try {
            return Integer.parseInt(digits);
        } catch (NumberFormatException e) {
            throw new LexException("Number too large '" + digits + "'", input, start, input.charAt(start));
        }
    }

    private boolean isWhitespace(char c) {
        return c == ' ' || c == '\t' || c == '\r' || c == '\n';
    }

    private boolean isLetter(char c) {
        return (c >= 'a' && c <= 'z') || (c >= 'A' && c <= 'Z');
    }

    private boolean isDigit(char c) {
        return c >= '0' && c <= '9';
    }

    private char advance() {
        return input.charAt(pos++);
    }

    private boolean match(char expected) {
        if (isAtEnd() || input.charAt(pos) != expected) {
            return false;
        }
        pos++;
        return true;
    }

    private char peek() {
        return input.charAt(pos);
    }

    private boolean isAtEnd() {
        return pos >= length;
    }
}
