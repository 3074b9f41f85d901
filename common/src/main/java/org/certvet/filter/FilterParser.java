/*
 * Copyright (C) 2025 The Certvet Authors
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *      http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package org.certvet.filter;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import org.certvet.Platform;
import org.certvet.SemanticVersion;
import org.certvet.Versions;

/**
 * Recursive descent parser for
 * <pre>
 *   filter     := constraint (',' constraint)*
 *   constraint := platform (operator version)?
 * </pre>
 */
final class FilterParser {
    private enum TokenType {
        COMMA,
        OPERATOR,
        PLATFORM,
        VERSION,
        END
    }

    private static final class Token {
        final TokenType type;
        final String text;
        final int offset;

        Token(TokenType type, String text, int offset) {
            this.type = type;
            this.text = text;
            this.offset = offset;
        }
    }

    // Group order is match priority.
    private static final Pattern TOKEN = Pattern.compile(
            "(\\s+)"
            + "|(,)"
            + "|(>=|<=|>|<|=)"
            + "|((?i:\\bios\\b|\\bipados\\b|\\bmacos\\b|\\btvos\\b|\\bvisionos\\b"
            + "|\\bwatchos\\b|\\bandroid\\b|\\bchrome\\b|\\bwindows\\b))"
            + "|(\\d+(?:\\.\\d+)*|current)");

    private final String expression;
    private List<Token> tokens;
    private int pos;

    FilterParser(String expression) {
        this.expression = expression == null ? "" : expression.trim();
    }

    Filter parse() throws FilterSyntaxException {
        if (expression.isEmpty()) {
            throw new FilterSyntaxException("empty filter expression", "");
        }
        tokens = tokenize();
        pos = 0;

        List<FilterConstraint> constraints = new ArrayList<FilterConstraint>();
        constraints.add(parseConstraint());
        while (peek().type == TokenType.COMMA) {
            next();
            constraints.add(parseConstraint());
        }
        Token trailing = peek();
        if (trailing.type != TokenType.END) {
            throw unexpected(trailing, "\",\"");
        }
        return new Filter(constraints);
    }

    private FilterConstraint parseConstraint() throws FilterSyntaxException {
        Token platformToken = next();
        if (platformToken.type != TokenType.PLATFORM) {
            throw unexpected(platformToken, "platform");
        }
        Platform platform = Platform.lookup(platformToken.text);

        Token operatorToken = null;
        if (peek().type == TokenType.OPERATOR) {
            operatorToken = next();
        }
        Token versionToken = null;
        if (peek().type == TokenType.VERSION) {
            versionToken = next();
        }

        if (operatorToken == null && versionToken == null) {
            return FilterConstraint.any(platform);
        }
        if (operatorToken == null) {
            throw new FilterSyntaxException(
                    invalid("missing operator for " + platformToken.text),
                    platformToken.text + " " + versionToken.text);
        }
        if (versionToken == null) {
            throw new FilterSyntaxException(
                    invalid("missing version for " + platformToken.text + operatorToken.text),
                    platformToken.text + operatorToken.text);
        }

        Operator operator = Operator.fromSymbol(operatorToken.text);
        if (Versions.isCurrent(versionToken.text)) {
            return FilterConstraint.ofCurrent(platform, operator);
        }
        SemanticVersion version = SemanticVersion.tryParse(versionToken.text);
        if (version == null) {
            throw new FilterSyntaxException(
                    invalid("invalid version \"" + versionToken.text + "\""),
                    versionToken.text);
        }
        return FilterConstraint.of(platform, operator, version);
    }

    private List<Token> tokenize() throws FilterSyntaxException {
        List<Token> result = new ArrayList<Token>();
        Matcher m = TOKEN.matcher(expression);
        // Word boundaries must see the characters outside the region.
        m.useTransparentBounds(true);
        int offset = 0;
        while (offset < expression.length()) {
            m.region(offset, expression.length());
            if (!m.lookingAt()) {
                throw new FilterSyntaxException(invalid("unexpected character \""
                        + expression.charAt(offset) + "\" at offset " + offset),
                        expression.substring(offset));
            }
            if (m.group(2) != null) {
                result.add(new Token(TokenType.COMMA, m.group(), offset));
            } else if (m.group(3) != null) {
                result.add(new Token(TokenType.OPERATOR, m.group(), offset));
            } else if (m.group(4) != null) {
                result.add(new Token(TokenType.PLATFORM, m.group(), offset));
            } else if (m.group(5) != null) {
                result.add(new Token(TokenType.VERSION, m.group(), offset));
            }
            offset = m.end();
        }
        result.add(new Token(TokenType.END, "", expression.length()));
        return result;
    }

    private Token peek() {
        return tokens.get(pos);
    }

    private Token next() {
        Token t = tokens.get(pos);
        if (t.type != TokenType.END) {
            pos++;
        }
        return t;
    }

    private FilterSyntaxException unexpected(Token token, String expected) {
        if (token.type == TokenType.END) {
            return new FilterSyntaxException(
                    invalid("unexpected end of expression (expected " + expected + ")"),
                    expression);
        }
        return new FilterSyntaxException(invalid("unexpected token \"" + token.text
                + "\" at offset " + token.offset + " (expected " + expected + ")"), token.text);
    }

    private String invalid(String detail) {
        return "invalid filter \"" + expression + "\": " + detail;
    }
}
