/*
 * This file is part of NatNorm.
 * Copyright (c) 2023 Tobias Meggendorfer.
 *
 * NatNorm is free software: you can redistribute it and/or modify
 * it under the terms of the GNU General Public License as published by
 * the Free Software Foundation, version 3.
 *
 * NatNorm is distributed in the hope that it will be useful, but
 * WITHOUT ANY WARRANTY; without even the implied warranty of
 * MERCHANTABILITY or FITNESS FOR A PARTICULAR PURPOSE. See the GNU
 * General Public License for more details.
 *
 * You should have received a copy of the GNU General Public License
 * along with NatNorm. If not, see <http://www.gnu.org/licenses/>.
 */
package de.tum.in.natnorm;

import java.math.BigInteger;

/**
 * Parses the infix surface syntax of terms: natural number literals, identifiers, the binary
 * operators {@code + - * ^} and parentheses. {@code ^} binds strongest and is right associative,
 * {@code *} binds stronger than {@code +} and {@code -}, which are left associative. Identifiers are
 * resolved through a {@link Variables} pool, creating variables on first use.
 */
public final class TermParser {
    private final String input;
    private final Variables variables;
    private int position = 0;

    private TermParser(String input, Variables variables) {
        this.input = input;
        this.variables = variables;
    }

    public static Term parse(String input, Variables variables) throws InvalidFormatException {
        TermParser parser = new TermParser(input, variables);
        Term term = parser.parseSum();
        parser.skipWhitespace();
        if (parser.position < input.length()) {
            throw parser.error("Unexpected character '" + input.charAt(parser.position) + "'");
        }
        return term;
    }

    private Term parseSum() throws InvalidFormatException {
        Term term = parseProduct();
        while (true) {
            if (accept('+')) {
                term = Term.add(term, parseProduct());
            } else if (accept('-')) {
                term = Term.subtract(term, parseProduct());
            } else {
                return term;
            }
        }
    }

    private Term parseProduct() throws InvalidFormatException {
        Term term = parsePower();
        while (accept('*')) {
            term = Term.multiply(term, parsePower());
        }
        return term;
    }

    private Term parsePower() throws InvalidFormatException {
        Term base = parseAtom();
        if (accept('^')) {
            return Term.power(base, parsePower());
        }
        return base;
    }

    private Term parseAtom() throws InvalidFormatException {
        skipWhitespace();
        if (position >= input.length()) {
            throw error("Unexpected end of input");
        }
        char current = input.charAt(position);
        if (current == '(') {
            position += 1;
            Term term = parseSum();
            if (!accept(')')) {
                throw error("Expected ')'");
            }
            return term;
        }
        if (isDigit(current)) {
            int start = position;
            while (position < input.length() && isDigit(input.charAt(position))) {
                position += 1;
            }
            return Term.constant(new BigInteger(input.substring(start, position)));
        }
        if (isIdentifierStart(current)) {
            int start = position;
            while (position < input.length() && isIdentifierPart(input.charAt(position))) {
                position += 1;
            }
            return Term.variable(variables.get(input.substring(start, position)));
        }
        throw error("Unexpected character '" + current + "'");
    }

    private boolean accept(char expected) {
        skipWhitespace();
        if (position < input.length() && input.charAt(position) == expected) {
            position += 1;
            return true;
        }
        return false;
    }

    private void skipWhitespace() {
        while (position < input.length() && Character.isWhitespace(input.charAt(position))) {
            position += 1;
        }
    }

    private InvalidFormatException error(String message) {
        return new InvalidFormatException(String.format("%s at position %d in \"%s\"", message, position, input));
    }

    private static boolean isDigit(char character) {
        return '0' <= character && character <= '9';
    }

    // Identifiers are plain ASCII: [A-Za-z_][A-Za-z0-9_']*
    private static boolean isIdentifierStart(char character) {
        return ('a' <= character && character <= 'z') || ('A' <= character && character <= 'Z') || character == '_';
    }

    private static boolean isIdentifierPart(char character) {
        return isIdentifierStart(character) || isDigit(character) || character == '\'';
    }
}
