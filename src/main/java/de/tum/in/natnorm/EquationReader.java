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

import java.io.BufferedReader;
import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Reads equation systems from a simple line based format. Blank lines and lines starting with
 * {@code #} are ignored, every other line has the form {@code given: lhs == rhs} or
 * {@code wanted: lhs == rhs}. The handle of each equation is its (1-based) line number.
 */
public final class EquationReader {
    private static final Pattern EQUATION = Pattern.compile("^(\\w+)\\s*:(.*?)==(.*)$");

    private EquationReader() {}

    public static List<Equation<Integer>> read(BufferedReader reader, Variables variables)
            throws IOException, InvalidFormatException {
        List<Equation<Integer>> equations = new ArrayList<>();
        int lineNumber = 0;
        while (true) {
            String line = reader.readLine();
            if (line == null) {
                break;
            }
            lineNumber += 1;
            String stripped = line.strip();
            if (stripped.isEmpty() || stripped.charAt(0) == '#') {
                continue;
            }
            Matcher matcher = EQUATION.matcher(stripped);
            if (!matcher.matches()) {
                throw new InvalidFormatException("Invalid equation in line " + lineNumber + ": " + line);
            }
            Origin origin;
            try {
                origin = Origin.valueOf(matcher.group(1).toUpperCase(Locale.ROOT));
            } catch (IllegalArgumentException e) {
                throw new InvalidFormatException("Invalid origin in line " + lineNumber + ": " + line, e);
            }
            Term lhs = parse(matcher.group(2), variables, lineNumber);
            Term rhs = parse(matcher.group(3), variables, lineNumber);
            equations.add(Equation.of(lineNumber, origin, lhs, rhs));
        }
        return equations;
    }

    private static Term parse(String text, Variables variables, int lineNumber) throws InvalidFormatException {
        try {
            return TermParser.parse(text, variables);
        } catch (InvalidFormatException e) {
            throw new InvalidFormatException("Invalid term in line " + lineNumber, e);
        }
    }
}
