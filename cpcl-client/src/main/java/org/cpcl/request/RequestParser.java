/*
 * Licensed to the Apache Software Foundation (ASF) under one
 * or more contributor license agreements.  See the NOTICE file
 * distributed with this work for additional information
 * regarding copyright ownership.  The ASF licenses this file
 * to you under the Apache License, Version 2.0 (the
 * "License"); you may not use this file except in compliance
 * with the License.  You may obtain a copy of the License at
 *
 *   http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing,
 * software distributed under the License is distributed on an
 * "AS IS" BASIS, WITHOUT WARRANTIES OR CONDITIONS OF ANY
 * KIND, either express or implied.  See the License for the
 * specific language governing permissions and limitations
 * under the License.
 */

package org.cpcl.request;

import org.cpcl.exception.CpclInvalidPatternException;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Parses request strings.
 *
 * <p>Supported patterns:
 * <ul>
 *   <li>{@code family.key}</li>
 *   <li>{@code family.key:col1,col2,coln}</li>
 *   <li>{@code family.key:col1-col2}</li>
 *   <li>{@code family.key:col1-col2|100}</li>
 *   <li>{@code family.key|100R}</li>
 *   <li>{@code family.key.super:col1,col2}</li>
 *   <li>{@code family\.name.key\:name:col\.1,col\|2|100}</li>
 * </ul>
 *
 * <p>The characters {@code . : , - |} are escaped with a backslash when they are part of a name.
 */
public final class RequestParser {

    private static final char[] TOKENS = {'.', ':', ',', '-', '|'};
    private static final char PLACEHOLDER_BASE = '\uE000';

    // family . key ( .super | [] )? ( :columns )? ( |count R? )?
    private static final Pattern REQUEST =
            Pattern.compile("^(.+?)\\.(.+?)(?:\\.(.*?)|\\[\\])??(?::(.*?))??(?:\\|(\\d*?)(R)??)??$", Pattern.DOTALL);

    private final int defaultColumnCount;

    public RequestParser(int defaultColumnCount) {
        this.defaultColumnCount = defaultColumnCount;
    }

    /**
     * Parses a request string.
     *
     * @param request the request string
     * @return the parsed parts
     * @throws CpclInvalidPatternException if the string does not follow the request syntax
     */
    public ParsedRequest parse(String request) {
        if (request == null) {
            throw new CpclInvalidPatternException("Invalid get request null provided", null);
        }
        Matcher matcher = REQUEST.matcher(protect(request));
        if (!matcher.matches()) {
            throw new CpclInvalidPatternException("Invalid get request \"" + request + "\" provided", request);
        }

        String superColumn = matcher.group(3);
        String columnPart = matcher.group(4);
        String countPart = matcher.group(5);

        List<String> columns = null;
        String startColumn = null;
        String endColumn = null;

        if (columnPart != null && !columnPart.isEmpty()) {
            if (columnPart.indexOf(',') >= 0) {
                columns = new ArrayList<>();
                for (String column : columnPart.split(",", -1)) {
                    columns.add(restore(column.trim()));
                }
            } else if (columnPart.indexOf('-') >= 0) {
                String[] bounds = columnPart.split("-", -1);
                if (bounds.length > 2) {
                    throw new CpclInvalidPatternException(
                            "Expected no more than 2 columns to define a range", request);
                }
                startColumn = restore(bounds[0].trim());
                endColumn = restore(bounds[1].trim());
            } else {
                columns = List.of(restore(columnPart.trim()));
            }
        }

        int columnCount = defaultColumnCount;
        if (countPart != null && !countPart.isEmpty()) {
            try {
                columnCount = Integer.parseInt(countPart);
            } catch (NumberFormatException e) {
                throw new CpclInvalidPatternException("Column count " + countPart + " is out of range", request);
            }
        }

        return new ParsedRequest(
                restore(matcher.group(1)),
                restore(matcher.group(2)),
                superColumn == null || superColumn.isEmpty() ? null : restore(superColumn),
                columns == null ? null : List.copyOf(columns),
                startColumn,
                endColumn,
                matcher.group(6) != null,
                columnCount);
    }

    /**
     * Escapes the request syntax characters of a name.
     *
     * @param value the raw name
     * @return the escaped name
     */
    public static String escape(String value) {
        if (value == null || value.isEmpty()) {
            return value;
        }
        StringBuilder escaped = new StringBuilder(value.length() + 8);
        for (int i = 0; i < value.length(); i++) {
            char c = value.charAt(i);
            if (tokenIndex(c) >= 0) {
                escaped.append('\\');
            }
            escaped.append(c);
        }
        return escaped.toString();
    }

    /**
     * Removes the escaping added by {@link #escape(String)}.
     *
     * @param value the escaped name
     * @return the raw name
     */
    public static String unescape(String value) {
        if (value == null || value.isEmpty()) {
            return value;
        }
        return restore(protect(value));
    }

    /**
     * Finds the first dot that is not escaped.
     *
     * @param value the escaped text
     * @return the index of the dot, or -1 when there is none
     */
    public static int indexOfUnescapedDot(String value) {
        if (value == null) {
            return -1;
        }
        for (int i = 0; i < value.length(); i++) {
            char c = value.charAt(i);
            if (c == '\\') {
                i++;
            } else if (c == '.') {
                return i;
            }
        }
        return -1;
    }

    private static String protect(String value) {
        StringBuilder protectedValue = new StringBuilder(value.length());
        for (int i = 0; i < value.length(); i++) {
            char c = value.charAt(i);
            if (c == '\\' && i + 1 < value.length() && tokenIndex(value.charAt(i + 1)) >= 0) {
                protectedValue.append((char) (PLACEHOLDER_BASE + tokenIndex(value.charAt(i + 1))));
                i++;
            } else {
                protectedValue.append(c);
            }
        }
        return protectedValue.toString();
    }

    private static String restore(String value) {
        StringBuilder restored = new StringBuilder(value.length());
        for (int i = 0; i < value.length(); i++) {
            char c = value.charAt(i);
            int index = c - PLACEHOLDER_BASE;
            restored.append(index >= 0 && index < TOKENS.length ? TOKENS[index] : c);
        }
        return restored.toString();
    }

    private static int tokenIndex(char c) {
        for (int i = 0; i < TOKENS.length; i++) {
            if (TOKENS[i] == c) {
                return i;
            }
        }
        return -1;
    }
}
