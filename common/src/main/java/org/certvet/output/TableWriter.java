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

package org.certvet.output;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * Lays out rows in left aligned columns separated by at least three spaces. The last column
 * is not padded.
 */
public final class TableWriter {
    private static final int PADDING = 3;

    private final List<List<String>> rows = new ArrayList<List<String>>();

    public TableWriter header(String... columns) {
        return row(columns);
    }

    public TableWriter row(String... values) {
        rows.add(Arrays.asList(values));
        return this;
    }

    @Override
    public String toString() {
        if (rows.isEmpty()) {
            return "";
        }
        List<Integer> widths = new ArrayList<Integer>();
        for (List<String> row : rows) {
            for (int i = 0; i < row.size() - 1; i++) {
                int width = width(row.get(i));
                if (widths.size() <= i) {
                    widths.add(width);
                } else if (widths.get(i) < width) {
                    widths.set(i, width);
                }
            }
        }

        StringBuilder sb = new StringBuilder();
        for (List<String> row : rows) {
            if (sb.length() > 0) {
                sb.append('\n');
            }
            for (int i = 0; i < row.size(); i++) {
                String cell = row.get(i) == null ? "" : row.get(i);
                sb.append(cell);
                if (i < row.size() - 1) {
                    for (int pad = width(cell); pad < widths.get(i) + PADDING; pad++) {
                        sb.append(' ');
                    }
                }
            }
        }
        return sb.toString();
    }

    private static int width(String cell) {
        return cell == null ? 0 : cell.codePointCount(0, cell.length());
    }
}
