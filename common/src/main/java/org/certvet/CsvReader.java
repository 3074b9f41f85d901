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

package org.certvet;

import java.io.BufferedReader;
import java.io.Closeable;
import java.io.IOException;
import java.io.Reader;
import java.util.ArrayList;
import java.util.List;

/**
 * Reads RFC 4180 comma separated records: fields may be quoted, quoted fields may contain
 * commas, line breaks and doubled quotes.
 */
final class CsvReader implements Closeable {
    private final BufferedReader in;
    private final String source;
    private int line = 1;
    private int recordLine;

    CsvReader(Reader reader, String source) {
        this.in = reader instanceof BufferedReader
                ? (BufferedReader) reader : new BufferedReader(reader);
        this.source = source;
    }

    /** Line on which the record last returned by {@link #read()} starts. */
    int getRecordLine() {
        return recordLine;
    }

    String getSource() {
        return source;
    }

    /**
     * Returns the next record, or {@code null} at end of input. Blank lines are skipped.
     */
    List<String> read() throws IOException {
        int c = in.read();
        while (c == '\n' || c == '\r') {
            if (c == '\n') {
                line++;
            }
            c = in.read();
        }
        if (c == -1) {
            return null;
        }
        recordLine = line;

        List<String> fields = new ArrayList<String>();
        StringBuilder field = new StringBuilder();
        boolean quoted = false;
        boolean fieldStart = true;
        while (true) {
            if (quoted) {
                if (c == -1) {
                    throw new TrustStoreLoadException(source, recordLine,
                            "unterminated quoted field");
                }
                if (c == '"') {
                    in.mark(1);
                    int next = in.read();
                    if (next == '"') {
                        field.append('"');
                    } else {
                        quoted = false;
                        in.reset();
                    }
                } else {
                    if (c == '\n') {
                        line++;
                    }
                    field.append((char) c);
                }
            } else if (c == '"' && fieldStart) {
                quoted = true;
                fieldStart = false;
            } else if (c == ',') {
                fields.add(field.toString());
                field.setLength(0);
                fieldStart = true;
            } else if (c == '\n' || c == '\r' || c == -1) {
                if (c == '\r') {
                    in.mark(1);
                    if (in.read() != '\n') {
                        in.reset();
                    }
                }
                if (c != -1) {
                    line++;
                }
                fields.add(field.toString());
                return fields;
            } else {
                if (c == '"') {
                    throw new TrustStoreLoadException(source, line,
                            "bare \" in non-quoted field");
                }
                field.append((char) c);
                fieldStart = false;
            }
            c = in.read();
        }
    }

    @Override
    public void close() throws IOException {
        in.close();
    }
}
