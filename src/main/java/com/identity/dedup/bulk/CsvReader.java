package com.identity.dedup.bulk;

import java.io.BufferedReader;
import java.io.IOException;
import java.util.ArrayList;
import java.util.List;

/**
 * Minimal RFC-4180 record reader: comma separated, double-quote quoting with
 * {@code ""} escapes, quoted fields may span lines.
 */
final class CsvReader {

    private final BufferedReader reader;
    private long lineNumber;
    private long recordStartLine;

    CsvReader(BufferedReader reader) {
        this.reader = reader;
    }

    /**
     * Reads the next record, or returns null at end of input.
     */
    List<String> next() throws IOException {
        String line = reader.readLine();
        if (line == null) {
            return null;
        }
        lineNumber++;
        recordStartLine = lineNumber;

        List<String> fields = new ArrayList<>();
        StringBuilder field = new StringBuilder();
        boolean quoted = false;
        int i = 0;
        while (true) {
            if (i >= line.length()) {
                if (!quoted) {
                    break;
                }
                String continuation = reader.readLine();
                if (continuation == null) {
                    break;
                }
                lineNumber++;
                field.append('\n');
                line = continuation;
                i = 0;
                continue;
            }
            char c = line.charAt(i);
            if (quoted) {
                if (c == '"') {
                    if (i + 1 < line.length() && line.charAt(i + 1) == '"') {
                        field.append('"');
                        i++;
                    } else {
                        quoted = false;
                    }
                } else {
                    field.append(c);
                }
            } else if (c == '"') {
                quoted = true;
            } else if (c == ',') {
                fields.add(field.toString());
                field.setLength(0);
            } else {
                field.append(c);
            }
            i++;
        }
        fields.add(field.toString());
        return fields;
    }

    /**
     * Line on which the last returned record started.
     */
    long recordLine() {
        return recordStartLine;
    }

    static boolean isBlank(List<String> record) {
        return record.size() == 1 && record.get(0).isBlank();
    }

    static String escape(String value) {
        if (value == null) {
            return "";
        }
        if (value.indexOf(',') >= 0 || value.indexOf('"') >= 0 || value.indexOf('\n') >= 0
                || value.indexOf('\r') >= 0) {
            return '"' + value.replace("\"", "\"\"") + '"';
        }
        return value;
    }
}
