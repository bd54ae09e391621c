package io.github.cyfko.proplogic.core.table;

import io.github.cyfko.proplogic.core.model.TruthTable;
import io.github.cyfko.proplogic.core.model.TruthTableRow;

import java.util.ArrayList;
import java.util.List;

/**
 * Plain-text rendering of a {@link TruthTable} for consoles and logs.
 *
 * <pre>
 * P | Q | Result
 * --+---+-------
 * T | T | T
 * T | F | F
 * F | T | F
 * F | F | F
 * </pre>
 * <p>
 * Values render as {@code T}/{@code F}; rows that failed to evaluate show {@code ERR} in the result
 * column. Each column is as wide as the longer of its header and its cells. Lines are separated by
 * {@code '\n'}.
 * </p>
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
public final class TruthTableRenderer {

    static final String RESULT_HEADER = "Result";
    static final String ERROR_CELL = "ERR";

    private TruthTableRenderer() {}

    public static String render(TruthTable table) {
        List<String> headers = new ArrayList<>(table.variables().names());
        headers.add(RESULT_HEADER);

        List<String> lines = new ArrayList<>(table.rowCount() + 2);
        lines.add(line(headers, headers));

        List<String> separators = new ArrayList<>(headers.size());
        for (String header : headers) {
            separators.add("-".repeat(header.length()));
        }
        lines.add(String.join("-+-", separators));

        for (TruthTableRow row : table.rows()) {
            List<String> cells = new ArrayList<>(headers.size());
            for (Boolean value : row.values()) {
                cells.add(cell(value));
            }
            cells.add(row.hasError() ? ERROR_CELL : cell(row.result()));
            lines.add(line(cells, headers));
        }
        return String.join("\n", lines);
    }

    private static String cell(Boolean value) {
        return value ? "T" : "F";
    }

    private static String line(List<String> cells, List<String> headers) {
        List<String> padded = new ArrayList<>(cells.size());
        for (int i = 0; i < cells.size(); i++) {
            int width = Math.max(headers.get(i).length(), cells.get(i).length());
            padded.add(i == cells.size() - 1 ? cells.get(i) : pad(cells.get(i), width));
        }
        return String.join(" | ", padded);
    }

    private static String pad(String text, int width) {
        return text + " ".repeat(width - text.length());
    }
}
