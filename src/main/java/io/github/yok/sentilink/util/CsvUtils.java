package io.github.yok.sentilink.util;

import java.io.IOException;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import org.apache.commons.csv.CSVFormat;
import org.apache.commons.csv.CSVPrinter;
import org.apache.commons.csv.QuoteMode;

/**
 * Utility class for reading and writing delimited files.
 *
 * <p>
 * Both directions use Apache Commons CSV with the same delimiter and quote character, so a file
 * written by {@link #writeCsvUtf8(Path, List, List, char)} can be read back with
 * {@link #readFormat(char)}.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
public final class CsvUtils {

    private CsvUtils() {
        // Utility class; do not instantiate.
    }

    /**
     * Returns the format used to read delimited files.
     *
     * <p>
     * The first record is taken as the header and skipped from the data records. Empty lines are
     * ignored.
     * </p>
     *
     * @param delimiter field delimiter
     * @return read format
     */
    public static CSVFormat readFormat(char delimiter) {
        return CSVFormat.DEFAULT.builder().setDelimiter(delimiter).setHeader()
                .setSkipHeaderRecord(true).setIgnoreEmptyLines(true).get();
    }

    /**
     * Writes the given header and row data to a delimited file encoded in UTF-8.
     *
     * <p>
     * The file is written with:
     * </p>
     * <ul>
     * <li>Header row provided by {@code headers}</li>
     * <li>Quote mode: {@link QuoteMode#MINIMAL}</li>
     * <li>{@code null} cells written as empty fields</li>
     * <li>Record separator: {@link System#lineSeparator()}</li>
     * </ul>
     *
     * <p>
     * Missing parent directories are created and an existing file is overwritten.
     * </p>
     *
     * @param csvFile destination file
     * @param headers header columns written as the first record
     * @param rows data rows; each inner list represents one record
     * @param delimiter field delimiter
     * @throws IOException if an I/O error occurs while writing the file
     */
    public static void writeCsvUtf8(Path csvFile, List<String> headers, List<List<Object>> rows,
            char delimiter) throws IOException {
        Path parent = csvFile.toAbsolutePath().getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
        CSVFormat fmt = CSVFormat.DEFAULT.builder().setDelimiter(delimiter)
                .setHeader(headers.toArray(new String[0])).setQuoteMode(QuoteMode.MINIMAL)
                .setRecordSeparator(System.lineSeparator()).get();
        try (Writer w = Files.newBufferedWriter(csvFile, StandardCharsets.UTF_8);
                CSVPrinter printer = new CSVPrinter(w, fmt)) {
            for (List<Object> row : rows) {
                printer.printRecord(row);
            }
        }
    }
}
