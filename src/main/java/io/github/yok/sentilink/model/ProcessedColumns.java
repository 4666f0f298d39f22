package io.github.yok.sentilink.model;

import com.google.common.collect.ImmutableList;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.List;

/**
 * Names and formats of the columns added to every processed row.
 *
 * @author Yasuharu.Okawauchi
 */
public final class ProcessedColumns {

    public static final String PROCESSED_AT = "processed_at";
    public static final String SENTIMENT = "sentiment";
    public static final String POLARITY = "polarity";
    public static final String SUBJECTIVITY = "subjectivity";

    // Appended in this order
    public static final ImmutableList<String> ALL =
            ImmutableList.of(PROCESSED_AT, SENTIMENT, POLARITY, SUBJECTIVITY);

    // ISO-8601 local date-time, seconds precision
    public static final DateTimeFormatter PROCESSED_AT_FORMAT =
            DateTimeFormatter.ofPattern("yyyy-MM-dd'T'HH:mm:ss");

    private ProcessedColumns() {
        // Constants only.
    }

    /**
     * Returns the column set of a processed dataset: the input columns in their order followed by
     * the processed columns the input does not already have.
     *
     * @param inputColumns input column names
     * @return processed column names
     */
    public static List<String> extend(List<String> inputColumns) {
        List<String> columns = new ArrayList<>(inputColumns);
        for (String column : ALL) {
            if (!columns.contains(column)) {
                columns.add(column);
            }
        }
        return columns;
    }
}
