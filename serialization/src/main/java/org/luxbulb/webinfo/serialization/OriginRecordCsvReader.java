package org.luxbulb.webinfo.serialization;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.MappingIterator;
import com.fasterxml.jackson.databind.RuntimeJsonMappingException;
import com.fasterxml.jackson.dataformat.csv.CsvMapper;
import com.fasterxml.jackson.dataformat.csv.CsvParser;
import com.fasterxml.jackson.dataformat.csv.CsvSchema;
import org.jetbrains.annotations.NotNull;
import org.luxbulb.webinfo.models.OriginRecord;

import java.io.Closeable;
import java.io.IOException;
import java.io.Reader;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Iterator;
import java.util.Map;
import java.util.NoSuchElementException;

/**
 * Reads {@link OriginRecord}s from a CSV file with the {@code origin,popularity,date,country} header.
 * <p>
 * Rows that cannot be converted to a record are not skipped silently: they are returned as
 * {@link InputRow#invalid(long, String) invalid rows} so that the caller can report them.
 */
public class OriginRecordCsvReader implements Iterator<InputRow>, Closeable {
    public static final String ORIGIN_COLUMN = "origin";
    public static final String POPULARITY_COLUMN = "popularity";
    public static final String DATE_COLUMN = "date";
    public static final String COUNTRY_COLUMN = "country";

    private static final CsvMapper CSV_MAPPER = new CsvMapper();

    private final Reader _source;
    private final MappingIterator<Map<String, String>> _rows;
    private long _rowIndex = 0;

    private OriginRecordCsvReader(@NotNull Reader source) throws IOException {
        _source = source;
        _rows = CSV_MAPPER.readerForMapOf(String.class)
                .with(CsvSchema.emptySchema().withHeader())
                .with(CsvParser.Feature.TRIM_SPACES)
                .with(CsvParser.Feature.SKIP_EMPTY_LINES)
                .with(CsvParser.Feature.IGNORE_TRAILING_UNMAPPABLE)
                .readValues(source);
    }

    /**
     * Opens a CSV file for reading.
     *
     * @param path The path of the file.
     * @return The reader. The caller is responsible for closing it.
     * @throws IOException If the file cannot be opened.
     */
    public static OriginRecordCsvReader open(@NotNull Path path) throws IOException {
        return new OriginRecordCsvReader(Files.newBufferedReader(path, StandardCharsets.UTF_8));
    }

    /**
     * Creates a CSV reader over an existing character source.
     */
    public static OriginRecordCsvReader of(@NotNull Reader reader) throws IOException {
        return new OriginRecordCsvReader(reader);
    }

    @Override
    public boolean hasNext() {
        try {
            return _rows.hasNextValue();
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }

    @Override
    public InputRow next() {
        if (!hasNext())
            throw new NoSuchElementException();

        // Line 1 is the header
        final var lineNumber = ++_rowIndex + 1;
        try {
            return toInputRow(lineNumber, _rows.nextValue());
        } catch (RuntimeJsonMappingException e) {
            return InputRow.invalid(lineNumber, "Malformed CSV row: " + e.getMessage());
        } catch (JsonProcessingException e) {
            return InputRow.invalid(lineNumber, "Malformed CSV row: " + e.getOriginalMessage());
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }

    static InputRow toInputRow(long lineNumber, @NotNull Map<String, String> row) {
        for (var column : new String[]{ORIGIN_COLUMN, POPULARITY_COLUMN, DATE_COLUMN, COUNTRY_COLUMN}) {
            if (!row.containsKey(column) || row.get(column) == null)
                return InputRow.invalid(lineNumber, "Missing column '%s'".formatted(column));
        }

        final var origin = row.get(ORIGIN_COLUMN);
        if (origin.isBlank())
            return InputRow.invalid(lineNumber, "Empty origin");

        final long popularity;
        try {
            popularity = Long.parseLong(row.get(POPULARITY_COLUMN));
        } catch (NumberFormatException e) {
            return InputRow.invalid(lineNumber, "Invalid popularity '%s'".formatted(row.get(POPULARITY_COLUMN)));
        }

        if (popularity < 0)
            return InputRow.invalid(lineNumber, "Negative popularity " + popularity);

        return InputRow.valid(lineNumber,
                new OriginRecord(origin, popularity, row.get(DATE_COLUMN), row.get(COUNTRY_COLUMN)));
    }

    @Override
    public void close() throws IOException {
        _rows.close();
        _source.close();
    }
}
