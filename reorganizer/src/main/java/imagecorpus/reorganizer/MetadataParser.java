package imagecorpus.reorganizer;

import java.io.Closeable;
import java.io.IOException;
import java.io.Reader;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Arrays;
import java.util.Iterator;
import java.util.List;
import java.util.Locale;
import java.util.NoSuchElementException;
import org.apache.commons.csv.CSVFormat;
import org.apache.commons.csv.CSVParser;
import org.apache.commons.csv.CSVRecord;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Streams {@link MetadataRecord}s out of a tabular metadata file.
 * <p>
 * The file must start with a header naming exactly the four columns
 * {@code filename, base_model, model_name, model_type} (any order, any case). Rows with a different
 * number of cells, or with a blank filename, are skipped and counted in {@link #getMalformedRows()}.
 * A row the CSV tokenizer cannot read (stray or unterminated quotes) is counted as malformed and ends
 * the stream, since the rest of the file cannot be split reliably after it.
 * Records are produced lazily, so the counters are final only once iteration is complete.
 * <p>
 * Comma separated by default; {@code .tsv} and {@code .tab} files are read as tab separated.
 */
public final class MetadataParser implements Closeable, Iterable<MetadataRecord> {

    private static final Logger log = LoggerFactory.getLogger(MetadataParser.class);

    static final List<String> COLUMNS = List.of("filename", "base_model", "model_name", "model_type");

    private final Path source;
    private final Reader reader;
    private final CSVParser parser;
    private final Iterator<CSVRecord> rows;
    // position of filename, base_model, model_name, model_type within a row
    private final int[] columnIndex;
    private boolean iterated;
    private boolean truncated;
    private long parsedRecords;
    private long malformedRows;

    private MetadataParser(Path source, Reader reader, CSVParser parser) {
        this.source = source;
        this.reader = reader;
        this.parser = parser;
        this.rows = parser.iterator();
        this.columnIndex = readHeader();
    }

    /**
     * Open a metadata file and validate its header.
     *
     * @throws IllegalArgumentException if the header is missing or does not name the four expected columns
     * @throws IOException              if the file cannot be read
     */
    public static MetadataParser open(Path metadataFile) throws IOException {
        if (!Files.isRegularFile(metadataFile)) {
            throw new IllegalArgumentException("Metadata file not found: " + metadataFile);
        }
        Reader reader = Files.newBufferedReader(metadataFile, StandardCharsets.UTF_8);
        try {
            CSVParser parser = formatFor(metadataFile).parse(reader);
            return new MetadataParser(metadataFile, reader, parser);
        } catch (IOException | RuntimeException e) {
            reader.close();
            throw e;
        }
    }

    static CSVFormat formatFor(Path metadataFile) {
        String name = metadataFile.getFileName().toString().toLowerCase(Locale.ROOT);
        char delimiter = name.endsWith(".tsv") || name.endsWith(".tab") ? '\t' : ',';
        return CSVFormat.DEFAULT.builder()
            .setDelimiter(delimiter)
            .setIgnoreEmptyLines(true)
            .build();
    }

    private int[] readHeader() {
        CSVRecord header;
        try {
            if (!rows.hasNext()) {
                throw new IllegalArgumentException("Metadata file has no header row: " + source);
            }
            header = rows.next();
        } catch (UncheckedIOException e) {
            throw new IllegalArgumentException("Unreadable metadata header in " + source + ": "
                + e.getCause().getMessage(), e);
        }
        if (header.size() != COLUMNS.size()) {
            throw new IllegalArgumentException("Metadata header must have " + COLUMNS.size()
                + " columns " + COLUMNS + " but has " + header.size() + " in " + source);
        }
        int[] index = new int[COLUMNS.size()];
        Arrays.fill(index, -1);
        for (int i = 0; i < header.size(); i++) {
            String name = header.get(i).replace("\uFEFF", "").trim().toLowerCase(Locale.ROOT);
            int column = COLUMNS.indexOf(name);
            if (column < 0 || index[column] >= 0) {
                throw new IllegalArgumentException("Unexpected metadata header '" + header.get(i)
                    + "' in " + source + "; expected " + COLUMNS);
            }
            index[column] = i;
        }
        return index;
    }

    /** Single-use: the records come straight off the underlying reader. */
    @Override
    public Iterator<MetadataRecord> iterator() {
        if (iterated) {
            throw new IllegalStateException("Metadata records can only be iterated once");
        }
        iterated = true;
        return new Iterator<>() {
            private MetadataRecord next;

            @Override
            public boolean hasNext() {
                while (next == null && nextRow()) {
                    next = toRecord(rows.next());
                }
                return next != null;
            }

            @Override
            public MetadataRecord next() {
                if (!hasNext()) throw new NoSuchElementException();
                MetadataRecord r = next;
                next = null;
                return r;
            }
        };
    }

    private boolean nextRow() {
        if (truncated) {
            return false;
        }
        try {
            return rows.hasNext();
        } catch (UncheckedIOException e) {
            truncated = true;
            malformedRows++;
            log.warn("Stopped reading {} at line {}: {}; later rows are ignored",
                source.getFileName(), parser.getCurrentLineNumber(), e.getCause().getMessage());
            return false;
        }
    }

    private MetadataRecord toRecord(CSVRecord row) {
        long rowNumber = row.getRecordNumber();
        if (row.size() != COLUMNS.size()) {
            malformedRows++;
            log.warn("Skipping row {} of {}: expected {} cells, found {}",
                rowNumber, source.getFileName(), COLUMNS.size(), row.size());
            return null;
        }
        String filename = row.get(columnIndex[0]).trim();
        if (filename.isEmpty()) {
            malformedRows++;
            log.warn("Skipping row {} of {}: blank filename", rowNumber, source.getFileName());
            return null;
        }
        parsedRecords++;
        return new MetadataRecord(filename,
            row.get(columnIndex[1]),
            row.get(columnIndex[2]),
            row.get(columnIndex[3]),
            rowNumber);
    }

    public long getParsedRecords() { return parsedRecords; }
    public long getMalformedRows() { return malformedRows; }

    /** True when reading stopped early at a row that could not be tokenized. */
    public boolean isTruncated() { return truncated; }

    @Override
    public void close() throws IOException {
        try {
            parser.close();
        } finally {
            reader.close();
        }
    }
}
