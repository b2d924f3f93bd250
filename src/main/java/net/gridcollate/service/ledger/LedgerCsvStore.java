package net.gridcollate.service.ledger;

import com.fasterxml.jackson.databind.MappingIterator;
import com.fasterxml.jackson.dataformat.csv.CsvMapper;
import com.fasterxml.jackson.dataformat.csv.CsvParser;
import com.fasterxml.jackson.dataformat.csv.CsvSchema;
import java.io.IOException;
import java.io.Reader;
import java.nio.ByteBuffer;
import java.nio.channels.FileChannel;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.util.ArrayList;
import java.util.List;
import net.gridcollate.exception.LedgerException;
import net.gridcollate.model.image.Fingerprint;
import net.gridcollate.model.ledger.LedgerEntry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Append-only CSV backing store for the duplicate ledger.
 *
 * <p>The header row is written only when the file is created. Existing rows are never
 * rewritten or reordered; row order is the chronological history of accepted images.
 * Rows are read by position, so ledgers whose header uses different column titles
 * remain readable.</p>
 */
public class LedgerCsvStore {

    private static final Logger logger = LoggerFactory.getLogger(LedgerCsvStore.class);
    private static final int COLUMN_COUNT = 5;
    private static final byte[] LINE_BREAK = {'\n'};

    private final Path file;
    private final CsvMapper csvMapper;
    private final CsvSchema headerSchema;

    public LedgerCsvStore(Path file) {
        this.file = file;
        this.csvMapper = CsvMapper.builder()
            .enable(CsvParser.Feature.WRAP_AS_ARRAY)
            .enable(CsvParser.Feature.SKIP_EMPTY_LINES)
            .build();
        this.headerSchema = csvMapper.schemaFor(LedgerRow.class);
    }

    public Path getFile() {
        return file;
    }

    /**
     * Reads every historical entry in file order. A missing file is an empty ledger.
     *
     * @throws LedgerException when the file exists but cannot be read or holds a malformed row
     */
    public List<LedgerEntry> readAll() {
        if (!Files.exists(file)) {
            logger.info("No ledger at {}; starting with empty dedup history.", file);
            return List.of();
        }
        List<LedgerEntry> entries = new ArrayList<>();
        try (Reader reader = Files.newBufferedReader(file, StandardCharsets.UTF_8);
             MappingIterator<String[]> rows = csvMapper.readerFor(String[].class).readValues(reader)) {
            boolean header = true;
            int line = 0;
            while (rows.hasNextValue()) {
                String[] row = rows.nextValue();
                line++;
                if (header) {
                    header = false;
                    continue;
                }
                entries.add(parseRow(row, line));
            }
        } catch (LedgerException e) {
            throw e;
        } catch (IOException | RuntimeException e) {
            throw new LedgerException("Failed to read ledger: " + e.getMessage(), file, e);
        }
        logger.info("Loaded {} ledger entries from {}.", entries.size(), file);
        return entries;
    }

    /**
     * Appends entries to the end of the file and forces them to disk.
     *
     * @throws LedgerException when the append cannot be completed
     */
    public void append(List<LedgerEntry> entries) {
        if (entries == null || entries.isEmpty()) {
            return;
        }
        try {
            boolean needsHeader = !Files.exists(file) || Files.size(file) == 0;
            Path parent = file.toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            CsvSchema schema = needsHeader ? headerSchema.withHeader() : headerSchema.withoutHeader();
            List<LedgerRow> rows = entries.stream().map(LedgerRow::from).toList();
            byte[] payload = csvMapper.writer(schema).writeValueAsBytes(rows);
            boolean needsLineBreak = !needsHeader && !endsWithLineBreak();
            if (needsLineBreak) {
                logger.warn("Ledger {} does not end with a line break; terminating its last row before appending.", file);
            }

            try (FileChannel channel = FileChannel.open(file,
                    StandardOpenOption.CREATE, StandardOpenOption.WRITE, StandardOpenOption.APPEND)) {
                if (needsLineBreak) {
                    writeFully(channel, ByteBuffer.wrap(LINE_BREAK));
                }
                writeFully(channel, ByteBuffer.wrap(payload));
                channel.force(true);
            }
            logger.debug("Appended {} ledger entries to {}.", entries.size(), file);
        } catch (IOException | RuntimeException e) {
            throw new LedgerException("Failed to append " + entries.size() + " ledger entries: " + e.getMessage(), file, e);
        }
    }

    private boolean endsWithLineBreak() throws IOException {
        try (FileChannel channel = FileChannel.open(file, StandardOpenOption.READ)) {
            long size = channel.size();
            if (size == 0) {
                return true;
            }
            ByteBuffer last = ByteBuffer.allocate(1);
            channel.read(last, size - 1);
            return last.get(0) == '\n';
        }
    }

    private static void writeFully(FileChannel channel, ByteBuffer buffer) throws IOException {
        while (buffer.hasRemaining()) {
            channel.write(buffer);
        }
    }

    private LedgerEntry parseRow(String[] row, int line) {
        if (row.length != COLUMN_COUNT) {
            throw new LedgerException("Ledger row " + line + " has " + row.length + " columns, expected " + COLUMN_COUNT, file, null);
        }
        try {
            return new LedgerEntry(
                row[0],
                row[1],
                Integer.parseInt(row[2].trim()),
                Fingerprint.fromHex(row[3]),
                row[4]);
        } catch (IllegalArgumentException e) {
            throw new LedgerException("Ledger row " + line + " is malformed: " + e.getMessage(), file, e);
        }
    }
}
