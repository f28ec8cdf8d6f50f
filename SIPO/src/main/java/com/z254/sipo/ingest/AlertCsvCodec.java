package com.z254.sipo.ingest;

import com.fasterxml.jackson.databind.MappingIterator;
import com.fasterxml.jackson.databind.ObjectReader;
import com.fasterxml.jackson.databind.ObjectWriter;
import com.fasterxml.jackson.dataformat.csv.CsvMapper;
import com.fasterxml.jackson.dataformat.csv.CsvParser;
import com.fasterxml.jackson.dataformat.csv.CsvSchema;
import com.z254.sipo.domain.model.AlertRecord;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Reads and writes alert CSV files.
 * <p>
 * Expected header: {@code timestamp,device_id,error_code,customer_impact,revenue_risk}.
 * Extra columns are ignored, missing cells read as absent and numeric cells
 * are normalized through {@link AlertNormalizer}.
 */
@Slf4j
@Component
public class AlertCsvCodec {

    private static final CsvSchema WRITE_SCHEMA = CsvSchema.builder()
            .addColumn(AlertNormalizer.TIMESTAMP)
            .addColumn(AlertNormalizer.DEVICE_ID)
            .addColumn(AlertNormalizer.ERROR_CODE)
            .addColumn(AlertNormalizer.CUSTOMER_IMPACT, CsvSchema.ColumnType.NUMBER)
            .addColumn(AlertNormalizer.REVENUE_RISK, CsvSchema.ColumnType.NUMBER)
            .build()
            .withHeader();

    private final ObjectReader rowReader;
    private final ObjectWriter rowWriter;

    public AlertCsvCodec() {
        CsvMapper csvMapper = CsvMapper.builder()
                .enable(CsvParser.Feature.SKIP_EMPTY_LINES)
                .enable(CsvParser.Feature.TRIM_SPACES)
                .enable(CsvParser.Feature.ALLOW_TRAILING_COMMA)
                .enable(CsvParser.Feature.IGNORE_TRAILING_UNMAPPABLE)
                .build();
        this.rowReader = csvMapper.readerForMapOf(String.class)
                .with(CsvSchema.emptySchema().withHeader());
        this.rowWriter = csvMapper.writerFor(AlertRecord.class).with(WRITE_SCHEMA);
    }

    /**
     * Read all alerts from a file.
     *
     * @throws AlertDataNotFoundException if the file does not exist
     * @throws AlertIngestionException if the file cannot be parsed
     */
    public List<AlertRecord> read(Path path) {
        if (!Files.exists(path)) {
            throw new AlertDataNotFoundException(path);
        }
        try (InputStream in = Files.newInputStream(path)) {
            List<AlertRecord> alerts = read(in);
            log.info("Loaded {} alerts from {}", alerts.size(), path);
            return alerts;
        } catch (IOException e) {
            throw new AlertIngestionException("Failed to read alerts from " + path, e);
        }
    }

    /**
     * Read all alerts from a stream, closing it when done.
     */
    public List<AlertRecord> read(InputStream in) {
        List<AlertRecord> alerts = new ArrayList<>();
        try (MappingIterator<Map<String, String>> rows = rowReader.readValues(in)) {
            while (rows.hasNextValue()) {
                alerts.add(AlertNormalizer.fromFields(rows.nextValue()));
            }
        } catch (IOException | RuntimeException e) {
            throw new AlertIngestionException("Failed to parse alert CSV: " + e.getMessage(), e);
        }
        return alerts;
    }

    public List<AlertRecord> read(byte[] content) {
        return read(new ByteArrayInputStream(content));
    }

    /**
     * Write alerts with a header row, replacing the file if present.
     * <p>
     * Rows go to a temporary file in the target directory, which is then moved
     * over the target, so readers see either the old file or the complete new
     * one. On failure the previous file is left unchanged.
     */
    public void write(List<AlertRecord> alerts, Path path) {
        Path target = path.toAbsolutePath();
        try {
            Path parent = target.getParent();
            Files.createDirectories(parent);
            Path staging = Files.createTempFile(parent, target.getFileName() + ".", ".tmp");
            try {
                try (Writer out = Files.newBufferedWriter(staging, StandardCharsets.UTF_8)) {
                    rowWriter.writeValues(out).writeAll(alerts).close();
                }
                replace(staging, target);
            } finally {
                Files.deleteIfExists(staging);
            }
        } catch (IOException e) {
            throw new AlertIngestionException("Failed to write alerts to " + path, e);
        }
        log.info("Wrote {} alerts to {}", alerts.size(), path);
    }

    private static void replace(Path staging, Path target) throws IOException {
        try {
            Files.move(staging, target, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
        } catch (AtomicMoveNotSupportedException e) {
            log.debug("Atomic move not supported for {}, falling back to plain replace", target);
            Files.move(staging, target, StandardCopyOption.REPLACE_EXISTING);
        }
    }
}
