package com.tbmerch.backoffice.ingestion;

import com.fasterxml.jackson.databind.MappingIterator;
import com.fasterxml.jackson.dataformat.csv.CsvMapper;
import com.fasterxml.jackson.dataformat.csv.CsvParser;
import com.fasterxml.jackson.dataformat.csv.CsvSchema;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.InputStream;
import java.util.List;
import java.util.Map;

/**
 * Reads a CSV export into rows keyed by the header line. All values come back as strings.
 */
@Component
public class CsvRowReader {

    private final CsvMapper csvMapper = CsvMapper.builder()
            .enable(CsvParser.Feature.TRIM_SPACES)
            .enable(CsvParser.Feature.SKIP_EMPTY_LINES)
            .build();

    public List<Map<String, String>> read(InputStream csv) {
        CsvSchema schema = CsvSchema.emptySchema().withHeader();
        try (MappingIterator<Map<String, String>> rows = csvMapper
                .readerForMapOf(String.class)
                .with(schema)
                .readValues(csv)) {
            return rows.readAll();
        } catch (IOException | RuntimeException e) {
            throw new ImportValidationException("Could not read CSV file: " + e.getMessage(), e);
        }
    }
}
