package com.modelguard.modelguard.ledger;

import org.apache.commons.csv.CSVFormat;
import org.apache.commons.csv.CSVParser;
import org.apache.commons.csv.CSVRecord;
import org.springframework.core.io.ClassPathResource;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.InputStreamReader;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Reads the source population from a classpath CSV configured via {@code ledger.source-file-path}.
 */
@Component
public class ClasspathSourcePopulationReader implements SourcePopulationReader {

    private final LedgerProperties ledgerProperties;

    public ClasspathSourcePopulationReader(LedgerProperties ledgerProperties) {
        this.ledgerProperties = ledgerProperties;
    }

    @Override
    public List<SourceRecord> readAll() {
        String path = ledgerProperties.getSourceFilePath();
        ClassPathResource resource = new ClassPathResource(path);
        if (!resource.exists()) {
            throw new IllegalStateException(LedgerConstants.MSG_SOURCE_NOT_FOUND.formatted(path));
        }

        CSVFormat format = CSVFormat.DEFAULT.builder()
                .setHeader()
                .setSkipHeaderRecord(true)
                .setTrim(true)
                .setIgnoreEmptyLines(true)
                .build();

        try (Reader reader = new InputStreamReader(resource.getInputStream(), StandardCharsets.UTF_8);
             CSVParser parser = format.parse(reader)) {
            List<String> headers = parser.getHeaderNames();
            requireColumn(headers, ledgerProperties.getSourceIdColumn(), path);
            ledgerProperties.getSourceTextColumns().forEach(column -> requireColumn(headers, column, path));
            ledgerProperties.getSourceMetadataColumns().forEach(column -> requireColumn(headers, column, path));
            String labelColumn = ledgerProperties.getSourceLabelColumn();
            boolean hasLabel = labelColumn != null && !labelColumn.isBlank();
            if (hasLabel) {
                requireColumn(headers, labelColumn, path);
            }

            List<SourceRecord> records = new ArrayList<>();
            Set<Long> seenIds = new HashSet<>();
            for (CSVRecord csvRecord : parser) {
                long entityId = Long.parseLong(csvRecord.get(ledgerProperties.getSourceIdColumn()));
                if (!seenIds.add(entityId)) {
                    throw new IllegalStateException(LedgerConstants.MSG_SOURCE_DUPLICATE_ID.formatted(entityId));
                }
                records.add(new SourceRecord(
                        entityId,
                        readColumns(csvRecord, ledgerProperties.getSourceTextColumns()),
                        readColumns(csvRecord, ledgerProperties.getSourceMetadataColumns()),
                        hasLabel ? emptyToNull(csvRecord.get(labelColumn)) : null
                ));
            }

            if (records.isEmpty()) {
                throw new IllegalStateException(LedgerConstants.MSG_SOURCE_EMPTY.formatted(path));
            }
            return records;
        } catch (IOException ex) {
            throw new IllegalStateException(LedgerConstants.MSG_SOURCE_READ_FAILED.formatted(path), ex);
        }
    }

    private Map<String, String> readColumns(CSVRecord csvRecord, List<String> columns) {
        Map<String, String> values = new LinkedHashMap<>();
        for (String column : columns) {
            String value = csvRecord.get(column);
            values.put(column, value == null ? "" : value);
        }
        return values;
    }

    private void requireColumn(List<String> headers, String column, String path) {
        if (!headers.contains(column)) {
            throw new IllegalStateException(LedgerConstants.MSG_SOURCE_COLUMN_MISSING.formatted(column, path));
        }
    }

    private String emptyToNull(String value) {
        return value == null || value.isBlank() ? null : value;
    }
}
