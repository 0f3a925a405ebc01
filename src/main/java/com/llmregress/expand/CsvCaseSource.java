package com.llmregress.expand;

import java.io.IOException;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.fasterxml.jackson.databind.MappingIterator;
import com.fasterxml.jackson.dataformat.csv.CsvMapper;
import com.fasterxml.jackson.dataformat.csv.CsvParser;

public class CsvCaseSource {
    private static final Logger log = LoggerFactory.getLogger(CsvCaseSource.class);

    private final CsvMapper mapper = CsvMapper.builder()
            .enable(CsvParser.Feature.WRAP_AS_ARRAY)
            .enable(CsvParser.Feature.SKIP_EMPTY_LINES)
            .build();

    public List<Map<String, String>> readRows(Path csvPath) throws DataSourceException {
        if (!Files.isRegularFile(csvPath)) {
            throw new DataSourceException("Failed to open CSV '" + csvPath + "': file not found");
        }
        try (Reader reader = Files.newBufferedReader(csvPath, StandardCharsets.UTF_8);
                MappingIterator<String[]> records = mapper.readerFor(String[].class).readValues(reader)) {
            if (!records.hasNextValue()) {
                throw new DataSourceException("CSV '" + csvPath + "' has no header row");
            }
            List<String> header = header(csvPath, records.nextValue());

            List<Map<String, String>> rows = new ArrayList<>();
            int line = 1;
            while (records.hasNextValue()) {
                String[] record = records.nextValue();
                line++;
                if (record.length != header.size()) {
                    throw new DataSourceException(String.format(
                            "CSV '%s' row %d has %d field(s), header declares %d",
                            csvPath, line, record.length, header.size()));
                }
                Map<String, String> bindings = new LinkedHashMap<>();
                for (int i = 0; i < header.size(); i++) {
                    bindings.put(header.get(i), record[i] == null ? "" : record[i]);
                }
                rows.add(bindings);
            }
            log.debug("csv.loaded path={} columns={} rows={}", csvPath, header, rows.size());
            return rows;
        } catch (DataSourceException e) {
            throw e;
        } catch (IOException | RuntimeException e) {
            throw new DataSourceException("Failed to parse CSV '" + csvPath + "': " + e.getMessage(), e);
        }
    }

    private static List<String> header(Path csvPath, String[] rawHeader) throws DataSourceException {
        List<String> header = new ArrayList<>();
        Set<String> seen = new HashSet<>();
        for (int i = 0; i < rawHeader.length; i++) {
            String name = rawHeader[i] == null ? "" : rawHeader[i].trim();
            if (i == 0 && name.startsWith("\uFEFF")) {
                name = name.substring(1);
            }
            if (name.isEmpty()) {
                throw new DataSourceException("CSV '" + csvPath + "' header column " + (i + 1) + " is blank");
            }
            if (!seen.add(name)) {
                throw new DataSourceException("CSV '" + csvPath + "' header repeats column '" + name + "'");
            }
            header.add(name);
        }
        return header;
    }
}
