package com.delta.cnpjresolver.resolve.service;

import org.apache.commons.csv.CSVFormat;
import org.apache.commons.csv.CSVParser;
import org.apache.commons.csv.CSVRecord;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Reads the {@code company_name} column of the input CSV, in file order, without duplicates.
 */
@Component
public class CsvCompanySource {
    private static final Logger log = LoggerFactory.getLogger(CsvCompanySource.class);
    static final String COMPANY_COLUMN = "company_name";

    public List<String> read(Path path) {
        if (!Files.exists(path)) {
            throw new ResolutionException("Input CSV not found: " + path);
        }
        Set<String> names = new LinkedHashSet<>();
        try (Reader reader = Files.newBufferedReader(path, StandardCharsets.UTF_8);
             CSVParser parser = csvParser(reader)) {
            String header = findHeader(parser.getHeaderNames());
            if (header == null) {
                throw new ResolutionException("Input CSV " + path + " has no " + COMPANY_COLUMN + " column");
            }
            for (CSVRecord record : parser) {
                if (!record.isSet(header)) {
                    continue;
                }
                String name = record.get(header).trim();
                if (!name.isEmpty()) {
                    names.add(name);
                }
            }
        } catch (IOException e) {
            throw new ResolutionException("Failed to read input CSV at " + path, e);
        }
        log.info("Loaded {} companies from {}", names.size(), path);
        return new ArrayList<>(names);
    }

    private CSVParser csvParser(Reader reader) throws IOException {
        CSVFormat format = CSVFormat.DEFAULT.builder()
            .setHeader()
            .setSkipHeaderRecord(true)
            .setIgnoreSurroundingSpaces(true)
            .setIgnoreEmptyLines(true)
            .build();
        return format.parse(reader);
    }

    private String findHeader(List<String> headers) {
        for (String header : headers) {
            if (header != null && header.replace("\uFEFF", "").trim().equalsIgnoreCase(COMPANY_COLUMN)) {
                return header;
            }
        }
        return null;
    }
}
