package com.delta.cnpjresolver.resolve.sink;

import com.delta.cnpjresolver.config.ResolverProperties;
import com.delta.cnpjresolver.resolve.model.BranchEntry;
import com.delta.cnpjresolver.resolve.model.Cnpj;
import com.delta.cnpjresolver.resolve.model.ResolutionResult;
import com.delta.cnpjresolver.resolve.service.ResolutionException;
import com.delta.cnpjresolver.resolve.util.CnpjValidator;
import org.apache.commons.csv.CSVFormat;
import org.apache.commons.csv.CSVParser;
import org.apache.commons.csv.CSVPrinter;
import org.apache.commons.csv.CSVRecord;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.io.BufferedWriter;
import java.io.IOException;
import java.io.Reader;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.time.Clock;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * Appends result rows to a CSV file, one primary row per company followed by its branch rows.
 * The existing file is read once, on first use, to skip rows recorded by earlier runs.
 */
@Component
public class CsvResultSink implements ResultSink {
    private static final Logger log = LoggerFactory.getLogger(CsvResultSink.class);

    static final String[] COLUMNS = {"company_name", "filial_name", "cnpj", "status", "timestamp", "notes", "source_url"};
    static final String PRIMARY_LABEL = "Matriz";
    static final String BRANCH_STATUS = "ok";

    private final Path outputPath;
    private final String branchNote;
    private final Clock clock;
    private final Set<String> writtenKeys = new HashSet<>();
    private final Set<String> companies = new LinkedHashSet<>();
    private final Map<String, PrimaryRow> primaries = new LinkedHashMap<>();
    private final Set<String> companiesWithBranches = new HashSet<>();
    private boolean loaded;

    @Autowired
    public CsvResultSink(ResolverProperties properties, Clock clock) {
        this(Path.of(properties.getBatch().getOutputCsv()), properties.getBranches().getSourceLabel(), clock);
    }

    public CsvResultSink(Path outputPath, String branchNote, Clock clock) {
        this.outputPath = outputPath;
        this.branchNote = branchNote;
        this.clock = clock;
    }

    @Override
    public synchronized void appendPrimary(String companyName, ResolutionResult result) {
        ensureLoaded();
        String name = normalizeCompany(companyName);
        List<String> row = primaryRow(name, result);
        if (row != null) {
            writeRows(List.of(row));
        }
        recordPrimary(name, result);
    }

    @Override
    public synchronized int appendBranches(String companyName, Cnpj anchor, List<BranchEntry> entries) {
        ensureLoaded();
        String name = normalizeCompany(companyName);
        List<List<String>> rows = branchRows(name, anchor, entries);
        if (!rows.isEmpty()) {
            writeRows(rows);
            companiesWithBranches.add(name.toLowerCase(Locale.ROOT));
        }
        log.info("Wrote {} branch rows for {} ({} skipped)", rows.size(), name, entries.size() - rows.size());
        return rows.size();
    }

    @Override
    public synchronized int appendCompany(String companyName, ResolutionResult result, List<BranchEntry> branches) {
        ensureLoaded();
        String name = normalizeCompany(companyName);
        List<List<String>> rows = new ArrayList<>();
        List<String> primary = primaryRow(name, result);
        if (primary != null) {
            rows.add(primary);
        }
        List<List<String>> branchRows = branchRows(name, result.selected(), branches);
        rows.addAll(branchRows);
        if (!rows.isEmpty()) {
            writeRows(rows);
        }
        recordPrimary(name, result);
        if (!branchRows.isEmpty()) {
            companiesWithBranches.add(name.toLowerCase(Locale.ROOT));
        }
        log.info("Wrote {} rows for {} ({} branches)", rows.size(), name, branchRows.size());
        return branchRows.size();
    }

    @Override
    public synchronized Set<String> processedCompanies() {
        ensureLoaded();
        return Set.copyOf(companies);
    }

    @Override
    public synchronized Map<String, Cnpj> primariesWithoutBranches() {
        ensureLoaded();
        Map<String, Cnpj> pending = new LinkedHashMap<>();
        for (Map.Entry<String, PrimaryRow> entry : primaries.entrySet()) {
            if (!companiesWithBranches.contains(entry.getKey())) {
                pending.put(entry.getValue().companyName(), entry.getValue().cnpj());
            }
        }
        return pending;
    }

    private List<String> primaryRow(String name, ResolutionResult result) {
        Cnpj selected = result.selected();
        if (selected != null && !writtenKeys.add(key(name, selected.digits()))) {
            log.debug("Primary row for {} {} already present, skipping", name, selected);
            return null;
        }
        return List.of(
            name,
            selected == null ? "" : PRIMARY_LABEL,
            selected == null ? "" : selected.formatted(),
            result.status().name().toLowerCase(Locale.ROOT),
            timestamp(),
            result.notes(),
            result.sourceUrl() == null ? "" : result.sourceUrl()
        );
    }

    private List<List<String>> branchRows(String name, Cnpj anchor, List<BranchEntry> entries) {
        List<List<String>> rows = new ArrayList<>();
        String now = timestamp();
        for (BranchEntry entry : entries) {
            if (anchor != null && anchor.equals(entry.cnpj())) {
                continue;
            }
            if (!writtenKeys.add(key(name, entry.cnpj().digits()))) {
                continue;
            }
            rows.add(List.of(name, entry.label(), entry.cnpj().formatted(), BRANCH_STATUS, now, branchNote, ""));
        }
        return rows;
    }

    private void recordPrimary(String name, ResolutionResult result) {
        companies.add(name);
        if (result.selected() != null) {
            primaries.putIfAbsent(name.toLowerCase(Locale.ROOT), new PrimaryRow(name, result.selected()));
        }
    }

    private void ensureLoaded() {
        if (loaded) {
            return;
        }
        if (!Files.exists(outputPath)) {
            loaded = true;
            return;
        }
        Set<String> keys = new HashSet<>();
        Set<String> names = new LinkedHashSet<>();
        Map<String, PrimaryRow> primaryRows = new LinkedHashMap<>();
        Set<String> branched = new HashSet<>();
        CSVFormat format = CSVFormat.DEFAULT.builder()
            .setHeader()
            .setSkipHeaderRecord(true)
            .setIgnoreSurroundingSpaces(true)
            .build();
        try (Reader reader = Files.newBufferedReader(outputPath, StandardCharsets.UTF_8);
             CSVParser parser = format.parse(reader)) {
            for (CSVRecord record : parser) {
                if (!record.isMapped("company_name")) {
                    continue;
                }
                String name = normalizeCompany(record.get("company_name"));
                if (name.isEmpty()) {
                    continue;
                }
                String lower = name.toLowerCase(Locale.ROOT);
                names.add(name);
                String digits = record.isMapped("cnpj") ? CnpjValidator.extractDigits(record.get("cnpj")) : "";
                if (!digits.isEmpty()) {
                    keys.add(key(name, digits));
                }
                String label = record.isMapped("filial_name") ? record.get("filial_name").trim() : "";
                if (label.equals(PRIMARY_LABEL)) {
                    Cnpj.parse(digits).ifPresent(cnpj -> primaryRows.putIfAbsent(lower, new PrimaryRow(name, cnpj)));
                } else if (!label.isEmpty()) {
                    branched.add(lower);
                }
            }
        } catch (IOException | UncheckedIOException | IllegalArgumentException e) {
            throw new ResolutionException("Failed to read existing results at " + outputPath, e);
        }
        writtenKeys.addAll(keys);
        companies.addAll(names);
        primaries.putAll(primaryRows);
        companiesWithBranches.addAll(branched);
        loaded = true;
        log.info("Loaded {} companies from existing results at {}", companies.size(), outputPath);
    }

    private void writeRows(List<List<String>> rows) {
        try {
            Path parent = outputPath.toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            boolean needsHeader = !Files.exists(outputPath) || Files.size(outputPath) == 0;
            try (BufferedWriter writer = Files.newBufferedWriter(
                outputPath,
                StandardCharsets.UTF_8,
                StandardOpenOption.CREATE,
                StandardOpenOption.APPEND
            );
                 CSVPrinter printer = new CSVPrinter(writer, CSVFormat.DEFAULT)) {
                if (needsHeader) {
                    printer.printRecord((Object[]) COLUMNS);
                }
                for (List<String> row : rows) {
                    printer.printRecord(row);
                }
            }
        } catch (IOException e) {
            throw new ResolutionException("Failed to write results to " + outputPath, e);
        }
    }

    private String timestamp() {
        return Instant.now(clock).truncatedTo(ChronoUnit.SECONDS).toString();
    }

    private static String key(String company, String digits) {
        return company.toLowerCase(Locale.ROOT) + "|" + digits;
    }

    static String normalizeCompany(String companyName) {
        return companyName == null ? "" : companyName.trim();
    }

    private record PrimaryRow(String companyName, Cnpj cnpj) {
    }
}
