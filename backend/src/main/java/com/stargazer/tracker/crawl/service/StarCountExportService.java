package com.stargazer.tracker.crawl.service;

import com.stargazer.tracker.crawl.model.LatestStarCount;
import com.stargazer.tracker.crawl.persistence.CrawlJdbcRepository;
import org.apache.commons.csv.CSVFormat;
import org.apache.commons.csv.CSVPrinter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Writes the newest star count of every stored repository as CSV, highest first.
 */
@Service
public class StarCountExportService {
    private static final Logger log = LoggerFactory.getLogger(StarCountExportService.class);
    static final String[] HEADER = {
        "node_id", "name_with_owner", "owner_login", "name", "star_count", "recorded_at"
    };

    private final CrawlJdbcRepository repository;

    public StarCountExportService(CrawlJdbcRepository repository) {
        this.repository = repository;
    }

    /**
     * @return number of data rows written
     */
    public int write(Writer writer) throws IOException {
        CSVFormat format = CSVFormat.DEFAULT.builder()
            .setHeader(HEADER)
            .setRecordSeparator("\n")
            .build();
        AtomicInteger rows = new AtomicInteger();
        CSVPrinter printer = new CSVPrinter(writer, format);
        try {
            repository.forEachLatestStarCount(row -> {
                try {
                    printRow(printer, row);
                } catch (IOException e) {
                    throw new UncheckedIOException(e);
                }
                rows.incrementAndGet();
            });
        } catch (UncheckedIOException e) {
            throw e.getCause();
        }
        printer.flush();
        return rows.get();
    }

    public int exportToFile(Path path) throws IOException {
        Path parent = path.toAbsolutePath().getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
        try (Writer writer = Files.newBufferedWriter(path, StandardCharsets.UTF_8)) {
            int rows = write(writer);
            log.info("Exported {} repositories to {}", rows, path.toAbsolutePath());
            return rows;
        }
    }

    private void printRow(CSVPrinter printer, LatestStarCount row) throws IOException {
        printer.printRecord(
            row.nodeId(),
            row.nameWithOwner(),
            row.ownerLogin(),
            row.name(),
            row.starCount(),
            row.recordedAt()
        );
    }
}
