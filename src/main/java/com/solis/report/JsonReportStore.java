package com.solis.report;

import com.solis.model.SignalReport;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.json.JSONObject;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.regex.Pattern;
import java.util.stream.Stream;

/**
 * Daily reports stored as {@code <reportsDir>/yyyy-MM-dd.json}.
 */
public final class JsonReportStore implements PreviousReportLoader {
    private static final Logger LOG = LogManager.getLogger(JsonReportStore.class);
    private static final Pattern REPORT_FILE = Pattern.compile("^\\d{4}-\\d{2}-\\d{2}\\.json$");

    private final Path reportsDir;

    public JsonReportStore(Path reportsDir) {
        if (reportsDir == null) {
            throw new IllegalArgumentException("reportsDir must not be null");
        }
        this.reportsDir = reportsDir;
    }

    public Path reportsDir() {
        return reportsDir;
    }

    public Path pathFor(LocalDate date) {
        return reportsDir.resolve(date + ".json");
    }

    public Path save(SignalReport report) throws IOException {
        Files.createDirectories(reportsDir);
        Path target = pathFor(report.date());
        Path temp = target.resolveSibling(target.getFileName() + ".tmp");
        try {
            Files.writeString(temp, SignalReportJson.toJson(report).toString(2), StandardCharsets.UTF_8);
            try {
                Files.move(temp, target, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
            } catch (AtomicMoveNotSupportedException e) {
                Files.move(temp, target, StandardCopyOption.REPLACE_EXISTING);
            }
        } catch (IOException e) {
            try {
                Files.deleteIfExists(temp);
            } catch (IOException cleanup) {
                e.addSuppressed(cleanup);
            }
            throw e;
        }
        LOG.info("[REPORT] saved file={} signals={} anomalies={}",
                target, report.signals().size(), report.anomalies().size());
        return target;
    }

    @Override
    public Optional<SignalReport> loadPrevious(LocalDate excludeDate) {
        if (!Files.isDirectory(reportsDir)) {
            return Optional.empty();
        }
        String excluded = excludeDate == null ? "" : excludeDate + ".json";
        List<String> names = new ArrayList<>();
        try (Stream<Path> files = Files.list(reportsDir)) {
            files.map(p -> p.getFileName().toString())
                    .filter(name -> REPORT_FILE.matcher(name).matches())
                    .filter(name -> !name.equals(excluded))
                    .forEach(names::add);
        } catch (IOException e) {
            LOG.warn("[REPORT] cannot list reports dir={} error={}", reportsDir, e.getMessage());
            return Optional.empty();
        }
        if (names.isEmpty()) {
            return Optional.empty();
        }
        // ISO dates sort lexically.
        names.sort(Comparator.reverseOrder());
        Path latest = reportsDir.resolve(names.get(0));
        try {
            String raw = Files.readString(latest, StandardCharsets.UTF_8);
            SignalReport report = SignalReportJson.fromJson(new JSONObject(raw));
            LOG.info("[REPORT] previous report loaded file={} date={}", latest, report.date());
            return Optional.of(report);
        } catch (IOException | RuntimeException e) {
            LOG.warn("[REPORT] previous report unreadable file={} error={}", latest, e.getMessage());
            return Optional.empty();
        }
    }
}
