package tw.gc.strategy.optimizer.services.storage;

import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.channels.FileChannel;
import java.nio.charset.StandardCharsets;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.nio.file.StandardOpenOption;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.locks.ReadWriteLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.json.JsonMapper;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;

import lombok.extern.slf4j.Slf4j;
import tw.gc.strategy.optimizer.enums.SearchKind;
import tw.gc.strategy.optimizer.exceptions.ResultsStoreException;
import tw.gc.strategy.optimizer.exceptions.RunNotFoundException;
import tw.gc.strategy.optimizer.model.RunIndexEntry;
import tw.gc.strategy.optimizer.model.RunRecord;

/**
 * File-backed run history.
 *
 * <p>Layout under the base directory:
 * <pre>
 * history/runs.jsonl       one {@link RunIndexEntry} per line, append-only except for delete/reconcile
 * details/&lt;runId&gt;.json    full {@link RunRecord}
 * </pre>
 *
 * <p>Write ordering keeps the index from ever referencing a missing detail record:
 * <ul>
 *   <li>save: detail to a temp file, fsync, then under the index lock an atomic rename and an index
 *   append with fsync</li>
 *   <li>delete: index rewritten without the entry (temp + atomic rename), then detail removed</li>
 * </ul>
 * A crash can therefore leave only an orphan detail record or a temp file, both removed by
 * {@link #reconcile()}.
 *
 * <p>Index writes are serialized by a single write lock; reads share a read lock. Detail records are
 * serialized and fsynced outside the lock, each into its own temp file.
 */
@Slf4j
public class ResultsStore {

    static final String HISTORY_DIR = "history";
    static final String DETAILS_DIR = "details";
    static final String INDEX_FILE = "runs.jsonl";
    static final String DETAIL_SUFFIX = ".json";
    static final String TEMP_SUFFIX = ".tmp";

    static final int MIN_COMPARE = 2;
    static final int MAX_COMPARE = 5;

    private final Path baseDir;
    private final Path indexFile;
    private final Path detailsDir;
    private final ObjectMapper objectMapper;
    private final ReadWriteLock indexLock = new ReentrantReadWriteLock();
    private final Set<String> reservedIds = new HashSet<>();

    public ResultsStore(Path baseDir, ObjectMapper objectMapper) {
        this.baseDir = baseDir;
        this.indexFile = baseDir.resolve(HISTORY_DIR).resolve(INDEX_FILE);
        this.detailsDir = baseDir.resolve(DETAILS_DIR);
        this.objectMapper = objectMapper;
        try {
            Files.createDirectories(indexFile.getParent());
            Files.createDirectories(detailsDir);
            if (!Files.exists(indexFile)) {
                Files.createFile(indexFile);
            }
        } catch (IOException e) {
            throw new ResultsStoreException("Cannot initialise results store at " + baseDir, e);
        }
        log.info("📁 Results store ready at {}", baseDir.toAbsolutePath());
    }

    /**
     * Mapper used for index lines and detail records: ISO-8601 dates, unknown properties ignored so
     * older records stay readable.
     */
    public static ObjectMapper createObjectMapper() {
        return JsonMapper.builder()
            .addModule(new JavaTimeModule())
            .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
            .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES)
            .build();
    }

    public Path getBaseDir() {
        return baseDir;
    }

    /**
     * Reserves a fresh run id. Candidates are tried with an increasing disambiguator until one is
     * unused by the index, the detail directory and other in-process reservations. The reservation is
     * released when the run is saved.
     */
    public String allocateRunId(String strategyId, SearchKind kind, Instant createdAt) {
        Set<String> indexed = indexedRunIds();
        synchronized (reservedIds) {
            for (int n = 0; ; n++) {
                String candidate = RunIdGenerator.generate(strategyId, kind, createdAt, n);
                if (!indexed.contains(candidate)
                        && !reservedIds.contains(candidate)
                        && !Files.exists(detailPath(candidate))) {
                    reservedIds.add(candidate);
                    if (n > 0) {
                        log.debug("Run id collision resolved: {}", candidate);
                    }
                    return candidate;
                }
            }
        }
    }

    /**
     * Releases a reservation for a run that will not be saved.
     */
    public void releaseRunId(String runId) {
        synchronized (reservedIds) {
            reservedIds.remove(runId);
        }
    }

    /**
     * Persists a run: detail record first, index entry last.
     *
     * @return the run id
     * @throws IllegalArgumentException if the record has no id or the id is already indexed
     */
    public String save(RunRecord record) {
        String runId = record.getRunId();
        Path temp = null;
        try {
            if (runId == null || runId.isBlank()) {
                throw new IllegalArgumentException("RunRecord must carry a run id, use allocateRunId");
            }
            if (indexedRunIds().contains(runId)) {
                throw new IllegalArgumentException("Run already exists: " + runId);
            }

            Path detail = detailPath(runId);
            temp = Files.createTempFile(detailsDir, runId + DETAIL_SUFFIX + ".", TEMP_SUFFIX);
            writeDurably(temp, objectMapper.writerWithDefaultPrettyPrinter().writeValueAsBytes(record));
            byte[] line = (objectMapper.writeValueAsString(record.toIndexEntry()) + "\n")
                .getBytes(StandardCharsets.UTF_8);

            indexLock.writeLock().lock();
            try {
                // A concurrent save of the same id may have committed since the first check
                if (indexedRunIds().contains(runId)) {
                    throw new IllegalArgumentException("Run already exists: " + runId);
                }
                moveAtomically(temp, detail);
                temp = null;
                appendIndexLine(line);
            } finally {
                indexLock.writeLock().unlock();
            }
        } catch (IOException e) {
            throw new ResultsStoreException("Failed to save run " + runId, e);
        } finally {
            deleteQuietly(temp);
            releaseRunId(runId);
        }

        log.info("💾 Run saved: {}", runId);
        return runId;
    }

    public List<RunIndexEntry> list() {
        return list(RunFilter.all(), RunSort.newestFirst());
    }

    public List<RunIndexEntry> list(RunFilter filter) {
        return list(filter, RunSort.newestFirst());
    }

    public List<RunIndexEntry> list(RunFilter filter, RunSort sort) {
        List<RunIndexEntry> all = readIndex();
        List<RunIndexEntry> filtered = all.stream()
            .filter(filter::matches)
            .sorted(sort.comparator())
            .toList();
        log.debug("Runs listed: {}/{}", filtered.size(), all.size());
        return filtered;
    }

    /**
     * @throws RunNotFoundException if the run is not in the index
     */
    public RunRecord get(String runId) {
        if (!indexedRunIds().contains(runId)) {
            throw new RunNotFoundException(runId);
        }
        try {
            return objectMapper.readValue(Files.readAllBytes(detailPath(runId)), RunRecord.class);
        } catch (NoSuchFileException e) {
            throw new ResultsStoreException("Index entry without detail record: " + runId, e);
        } catch (IOException e) {
            throw new ResultsStoreException("Failed to read run " + runId, e);
        }
    }

    public boolean exists(String runId) {
        return indexedRunIds().contains(runId);
    }

    /**
     * Removes a run's index entry, then its detail record.
     *
     * @throws RunNotFoundException if either the entry or the detail record is missing
     */
    public void delete(String runId) {
        indexLock.writeLock().lock();
        try {
            List<String> lines = readIndexLines();
            List<String> kept = new ArrayList<>(lines.size());
            boolean found = false;
            for (String line : lines) {
                if (!found && runId.equals(parseRunId(line))) {
                    found = true;
                } else {
                    kept.add(line);
                }
            }
            Path detail = detailPath(runId);
            if (!found || !Files.exists(detail)) {
                throw new RunNotFoundException(runId);
            }

            rewriteIndex(kept);
            Files.delete(detail);
        } catch (IOException e) {
            throw new ResultsStoreException("Failed to delete run " + runId, e);
        } finally {
            indexLock.writeLock().unlock();
        }
        log.info("🗑️ Run deleted: {}", runId);
    }

    /**
     * Loads 2 to 5 runs and aligns their best metrics and parameters.
     *
     * @throws IllegalArgumentException on a wrong id count, a repeated id or an unknown id
     */
    public RunComparison compare(List<String> runIds) {
        if (runIds == null || runIds.size() < MIN_COMPARE || runIds.size() > MAX_COMPARE) {
            throw new IllegalArgumentException("Comparison needs %d to %d run ids, got %d"
                .formatted(MIN_COMPARE, MAX_COMPARE, runIds == null ? 0 : runIds.size()));
        }
        if (new LinkedHashSet<>(runIds).size() != runIds.size()) {
            throw new IllegalArgumentException("Duplicate run ids in comparison: " + runIds);
        }

        List<RunRecord> runs = new ArrayList<>(runIds.size());
        for (String runId : runIds) {
            try {
                runs.add(get(runId));
            } catch (RunNotFoundException e) {
                throw new IllegalArgumentException("Unknown run id in comparison: " + runId, e);
            }
        }
        log.info("✓ Compared {} runs", runs.size());
        return RunComparison.of(runs);
    }

    /**
     * Highest-ranked run by an index field, optionally restricted to one strategy.
     */
    public Optional<RunIndexEntry> bestRun(String strategyId, RunSortField field) {
        RunFilter filter = strategyId == null ? RunFilter.all() : RunFilter.builder().strategy(strategyId).build();
        Optional<RunIndexEntry> best = list(filter, RunSort.descending(field)).stream().findFirst();
        best.ifPresent(entry -> log.info("Best run by {}: {}", field, entry.runId()));
        return best;
    }

    public StoreStatistics statistics() {
        List<RunIndexEntry> runs = readIndex();
        if (runs.isEmpty()) {
            return StoreStatistics.empty();
        }
        List<String> strategies = runs.stream().map(RunIndexEntry::strategyId).distinct().sorted().toList();
        List<SearchKind> kinds = runs.stream().map(RunIndexEntry::searchKind).distinct().sorted().toList();
        return new StoreStatistics(
            runs.size(),
            strategies.size(),
            runs.stream().mapToDouble(RunIndexEntry::bestSharpe).max().orElse(0.0),
            runs.stream().mapToDouble(RunIndexEntry::bestReturn).max().orElse(0.0),
            runs.stream().mapToDouble(RunIndexEntry::bestSharpe).average().orElse(0.0),
            runs.stream().mapToDouble(RunIndexEntry::bestReturn).average().orElse(0.0),
            strategies,
            kinds);
    }

    /**
     * Repairs what an interrupted write can leave behind: leftover temp files, detail records with no
     * index entry, index lines that cannot be parsed or whose detail record is gone. Runs being saved
     * in this process are left alone.
     */
    public ReconciliationReport reconcile() {
        indexLock.writeLock().lock();
        try {
            Set<String> reserved;
            synchronized (reservedIds) {
                reserved = Set.copyOf(reservedIds);
            }

            int tempFiles = removeTempFiles(reserved);

            List<String> lines = readIndexLines();
            List<String> kept = new ArrayList<>(lines.size());
            Set<String> indexed = new HashSet<>();
            List<String> dangling = new ArrayList<>();
            int corrupt = 0;
            for (String line : lines) {
                String runId = parseRunId(line);
                if (runId == null) {
                    corrupt++;
                } else if (!Files.exists(detailPath(runId))) {
                    dangling.add(runId);
                } else {
                    kept.add(line);
                    indexed.add(runId);
                }
            }
            if (kept.size() != lines.size()) {
                rewriteIndex(kept);
            }

            List<String> orphans = new ArrayList<>();
            try (DirectoryStream<Path> details = Files.newDirectoryStream(detailsDir, "*" + DETAIL_SUFFIX)) {
                for (Path detail : details) {
                    String name = detail.getFileName().toString();
                    String runId = name.substring(0, name.length() - DETAIL_SUFFIX.length());
                    if (!indexed.contains(runId) && !reserved.contains(runId)) {
                        Files.deleteIfExists(detail);
                        orphans.add(runId);
                    }
                }
            }

            ReconciliationReport report = new ReconciliationReport(
                List.copyOf(orphans), List.copyOf(dangling), corrupt, tempFiles);
            if (report.clean()) {
                log.info("✅ Results store consistent ({} runs)", indexed.size());
            } else {
                log.warn("🔧 Results store reconciled: {} orphan details, {} dangling entries, {} corrupt lines, {} temp files",
                    orphans.size(), dangling.size(), corrupt, tempFiles);
            }
            return report;
        } catch (IOException e) {
            throw new ResultsStoreException("Failed to reconcile results store at " + baseDir, e);
        } finally {
            indexLock.writeLock().unlock();
        }
    }

    Path detailPath(String runId) {
        return detailsDir.resolve(runId + DETAIL_SUFFIX);
    }

    private List<RunIndexEntry> readIndex() {
        List<String> lines;
        indexLock.readLock().lock();
        try {
            lines = readIndexLines();
        } catch (IOException e) {
            throw new ResultsStoreException("Failed to read run index " + indexFile, e);
        } finally {
            indexLock.readLock().unlock();
        }

        List<RunIndexEntry> entries = new ArrayList<>(lines.size());
        for (String line : lines) {
            try {
                entries.add(objectMapper.readValue(line, RunIndexEntry.class));
            } catch (JsonProcessingException e) {
                log.warn("⚠️ Skipping unreadable index line: {}", e.getOriginalMessage());
            }
        }
        return entries;
    }

    private Set<String> indexedRunIds() {
        Set<String> ids = new HashSet<>();
        readIndex().forEach(entry -> ids.add(entry.runId()));
        return ids;
    }

    private List<String> readIndexLines() throws IOException {
        if (!Files.exists(indexFile)) {
            return List.of();
        }
        return Files.readAllLines(indexFile, StandardCharsets.UTF_8).stream()
            .filter(line -> !line.isBlank())
            .toList();
    }

    /**
     * @return the line's run id, or null if the line is not a readable index entry
     */
    private String parseRunId(String line) {
        try {
            RunIndexEntry entry = objectMapper.readValue(line, RunIndexEntry.class);
            return entry.runId();
        } catch (JsonProcessingException e) {
            return null;
        }
    }

    private void rewriteIndex(List<String> lines) throws IOException {
        Path temp = indexFile.resolveSibling(INDEX_FILE + TEMP_SUFFIX);
        StringBuilder content = new StringBuilder();
        lines.forEach(line -> content.append(line).append('\n'));
        writeDurably(temp, content.toString().getBytes(StandardCharsets.UTF_8));
        moveAtomically(temp, indexFile);
    }

    /**
     * Appends one line to the index. A previous append torn mid-line is terminated first so the new
     * entry starts on its own line; the partial line is left for {@link #reconcile()} to drop.
     */
    private void appendIndexLine(byte[] line) throws IOException {
        try (FileChannel channel = FileChannel.open(indexFile,
                StandardOpenOption.CREATE, StandardOpenOption.READ, StandardOpenOption.WRITE)) {
            long size = channel.size();
            if (size > 0) {
                ByteBuffer last = ByteBuffer.allocate(1);
                channel.read(last, size - 1);
                if (last.get(0) != '\n') {
                    log.warn("⚠️ Run index ends with a partial line, terminating it before append");
                    channel.write(ByteBuffer.wrap(new byte[] {'\n'}), size);
                    size++;
                }
            }
            ByteBuffer buffer = ByteBuffer.wrap(line);
            while (buffer.hasRemaining()) {
                size += channel.write(buffer, size);
            }
            channel.force(true);
        }
    }

    private static void deleteQuietly(Path temp) {
        if (temp == null) {
            return;
        }
        try {
            Files.deleteIfExists(temp);
        } catch (IOException e) {
            log.warn("Could not remove temp file {}: {}", temp, e.getMessage());
        }
    }

    private int removeTempFiles(Set<String> reserved) throws IOException {
        int removed = 0;
        for (Path dir : List.of(detailsDir, indexFile.getParent())) {
            List<Path> temps = new ArrayList<>();
            try (DirectoryStream<Path> stream = Files.newDirectoryStream(dir, "*" + TEMP_SUFFIX)) {
                stream.forEach(temps::add);
            }
            for (Path temp : temps) {
                String name = temp.getFileName().toString();
                boolean inFlight = reserved.stream().anyMatch(id -> name.startsWith(id + DETAIL_SUFFIX + "."));
                if (!inFlight && Files.deleteIfExists(temp)) {
                    removed++;
                }
            }
        }
        return removed;
    }

    private static void writeDurably(Path target, byte[] content) throws IOException {
        try (FileChannel channel = FileChannel.open(target,
                StandardOpenOption.CREATE, StandardOpenOption.WRITE, StandardOpenOption.TRUNCATE_EXISTING)) {
            ByteBuffer buffer = ByteBuffer.wrap(content);
            while (buffer.hasRemaining()) {
                channel.write(buffer);
            }
            channel.force(true);
        }
    }

    private static void moveAtomically(Path source, Path target) throws IOException {
        try {
            Files.move(source, target, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
        } catch (AtomicMoveNotSupportedException e) {
            log.warn("Atomic move not supported for {}, falling back to replace", target);
            Files.move(source, target, StandardCopyOption.REPLACE_EXISTING);
        }
    }
}
