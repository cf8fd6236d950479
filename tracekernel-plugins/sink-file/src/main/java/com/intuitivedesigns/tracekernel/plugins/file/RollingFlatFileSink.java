/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.tracekernel.plugins.file;

import com.intuitivedesigns.tracekernel.core.EventFormatter;
import com.intuitivedesigns.tracekernel.core.SinkDiagnostics;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedWriter;
import java.io.IOException;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.nio.file.StandardOpenOption;
import java.nio.file.attribute.BasicFileAttributes;
import java.nio.file.attribute.FileTime;
import java.time.Clock;
import java.time.DateTimeException;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.UUID;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.stream.Stream;

/**
 * Flat file sink that moves the active file aside once it grows past a size or outlives an interval.
 *
 * <p>Archives sit next to the active file and are named
 * {@code <base>.<timestamp>[.<sequence>]<extension>}, e.g. {@code events.2025-07-01.2.log}. The roll
 * check runs before each line is written, so an idle file is rolled by the next write.
 */
public final class RollingFlatFileSink extends FormattedLineWriter {

    private static final Logger log = LoggerFactory.getLogger(RollingFlatFileSink.class);

    private static final String INVALID_NAME_CHARS = "/\\:*?\"<>|";
    private static final int LINE_SEPARATOR_BYTES = System.lineSeparator().getBytes(StandardCharsets.UTF_8).length;

    /**
     * Roll triggers and archive handling. A size of 0 disables size rolling; 0 archived files keeps
     * every archive.
     */
    public record RollPolicy(long rollSizeBytes,
                             RollInterval interval,
                             String timestampPattern,
                             RollFileExistsBehavior existsBehavior,
                             int maxArchivedFiles) {

        public RollPolicy {
            if (rollSizeBytes < 0) {
                throw new IllegalArgumentException("rollSizeBytes must be >= 0: " + rollSizeBytes);
            }
            if (maxArchivedFiles < 0) {
                throw new IllegalArgumentException("maxArchivedFiles must be >= 0: " + maxArchivedFiles);
            }
            interval = (interval == null) ? RollInterval.NONE : interval;
            existsBehavior = (existsBehavior == null) ? RollFileExistsBehavior.OVERWRITE : existsBehavior;
            timestampPattern = (timestampPattern == null || timestampPattern.isBlank()) ? null : timestampPattern.trim();
            if (interval != RollInterval.NONE && timestampPattern == null) {
                throw new IllegalArgumentException("A timestamp pattern is required to roll every " + interval);
            }
        }

        public static RollPolicy bySize(long rollSizeBytes) {
            return new RollPolicy(rollSizeBytes, RollInterval.NONE, null, RollFileExistsBehavior.INCREMENT, 0);
        }
    }

    private final Path path;
    private final RollPolicy policy;
    private final DateTimeFormatter timestampFormat;
    private final Clock clock;
    private final String baseName;
    private final String extension;

    private BufferedWriter writer;
    private long tally;
    private LocalDateTime nextRoll;

    public RollingFlatFileSink(String id, Path path, RollPolicy policy, EventFormatter formatter,
                               SinkDiagnostics diagnostics, Clock clock) throws IOException {
        super(id, formatter, diagnostics);
        this.path = Objects.requireNonNull(path, "path").toAbsolutePath();
        this.policy = Objects.requireNonNull(policy, "policy");
        this.clock = (clock == null) ? Clock.systemDefaultZone() : clock;
        this.timestampFormat = (policy.timestampPattern() == null) ? null : timestampFormat(policy.timestampPattern(), this.clock);

        final String fileName = this.path.getFileName().toString();
        final int dot = fileName.lastIndexOf('.');
        this.baseName = (dot > 0) ? fileName.substring(0, dot) : fileName;
        this.extension = (dot > 0) ? fileName.substring(dot) : "";

        final Path parent = this.path.getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
        open(startOfActiveFile());
        log.info("RollingFlatFileSink [{}] writing to {} (policy={})", id, this.path, policy);
    }

    @Override
    protected Writer writer() {
        return writer;
    }

    @Override
    protected void writeLine(String line) throws IOException {
        rollIfNecessary();
        super.writeLine(line);
        tally += line.getBytes(StandardCharsets.UTF_8).length + LINE_SEPARATOR_BYTES;
    }

    public Path path() {
        return path;
    }

    /**
     * Bytes in the active file, counting lines not yet flushed.
     */
    public long tally() {
        return tally;
    }

    /**
     * @return the time of the next interval roll, or null when only size rolls apply
     */
    public LocalDateTime nextRoll() {
        return nextRoll;
    }

    @Override
    public void close() throws IOException {
        writer.close();
        log.info("RollingFlatFileSink [{}] closed.", id());
    }

    void rollIfNecessary() throws IOException {
        final LocalDateTime now = LocalDateTime.now(clock);
        final boolean bySize = policy.rollSizeBytes() > 0 && tally > policy.rollSizeBytes();
        final boolean byTime = nextRoll != null && !now.isBefore(nextRoll);
        if (bySize || byTime) {
            roll(now);
        }
    }

    private void roll(LocalDateTime rollTime) throws IOException {
        writer.close();

        IOException failure = null;
        try {
            if (policy.existsBehavior() == RollFileExistsBehavior.OVERWRITE && timestampFormat == null) {
                // Nothing to tell archives apart by; start the active file over.
                Files.newOutputStream(path, StandardOpenOption.TRUNCATE_EXISTING).close();
                log.debug("RollingFlatFileSink [{}] truncated {}", id(), path);
            } else {
                final Path archive = moveAside(archivePath(rollTime));
                log.debug("RollingFlatFileSink [{}] rolled {} to {}", id(), path, archive);
                purgeArchives();
            }
        } catch (IOException e) {
            failure = e;
        }

        open(rollTime);
        if (failure != null) {
            throw failure;
        }
    }

    private void open(LocalDateTime started) throws IOException {
        writer = Files.newBufferedWriter(path, StandardCharsets.UTF_8,
                StandardOpenOption.CREATE, StandardOpenOption.WRITE, StandardOpenOption.APPEND);
        tally = Files.size(path);
        nextRoll = policy.interval().next(started);
    }

    private LocalDateTime startOfActiveFile() throws IOException {
        if (Files.exists(path) && Files.size(path) > 0) {
            final FileTime created = Files.readAttributes(path, BasicFileAttributes.class).creationTime();
            return LocalDateTime.ofInstant(created.toInstant(), clock.getZone());
        }
        return LocalDateTime.now(clock);
    }

    Path archivePath(LocalDateTime rollTime) throws IOException {
        final StringBuilder name = new StringBuilder(baseName);
        if (timestampFormat != null) {
            name.append('.').append(timestampFormat.format(rollTime));
        }
        if (policy.existsBehavior() == RollFileExistsBehavior.INCREMENT) {
            final int sequence = maxSequence(name.toString()) + 1;
            name.append('.').append(sequence);
        }
        name.append(extension);
        return path.resolveSibling(name.toString());
    }

    private Path moveAside(Path archive) throws IOException {
        try {
            return Files.move(path, archive, StandardCopyOption.REPLACE_EXISTING);
        } catch (IOException e) {
            final Path fallback = archive.resolveSibling(archive.getFileName() + "." + UUID.randomUUID());
            log.warn("RollingFlatFileSink [{}] could not archive to {}, using {}", id(), archive, fallback, e);
            return Files.move(path, fallback);
        }
    }

    private int maxSequence(String prefix) throws IOException {
        final Pattern pattern = Pattern.compile(Pattern.quote(prefix) + "\\.(\\d{1,9})" + Pattern.quote(extension));
        int max = 0;
        try (Stream<Path> files = Files.list(path.getParent())) {
            for (Path file : (Iterable<Path>) files::iterator) {
                final Matcher m = pattern.matcher(file.getFileName().toString());
                if (m.matches()) {
                    max = Math.max(max, Integer.parseInt(m.group(1)));
                }
            }
        }
        return max;
    }

    private void purgeArchives() throws IOException {
        final int keep = policy.maxArchivedFiles();
        if (keep <= 0) {
            return;
        }

        final List<Archive> archives = new ArrayList<>();
        try (Stream<Path> files = Files.list(path.getParent())) {
            for (Path file : (Iterable<Path>) files::iterator) {
                final String name = file.getFileName().toString();
                if (isArchive(name)) {
                    archives.add(new Archive(file, Files.getLastModifiedTime(file), sequenceOf(name)));
                }
            }
        }
        if (archives.size() <= keep) {
            return;
        }

        archives.sort(Archive.NEWEST_FIRST);
        for (Archive old : archives.subList(keep, archives.size())) {
            try {
                Files.deleteIfExists(old.path());
                log.debug("RollingFlatFileSink [{}] purged {}", id(), old.path());
            } catch (IOException e) {
                log.warn("RollingFlatFileSink [{}] could not purge {}", id(), old.path(), e);
            }
        }
    }

    private boolean isArchive(String name) {
        return !name.equals(path.getFileName().toString())
                && name.startsWith(baseName + ".")
                && name.endsWith(extension);
    }

    private int sequenceOf(String name) {
        final String stem = name.substring(0, name.length() - extension.length());
        final int dot = stem.lastIndexOf('.');
        final String tail = stem.substring(dot + 1);
        if (tail.isEmpty() || tail.length() > 9 || !tail.chars().allMatch(Character::isDigit)) {
            return -1;
        }
        return Integer.parseInt(tail);
    }

    private static DateTimeFormatter timestampFormat(String pattern, Clock clock) {
        final DateTimeFormatter format;
        final String sample;
        try {
            format = DateTimeFormatter.ofPattern(pattern, Locale.ROOT);
            sample = format.format(LocalDateTime.now(clock));
        } catch (IllegalArgumentException | DateTimeException e) {
            throw new IllegalArgumentException("Invalid timestamp pattern: '" + pattern + "'", e);
        }
        for (char c : sample.toCharArray()) {
            if (INVALID_NAME_CHARS.indexOf(c) >= 0 || Character.isISOControl(c)) {
                throw new IllegalArgumentException("Timestamp pattern '" + pattern + "' produces '" + c
                        + "', which is not allowed in a file name");
            }
        }
        return format;
    }

    private record Archive(Path path, FileTime modified, int sequence) {
        static final Comparator<Archive> NEWEST_FIRST = Comparator.comparing(Archive::modified)
                .thenComparingInt(Archive::sequence)
                .thenComparing(a -> a.path().getFileName().toString())
                .reversed();
    }
}
