package com.chapterbus.persistence;

import com.chapterbus.pipeline.ChapterOutline;
import com.chapterbus.pipeline.ChapterSnapshot;
import com.chapterbus.pipeline.ChapterStatus;
import com.chapterbus.pipeline.ReviewFinding;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.stream.Stream;

/**
 * Chapters on disk:
 * <pre>
 * chapters/chapter_001.md           current text
 * chapters/chapter_001_meta.json    metadata and outline
 * versions/chapter_001/v_&lt;hash&gt;.md  one file per distinct committed text
 * intermediates/chapter_001/...     pipeline by-products
 * </pre>
 * Files are written to a temp file and moved into place.
 */
public class FileSystemChapterStore implements ChapterStore {

    private static final Logger log = LoggerFactory.getLogger(FileSystemChapterStore.class);

    private static final Pattern CHAPTER_FILE = Pattern.compile("chapter_(\\d{3,})\\.md");
    private static final int VERSION_HASH_LENGTH = 16;

    private final Path chaptersDir;
    private final Path versionsDir;
    private final Path intermediatesDir;
    private final boolean versioning;
    private final ObjectMapper mapper;

    public FileSystemChapterStore(Path outputDir, boolean versioning, ObjectMapper mapper) {
        this.chaptersDir = outputDir.resolve("chapters");
        this.versionsDir = outputDir.resolve("versions");
        this.intermediatesDir = outputDir.resolve("intermediates");
        this.versioning = versioning;
        this.mapper = mapper;
    }

    @Override
    public synchronized void commit(int chapterNumber, ChapterSnapshot snapshot) {
        Optional<StoredMeta> current = readMeta(chapterNumber);
        if (current.isPresent() && current.get().contentHash().equals(snapshot.contentHash())) {
            log.info("Chapter {} already committed with hash {}", chapterNumber, shortHash(snapshot.contentHash()));
            return;
        }
        String markdown = snapshot.text() + "\n";
        try {
            if (versioning) {
                Path versionFile = versionsDir.resolve(chapterKey(chapterNumber))
                    .resolve("v_" + shortHash(snapshot.contentHash()) + ".md");
                if (!Files.exists(versionFile)) {
                    writeAtomically(versionFile, markdown);
                }
            }
            writeAtomically(chaptersDir.resolve(chapterKey(chapterNumber) + ".md"), markdown);
            writeAtomically(metaFile(chapterNumber),
                mapper.writerWithDefaultPrettyPrinter().writeValueAsString(StoredMeta.of(snapshot)));
        } catch (IOException ex) {
            throw new PersistenceException("could not write chapter " + chapterNumber + ": " + ex.getMessage(), ex);
        }
        log.info("Committed chapter {} ({} words, hash {})",
            chapterNumber, snapshot.wordCount(), shortHash(snapshot.contentHash()));
    }

    @Override
    public synchronized Optional<ChapterSnapshot> find(int chapterNumber) {
        Optional<StoredMeta> meta = readMeta(chapterNumber);
        if (meta.isEmpty()) {
            return Optional.empty();
        }
        Path textFile = chaptersDir.resolve(chapterKey(chapterNumber) + ".md");
        try {
            String markdown = Files.readString(textFile, StandardCharsets.UTF_8);
            String text = markdown.endsWith("\n") ? markdown.substring(0, markdown.length() - 1) : markdown;
            return Optional.of(meta.get().toSnapshot(text));
        } catch (IOException ex) {
            throw new PersistenceException("could not read chapter " + chapterNumber + ": " + ex.getMessage(), ex);
        }
    }

    @Override
    public synchronized List<Integer> committedChapters() {
        if (!Files.isDirectory(chaptersDir)) {
            return List.of();
        }
        List<Integer> numbers = new ArrayList<>();
        try (Stream<Path> files = Files.list(chaptersDir)) {
            files.forEach(file -> {
                Matcher matcher = CHAPTER_FILE.matcher(file.getFileName().toString());
                if (matcher.matches()) {
                    numbers.add(Integer.parseInt(matcher.group(1)));
                }
            });
        } catch (IOException ex) {
            throw new PersistenceException("could not list chapters: " + ex.getMessage(), ex);
        }
        numbers.sort(null);
        return numbers;
    }

    @Override
    public synchronized int versionCount(int chapterNumber) {
        if (!versioning) {
            return Files.exists(metaFile(chapterNumber)) ? 1 : 0;
        }
        Path dir = versionsDir.resolve(chapterKey(chapterNumber));
        if (!Files.isDirectory(dir)) {
            return 0;
        }
        try (Stream<Path> files = Files.list(dir)) {
            return (int) files.filter(file -> file.getFileName().toString().endsWith(".md")).count();
        } catch (IOException ex) {
            throw new PersistenceException("could not list versions of chapter " + chapterNumber, ex);
        }
    }

    @Override
    public void saveIntermediate(int chapterNumber, String name, Object content) {
        Path dir = intermediatesDir.resolve(chapterKey(chapterNumber));
        try {
            if (content instanceof String text) {
                writeAtomically(dir.resolve(name + ".md"), text);
            } else {
                writeAtomically(dir.resolve(name + ".json"),
                    mapper.writerWithDefaultPrettyPrinter().writeValueAsString(content));
            }
        } catch (IOException ex) {
            throw new PersistenceException("could not save intermediate " + name + " of chapter " + chapterNumber, ex);
        }
    }

    private Optional<StoredMeta> readMeta(int chapterNumber) {
        Path file = metaFile(chapterNumber);
        if (!Files.exists(file)) {
            return Optional.empty();
        }
        try {
            return Optional.of(mapper.readValue(file.toFile(), StoredMeta.class));
        } catch (IOException ex) {
            throw new PersistenceException("unreadable metadata for chapter " + chapterNumber + ": " + ex.getMessage(), ex);
        }
    }

    private Path metaFile(int chapterNumber) {
        return chaptersDir.resolve(chapterKey(chapterNumber) + "_meta.json");
    }

    private static void writeAtomically(Path target, String content) throws IOException {
        Files.createDirectories(target.getParent());
        Path temp = Files.createTempFile(target.getParent(), target.getFileName().toString(), ".tmp");
        try {
            Files.writeString(temp, content, StandardCharsets.UTF_8);
            try {
                Files.move(temp, target, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
            } catch (AtomicMoveNotSupportedException ex) {
                Files.move(temp, target, StandardCopyOption.REPLACE_EXISTING);
            }
        } finally {
            Files.deleteIfExists(temp);
        }
    }

    static String chapterKey(int chapterNumber) {
        return String.format("chapter_%03d", chapterNumber);
    }

    private static String shortHash(String hash) {
        return hash.length() > VERSION_HASH_LENGTH ? hash.substring(0, VERSION_HASH_LENGTH) : hash;
    }

    @JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
    record StoredMeta(
        int chapterNumber,
        String title,
        int wordCount,
        int charCount,
        Instant generatedAt,
        String povCharacter,
        int sceneCount,
        String chapterGoal,
        ChapterStatus status,
        int revisionRounds,
        String contentHash,
        ChapterOutline outline,
        List<ReviewFinding> unresolvedFindings
    ) {

        static StoredMeta of(ChapterSnapshot snapshot) {
            ChapterOutline outline = snapshot.outline();
            return new StoredMeta(
                snapshot.chapterNumber(),
                snapshot.title(),
                snapshot.wordCount(),
                snapshot.text().length(),
                snapshot.createdAt(),
                outline != null ? outline.povCharacter() : "",
                outline != null ? outline.sceneCount() : 0,
                outline != null ? outline.chapterGoal() : "",
                snapshot.status(),
                snapshot.revisionRounds(),
                snapshot.contentHash(),
                outline,
                snapshot.unresolvedFindings());
        }

        ChapterSnapshot toSnapshot(String text) {
            return new ChapterSnapshot(chapterNumber, title, text, outline, unresolvedFindings,
                revisionRounds, status, contentHash, generatedAt);
        }
    }
}
