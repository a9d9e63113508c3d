package com.dcruver.vault.domain;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.nio.file.attribute.PosixFileAttributeView;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;

/**
 * Persistent index of vault notes: file records, tag and topic inverted indices,
 * backlinks and aggregate stats.
 *
 * The whole snapshot is loaded once by {@link #open(Path)}, mutated in memory and written
 * back in one piece by {@link #save()}. Not thread-safe; one instance owns the index file.
 */
@Slf4j
public class KnowledgeIndex {

    public static final int DEFAULT_MAX_RESULTS = 5;
    public static final double DEFAULT_MIN_RELEVANCE = 0.3;

    private static final ObjectMapper OBJECT_MAPPER = new ObjectMapper()
        .registerModule(new JavaTimeModule())
        .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
        .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);

    private final Path indexPath;
    private final IndexSnapshot data;

    private KnowledgeIndex(Path indexPath, IndexSnapshot data) {
        this.indexPath = indexPath;
        this.data = data;
    }

    /**
     * Load the index at the given path, or start an empty one if the file does not exist.
     *
     * @throws IOException if the stored snapshot cannot be read or is structurally invalid
     */
    public static KnowledgeIndex open(Path indexPath) throws IOException {
        if (!Files.exists(indexPath)) {
            log.info("No existing index at {}, starting fresh", indexPath);
            return new KnowledgeIndex(indexPath, IndexSnapshot.empty());
        }

        IndexSnapshot snapshot = OBJECT_MAPPER.readValue(indexPath.toFile(), IndexSnapshot.class);
        heal(indexPath, snapshot);
        log.info("Loaded index from {} with {} files", indexPath, snapshot.getFiles().size());

        KnowledgeIndex index = new KnowledgeIndex(indexPath, snapshot);
        // Stored stats are not trusted
        index.updateStats();
        return index;
    }

    private static void heal(Path indexPath, IndexSnapshot snapshot) throws MalformedIndexException {
        if (snapshot == null) {
            throw new MalformedIndexException(indexPath, "empty document");
        }
        if (snapshot.getFiles() == null) {
            throw new MalformedIndexException(indexPath, "missing 'files'");
        }
        if (snapshot.getTopicsIndex() == null) {
            throw new MalformedIndexException(indexPath, "missing 'topics_index'");
        }
        if (snapshot.getTagsIndex() == null) {
            throw new MalformedIndexException(indexPath, "missing 'tags_index'");
        }

        // Older snapshots predate backlinks
        if (snapshot.getBacklinks() == null) {
            snapshot.setBacklinks(new LinkedHashMap<>());
        }

        checkEntries(indexPath, "topics_index", snapshot.getTopicsIndex());
        checkEntries(indexPath, "tags_index", snapshot.getTagsIndex());
        checkEntries(indexPath, "backlinks", snapshot.getBacklinks());

        for (Map.Entry<String, FileRecord> entry : snapshot.getFiles().entrySet()) {
            FileRecord record = entry.getValue();
            if (record == null) {
                throw new MalformedIndexException(indexPath, "null entry for '" + entry.getKey() + "'");
            }
            record.setFilename(entry.getKey());
            if (record.getTags() == null) {
                record.setTags(new ArrayList<>());
            }
            if (record.getTopics() == null) {
                record.setTopics(new ArrayList<>());
            }
            if (record.getRelated() == null) {
                record.setRelated(new ArrayList<>());
            }
        }
    }

    private static void checkEntries(Path indexPath, String section, Map<String, List<String>> entries)
            throws MalformedIndexException {
        for (Map.Entry<String, List<String>> entry : entries.entrySet()) {
            if (entry.getValue() == null || entry.getValue().contains(null)) {
                throw new MalformedIndexException(indexPath,
                    "null value in '" + section + "' for '" + entry.getKey() + "'");
            }
        }
    }

    /**
     * Write the complete snapshot. The file is replaced atomically where the file system allows it.
     */
    public void save() throws IOException {
        data.setLastUpdated(LocalDateTime.now());

        Path target = indexPath.toAbsolutePath();
        Files.createDirectories(target.getParent());

        // createFile applies the default permissions, unlike createTempFile
        Path temp = Files.createFile(target.resolveSibling(target.getFileName() + "." + UUID.randomUUID() + ".tmp"));
        try {
            copyPermissions(target, temp);
            OBJECT_MAPPER.writerWithDefaultPrettyPrinter().writeValue(temp.toFile(), data);
            try {
                Files.move(temp, target, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
            } catch (AtomicMoveNotSupportedException e) {
                log.debug("Atomic move not supported for {}, replacing in place", target);
                Files.move(temp, target, StandardCopyOption.REPLACE_EXISTING);
            }
        } finally {
            Files.deleteIfExists(temp);
        }

        log.info("Index saved to {}", indexPath);
    }

    private static void copyPermissions(Path from, Path to) throws IOException {
        if (Files.exists(from) && Files.getFileStore(from).supportsFileAttributeView(PosixFileAttributeView.class)) {
            Files.setPosixFilePermissions(to, Files.getPosixFilePermissions(from));
        }
    }

    public void add(String filename, String title, List<String> tags, List<String> topics) {
        add(filename, title, tags, topics, null, null, 0);
    }

    public void add(String filename, String title, List<String> tags, List<String> topics,
                    String parent, List<String> related) {
        add(filename, title, tags, topics, parent, related, 0);
    }

    /**
     * Insert or overwrite a file record and keep the inverted indices in step with it.
     */
    public void add(String filename, String title, List<String> tags, List<String> topics,
                    String parent, List<String> related, int sizeChars) {
        List<String> newTags = distinct(tags);
        List<String> newTopics = distinct(topics);

        FileRecord previous = data.getFiles().get(filename);
        if (previous != null) {
            log.debug("Overwriting existing record {}", filename);
            removeFromIndex(data.getTagsIndex(), filename, previous.getTags(), newTags);
            removeFromIndex(data.getTopicsIndex(), filename, previous.getTopics(), newTopics);
        }

        LocalDate today = LocalDate.now();
        FileRecord record = FileRecord.builder()
            .filename(filename)
            .title(title)
            .tags(newTags)
            .topics(newTopics)
            .created(today)
            .updated(today)
            .sizeChars(sizeChars)
            .parent(parent)
            .related(related != null ? new ArrayList<>(related) : new ArrayList<>())
            .build();
        data.getFiles().put(filename, record);

        addToIndex(data.getTopicsIndex(), filename, newTopics);
        addToIndex(data.getTagsIndex(), filename, newTags);
        updateStats();

        log.info("File added: {}", filename);
    }

    public List<String> findByTag(String tag) {
        return List.copyOf(data.getTagsIndex().getOrDefault(tag, List.of()));
    }

    public List<String> findByTopic(String topic) {
        return List.copyOf(data.getTopicsIndex().getOrDefault(topic, List.of()));
    }

    public Optional<FileRecord> getFileInfo(String filename) {
        return Optional.ofNullable(data.getFiles().get(filename)).map(FileRecord::copy);
    }

    public boolean contains(String filename) {
        return data.getFiles().containsKey(filename);
    }

    /**
     * Replace the related links of a known file. Backlinks are not touched.
     */
    public void updateRelatedLinks(String filename, List<String> related) {
        FileRecord record = data.getFiles().get(filename);
        if (record == null) {
            log.debug("Ignoring related links for unknown file {}", filename);
            return;
        }
        record.setRelated(new ArrayList<>(related));
        updateStats();
        log.info("Links updated for {}", filename);
    }

    /**
     * Record that {@code source} links to {@code target}. Idempotent.
     */
    public void updateBacklink(String source, String target) {
        List<String> sources = data.getBacklinks().computeIfAbsent(target, k -> new ArrayList<>());
        if (!sources.contains(source)) {
            sources.add(source);
        }
    }

    public List<String> getBacklinks(String filename) {
        return List.copyOf(data.getBacklinks().getOrDefault(filename, List.of()));
    }

    public List<RelatedFile> findRelated(String filename) {
        return findRelated(filename, DEFAULT_MAX_RESULTS, DEFAULT_MIN_RELEVANCE);
    }

    /**
     * Rank every other file by weighted Jaccard similarity of tags and topics.
     * Equal scores are ordered by filename.
     */
    public List<RelatedFile> findRelated(String filename, int maxResults, double minRelevance) {
        FileRecord current = data.getFiles().get(filename);
        if (current == null) {
            return List.of();
        }

        List<RelatedFile> related = new ArrayList<>();
        for (FileRecord other : data.getFiles().values()) {
            if (other.getFilename().equals(filename)) {
                continue;
            }
            double relevance = SimilarityRanker.relevance(current, other);
            if (relevance >= minRelevance) {
                related.add(new RelatedFile(other.getFilename(), relevance));
            }
        }

        return related.stream()
            .sorted(Comparator.comparingDouble(RelatedFile::getScore).reversed()
                .thenComparing(RelatedFile::getFilename))
            .limit(Math.max(0, maxResults))
            .toList();
    }

    /**
     * Immutable copy of the topic index, in insertion order
     */
    public Map<String, List<String>> getTopics() {
        Map<String, List<String>> topics = new LinkedHashMap<>();
        data.getTopicsIndex().forEach((topic, filenames) -> topics.put(topic, List.copyOf(filenames)));
        return Collections.unmodifiableMap(topics);
    }

    public Set<String> getFilenames() {
        return Collections.unmodifiableSet(data.getFiles().keySet());
    }

    public IndexStats getStats() {
        return new IndexStats(data.getStats().getTotalFiles(), data.getStats().getTotalLinks());
    }

    public int uniqueTopicCount() {
        return data.getTopicsIndex().size();
    }

    public int uniqueTagCount() {
        return data.getTagsIndex().size();
    }

    public LocalDateTime getLastUpdated() {
        return data.getLastUpdated();
    }

    public Path getIndexPath() {
        return indexPath;
    }

    public GraphExport exportGraph() {
        List<GraphExport.Node> nodes = new ArrayList<>();
        List<GraphExport.Edge> edges = new ArrayList<>();

        for (FileRecord record : data.getFiles().values()) {
            nodes.add(GraphExport.Node.builder()
                .id(record.getFilename())
                .label(record.getTitle())
                .tags(List.copyOf(record.getTags()))
                .group(record.getTags().isEmpty() ? "other" : record.getTags().get(0))
                .build());

            for (String target : record.getRelated()) {
                edges.add(GraphExport.Edge.builder()
                    .source(record.getFilename())
                    .target(target)
                    .weight(1)
                    .build());
            }
        }

        return GraphExport.builder()
            .nodes(nodes)
            .edges(edges)
            .stats(getStats())
            .build();
    }

    private void updateStats() {
        int totalLinks = data.getFiles().values().stream()
            .mapToInt(record -> record.getRelated().size())
            .sum();
        data.setStats(new IndexStats(data.getFiles().size(), totalLinks));
    }

    private static void addToIndex(Map<String, List<String>> index, String filename, List<String> keys) {
        for (String key : keys) {
            List<String> filenames = index.computeIfAbsent(key, k -> new ArrayList<>());
            if (!filenames.contains(filename)) {
                filenames.add(filename);
            }
        }
    }

    private static void removeFromIndex(Map<String, List<String>> index, String filename,
                                        List<String> oldKeys, List<String> newKeys) {
        for (String key : oldKeys) {
            if (newKeys.contains(key)) {
                continue;
            }
            List<String> filenames = index.get(key);
            if (filenames == null) {
                continue;
            }
            filenames.remove(filename);
            if (filenames.isEmpty()) {
                index.remove(key);
            }
        }
    }

    private static List<String> distinct(List<String> values) {
        if (values == null) {
            return new ArrayList<>();
        }
        return new ArrayList<>(new LinkedHashSet<>(values));
    }
}
