package com.dcruver.vault.app;

import com.dcruver.vault.config.VaultProperties;
import com.dcruver.vault.domain.FileRecord;
import com.dcruver.vault.domain.FilenameDeriver;
import com.dcruver.vault.domain.GraphExport;
import com.dcruver.vault.domain.IndexStats;
import com.dcruver.vault.domain.KnowledgeIndex;
import com.dcruver.vault.domain.TopicExtractor;
import com.dcruver.vault.domain.links.LinkInferencer;
import com.dcruver.vault.domain.links.LinkingResult;
import com.dcruver.vault.io.DocumentSource;
import com.dcruver.vault.io.FrontmatterParser;
import com.dcruver.vault.io.LoadedDocument;
import com.dcruver.vault.io.MarkdownNote;
import com.dcruver.vault.io.MarkdownNoteWriter;
import com.dcruver.vault.nlp.GenerativeClient;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Processes source documents into indexed, cross-linked vault notes.
 *
 * Each note runs to completion before the next: load, generate, parse, name, index,
 * link, write, save. The pipeline is the only writer of the shared {@link KnowledgeIndex}.
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class KnowledgeBasePipeline {

    private static final String NOTE_EXTENSION = ".md";

    private final DocumentSource documentSource;
    private final GenerativeClient generativeClient;
    private final FrontmatterParser frontmatterParser;
    private final FilenameDeriver filenameDeriver;
    private final TopicExtractor topicExtractor;
    private final KnowledgeIndex index;
    private final LinkInferencer linkInferencer;
    private final MarkdownNoteWriter noteWriter;
    private final VaultProperties properties;

    public Path processDocument(Path inputFile, Path promptFile) throws IOException {
        return processDocument(inputFile, promptFile, null);
    }

    /**
     * Turn one source document into a vault note and persist the updated index.
     *
     * @param outputFilename used when the generated frontmatter has no main topic; may be null
     * @return path of the written note
     */
    public Path processDocument(Path inputFile, Path promptFile, String outputFilename) throws IOException {
        log.info("Processing: {}", inputFile);

        LoadedDocument document = documentSource.load(inputFile);
        String prompt = documentSource.load(promptFile).getContent();
        log.info("Text size: {} characters", document.getContent().length());

        String raw;
        try {
            raw = generativeClient.generate(document.getContent(), prompt);
        } catch (RuntimeException e) {
            log.error("Generation failed for {}", inputFile, e);
            throw e;
        }

        MarkdownNote note = frontmatterParser.parse(raw);
        String filename = resolveFilename(note, document, outputFilename);
        String title = note.getTitle() != null ? note.getTitle() : stripExtension(filename);
        List<String> topics = topicExtractor.extractTopics(note.getBody());

        index.add(filename, title, note.getTags(), topics, null, List.of(), note.getBody().length());

        LinkingResult linking = linkInferencer.link(filename, note.getBody(),
            properties.getLinking().getAutoLinkMinConfidence());
        recordLinks(filename, linking);

        Path outputPath = Path.of(properties.getOutputDir()).resolve(filename);
        noteWriter.write(note.withBody(linking.getBody()), outputPath);

        index.save();
        log.info("File saved: {}", outputPath);

        return outputPath;
    }

    public GraphStats getGraphStats() {
        IndexStats stats = index.getStats();
        return GraphStats.builder()
            .totalFiles(stats.getTotalFiles())
            .totalLinks(stats.getTotalLinks())
            .uniqueTopics(index.uniqueTopicCount())
            .uniqueTags(index.uniqueTagCount())
            .build();
    }

    /**
     * Files with neither backlinks nor related links
     */
    public List<String> findOrphanedFiles() {
        List<String> orphaned = new ArrayList<>();
        for (String filename : index.getFilenames()) {
            boolean hasIncoming = !index.getBacklinks(filename).isEmpty();
            boolean hasOutgoing = index.getFileInfo(filename)
                .map(FileRecord::getRelated)
                .filter(related -> !related.isEmpty())
                .isPresent();
            if (!hasIncoming && !hasOutgoing) {
                orphaned.add(filename);
            }
        }
        return orphaned;
    }

    public GraphExport exportGraph() {
        return index.exportGraph();
    }

    /**
     * Related links come from the Related Topics section; every link target gets a backlink.
     */
    private void recordLinks(String filename, LinkingResult linking) {
        index.updateRelatedLinks(filename, linking.getRelatedTargets());

        Set<String> targets = new LinkedHashSet<>(linking.getLinkedTargets());
        targets.addAll(linking.getRelatedTargets());
        for (String target : targets) {
            index.updateBacklink(filename, target);
        }
        log.debug("Recorded {} backlinks from {}", targets.size(), filename);
    }

    private String resolveFilename(MarkdownNote note, LoadedDocument document, String outputFilename) {
        String base;
        if (note.getMainTopic() != null) {
            String title = note.getTitle() != null ? note.getTitle() : "";
            base = filenameDeriver.derive(note.getMainTopic(), title, properties.getDefaultFilename());
        } else if (outputFilename != null && !outputFilename.isBlank()) {
            base = outputFilename.strip();
        } else {
            String source = note.getTitle() != null ? note.getTitle() : stripSourceExtension(document.getFileName());
            base = filenameDeriver.derive(null, source, properties.getDefaultFilename());
        }
        return base.endsWith(NOTE_EXTENSION) ? base : base + NOTE_EXTENSION;
    }

    private static String stripExtension(String filename) {
        return filename.endsWith(NOTE_EXTENSION)
            ? filename.substring(0, filename.length() - NOTE_EXTENSION.length())
            : filename;
    }

    private static String stripSourceExtension(String fileName) {
        int dot = fileName.lastIndexOf('.');
        return dot > 0 ? fileName.substring(0, dot) : fileName;
    }
}
