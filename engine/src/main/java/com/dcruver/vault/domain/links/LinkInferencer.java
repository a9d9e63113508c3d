package com.dcruver.vault.domain.links;

import com.dcruver.vault.domain.FileRecord;
import com.dcruver.vault.domain.KnowledgeIndex;
import com.dcruver.vault.domain.RelatedFile;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Enriches note bodies with wiki-style cross-references.
 *
 * Bold mentions that match an indexed topic become inline links, and every sufficiently
 * related note is listed in a "Related Topics" section. The index is only read, never written.
 */
@Slf4j
@RequiredArgsConstructor
public class LinkInferencer {

    public static final double MENTION_CONFIDENCE = 0.8;
    public static final double DEFAULT_AUTO_LINK_MIN_CONFIDENCE = 0.6;
    public static final double RELATED_SECTION_MIN_CONFIDENCE = 0.4;

    static final String RELATED_HEADING = "## Related Topics";

    private static final Pattern MENTION = Pattern.compile("\\*\\*([^*]+)\\*\\*");
    private static final Pattern RELATED_SECTION_START = Pattern.compile("^## Related Topics[ \\t]*$", Pattern.MULTILINE);
    private static final Pattern NEXT_HEADING = Pattern.compile("^#{1,6}\\s", Pattern.MULTILINE);
    private static final String NOTE_EXTENSION = ".md";

    private final KnowledgeIndex index;

    /**
     * Lowercased text of every bold span, in order of appearance.
     * Evaluated lazily; each iteration rescans the body.
     */
    public Iterable<String> extractMentions(String body) {
        Objects.requireNonNull(body, "body");
        return () -> MENTION.matcher(body).results()
            .map(match -> match.group(1).toLowerCase(Locale.ROOT))
            .iterator();
    }

    public List<LinkOpportunity> findLinkOpportunities(String filename, String body) {
        return findLinkOpportunities(filename, body, KnowledgeIndex.DEFAULT_MIN_RELEVANCE);
    }

    /**
     * Mentions matching an indexed topic (either containing the other) yield anchored
     * opportunities; similar files from the index yield unanchored ones scored by similarity.
     */
    public List<LinkOpportunity> findLinkOpportunities(String filename, String body, double minRelevance) {
        List<LinkOpportunity> opportunities = new ArrayList<>();
        Map<String, List<String>> topics = index.getTopics();

        for (String mention : extractMentions(body)) {
            for (Map.Entry<String, List<String>> entry : topics.entrySet()) {
                String topic = entry.getKey();
                if (topic.isBlank() || !(topic.contains(mention) || mention.contains(topic))) {
                    continue;
                }
                for (String target : entry.getValue()) {
                    if (!target.equals(filename)) {
                        opportunities.add(new LinkOpportunity(target, mention, MENTION_CONFIDENCE));
                    }
                }
            }
        }

        for (RelatedFile related : index.findRelated(filename, KnowledgeIndex.DEFAULT_MAX_RESULTS, minRelevance)) {
            opportunities.add(new LinkOpportunity(related.getFilename(), null, related.getScore()));
        }

        log.debug("Found {} link opportunities for {}", opportunities.size(), filename);
        return opportunities;
    }

    public String generateLinks(String filename, String body) {
        return generateLinks(filename, body, DEFAULT_AUTO_LINK_MIN_CONFIDENCE);
    }

    public String generateLinks(String filename, String body, double autoLinkMinConfidence) {
        return link(filename, body, autoLinkMinConfidence).getBody();
    }

    /**
     * Rewrite bold mentions into links and build or replace the Related Topics section.
     */
    public LinkingResult link(String filename, String body, double autoLinkMinConfidence) {
        List<LinkOpportunity> opportunities = findLinkOpportunities(filename, body);

        String content = body;
        List<String> linkedTargets = new ArrayList<>();

        for (LinkOpportunity opportunity : opportunities) {
            if (!opportunity.isAnchored() || opportunity.getConfidence() < autoLinkMinConfidence) {
                continue;
            }

            // Anchors are lowercased mentions; the bold span in the body keeps its original case
            String anchor = opportunity.getAnchor().get();
            Pattern bold = Pattern.compile("\\*\\*" + Pattern.quote(anchor) + "\\*\\*",
                Pattern.CASE_INSENSITIVE | Pattern.UNICODE_CASE);
            Matcher matcher = bold.matcher(content);
            if (matcher.find()) {
                String link = "[[" + stripExtension(opportunity.getTarget()) + "|" + anchor + "]]";
                content = content.substring(0, matcher.start()) + link + content.substring(matcher.end());
                linkedTargets.add(opportunity.getTarget());
            }
        }

        List<String> relatedTargets = new ArrayList<>();
        if (!opportunities.isEmpty()) {
            content = writeRelatedSection(content, opportunities, relatedTargets);
        }

        if (!linkedTargets.isEmpty()) {
            log.info("Added {} inline links to {}", linkedTargets.size(), filename);
        }

        return LinkingResult.builder()
            .body(content)
            .linkedTargets(linkedTargets)
            .relatedTargets(relatedTargets)
            .build();
    }

    private String writeRelatedSection(String content, List<LinkOpportunity> opportunities, List<String> relatedTargets) {
        StringBuilder section = new StringBuilder(RELATED_HEADING).append("\n");

        Set<String> seen = new LinkedHashSet<>();
        for (LinkOpportunity opportunity : opportunities) {
            if (opportunity.getConfidence() > RELATED_SECTION_MIN_CONFIDENCE && seen.add(opportunity.getTarget())) {
                String name = stripExtension(opportunity.getTarget());
                String title = index.getFileInfo(opportunity.getTarget())
                    .map(FileRecord::getTitle)
                    .orElse(name);
                section.append("- [[").append(name).append("]] - ").append(title).append("\n");
            }
        }
        relatedTargets.addAll(seen);

        Matcher start = RELATED_SECTION_START.matcher(content);
        if (start.find()) {
            int sectionEnd = content.length();
            String trailer = "";
            Matcher next = NEXT_HEADING.matcher(content);
            if (next.find(start.end())) {
                sectionEnd = next.start();
                trailer = "\n";
            }
            return content.substring(0, start.start()) + section + trailer + content.substring(sectionEnd);
        }

        String separator = content.isEmpty() ? "" : content.endsWith("\n") ? "\n" : "\n\n";
        return content + separator + section;
    }

    private static String stripExtension(String filename) {
        return filename.endsWith(NOTE_EXTENSION)
            ? filename.substring(0, filename.length() - NOTE_EXTENSION.length())
            : filename;
    }
}
