package com.example.JobCopilot.service;

import com.example.JobCopilot.model.EvidenceItem;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.List;
import java.util.function.Predicate;
import java.util.stream.Collectors;

/**
 * Renders evidence as labeled sections for the prompt:
 * <pre>
 * Job Notes:
 * - [2024-11-12 17:40 UTC] Homeowner reported rattling. (doc_id: note_demo_1)
 * </pre>
 * Empty sections are left out.
 */
@Component
public class EvidenceFormatter {

    private static final DateTimeFormatter STAMP =
            DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm 'UTC'").withZone(ZoneOffset.UTC);

    public String format(List<EvidenceItem> evidence, List<EvidenceItem> vectorEvidence) {
        List<String> sections = new ArrayList<>();
        addSection(sections, "Job Notes", evidence, scoped("job", EvidenceItem.TYPE_NOTE));
        addSection(sections, "Job Events", evidence, scoped("job", EvidenceItem.TYPE_JOB_EVENT));
        addSection(sections, "Property Notes", evidence, scoped("property", EvidenceItem.TYPE_NOTE));
        addSection(sections, "Client Notes", evidence, scoped("client", EvidenceItem.TYPE_NOTE));
        addSection(sections, "Related Vector Matches", vectorEvidence, item -> true);
        return String.join("\n\n", sections);
    }

    static String formatStamp(Instant date) {
        return date == null ? "" : STAMP.format(date);
    }

    private static Predicate<EvidenceItem> scoped(String scope, String type) {
        return item -> scope.equals(item.scope()) && type.equals(item.type());
    }

    private static void addSection(List<String> sections, String title, List<EvidenceItem> items,
                                   Predicate<EvidenceItem> filter) {
        if (items == null) {
            return;
        }
        String lines = items.stream()
                .filter(filter)
                .map(EvidenceFormatter::line)
                .collect(Collectors.joining("\n"));
        if (!lines.isEmpty()) {
            sections.add(title + ":\n" + lines);
        }
    }

    private static String line(EvidenceItem item) {
        String stamp = formatStamp(item.date());
        String prefix = stamp.isEmpty() ? "" : "[" + stamp + "] ";
        String text = item.snippet() == null ? "" : item.snippet();
        return "- " + prefix + text + " (doc_id: " + item.docId() + ")";
    }
}
