package dev.pekelund.genai.response;

import dev.pekelund.genai.content.Candidate;
import dev.pekelund.genai.content.CitationMetadata;
import dev.pekelund.genai.content.CitationSource;
import dev.pekelund.genai.content.Content;
import dev.pekelund.genai.content.FinishReason;
import dev.pekelund.genai.content.GenerateContentChunk;
import dev.pekelund.genai.content.HarmCategory;
import dev.pekelund.genai.content.Part;
import dev.pekelund.genai.content.SafetyRating;
import dev.pekelund.genai.content.UsageMetadata;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.TreeMap;

/**
 * Folds the partial messages of a streamed response into one accumulated message.
 *
 * <p>Candidates are matched by index. For each index the text parts that arrive back to back are
 * joined into a single part while every non-text part is kept as its own part, the last finish
 * reason wins, safety ratings are combined per category and citations are appended in arrival
 * order. Prompt feedback is taken from the first message only, since the service sends it once.
 */
public final class ResponseChunkMerger {

    private ResponseChunkMerger() {
        // Utility class
    }

    public static GenerateContentChunk merge(GenerateContentChunk existing, GenerateContentChunk next) {
        Objects.requireNonNull(existing, "existing");
        Objects.requireNonNull(next, "next");

        Map<Integer, List<Candidate>> byIndex = new TreeMap<>();
        for (Candidate candidate : existing.candidates()) {
            byIndex.computeIfAbsent(candidate.index(), key -> new ArrayList<>()).add(candidate);
        }
        for (Candidate candidate : next.candidates()) {
            byIndex.computeIfAbsent(candidate.index(), key -> new ArrayList<>()).add(candidate);
        }

        List<Candidate> candidates = new ArrayList<>(byIndex.size());
        for (Map.Entry<Integer, List<Candidate>> entry : byIndex.entrySet()) {
            candidates.add(joinCandidates(entry.getKey(), entry.getValue()));
        }

        UsageMetadata usage = next.usageMetadata() != null ? next.usageMetadata() : existing.usageMetadata();
        return new GenerateContentChunk(candidates, existing.promptFeedback(), usage);
    }

    public static GenerateContentChunk merge(List<GenerateContentChunk> chunks) {
        if (chunks == null || chunks.isEmpty()) {
            throw new IllegalArgumentException("At least one chunk is required");
        }
        GenerateContentChunk result = chunks.get(0);
        for (int i = 1; i < chunks.size(); i++) {
            result = merge(result, chunks.get(i));
        }
        return result;
    }

    private static Candidate joinCandidates(int index, List<Candidate> candidates) {
        List<Content> contents = new ArrayList<>(candidates.size());
        List<SafetyRating> ratings = new ArrayList<>();
        List<CitationSource> citations = new ArrayList<>();
        boolean anyCitations = false;
        FinishReason finishReason = null;

        for (Candidate candidate : candidates) {
            if (candidate.content() != null) {
                contents.add(candidate.content());
            }
            ratings.addAll(candidate.safetyRatings());
            if (candidate.citationMetadata() != null) {
                anyCitations = true;
                citations.addAll(candidate.citationMetadata().citationSources());
            }
            finishReason = candidate.finishReason();
        }

        return new Candidate(
            index,
            joinContents(index, contents),
            finishReason,
            joinSafetyRatings(ratings),
            anyCitations ? new CitationMetadata(citations) : null);
    }

    private static Content joinContents(int index, List<Content> contents) {
        if (contents.isEmpty()) {
            return null;
        }

        String role = null;
        List<Part> parts = new ArrayList<>();
        for (Content content : contents) {
            String contentRole = content.role();
            if (contentRole != null && !contentRole.isEmpty()) {
                if (role == null) {
                    role = contentRole;
                } else if (!role.equals(contentRole)) {
                    throw new ResponseMergeException("Candidate " + index + " changed role from '" + role
                        + "' to '" + contentRole + "' within one response");
                }
            }
            for (Part part : content.parts()) {
                int last = parts.size() - 1;
                if (last >= 0 && joinsAsText(parts.get(last)) && joinsAsText(part)) {
                    parts.set(last, parts.get(last).withText(parts.get(last).text() + part.text()));
                } else {
                    parts.add(part);
                }
            }
        }
        return new Content(role, parts);
    }

    // an empty text part is kept as its own boundary
    private static boolean joinsAsText(Part part) {
        return part.hasText() && !part.text().isEmpty();
    }

    private static List<SafetyRating> joinSafetyRatings(List<SafetyRating> ratings) {
        Map<HarmCategory, SafetyRating> byCategory = new LinkedHashMap<>();
        for (SafetyRating rating : ratings) {
            SafetyRating previous = byCategory.get(rating.category());
            if (previous == null) {
                byCategory.put(rating.category(), rating);
            } else {
                byCategory.put(rating.category(),
                    new SafetyRating(rating.category(), rating.probability(), previous.blocked() || rating.blocked()));
            }
        }
        return new ArrayList<>(byCategory.values());
    }
}
