package dev.pekelund.genai.response;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import dev.pekelund.genai.content.BlockReason;
import dev.pekelund.genai.content.Candidate;
import dev.pekelund.genai.content.CitationMetadata;
import dev.pekelund.genai.content.CitationSource;
import dev.pekelund.genai.content.Content;
import dev.pekelund.genai.content.FinishReason;
import dev.pekelund.genai.content.GenerateContentChunk;
import dev.pekelund.genai.content.HarmCategory;
import dev.pekelund.genai.content.HarmProbability;
import dev.pekelund.genai.content.Part;
import dev.pekelund.genai.content.PromptFeedback;
import dev.pekelund.genai.content.SafetyRating;
import dev.pekelund.genai.content.UsageMetadata;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;

class ResponseChunkMergerTest {

    @Test
    void concatenatesAdjacentTextParts() {
        GenerateContentChunk merged = ResponseChunkMerger.merge(
            chunk(candidate(0, "Hello, ", null)),
            chunk(candidate(0, "world!", FinishReason.STOP)));

        assertThat(merged.candidates()).hasSize(1);
        assertThat(merged.candidates().get(0).parts()).containsExactly(Part.fromText("Hello, world!"));
        assertThat(merged.candidates().get(0).content().role()).isEqualTo(Content.ROLE_MODEL);
    }

    @Test
    void keepsNonTextPartsSeparate() {
        Part call = Part.functionCall("lookup", Map.of("city", "Oslo"));
        Candidate withCall = new Candidate(0, Content.of(Content.ROLE_MODEL, call), null, null, null);

        GenerateContentChunk merged = ResponseChunkMerger.merge(
            chunk(candidate(0, "Checking", null)),
            chunk(withCall));

        assertThat(merged.candidates().get(0).parts()).containsExactly(Part.fromText("Checking"), call);
    }

    @Test
    void textAfterNonTextStartsNewPart() {
        Part call = Part.functionCall("lookup", Map.of());
        GenerateContentChunk merged = ResponseChunkMerger.merge(List.of(
            chunk(new Candidate(0, Content.of(Content.ROLE_MODEL, call), null, null, null)),
            chunk(candidate(0, "a", null)),
            chunk(candidate(0, "b", null))));

        assertThat(merged.candidates().get(0).parts()).containsExactly(call, Part.fromText("ab"));
    }

    @Test
    void emptyTextPartIsNotJoined() {
        GenerateContentChunk merged = ResponseChunkMerger.merge(List.of(
            chunk(candidate(0, "a", null)),
            chunk(candidate(0, "", null)),
            chunk(candidate(0, "b", null))));

        assertThat(merged.candidates().get(0).parts())
            .containsExactly(Part.fromText("a"), Part.fromText(""), Part.fromText("b"));
    }

    @Test
    void lastFinishReasonWins() {
        GenerateContentChunk merged = ResponseChunkMerger.merge(List.of(
            chunk(candidate(0, "a", FinishReason.STOP)),
            chunk(candidate(0, "b", FinishReason.SAFETY)),
            chunk(candidate(0, "c", FinishReason.MAX_TOKENS))));

        assertThat(merged.candidates().get(0).finishReason()).isEqualTo(FinishReason.MAX_TOKENS);
    }

    @Test
    void foldingInOrderMatchesPairwiseMerges() {
        GenerateContentChunk first = chunk(candidate(0, "one ", null));
        GenerateContentChunk second = chunk(candidate(1, "alt", null), candidate(0, "two ", null));
        GenerateContentChunk third = chunk(candidate(0, "three", FinishReason.STOP));

        GenerateContentChunk folded = ResponseChunkMerger.merge(List.of(first, second, third));
        GenerateContentChunk stepwise = ResponseChunkMerger.merge(ResponseChunkMerger.merge(first, second), third);

        assertThat(folded).isEqualTo(stepwise);
        assertThat(folded.candidates().get(0).parts()).containsExactly(Part.fromText("one two three"));
    }

    @Test
    void blockedFlagIsStickyPerCategory() {
        Candidate early = new Candidate(0, Content.model("a"), null, List.of(
            new SafetyRating(HarmCategory.HARM_CATEGORY_HARASSMENT, HarmProbability.LOW, false),
            new SafetyRating(HarmCategory.HARM_CATEGORY_HATE_SPEECH, HarmProbability.NEGLIGIBLE, false)), null);
        Candidate late = new Candidate(0, Content.model("b"), null, List.of(
            new SafetyRating(HarmCategory.HARM_CATEGORY_HATE_SPEECH, HarmProbability.HIGH, true),
            new SafetyRating(HarmCategory.HARM_CATEGORY_HARASSMENT, HarmProbability.NEGLIGIBLE, false)), null);
        Candidate last = new Candidate(0, Content.model("c"), null, List.of(
            new SafetyRating(HarmCategory.HARM_CATEGORY_HATE_SPEECH, HarmProbability.LOW, false)), null);

        GenerateContentChunk merged = ResponseChunkMerger.merge(List.of(chunk(early), chunk(late), chunk(last)));

        assertThat(merged.candidates().get(0).safetyRatings()).containsExactly(
            new SafetyRating(HarmCategory.HARM_CATEGORY_HARASSMENT, HarmProbability.NEGLIGIBLE, false),
            new SafetyRating(HarmCategory.HARM_CATEGORY_HATE_SPEECH, HarmProbability.LOW, true));
    }

    @Test
    void sortsCandidatesByIndex() {
        GenerateContentChunk merged = ResponseChunkMerger.merge(
            chunk(candidate(2, "c", null)),
            chunk(candidate(0, "a", null), candidate(2, "C", null)));

        assertThat(merged.candidates()).extracting(Candidate::index).containsExactly(0, 2);
        assertThat(merged.candidates().get(1).parts()).containsExactly(Part.fromText("cC"));
    }

    @Test
    void appendsCitationsInArrivalOrder() {
        CitationSource source = new CitationSource(0, 10, "https://example.com/a", null);
        CitationSource repeated = new CitationSource(0, 10, "https://example.com/a", null);
        Candidate first = new Candidate(0, Content.model("a"), null, null, new CitationMetadata(List.of(source)));
        Candidate second = new Candidate(0, Content.model("b"), null, null, null);
        Candidate third = new Candidate(0, Content.model("c"), null, null, new CitationMetadata(List.of(repeated)));

        GenerateContentChunk merged = ResponseChunkMerger.merge(List.of(chunk(first), chunk(second), chunk(third)));

        assertThat(merged.candidates().get(0).citationMetadata().citationSources()).containsExactly(source, repeated);
    }

    @Test
    void keepsFirstPromptFeedback() {
        PromptFeedback feedback = new PromptFeedback(null, List.of(
            new SafetyRating(HarmCategory.HARM_CATEGORY_HARASSMENT, HarmProbability.NEGLIGIBLE, false)));
        GenerateContentChunk first = new GenerateContentChunk(List.of(candidate(0, "a", null)), feedback, null);
        GenerateContentChunk second = new GenerateContentChunk(List.of(candidate(0, "b", null)),
            new PromptFeedback(BlockReason.OTHER, null), null);

        assertThat(ResponseChunkMerger.merge(first, second).promptFeedback()).isEqualTo(feedback);
    }

    @Test
    void chunkWithoutCandidatesLeavesCandidatesUntouched() {
        GenerateContentChunk first = chunk(candidate(0, "a", FinishReason.STOP));
        GenerateContentChunk empty = new GenerateContentChunk(List.of(), null, new UsageMetadata(3, null, 1, 4));

        GenerateContentChunk merged = ResponseChunkMerger.merge(first, empty);

        assertThat(merged.candidates()).isEqualTo(first.candidates());
        assertThat(merged.usageMetadata().totalTokenCount()).isEqualTo(4);
    }

    @Test
    void latestUsageMetadataWins() {
        GenerateContentChunk first = new GenerateContentChunk(List.of(candidate(0, "a", null)), null,
            new UsageMetadata(3, null, 1, 4));
        GenerateContentChunk second = chunk(candidate(0, "b", null));
        GenerateContentChunk third = new GenerateContentChunk(List.of(candidate(0, "c", null)), null,
            new UsageMetadata(3, null, 3, 6));

        assertThat(ResponseChunkMerger.merge(first, second).usageMetadata()).isEqualTo(first.usageMetadata());
        assertThat(ResponseChunkMerger.merge(List.of(first, second, third)).usageMetadata())
            .isEqualTo(third.usageMetadata());
    }

    @Test
    void roleIsTakenFromFirstContentThatHasOne() {
        Candidate noRole = new Candidate(0, new Content(null, List.of(Part.fromText("a"))), null, null, null);

        GenerateContentChunk merged = ResponseChunkMerger.merge(chunk(noRole), chunk(candidate(0, "b", null)));

        assertThat(merged.candidates().get(0).content().role()).isEqualTo(Content.ROLE_MODEL);
    }

    @Test
    void roleChangeWithinCandidateIsRejected() {
        Candidate userTurn = new Candidate(0, Content.user("a"), null, null, null);

        assertThatThrownBy(() -> ResponseChunkMerger.merge(chunk(candidate(0, "b", null)), chunk(userTurn)))
            .isInstanceOf(ResponseMergeException.class)
            .isInstanceOf(IllegalStateException.class)
            .hasMessageContaining("changed role");
    }

    @Test
    void rejectsEmptyChunkList() {
        assertThatThrownBy(() -> ResponseChunkMerger.merge(List.of()))
            .isInstanceOf(IllegalArgumentException.class);
    }

    static GenerateContentChunk chunk(Candidate... candidates) {
        return GenerateContentChunk.of(candidates);
    }

    static Candidate candidate(int index, String text, FinishReason finishReason) {
        return new Candidate(index, Content.model(text), finishReason, null, null);
    }
}
