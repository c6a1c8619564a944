package dev.clarityhub.ingestion;

import dev.clarityhub.ingestion.chunking.ChunkingOptions;
import dev.clarityhub.ingestion.chunking.ChunkingOptions.SectionHeading;
import dev.clarityhub.ingestion.chunking.TranscriptSegment;
import java.util.List;
import java.util.stream.Collectors;
import org.jspecify.annotations.Nullable;

/**
 * Extracted content to chunk and embed for one document: either plain text with optional page and
 * section tables, or a timed transcript.
 *
 * @param text extracted document text; null for transcripts
 * @param transcript transcript segments; empty for plain text
 * @param pageBreaks ascending offsets where new pages start
 * @param sectionHeadings headings with ascending offsets
 */
public record ProcessDocumentRequest(
        @Nullable String text,
        List<TranscriptSegment> transcript,
        List<Integer> pageBreaks,
        List<SectionHeading> sectionHeadings) {

    public ProcessDocumentRequest {
        transcript = transcript == null ? List.of() : List.copyOf(transcript);
        pageBreaks = pageBreaks == null ? List.of() : List.copyOf(pageBreaks);
        sectionHeadings = sectionHeadings == null ? List.of() : List.copyOf(sectionHeadings);
        if (text != null && !text.isEmpty() && !transcript.isEmpty()) {
            throw new IllegalArgumentException("Provide either text or transcript segments, not both");
        }
    }

    public static ProcessDocumentRequest ofText(String text) {
        return new ProcessDocumentRequest(text, List.of(), List.of(), List.of());
    }

    public static ProcessDocumentRequest ofTranscript(List<TranscriptSegment> segments) {
        return new ProcessDocumentRequest(null, segments, List.of(), List.of());
    }

    public boolean isTranscript() {
        return !transcript.isEmpty();
    }

    /** The text that is summarised and stored: the document text, or the joined transcript. */
    public String fullText() {
        if (isTranscript()) {
            return transcript.stream().map(TranscriptSegment::text).collect(Collectors.joining(" "));
        }
        return text == null ? "" : text;
    }

    public ChunkingOptions chunkingOptions() {
        return new ChunkingOptions(pageBreaks, sectionHeadings);
    }
}
