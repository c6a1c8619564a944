package dev.clarityhub.ingestion;

import dev.langchain4j.data.message.SystemMessage;
import dev.langchain4j.data.message.UserMessage;
import dev.langchain4j.model.chat.ChatModel;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.List;

/**
 * Produces the short AI summary stored with each document. Best effort: a provider failure or an
 * empty answer yields {@link #FALLBACK_SUMMARY} instead of failing processing.
 */
@Service
public class DocumentSummarizer {

    private static final Logger log = LoggerFactory.getLogger(DocumentSummarizer.class);

    static final String FALLBACK_SUMMARY = "Summary unavailable.";
    static final int MAX_INPUT_CHARS = 12_000;

    static final String INSTRUCTION = "You are a legal document analyst. Provide a concise 2-3 sentence "
            + "summary of the document content. Focus on key facts, dates, parties, and legal significance.";

    private final ChatModel chatModel;

    public DocumentSummarizer(ChatModel chatModel) {
        this.chatModel = chatModel;
    }

    /**
     * Summarises the leading part of a document.
     *
     * @param text     the extracted text; only the first 12,000 characters are sent
     * @param fileName the document name, given to the model as context
     * @return the summary, or {@value #FALLBACK_SUMMARY}
     */
    public String summarize(String text, String fileName) {
        String excerpt = text.length() > MAX_INPUT_CHARS ? text.substring(0, MAX_INPUT_CHARS) : text;
        try {
            String summary = chatModel.chat(List.of(
                    SystemMessage.from(INSTRUCTION),
                    UserMessage.from("Summarize this document (filename: \"" + fileName + "\"):\n\n" + excerpt)
            )).aiMessage().text();
            if (summary == null || summary.isBlank()) {
                log.warn("Empty summary returned for {}", fileName);
                return FALLBACK_SUMMARY;
            }
            return summary.strip();
        } catch (RuntimeException e) {
            log.warn("Summary generation failed for {}: {}", fileName, e.getMessage());
            return FALLBACK_SUMMARY;
        }
    }
}
