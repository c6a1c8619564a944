package dev.clarityhub.search;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import dev.langchain4j.data.message.SystemMessage;
import dev.langchain4j.data.message.UserMessage;
import dev.langchain4j.model.chat.ChatModel;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Enriches a query with legal synonyms and concepts before retrieval.
 *
 * <p>Best effort: any provider error or malformed response yields {@link QueryExpansion#none},
 * so search never fails because of expansion.
 */
@Service
public class QueryExpander {

  private static final Logger log = LoggerFactory.getLogger(QueryExpander.class);

  static final String INSTRUCTION =
      """
      You are a legal search expert. Given a search query, suggest related legal terms and \
      concepts that should be included in the search.

      Respond with a single JSON object in this format:
      {
        "expandedQuery": "Enhanced version of the original query with legal context",
        "suggestedTerms": ["term1", "term2", "term3"],
        "legalConcepts": ["concept1", "concept2"],
        "synonyms": ["synonym1", "synonym2"]
      }

      Focus on legal terminology and synonyms, related concepts in law, common phrases used in \
      legal documents, and both formal legal language and plain language equivalents.

      Return only the JSON object without any additional text.""";

  private final ChatModel chatModel;
  private final ObjectMapper objectMapper;

  public QueryExpander(ChatModel chatModel, ObjectMapper objectMapper) {
    this.chatModel = chatModel;
    this.objectMapper = objectMapper;
  }

  /**
   * Expands a query.
   *
   * @param query the user's query
   * @return the expansion, or the query itself with no terms on any failure
   */
  public QueryExpansion expand(String query) {
    String response;
    try {
      response =
          chatModel
              .chat(
                  List.of(
                      SystemMessage.from(INSTRUCTION),
                      UserMessage.from("Original Query: \"" + query + "\"")))
              .aiMessage()
              .text();
    } catch (RuntimeException e) {
      log.warn("Query expansion failed, searching with the original query: {}", e.getMessage());
      return QueryExpansion.none(query);
    }
    return parse(query, response);
  }

  QueryExpansion parse(String query, String response) {
    if (response == null || response.isBlank()) {
      log.warn("Query expansion returned an empty response, using original query");
      return QueryExpansion.none(query);
    }
    JsonNode root;
    try {
      root = objectMapper.readTree(stripCodeFence(response));
    } catch (JsonProcessingException e) {
      log.warn("Failed to parse query expansion, using original query: {}", e.getMessage());
      return QueryExpansion.none(query);
    }
    if (root == null || !root.isObject()) {
      log.warn("Query expansion is not a JSON object, using original query");
      return QueryExpansion.none(query);
    }

    String expandedQuery = root.path("expandedQuery").asText("");
    if (expandedQuery.isBlank()) {
      expandedQuery = query;
    }
    Set<String> terms = new LinkedHashSet<>();
    addTerms(root.path("suggestedTerms"), terms);
    addTerms(root.path("legalConcepts"), terms);
    addTerms(root.path("synonyms"), terms);
    log.debug("Query expanded with {} suggested terms", terms.size());
    return new QueryExpansion(expandedQuery, new ArrayList<>(terms));
  }

  private static void addTerms(JsonNode array, Set<String> terms) {
    if (!array.isArray()) {
      return;
    }
    for (JsonNode element : array) {
      if (element.isTextual() && !element.asText().isBlank()) {
        terms.add(element.asText().strip());
      }
    }
  }

  /** Removes a surrounding Markdown code fence, which chat models often add despite instructions. */
  static String stripCodeFence(String response) {
    String trimmed = response.strip();
    if (!trimmed.startsWith("```")) {
      return trimmed;
    }
    int firstNewline = trimmed.indexOf('\n');
    int closingFence = trimmed.lastIndexOf("```");
    if (firstNewline < 0 || closingFence <= firstNewline) {
      return trimmed;
    }
    return trimmed.substring(firstNewline + 1, closingFence).strip();
  }
}
