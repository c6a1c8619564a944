package dev.clarityhub.search;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.BDDMockito.given;
import static org.mockito.Mockito.verify;

import com.fasterxml.jackson.databind.ObjectMapper;
import dev.langchain4j.data.message.AiMessage;
import dev.langchain4j.data.message.ChatMessage;
import dev.langchain4j.data.message.SystemMessage;
import dev.langchain4j.data.message.UserMessage;
import dev.langchain4j.model.chat.ChatModel;
import dev.langchain4j.model.chat.response.ChatResponse;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Captor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class QueryExpanderTest {

  private static final String QUERY = "tenant eviction notice";

  @Mock ChatModel chatModel;

  @Captor ArgumentCaptor<List<ChatMessage>> messagesCaptor;

  private QueryExpander expander;

  @BeforeEach
  void setUp() {
    expander = new QueryExpander(chatModel, new ObjectMapper());
  }

  private void answer(String text) {
    given(chatModel.chat(anyList()))
        .willReturn(ChatResponse.builder().aiMessage(AiMessage.from(text)).build());
  }

  @Test
  void mergesSuggestedTermsConceptsAndSynonyms() {
    answer(
        """
        {
          "expandedQuery": "tenant eviction notice unlawful detainer",
          "suggestedTerms": ["unlawful detainer", "notice to quit"],
          "legalConcepts": ["landlord-tenant law", "notice to quit"],
          "synonyms": ["removal", "  "]
        }
        """);

    QueryExpansion expansion = expander.expand(QUERY);

    assertThat(expansion.expandedQuery()).isEqualTo("tenant eviction notice unlawful detainer");
    assertThat(expansion.suggestedTerms())
        .containsExactly("unlawful detainer", "notice to quit", "landlord-tenant law", "removal");
  }

  @Test
  void sendsInstructionAndQuotedQuery() {
    answer("{\"expandedQuery\": \"x\"}");

    expander.expand(QUERY);

    verify(chatModel).chat(messagesCaptor.capture());
    List<ChatMessage> messages = messagesCaptor.getValue();
    assertThat(messages).hasSize(2);
    assertThat(((SystemMessage) messages.get(0)).text()).contains("legal search expert");
    assertThat(((UserMessage) messages.get(1)).singleText())
        .isEqualTo("Original Query: \"tenant eviction notice\"");
  }

  @Test
  void acceptsResponseWrappedInCodeFence() {
    answer("```json\n{\"expandedQuery\": \"expanded\", \"suggestedTerms\": [\"a term\"]}\n```");

    QueryExpansion expansion = expander.expand(QUERY);

    assertThat(expansion.expandedQuery()).isEqualTo("expanded");
    assertThat(expansion.suggestedTerms()).containsExactly("a term");
  }

  @Test
  void malformedJsonFallsBackToOriginalQuery() {
    answer("Sure! Here are some terms: eviction, notice");

    QueryExpansion expansion = expander.expand(QUERY);

    assertThat(expansion).isEqualTo(QueryExpansion.none(QUERY));
  }

  @Test
  void nonObjectJsonFallsBackToOriginalQuery() {
    answer("[\"eviction\"]");

    assertThat(expander.expand(QUERY)).isEqualTo(QueryExpansion.none(QUERY));
  }

  @Test
  void missingExpandedQueryKeepsOriginalButUsesTerms() {
    answer("{\"suggestedTerms\": [\"ejectment\"], \"synonyms\": \"not-an-array\"}");

    QueryExpansion expansion = expander.expand(QUERY);

    assertThat(expansion.expandedQuery()).isEqualTo(QUERY);
    assertThat(expansion.suggestedTerms()).containsExactly("ejectment");
  }

  @Test
  void providerFailureFallsBackToOriginalQuery() {
    given(chatModel.chat(anyList())).willThrow(new RuntimeException("401 Unauthorized"));

    assertThat(expander.expand(QUERY)).isEqualTo(QueryExpansion.none(QUERY));
  }

  @Test
  void blankResponseFallsBackToOriginalQuery() {
    answer("   ");

    assertThat(expander.expand(QUERY)).isEqualTo(QueryExpansion.none(QUERY));
  }

  @Test
  void stripsOnlySurroundingFences() {
    assertThat(QueryExpander.stripCodeFence("```\n{}\n```")).isEqualTo("{}");
    assertThat(QueryExpander.stripCodeFence("  {\"a\": 1}  ")).isEqualTo("{\"a\": 1}");
    assertThat(QueryExpander.stripCodeFence("```")).isEqualTo("```");
  }
}
