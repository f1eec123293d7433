package com.demoBank.chatbox.llm;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.test.web.client.MockRestServiceServer;
import org.springframework.web.client.RestClient;

import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.header;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.jsonPath;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.requestTo;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withSuccess;

class DifyLlmProviderTest {

    private static final String ENDPOINT = "https://dify.test/v1";

    private MockRestServiceServer server;
    private DifyLlmProvider provider;

    @BeforeEach
    void setUp() {
        RestClient.Builder builder = RestClient.builder();
        server = MockRestServiceServer.bindTo(builder).build();
        provider = new DifyLlmProvider(builder, new ObjectMapper(), ENDPOINT, "dify-key");
    }

    @Test
    @DisplayName("Conversation is flattened into one query and answer events are streamed")
    void stream_forwardsAnswers() {
        String events = """
                data: {"event":"workflow_started","task_id":"t1"}

                data: {"event":"message","answer":"Card ","conversation_id":"c1"}

                data: {"event":"message","answer":"blocked.","conversation_id":"c1"}

                data: {"event":"message_end","metadata":{"usage":{"prompt_tokens":30,"completion_tokens":4,"total_tokens":34}}}

                """;
        server.expect(requestTo(ENDPOINT + "/chat-messages"))
                .andExpect(header(HttpHeaders.AUTHORIZATION, "Bearer dify-key"))
                .andExpect(jsonPath("$.response_mode").value("streaming"))
                .andExpect(jsonPath("$.query").value("system: Be brief.\nuser: block my card"))
                .andRespond(withSuccess(events, MediaType.TEXT_EVENT_STREAM));
        List<String> chunks = new ArrayList<>();

        LlmResponse response = provider.stream(request(), chunks::add, new LlmCancellation());

        assertThat(chunks).containsExactly("Card ", "blocked.");
        assertThat(response.getContent()).isEqualTo("Card blocked.");
        assertThat(response.getTotalTokens()).isEqualTo(34);
        assertThat(response.getModel()).isEqualTo("dify-app");
        server.verify();
    }

    @Test
    @DisplayName("Error event fails the call")
    void stream_errorEvent() {
        server.expect(requestTo(ENDPOINT + "/chat-messages"))
                .andRespond(withSuccess("data: {\"event\":\"error\",\"status\":400,\"message\":\"app unavailable\"}\n\n",
                        MediaType.TEXT_EVENT_STREAM));

        assertThatThrownBy(() -> provider.stream(request(), chunk -> { }, new LlmCancellation()))
                .isInstanceOf(LlmException.class)
                .hasMessageContaining("app unavailable");
    }

    private static LlmRequest request() {
        return LlmRequest.builder()
                .model("dify-app")
                .turns(List.of(
                        new LlmRequest.Turn("system", "Be brief."),
                        new LlmRequest.Turn("user", "block my card")))
                .build();
    }
}
