package com.demoBank.chatbox.llm;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpMethod;
import org.springframework.http.MediaType;
import org.springframework.test.web.client.MockRestServiceServer;
import org.springframework.web.client.RestClient;

import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.header;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.jsonPath;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.method;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.requestTo;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withSuccess;

class AnthropicLlmProviderTest {

    private static final String ENDPOINT = "https://anthropic.test/v1";

    private MockRestServiceServer server;
    private AnthropicLlmProvider provider;

    @BeforeEach
    void setUp() {
        RestClient.Builder builder = RestClient.builder();
        server = MockRestServiceServer.bindTo(builder).build();
        provider = new AnthropicLlmProvider(builder, new ObjectMapper(), ENDPOINT, "anthropic-key");
    }

    @Test
    @DisplayName("Text deltas are streamed and input plus output tokens are reported")
    void stream_forwardsDeltas() {
        String events = """
                event: message_start
                data: {"type":"message_start","message":{"model":"claude-3-5-sonnet-20241022","usage":{"input_tokens":25,"output_tokens":1}}}

                event: content_block_start
                data: {"type":"content_block_start","index":0,"content_block":{"type":"text","text":""}}

                event: content_block_delta
                data: {"type":"content_block_delta","index":0,"delta":{"type":"text_delta","text":"Your balance"}}

                event: ping
                data: {"type":"ping"}

                event: content_block_delta
                data: {"type":"content_block_delta","index":0,"delta":{"type":"text_delta","text":" is ready."}}

                event: message_delta
                data: {"type":"message_delta","delta":{"stop_reason":"end_turn"},"usage":{"output_tokens":6}}

                event: message_stop
                data: {"type":"message_stop"}

                """;
        server.expect(requestTo(ENDPOINT + "/messages"))
                .andExpect(method(HttpMethod.POST))
                .andExpect(header("x-api-key", "anthropic-key"))
                .andExpect(header("anthropic-version", AnthropicLlmProvider.API_VERSION))
                .andExpect(jsonPath("$.stream").value(true))
                .andExpect(jsonPath("$.max_tokens").value(AnthropicLlmProvider.MAX_TOKENS))
                .andExpect(jsonPath("$.messages[0].role").value("user"))
                .andExpect(jsonPath("$.messages[1].content").value("what is my balance?"))
                .andRespond(withSuccess(events, MediaType.TEXT_EVENT_STREAM));
        List<String> chunks = new ArrayList<>();

        LlmResponse response = provider.stream(request(), chunks::add, new LlmCancellation());

        assertThat(chunks).containsExactly("Your balance", " is ready.");
        assertThat(response.getContent()).isEqualTo("Your balance is ready.");
        assertThat(response.getModel()).isEqualTo("claude-3-5-sonnet-20241022");
        assertThat(response.getTotalTokens()).isEqualTo(31);
        server.verify();
    }

    @Test
    @DisplayName("Error event in the stream fails the call")
    void stream_errorEvent() {
        server.expect(requestTo(ENDPOINT + "/messages"))
                .andRespond(withSuccess("event: error\ndata: {\"type\":\"error\",\"error\":{\"type\":\"overloaded_error\","
                        + "\"message\":\"Overloaded\"}}\n\n", MediaType.TEXT_EVENT_STREAM));

        assertThatThrownBy(() -> provider.stream(request(), chunk -> { }, new LlmCancellation()))
                .isInstanceOf(LlmException.class)
                .hasMessageContaining("Overloaded");
    }

    private static LlmRequest request() {
        return LlmRequest.builder()
                .model("claude-3-5-sonnet-latest")
                .turns(List.of(
                        new LlmRequest.Turn("system", "You are a helpful support assistant."),
                        new LlmRequest.Turn("user", "what is my balance?")))
                .build();
    }
}
