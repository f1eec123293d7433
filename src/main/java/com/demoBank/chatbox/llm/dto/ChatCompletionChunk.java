package com.demoBank.chatbox.llm.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * One server-sent event of a streamed chat completion.
 * Usage arrives on the last chunk, either top-level or under {@code x_groq}.
 */
@Data
@NoArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class ChatCompletionChunk {
    
    @JsonProperty("id")
    private String id;
    
    @JsonProperty("model")
    private String model;
    
    @JsonProperty("choices")
    private List<Choice> choices;
    
    @JsonProperty("usage")
    private Usage usage;
    
    @JsonProperty("x_groq")
    private ProviderExtension providerExtension;
    
    public String deltaContent() {
        if (choices == null || choices.isEmpty() || choices.get(0).getDelta() == null) {
            return null;
        }
        return choices.get(0).getDelta().getContent();
    }
    
    public Usage resolveUsage() {
        if (usage != null) {
            return usage;
        }
        return providerExtension != null ? providerExtension.getUsage() : null;
    }
    
    @Data
    @NoArgsConstructor
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class Choice {
        @JsonProperty("index")
        private Integer index;
        
        @JsonProperty("delta")
        private Delta delta;
        
        @JsonProperty("finish_reason")
        private String finishReason;
    }
    
    @Data
    @NoArgsConstructor
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class Delta {
        @JsonProperty("role")
        private String role;
        
        @JsonProperty("content")
        private String content;
    }
    
    @Data
    @NoArgsConstructor
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class Usage {
        @JsonProperty("prompt_tokens")
        private Integer promptTokens;
        
        @JsonProperty("completion_tokens")
        private Integer completionTokens;
        
        @JsonProperty("total_tokens")
        private Integer totalTokens;
    }
    
    @Data
    @NoArgsConstructor
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class ProviderExtension {
        @JsonProperty("usage")
        private Usage usage;
    }
}
