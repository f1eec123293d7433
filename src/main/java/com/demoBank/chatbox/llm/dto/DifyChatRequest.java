package com.demoBank.chatbox.llm.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.Map;

/**
 * Request body for a Dify chat application.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class DifyChatRequest {
    
    @JsonProperty("inputs")
    private Map<String, String> inputs;
    
    @JsonProperty("query")
    private String query;
    
    @JsonProperty("response_mode")
    private String responseMode;
    
    @JsonProperty("user")
    private String user;
}
