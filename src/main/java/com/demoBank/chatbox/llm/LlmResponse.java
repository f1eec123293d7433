package com.demoBank.chatbox.llm;

import lombok.Builder;
import lombok.Value;

@Value
@Builder
public class LlmResponse {
    
    String content;
    String model;
    
    /**
     * Tokens reported by the provider, or 0 when it reported none.
     */
    long totalTokens;
}
