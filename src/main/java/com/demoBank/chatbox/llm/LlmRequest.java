package com.demoBank.chatbox.llm;

import lombok.Builder;
import lombok.Value;

import java.util.List;

@Value
@Builder
public class LlmRequest {
    
    String model;
    List<Turn> turns;
    
    /**
     * One conversation turn; role is "system", "user" or "assistant".
     */
    @Value
    public static class Turn {
        String role;
        String content;
    }
}
