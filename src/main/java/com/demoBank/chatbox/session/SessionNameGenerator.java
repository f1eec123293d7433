package com.demoBank.chatbox.session;

/**
 * Derives a display name for a session from its first user message.
 */
public final class SessionNameGenerator {
    
    public static final String DEFAULT_NAME = "New Chat";
    public static final int MAX_LENGTH = 50;
    private static final String ELLIPSIS = "...";
    
    private SessionNameGenerator() {
    }
    
    /**
     * Takes the first line or sentence of the message and shortens it to {@code maxLength},
     * cutting at a word boundary when possible.
     * 
     * @param firstMessage First user message of the session
     * @param maxLength Maximum length of the name, ellipsis included
     * @return Session name, or {@value #DEFAULT_NAME} for blank input
     */
    public static String generate(String firstMessage, int maxLength) {
        String message = firstMessage == null ? "" : firstMessage.trim();
        if (message.isEmpty()) {
            return DEFAULT_NAME;
        }
        
        String name = firstSentenceOrLine(message);
        if (name.length() <= maxLength) {
            return name;
        }
        if (maxLength <= ELLIPSIS.length()) {
            return ELLIPSIS;
        }
        return truncateAtWordBoundary(name, maxLength - ELLIPSIS.length()) + ELLIPSIS;
    }
    
    public static String generate(String firstMessage) {
        return generate(firstMessage, MAX_LENGTH);
    }
    
    private static String firstSentenceOrLine(String text) {
        for (int i = 0; i < text.length(); i++) {
            char c = text.charAt(i);
            if (c == '\n' || c == '\r') {
                return text.substring(0, i).trim();
            }
        }
        for (int i = 0; i < text.length(); i++) {
            char c = text.charAt(i);
            if (c == '.' || c == '?' || c == '!') {
                return text.substring(0, i + 1).trim();
            }
        }
        return text;
    }
    
    private static String truncateAtWordBoundary(String text, int maxLength) {
        if (text.length() <= maxLength) {
            return text;
        }
        String truncated = text.substring(0, maxLength);
        int lastSpace = truncated.lastIndexOf(' ');
        if (lastSpace > 0) {
            return truncated.substring(0, lastSpace).trim();
        }
        return truncated;
    }
}
