package com.demoBank.chatbox.common.util;

/**
 * Utility class for masking user IDs in logs (privacy compliance).
 */
public final class UserIdMasker {
    
    private UserIdMasker() {
    }
    
    /**
     * Masks a user ID for logging.
     * Shows first 2 and last 2 characters, masks the middle.
     * 
     * @param userId The user ID to mask
     * @return Masked user ID (e.g., "us****42")
     */
    public static String mask(String userId) {
        if (userId == null || userId.length() <= 4) {
            return "****";
        }
        return userId.substring(0, 2) + "****" + userId.substring(userId.length() - 2);
    }
}
