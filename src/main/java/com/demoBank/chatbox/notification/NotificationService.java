package com.demoBank.chatbox.notification;

/**
 * Fire-and-forget delivery of admin notifications. Implementations never throw to the caller.
 */
public interface NotificationService {
    
    void notify(NotificationEvent event);
}
