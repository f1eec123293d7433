package com.demoBank.chatbox;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class ChatboxApplication {

    public static void main(String[] args) {
        SpringApplication.run(ChatboxApplication.class, args);
    }
}
