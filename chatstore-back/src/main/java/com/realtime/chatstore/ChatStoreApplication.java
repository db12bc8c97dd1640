package com.realtime.chatstore;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class ChatStoreApplication {

    public static void main(String[] args) {
        SpringApplication.run(ChatStoreApplication.class, args);
    }
}
