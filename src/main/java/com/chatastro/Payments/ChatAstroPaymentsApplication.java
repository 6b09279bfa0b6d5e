package com.chatastro.Payments;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class ChatAstroPaymentsApplication {

    public static void main(String[] args) {
        SpringApplication.run(ChatAstroPaymentsApplication.class, args);
    }
}
