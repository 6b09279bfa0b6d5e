package com.chatastro.Payments.Entities;

import com.fasterxml.jackson.annotation.JsonAlias;
import lombok.Data;

@Data
public class OrderRequest {
    private String userId;
    private String planType;
    private UserDetailsRequest userDetails; // optional

    @Data
    public static class UserDetailsRequest {
        private String name;
        @JsonAlias("mobile")
        private String contact;
        private String email;
    }
}
