package com.chatastro.Payments.Entities.model;

import lombok.Value;

@Value
public class UserDetails {
    public static final String DEFAULT_NAME = "User";

    String name;
    String contact;
    String email;

    public static UserDetails of(String name, String contact, String email) {
        return new UserDetails(
                name == null || name.isBlank() ? DEFAULT_NAME : name,
                contact == null ? "" : contact,
                email == null ? "" : email);
    }

    public static UserDetails anonymous() {
        return of(null, null, null);
    }
}
