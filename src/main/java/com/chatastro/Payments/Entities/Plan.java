package com.chatastro.Payments.Entities;

import com.fasterxml.jackson.annotation.JsonIgnore;
import lombok.Value;

@Value
public class Plan {
    String id;
    int questions;
    // whole currency units, e.g. rupees
    long price;
    String name;

    @JsonIgnore
    public long getPriceMinorUnits() {
        return price * 100;
    }

    public String describe() {
        return name + " - " + questions + " Questions";
    }
}
