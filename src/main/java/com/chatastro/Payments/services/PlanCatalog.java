package com.chatastro.Payments.services;

import com.chatastro.Payments.Entities.Plan;
import com.chatastro.Payments.config.PaymentProperties;
import com.chatastro.Payments.exception.InvalidPlanException;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Read-only plan lookup built once from configuration.
 */
@Component
public class PlanCatalog {

    private final Map<String, Plan> plans;

    @Autowired
    public PlanCatalog(PaymentProperties properties) {
        this(toPlans(properties.getPlans()));
    }

    public PlanCatalog(Map<String, Plan> plans) {
        this.plans = Collections.unmodifiableMap(new LinkedHashMap<>(plans));
    }

    public Optional<Plan> find(String planType) {
        if (planType == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(plans.get(planType));
    }

    public Plan require(String planType) {
        return find(planType).orElseThrow(() -> new InvalidPlanException(planType));
    }

    public List<Plan> all() {
        return new ArrayList<>(plans.values());
    }

    private static Map<String, Plan> toPlans(Map<String, PaymentProperties.PlanProperties> configured) {
        Map<String, Plan> plans = new LinkedHashMap<>();
        configured.forEach((id, p) -> {
            if (p.getPrice() <= 0) {
                throw new IllegalStateException("Plan " + id + " must have a positive price");
            }
            plans.put(id, new Plan(id, p.getQuestions(), p.getPrice(), p.getName() == null ? id : p.getName()));
        });
        return plans;
    }
}
