package com.chatastro.Payments.Entities;

import com.chatastro.Payments.Entities.model.FailureDetail;
import lombok.Data;

@Data
public class PaymentFailureRequest {
    private String orderId;
    private ErrorData error;

    @Data
    public static class ErrorData {
        private String code;
        private String description;
        private String source;
        private String reason;
    }

    public FailureDetail toFailureDetail() {
        if (error == null) {
            return FailureDetail.builder().build();
        }
        return FailureDetail.builder()
                .code(error.getCode())
                .description(error.getDescription())
                .source(error.getSource())
                .reason(error.getReason())
                .build();
    }
}
