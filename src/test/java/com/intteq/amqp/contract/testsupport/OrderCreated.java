package com.intteq.amqp.contract.testsupport;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class OrderCreated {

    @NotBlank
    private String orderId;

    @NotNull
    @Positive
    private BigDecimal amount;
}
