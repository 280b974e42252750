package com.intteq.amqp.contract.testsupport;

import jakarta.validation.constraints.NotBlank;
import lombok.Data;

@Data
public class TenantHeaders {

    @NotBlank
    private String tenant;
}
