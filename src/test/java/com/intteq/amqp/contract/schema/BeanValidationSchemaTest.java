package com.intteq.amqp.contract.schema;

import com.intteq.amqp.contract.testsupport.OrderCreated;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.util.Map;
import java.util.NoSuchElementException;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("[Schema] Bean Validation backed schemas")
class BeanValidationSchemaTest {

    private final BeanValidationSchema<OrderCreated> schema = BeanValidationSchema.of(OrderCreated.class);

    @Test
    @DisplayName("A valid JSON tree is converted to the target type")
    void validTree() {
        SchemaValidationResult<OrderCreated> result =
                schema.validate(Map.of("orderId", "ORD-1", "amount", 42.5, "extra", true));

        assertThat(result.isValid()).isTrue();
        assertThat(result.value().getOrderId()).isEqualTo("ORD-1");
        assertThat(result.value().getAmount()).isEqualByComparingTo("42.5");
    }

    @Test
    @DisplayName("An instance of the target type is validated as is")
    void instanceInput() {
        OrderCreated order = new OrderCreated("ORD-1", BigDecimal.TEN);

        assertThat(schema.validate(order).value()).isSameAs(order);
    }

    @Test
    @DisplayName("Constraint violations become issues sorted by path")
    void violations() {
        SchemaValidationResult<OrderCreated> result = schema.validate(Map.of("orderId", "", "amount", -1));

        assertThat(result.isValid()).isFalse();
        assertThat(result.issues()).extracting(ValidationIssue::path).containsExactly("amount", "orderId");
        assertThatThrownBy(result::value).isInstanceOf(NoSuchElementException.class);
    }

    @Test
    @DisplayName("A missing value is reported as required")
    void nullInput() {
        SchemaValidationResult<OrderCreated> result = schema.validate(null);

        assertThat(result.issues()).containsExactly(ValidationIssue.of("", "value is required"));
    }

    @Test
    @DisplayName("A value of the wrong shape is reported as unreadable")
    void unreadable() {
        SchemaValidationResult<OrderCreated> result = schema.validate("not an order");

        assertThat(result.isValid()).isFalse();
        assertThat(result.issues().get(0).message()).startsWith("cannot be read as OrderCreated");
    }

    @Test
    @DisplayName("A failure needs at least one issue")
    void failureNeedsIssues() {
        assertThatThrownBy(() -> SchemaValidationResult.failure(java.util.List.of()))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
