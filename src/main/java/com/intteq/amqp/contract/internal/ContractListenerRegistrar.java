package com.intteq.amqp.contract.internal;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.intteq.amqp.contract.AmqpContractProperties;
import com.intteq.amqp.contract.annotation.ContractHandler;
import com.intteq.amqp.contract.annotation.ContractListener;
import com.intteq.amqp.contract.exception.NonRetryableException;
import com.intteq.amqp.contract.rabbitmq.SharedConnectionRegistry;
import com.intteq.amqp.contract.topology.ContractDefinition;
import com.intteq.amqp.contract.worker.BatchConsumerHandler;
import com.intteq.amqp.contract.worker.ConsumedMessage;
import com.intteq.amqp.contract.worker.ConsumerHandler;
import com.intteq.amqp.contract.worker.ConsumerOptions;
import com.intteq.amqp.contract.worker.ContractWorker;
import io.micrometer.core.instrument.MeterRegistry;
import jakarta.annotation.Nullable;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.DisposableBean;
import org.springframework.beans.factory.SmartInitializingSingleton;
import org.springframework.context.ApplicationContext;
import org.springframework.core.ResolvableType;
import org.springframework.core.annotation.AnnotationUtils;
import org.springframework.util.ClassUtils;
import org.springframework.util.ReflectionUtils;

import java.lang.reflect.InvocationTargetException;
import java.lang.reflect.Method;
import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Binds {@link ContractHandler} methods of {@link ContractListener} beans to contract
 * consumers and runs them in a single {@link ContractWorker}.
 *
 * <p><b>Responsibilities:</b></p>
 * <ul>
 *     <li>Discovers {@link ContractListener} beans</li>
 *     <li>Validates handler signatures</li>
 *     <li>Adapts each handler method into a {@link ConsumerHandler}, or a
 *         {@link BatchConsumerHandler} when it declares a batch size</li>
 *     <li>Starts the worker once all singletons exist and closes it on shutdown</li>
 * </ul>
 *
 * <p>No worker is started when the context holds no handler.</p>
 */
@Slf4j
@RequiredArgsConstructor
public class ContractListenerRegistrar implements SmartInitializingSingleton, DisposableBean {

    private final ContractDefinition contract;
    private final SharedConnectionRegistry connectionRegistry;
    private final AmqpContractProperties properties;
    private final ApplicationContext context;
    private final ObjectMapper objectMapper;

    /** Optional Micrometer registry (null-safe). */
    @Nullable
    private final MeterRegistry meterRegistry;

    @Nullable
    private ContractWorker worker;

    // =====================================================================
    // INITIALIZATION
    // =====================================================================

    @Override
    public void afterSingletonsInstantiated() {
        log.info("Initializing contract listeners...");

        Map<String, HandlerMethod> handlers = new LinkedHashMap<>();
        context.getBeansWithAnnotation(ContractListener.class)
                .values()
                .forEach(bean -> collectHandlers(bean, handlers));

        if (handlers.isEmpty()) {
            log.info("No @ContractHandler methods found → worker not started");
            return;
        }

        ContractWorker.Builder builder = ContractWorker.builder()
                .contract(contract)
                .objectMapper(objectMapper)
                .meterRegistry(meterRegistry)
                .options(properties.getWorker().toOptions());

        handlers.forEach((name, handler) -> handler.register(builder));

        builder.connection(connectionRegistry.acquire(
                properties.getUrls(), properties.getConnection().toOptions()));

        ContractWorker created = builder.build();
        try {
            worker = created.start();
        } catch (RuntimeException e) {
            created.close();
            throw e;
        }
    }

    /**
     * @return the running worker, or {@code null} when no handler was registered
     */
    @Nullable
    public ContractWorker getWorker() {
        return worker;
    }

    // =====================================================================
    // BEAN DISCOVERY
    // =====================================================================

    private void collectHandlers(Object bean, Map<String, HandlerMethod> handlers) {
        Class<?> clazz = ClassUtils.getUserClass(bean);

        if (AnnotationUtils.findAnnotation(clazz, ContractListener.class) == null) {
            return;
        }

        for (Method method : clazz.getDeclaredMethods()) {

            ContractHandler annotation = method.getAnnotation(ContractHandler.class);
            if (annotation == null) {
                continue;
            }

            validateHandlerSignature(clazz, method);

            String consumerName = annotation.value();
            HandlerMethod previous = handlers.put(consumerName, new HandlerMethod(bean, method, annotation));
            if (previous != null) {
                throw new IllegalStateException(
                        "Duplicate @ContractHandler for consumer \"" + consumerName + "\": "
                                + describe(previous.method) + " and " + describe(method)
                );
            }

            log.debug("Registered contract handler → consumer={} method={}", consumerName, describe(method));
        }
    }

    // =====================================================================
    // VALIDATION
    // =====================================================================

    static void validateHandlerSignature(Class<?> clazz, Method method) {
        Class<?>[] types = method.getParameterTypes();
        ContractHandler annotation = method.getAnnotation(ContractHandler.class);

        if (annotation != null && annotation.batchSize() > 0) {
            if (types.length != 1 || types[0] != List.class) {
                throw new IllegalStateException(
                        "Invalid @ContractHandler signature: "
                                + clazz.getName() + "#" + method.getName()
                                + " → expected (List<ConsumedMessage>) for a batch handler"
                );
            }
            return;
        }

        boolean valid = (types.length == 1 && types[0] == ConsumedMessage.class)
                || (types.length == 2 && types[1] == ConsumedMessage.class);

        if (!valid) {
            throw new IllegalStateException(
                    "Invalid @ContractHandler signature: "
                            + clazz.getName() + "#" + method.getName()
                            + " → expected (Payload, ConsumedMessage) or (ConsumedMessage)"
            );
        }
    }

    private static String describe(Method method) {
        return method.getDeclaringClass().getSimpleName() + "#" + method.getName();
    }

    // =====================================================================
    // INVOCATION
    // =====================================================================

    /**
     * Reflective handler over one annotated method, registered either as a
     * {@link ConsumerHandler} or, with a batch size, as a {@link BatchConsumerHandler}.
     */
    private final class HandlerMethod implements ConsumerHandler<Object>, BatchConsumerHandler<Object> {

        private final Object bean;
        private final Method method;
        private final ContractHandler annotation;

        private HandlerMethod(Object bean, Method method, ContractHandler annotation) {
            this.bean = bean;
            this.method = method;
            this.annotation = annotation;
            ReflectionUtils.makeAccessible(method);
        }

        private void register(ContractWorker.Builder builder) {
            if (annotation.batchSize() > 0) {
                builder.batchHandler(annotation.value(), (BatchConsumerHandler<Object>) this, options());
            } else {
                builder.handler(annotation.value(), (ConsumerHandler<Object>) this, options());
            }
        }

        private ConsumerOptions options() {
            return ConsumerOptions.builder()
                    .prefetch(annotation.prefetch() > 0 ? annotation.prefetch() : null)
                    .concurrency(annotation.concurrency() > 0 ? annotation.concurrency() : null)
                    .batchSize(annotation.batchSize() > 0 ? annotation.batchSize() : null)
                    .batchTimeout(annotation.batchTimeoutMs() > 0 ? Duration.ofMillis(annotation.batchTimeoutMs()) : null)
                    .build();
        }

        @Override
        public void handle(ConsumedMessage<Object> message) throws Exception {
            Object[] args = method.getParameterCount() == 1
                    ? new Object[]{message}
                    : new Object[]{adaptPayload(message.payload(), method.getParameterTypes()[0]), message};
            invoke(args);
        }

        @Override
        public void handle(List<ConsumedMessage<Object>> messages) throws Exception {
            Class<?> target = ResolvableType.forMethodParameter(method, 0)
                    .getGeneric(0)
                    .getGeneric(0)
                    .resolve(Object.class);

            List<ConsumedMessage<Object>> adapted = new ArrayList<>(messages.size());
            for (ConsumedMessage<Object> message : messages) {
                adapted.add(new ConsumedMessage<>(message.consumerName(),
                        adaptPayload(message.payload(), target), message.headers(), message.message()));
            }
            invoke(new Object[]{adapted});
        }

        private void invoke(Object[] args) throws Exception {
            try {
                method.invoke(bean, args);
            } catch (InvocationTargetException e) {
                Throwable cause = e.getTargetException();
                if (cause instanceof Exception exception) {
                    throw exception;
                }
                if (cause instanceof Error error) {
                    throw error;
                }
                throw e;
            }
        }

        private Object adaptPayload(Object payload, Class<?> parameterType) {
            Class<?> target = ClassUtils.resolvePrimitiveIfNecessary(parameterType);
            if (payload == null || target.isInstance(payload)) {
                return payload;
            }
            try {
                return objectMapper.convertValue(payload, target);
            } catch (IllegalArgumentException e) {
                throw new NonRetryableException(
                        "Payload of consumer \"" + annotation.value() + "\" cannot be converted to "
                                + target.getName(), e);
            }
        }
    }

    // =====================================================================
    // SHUTDOWN
    // =====================================================================

    @Override
    public void destroy() {
        if (worker == null) {
            return;
        }
        log.info("Stopping contract listeners...");
        worker.close();
        worker = null;
    }
}
