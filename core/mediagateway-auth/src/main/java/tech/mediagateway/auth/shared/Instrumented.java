package tech.mediagateway.auth.shared;

import jakarta.interceptor.InterceptorBinding;
import java.lang.annotation.*;

/**
 * Marks a credential store class for automatic metrics instrumentation.
 * Records duration, count, and errors via Micrometer.
 *
 * Usage:
 * <pre>
 * {@code @Instrumented(backend = "redis")}
 * class RedisCredentialStore implements CredentialStore { ... }
 * </pre>
 *
 * Metrics produced:
 * - mediagateway_store_operation_duration_seconds (histogram)
 * - mediagateway_store_operations_total (counter)
 * - mediagateway_store_operation_errors_total (counter)
 */
@Inherited
@InterceptorBinding
@Retention(RetentionPolicy.RUNTIME)
@Target({ElementType.METHOD, ElementType.TYPE})
public @interface Instrumented {

    /**
     * Backend name used as the metrics tag.
     * If empty, derived from class name (e.g., RedisCredentialStore → redis).
     */
    String backend() default "";
}
