package tech.mediagateway.auth.shared;

import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import jakarta.annotation.Priority;
import jakarta.inject.Inject;
import jakarta.interceptor.AroundInvoke;
import jakarta.interceptor.Interceptor;
import jakarta.interceptor.InvocationContext;
import org.jboss.logging.Logger;
import tech.mediagateway.auth.store.CredentialStoreUnavailableException;

/**
 * CDI Interceptor that instruments credential store calls with metrics.
 *
 * Automatically records:
 * - Operation duration (histogram with percentiles)
 * - Operation count (success/error)
 * - Error count by type
 * - Slow operation warnings (>50ms)
 */
@Instrumented
@Interceptor
@Priority(Interceptor.Priority.APPLICATION)
public class InstrumentedInterceptor {

    private static final Logger LOG = Logger.getLogger(InstrumentedInterceptor.class);
    private static final long SLOW_OPERATION_THRESHOLD_MS = 50;

    @Inject
    MeterRegistry registry;

    @AroundInvoke
    public Object instrument(InvocationContext ctx) throws Exception {
        String backend = resolveBackend(ctx);
        String operation = ctx.getMethod().getName();

        Timer.Sample sample = Timer.start(registry);
        String result = "success";

        try {
            return ctx.proceed();
        } catch (Exception e) {
            result = "error";
            registry.counter("mediagateway.store.operation.errors",
                "backend", backend,
                "operation", operation,
                "error_type", classifyError(e)
            ).increment();
            throw e;
        } finally {
            long durationNanos = sample.stop(Timer.builder("mediagateway.store.operation.duration")
                .tag("backend", backend)
                .tag("operation", operation)
                .tag("result", result)
                .publishPercentileHistogram()
                .register(registry));

            long durationMs = durationNanos / 1_000_000;

            registry.counter("mediagateway.store.operations",
                "backend", backend,
                "operation", operation,
                "result", result
            ).increment();

            if (durationMs > SLOW_OPERATION_THRESHOLD_MS) {
                LOG.warnf("Slow credential store operation: %s.%s took %dms",
                    backend, operation, durationMs);
            }
        }
    }

    private String resolveBackend(InvocationContext ctx) {
        Instrumented methodAnnotation = ctx.getMethod().getAnnotation(Instrumented.class);
        if (methodAnnotation != null && !methodAnnotation.backend().isEmpty()) {
            return methodAnnotation.backend();
        }

        // CDI subclasses carry the annotation on the superclass
        Class<?> targetClass = ctx.getTarget().getClass();
        while (targetClass != null && targetClass != Object.class) {
            Instrumented classAnnotation = targetClass.getAnnotation(Instrumented.class);
            if (classAnnotation != null && !classAnnotation.backend().isEmpty()) {
                return classAnnotation.backend();
            }
            targetClass = targetClass.getSuperclass();
        }

        String className = ctx.getTarget().getClass().getSimpleName();
        if (className.contains("_")) {
            className = className.substring(0, className.indexOf("_"));
        }
        return className.replace("CredentialStore", "").toLowerCase();
    }

    private String classifyError(Exception e) {
        if (e instanceof CredentialStoreUnavailableException) {
            return "unavailable";
        }
        String name = e.getClass().getSimpleName();
        if (name.contains("Timeout")) {
            return "timeout";
        }
        return "other";
    }
}
