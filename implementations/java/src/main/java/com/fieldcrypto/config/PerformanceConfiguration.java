package com.fieldcrypto.config;

import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import lombok.extern.slf4j.Slf4j;
import org.aspectj.lang.ProceedingJoinPoint;
import org.aspectj.lang.annotation.Around;
import org.aspectj.lang.annotation.Aspect;
import org.springframework.context.annotation.Configuration;
import org.springframework.stereotype.Component;

/**
 * Performance Monitoring Configuration.
 *
 * Tracks latency of every cryptographic operation, split by outcome.
 *
 * Security: No plaintext, keys or digests in metrics.
 */
@Configuration
@Slf4j
public class PerformanceConfiguration {

    /**
     * Aspect for timing crypto operations.
     */
    @Aspect
    @Component
    @Slf4j
    public static class CryptoPerformanceAspect {

        static final String METRIC_NAME = "crypto.operation";

        private final MeterRegistry meterRegistry;

        public CryptoPerformanceAspect(MeterRegistry meterRegistry) {
            this.meterRegistry = meterRegistry;
        }

        /**
         * Time hashing, encryption and decryption operations.
         */
        @Around("execution(* com.fieldcrypto.infrastructure.crypto.CryptoService.*(..))")
        public Object timeCryptoOperation(ProceedingJoinPoint joinPoint) throws Throwable {
            String methodName = joinPoint.getSignature().getName();

            Timer.Sample sample = Timer.start(meterRegistry);

            try {
                Object result = joinPoint.proceed();

                sample.stop(Timer.builder(METRIC_NAME)
                    .tag("method", methodName)
                    .tag("outcome", "success")
                    .description("Cryptographic operation timing")
                    .register(meterRegistry));

                return result;

            } catch (Exception e) {
                sample.stop(Timer.builder(METRIC_NAME)
                    .tag("method", methodName)
                    .tag("outcome", "failure")
                    .description("Cryptographic operation timing")
                    .register(meterRegistry));

                throw e;
            }
        }
    }
}
