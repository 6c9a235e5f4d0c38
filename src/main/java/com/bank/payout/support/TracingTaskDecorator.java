package com.bank.payout.support;

import io.micrometer.tracing.Span;
import io.micrometer.tracing.Tracer;
import org.springframework.core.task.TaskDecorator;

/**
 * Runs a task inside the span that was current when it was submitted, so work handed to
 * another pool keeps the submitter's trace id.
 */
public class TracingTaskDecorator implements TaskDecorator {

    private final Tracer tracer;

    public TracingTaskDecorator(Tracer tracer) {
        this.tracer = tracer;
    }

    @Override
    public Runnable decorate(Runnable runnable) {
        Span span = tracer.currentSpan();
        if (span == null) {
            return runnable;
        }
        return () -> {
            try (Tracer.SpanInScope ignored = tracer.withSpan(span)) {
                runnable.run();
            }
        };
    }
}
