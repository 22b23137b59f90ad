package com.wayfarer.core.capability;

import com.wayfarer.core.llm.LlmService;
import com.wayfarer.core.state.PlanningState;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * A capability answered by one structured LLM call.
 * <p>
 * Refuses to start once the deadline has passed and stops waiting for the model when
 * it arrives. Every fault, including a reply that cannot be parsed, is reported as
 * {@link Outcome.Failure}.
 */
public class LlmCapability<P> implements Capability<P> {

    private static final Logger log = LoggerFactory.getLogger(LlmCapability.class);

    private final String name;
    private final LlmService llmService;
    private final String systemPrompt;
    private final PromptTemplate userPrompt;
    private final Class<P> outputType;
    private final Executor executor;

    public LlmCapability(String name, LlmService llmService, String systemPrompt,
                         PromptTemplate userPrompt, Class<P> outputType, Executor executor) {
        this.name = Objects.requireNonNull(name, "name");
        this.llmService = Objects.requireNonNull(llmService, "llmService");
        this.systemPrompt = systemPrompt;
        this.userPrompt = Objects.requireNonNull(userPrompt, "userPrompt");
        this.outputType = Objects.requireNonNull(outputType, "outputType");
        this.executor = Objects.requireNonNull(executor, "executor");
    }

    @Override
    public Outcome<P> execute(Map<String, String> parameters, PlanningState snapshot, Instant deadline) {
        if (deadline != null && !Instant.now().isBefore(deadline)) {
            return Outcome.failure("deadline passed before " + name + " started");
        }
        String prompt = userPrompt.render(parameters, snapshot);
        CompletableFuture<P> call = CompletableFuture.supplyAsync(
                () -> llmService.structuredCall(systemPrompt, prompt, outputType), executor);
        try {
            P result = deadline == null
                    ? call.get()
                    : call.get(Math.max(1, Duration.between(Instant.now(), deadline).toMillis()), TimeUnit.MILLISECONDS);
            if (result == null) {
                return Outcome.failure(name + " returned no answer");
            }
            return Outcome.success(result);
        } catch (TimeoutException e) {
            call.cancel(true);
            log.warn("{} did not answer before its deadline", name);
            return Outcome.failure("timeout");
        } catch (InterruptedException e) {
            call.cancel(true);
            Thread.currentThread().interrupt();
            return Outcome.failure(name + " interrupted");
        } catch (ExecutionException e) {
            Throwable cause = e.getCause() != null ? e.getCause() : e;
            log.warn("{} failed: {}", name, cause.getMessage());
            return Outcome.failure(cause.getMessage() != null ? cause.getMessage() : cause.getClass().getSimpleName());
        }
    }

    public String getName() {
        return name;
    }
}
