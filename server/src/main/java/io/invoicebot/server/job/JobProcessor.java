package io.invoicebot.server.job;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * Business work behind one operation type. Throw {@link InterventionRequiredException} when a human has to take
 * over, or {@link java.util.concurrent.CancellationException} when the run was interrupted.
 */
public interface JobProcessor {

    String operationType();

    JsonNode process(JobContext context);
}
