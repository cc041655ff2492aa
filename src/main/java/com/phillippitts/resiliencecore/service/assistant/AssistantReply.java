package com.phillippitts.resiliencecore.service.assistant;

/**
 * Reply returned to assistant callers.
 *
 * @param cached true when this caller did not trigger a model call (cache hit or coalesced)
 */
public record AssistantReply(String text, String model, int tier, boolean cached) { }
