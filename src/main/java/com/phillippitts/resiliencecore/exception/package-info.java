/**
 * Resilience-core exception hierarchy.
 *
 * <p>Exception Hierarchy:
 * <ul>
 *   <li>{@link com.phillippitts.resiliencecore.exception.AssistantCoreException} - Base exception
 *       for all application-specific errors</li>
 *   <li>{@link com.phillippitts.resiliencecore.exception.CircuitOpenException} - A breaker refused
 *       the call without invoking the handler</li>
 *   <li>{@link com.phillippitts.resiliencecore.exception.HandlerFailureException} - A provider
 *       handler raised or timed out</li>
 *   <li>{@link com.phillippitts.resiliencecore.exception.FallbackExhaustedException} - Every
 *       routing candidate failed</li>
 *   <li>{@link com.phillippitts.resiliencecore.exception.RateLimitExceededException} - Admission
 *       control denied the request</li>
 * </ul>
 *
 * <p>Cache misses are not exceptions; they surface as {@link java.util.Optional#empty()}.
 *
 * @see com.phillippitts.resiliencecore.presentation.exception.GlobalExceptionHandler
 */
package com.phillippitts.resiliencecore.exception;
