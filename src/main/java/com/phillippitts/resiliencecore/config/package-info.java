/**
 * Application-wide configuration beans and properties.
 *
 * <p>Configuration Classes:
 * <ul>
 *   <li>{@link com.phillippitts.resiliencecore.config.ResilienceConfig} - Clock and shared cache</li>
 *   <li>{@link com.phillippitts.resiliencecore.config.ThreadPoolConfig} - Router executor</li>
 *   <li>{@link com.phillippitts.resiliencecore.config.WebConfig} - Admission control registration</li>
 * </ul>
 *
 * <p>Sub-packages:
 * <ul>
 *   <li>{@code config.properties} - Typed {@code @ConfigurationProperties}</li>
 *   <li>{@code config.logging} - Logging infrastructure (MDC filter)</li>
 * </ul>
 */
package com.phillippitts.resiliencecore.config;
