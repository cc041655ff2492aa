/**
 * Logging infrastructure: request correlation through the Log4j2 ThreadContext.
 */
package com.phillippitts.resiliencecore.config.logging;
