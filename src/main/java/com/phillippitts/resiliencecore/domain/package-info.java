/**
 * Immutable value types shared by the router, the assistant pipeline and the web layer.
 */
package com.phillippitts.resiliencecore.domain;
