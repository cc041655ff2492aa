/**
 * HTTP layer: controllers, admission-control interceptor and exception mapping.
 *
 * <p>Business logic stays in the service layer; this package only translates between HTTP and
 * service calls.
 */
package com.phillippitts.resiliencecore.presentation;
