/**
 * REST controllers exposing the assistant pipeline and the resilience observability surface.
 */
package com.phillippitts.resiliencecore.presentation.controller;
