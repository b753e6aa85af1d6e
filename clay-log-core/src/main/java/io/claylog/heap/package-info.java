/**
 * Runtime memory counters for heap enrichment ({@code CLAY_LOG_HEAP=1}).
 */
package io.claylog.heap;
