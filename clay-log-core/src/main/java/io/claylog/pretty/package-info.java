/**
 * Pretty-print mode: {@link io.claylog.pretty.PrettyPrintStream} re-renders JSON
 * records as readable text before they reach the real sink.
 */
package io.claylog.pretty;
