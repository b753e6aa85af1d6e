/**
 * Default engine: newline-delimited JSON records written to an {@link java.io.OutputStream}.
 *
 * <p>{@link io.claylog.json.JsonLogEngine} creates {@link io.claylog.json.JsonLogHandle}s;
 * {@link io.claylog.json.JsonCodec} encodes records and parses them back for the
 * pretty printer.
 */
package io.claylog.json;
