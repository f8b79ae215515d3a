/*
 * Copyright 2025 Babak Farhang
 */
/**
 * Streaming segmentation of text log files into logical entries.
 * 
 * A log <em>entry</em> is one logical record, which may span multiple
 * physical lines (stack traces, pretty-printed JSON, Python tracebacks).
 * The goal here is to segment arbitrarily large logs in a single forward
 * pass, using bounded memory for everything but the entries themselves.
 * 
 * <h2>Design</h2>
 * <p>
 * The parsing works much like an XML SAX parser, only simpler. The
 * pipeline, per chunk, is
 * </p>
 * <ol>
 * <li>read a fixed-size chunk from the {@linkplain io.crums.logseg.ByteSource
 * ByteSource};</li>
 * <li>decode it incrementally (multi-byte chars may straddle chunks);</li>
 * <li>split it into lines, carrying the incomplete last line over to the
 * next chunk;</li>
 * <li>feed each line to the {@linkplain io.crums.logseg.EntryGrouper
 * EntryGrouper}, which finalizes an entry whenever a line looks like
 * the start of a new one (and not like a continuation).</li>
 * </ol>
 * <h3>Classification</h3>
 * <p>
 * The line rules are in {@linkplain io.crums.logseg.Classifier Classifier}.
 * They are heuristics: a line with a timestamp, a severity token, or an
 * opening brace starts an entry, unless it is blank, indented, or looks
 * like a stack or traceback frame. Ambiguous lines are merged into the
 * preceding entry.
 * </p>
 * <h3>Parser</h3>
 * <p>
 * {@linkplain io.crums.logseg.LogSegmenter LogSegmenter} is the entry point.
 * Each parse is a {@linkplain io.crums.logseg.Segmentation Segmentation}
 * reporting to a {@linkplain io.crums.logseg.LogSegmenter.Listener listener}.
 * What to display, filter, or transmit is up to the caller (see
 * {@linkplain io.crums.logseg.EntryFilter EntryFilter}).
 * </p>
 */
package io.crums.logseg;
