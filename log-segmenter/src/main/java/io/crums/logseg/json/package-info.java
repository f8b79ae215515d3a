/*
 * Copyright 2025 Babak Farhang
 */
/**
 * JSON output of parse results, using <em>json-simple</em>. The entity
 * writers themselves are nested in the types they write (e.g.
 * {@linkplain io.crums.logseg.LogEntry.Writer LogEntry.Writer}).
 */
package io.crums.logseg.json;
