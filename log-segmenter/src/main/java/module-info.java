/*
 * Copyright 2025 Babak Farhang
 */
module io.crums.logseg {
  
  requires transitive json.simple;
  
  exports io.crums.logseg;
  exports io.crums.logseg.json;
}
