package com.intentbench.oracle;

import java.io.IOException;

/**
 * Text-completion service that accepts a JSON-schema-constrained request and returns the raw
 * response text. Implementations must be safe to call from several threads.
 */
public interface InferenceOracle {
    String complete(OracleRequest request) throws IOException;
}
