package com.intentbench.oracle;

/**
 * Supplies the oracle that serves a given endpoint.
 */
@FunctionalInterface
public interface OracleProvider {
    InferenceOracle forEndpoint(String baseUrl);
}
