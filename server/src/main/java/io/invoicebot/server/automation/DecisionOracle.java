package io.invoicebot.server.automation;

/**
 * Last-resort advisor consulted after every route is exhausted. Called off the routing thread with a deadline.
 */
public interface DecisionOracle {

    OracleResponse suggest(OracleRequest request);
}
