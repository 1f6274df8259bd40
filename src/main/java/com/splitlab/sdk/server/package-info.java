/**
 * Main package for the SplitLab server-side Java SDK, containing the client, its configuration, and
 * the decision types it returns.
 * <p>
 * You will most often use {@link com.splitlab.sdk.server.DecisionClient} (the SDK client) and
 * {@link com.splitlab.sdk.server.DecisionConfig} (configuration options for the client).
 */
package com.splitlab.sdk.server;
