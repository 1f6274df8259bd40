/**
 * This package contains configuration builders for optional SDK behavior.
 * <p>
 * The class {@link com.splitlab.sdk.server.Components} is the entry point for creating them.
 */
package com.splitlab.sdk.server.integrations;
