/**
 * Types used by the SDK's configuration and error reporting that most applications never need to
 * refer to directly.
 */
package com.splitlab.sdk.server.subsystems;
