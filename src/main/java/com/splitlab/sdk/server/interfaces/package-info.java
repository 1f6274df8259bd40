/**
 * The package for interfaces that allow customization of SDK components, and for the public interface
 * of the client.
 * <p>
 * Most applications will not need to refer to these types. You will use them if you are creating a
 * user profile service or a custom forced variation store.
 */
package com.splitlab.sdk.server.interfaces;
