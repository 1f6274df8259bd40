/**
 * Types that describe a user to the SDK: {@link com.splitlab.sdk.UserAttributes} and
 * {@link com.splitlab.sdk.AttributeValue}.
 */
package com.splitlab.sdk;
