/**
 * Raw event to quarterly series normalization.
 *
 * @since 1.0.0
 */
package com.aesentinel.core.normalize;
