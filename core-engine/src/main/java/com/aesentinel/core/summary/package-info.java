/**
 * Series digests.
 *
 * @since 1.0.0
 */
package com.aesentinel.core.summary;
