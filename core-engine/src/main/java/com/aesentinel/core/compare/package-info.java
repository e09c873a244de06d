/**
 * Cross-product comparison.
 *
 * @since 1.0.0
 */
package com.aesentinel.core.compare;
