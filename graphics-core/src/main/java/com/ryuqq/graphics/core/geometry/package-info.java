/**
 * Planar polygon helpers.
 *
 * @since 1.0.0
 * @author Graphics Team
 */
package com.ryuqq.graphics.core.geometry;
