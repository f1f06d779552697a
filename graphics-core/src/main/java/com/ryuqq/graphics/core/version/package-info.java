/**
 * Format version preconditions.
 *
 * <p>{@link com.ryuqq.graphics.core.version.VersionGate} checks the active DXF version against
 * the minimum version of an {@link com.ryuqq.graphics.core.model.EntityKind} before any attribute
 * is computed.</p>
 *
 * @since 1.0.0
 * @author Graphics Team
 */
package com.ryuqq.graphics.core.version;
