/**
 * Unchecked domain exceptions raised before any entity is created.
 *
 * @since 1.0.0
 * @author Graphics Team
 */
package com.ryuqq.graphics.core.exception;
