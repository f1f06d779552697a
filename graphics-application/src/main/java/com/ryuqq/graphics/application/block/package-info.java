/**
 * Block reference composition.
 *
 * <p>{@link com.ryuqq.graphics.application.block.AutoBlockComposer} wraps a block reference and
 * its filled-in attributes into a new anonymous block.</p>
 *
 * @since 1.0.0
 * @author Graphics Team
 */
package com.ryuqq.graphics.application.block;
