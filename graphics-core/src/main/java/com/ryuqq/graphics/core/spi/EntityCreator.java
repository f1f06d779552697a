package com.ryuqq.graphics.core.spi;

import com.ryuqq.graphics.core.model.AttributeSet;
import com.ryuqq.graphics.core.model.EntityHandle;
import com.ryuqq.graphics.core.model.EntityKind;

/**
 * Entity creation SPI: allocates a handle and stores a new entity.
 *
 * <p>The graphics factory computes the complete attribute set of an entity and hands it
 * to this collaborator exactly once per logical entity. It never retries a call.</p>
 *
 * <p><strong>Implementation Requirements:</strong></p>
 * <ul>
 *   <li>Handles must be unique within the owning document</li>
 *   <li>The received attribute set is stored as-is (it is immutable)</li>
 *   <li>Failures propagate to the caller unchanged</li>
 * </ul>
 *
 * @author Graphics Team
 * @since 1.0.0
 */
public interface EntityCreator {

    /**
     * Creates a new entity.
     *
     * @param kind entity kind
     * @param attributes fully assembled entity attributes
     * @return handle of the created entity
     * @throws IllegalArgumentException if kind or attributes is null
     */
    EntityHandle create(EntityKind kind, AttributeSet attributes);
}
