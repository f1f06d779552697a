package com.ryuqq.graphics.core.spi;

import com.ryuqq.graphics.core.model.AttributeSet;
import com.ryuqq.graphics.core.model.Point3;

import java.util.List;

/**
 * Block table SPI.
 *
 * <p>Provides the attribute definitions (ATTDEF placeholders) of named blocks,
 * allocates anonymous blocks and exposes the entity layout of every block.</p>
 *
 * <p><strong>Anonymous blocks:</strong> {@link #newAnonymousBlock()} returns a fresh,
 * unused name (e.g. {@code *U1}). The block is empty until entities are added through
 * {@link #layout(String)}.</p>
 *
 * @author Graphics Team
 * @since 1.0.0
 */
public interface BlockTable {

    /**
     * Returns whether a block with the given name exists.
     *
     * @param name block name
     * @return true if the block exists
     */
    boolean contains(String name);

    /**
     * Returns the attribute definitions of a block in definition order.
     *
     * <p>Every element carries at least {@code tag} and {@code insert}; it may also carry
     * {@code prompt}, {@code handle} and arbitrary graphical attributes.</p>
     *
     * @param name block name
     * @return attribute definitions (empty if the block has none)
     * @throws IllegalArgumentException if the block does not exist
     */
    List<AttributeSet> attributeDefinitions(String name);

    /**
     * Returns the base point of a block.
     *
     * @param name block name
     * @return base point (origin for most blocks)
     * @throws IllegalArgumentException if the block does not exist
     */
    Point3 basePoint(String name);

    /**
     * Allocates a new anonymous block.
     *
     * @return name of the new block
     */
    String newAnonymousBlock();

    /**
     * Returns the entity layout of a block.
     *
     * @param name block name
     * @return creator that adds entities to the block
     * @throws IllegalArgumentException if the block does not exist
     */
    EntityCreator layout(String name);
}
