/**
 * Service Provider Interface (SPI) package.
 *
 * <p>This package defines the collaborators the graphics factory delegates to. Adapter
 * modules (e.g. graphics-adapter-inmemory) provide concrete implementations.</p>
 *
 * <h2>SPI Interfaces</h2>
 * <ul>
 *   <li>{@link com.ryuqq.graphics.core.spi.EntityCreator} - Handle allocation and entity storage</li>
 *   <li>{@link com.ryuqq.graphics.core.spi.BlockTable} - Attribute definitions, anonymous blocks, block layouts</li>
 *   <li>{@link com.ryuqq.graphics.core.spi.DimensionRenderer} - Dimension geometry rendering</li>
 *   <li>{@link com.ryuqq.graphics.core.spi.ArrowRenderer} - Arrow symbol library</li>
 * </ul>
 *
 * <h2>Design Principles</h2>
 * <ul>
 *   <li><strong>Hexagonal Architecture:</strong> Core defines interfaces, adapters provide implementations</li>
 *   <li><strong>Dependency Inversion:</strong> Core does not depend on a document model</li>
 * </ul>
 *
 * @since 1.0.0
 * @author Graphics Team
 */
package com.ryuqq.graphics.core.spi;
