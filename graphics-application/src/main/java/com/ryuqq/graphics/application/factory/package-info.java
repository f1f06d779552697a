/**
 * Entity factory facade.
 *
 * <p>{@link com.ryuqq.graphics.application.factory.GraphicsFactory} is the public surface of the
 * library. {@link com.ryuqq.graphics.application.factory.DefaultGraphicsFactory} runs the version gate,
 * the geometry engines of graphics-core and the attribute assembler, then hands the result to an
 * {@link com.ryuqq.graphics.core.spi.EntityCreator}.</p>
 *
 * <h2>Configuration</h2>
 * <ul>
 *   <li>{@link com.ryuqq.graphics.application.factory.FactoryConfig} - Active DXF version and factory defaults</li>
 * </ul>
 *
 * @since 1.0.0
 * @author Graphics Team
 */
package com.ryuqq.graphics.application.factory;
