/**
 * In-memory entity database.
 *
 * <p>Reference implementation of {@link com.ryuqq.graphics.core.spi.EntityCreator} for tests and
 * examples. Every {@link com.ryuqq.graphics.adapter.inmemory.entity.InMemoryLayout} writes into a
 * shared {@link com.ryuqq.graphics.adapter.inmemory.entity.InMemoryEntityDatabase} that allocates
 * unique hexadecimal handles.</p>
 *
 * @since 1.0.0
 * @author Graphics Team
 */
package com.ryuqq.graphics.adapter.inmemory.entity;
