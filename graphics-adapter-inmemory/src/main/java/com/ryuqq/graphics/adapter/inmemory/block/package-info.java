/**
 * In-memory block table.
 *
 * <p>{@link com.ryuqq.graphics.adapter.inmemory.block.InMemoryBlockTable} stores block base points
 * and exposes one layout per block; attribute definitions are the ATTDEF entities of that layout.</p>
 *
 * @since 1.0.0
 * @author Graphics Team
 */
package com.ryuqq.graphics.adapter.inmemory.block;
