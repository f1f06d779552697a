/**
 * Reusable SPI contract tests.
 *
 * <p>Adapters extend {@link com.ryuqq.graphics.testkit.contract.EntityCreatorContractTest} and
 * {@link com.ryuqq.graphics.testkit.contract.BlockTableContractTest} to verify that they honor the
 * collaborator contracts the graphics factory relies on.</p>
 *
 * @since 1.0.0
 * @author Graphics Team
 */
package com.ryuqq.graphics.testkit.contract;
