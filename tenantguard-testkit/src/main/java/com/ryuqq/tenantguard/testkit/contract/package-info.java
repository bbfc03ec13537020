/**
 * Contract test infrastructure for TenantGuard.
 *
 * <p>{@link com.ryuqq.tenantguard.testkit.contract.AbstractContractTest} wires a complete guard to
 * in-memory stores and a manual clock. Adapter implementations can reuse it to verify that the
 * protection layer keeps its guarantees on top of their stores.</p>
 *
 * @author TenantGuard Team
 * @since 1.0.0
 */
package com.ryuqq.tenantguard.testkit.contract;
