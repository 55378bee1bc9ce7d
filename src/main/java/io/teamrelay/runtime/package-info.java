/**
 * Boundary operations over one coordination root.
 *
 * <p>{@link io.teamrelay.runtime.TeamRelayRuntime} wires the team registry, task graph engine,
 * mailbox engine and backend registry together, adds the cross-component flows (assignment
 * notices, shutdown and plan-approval routing, spawn with rollback) and records every call in the
 * audit trail.
 */
package io.teamrelay.runtime;
