/**
 * Runtime orchestration package.
 *
 * <p>{@link io.agentfarm.runtime.FarmRuntime} wires the registry, the project store and the
 * external tools for one CLI invocation. Builder state changes go through
 * {@link io.agentfarm.runtime.BuilderLifecycle}; crash leftovers are found by
 * {@link io.agentfarm.runtime.OrphanReconciler}.
 */
package io.agentfarm.runtime;