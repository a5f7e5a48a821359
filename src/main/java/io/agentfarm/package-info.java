/**
 * Agent farm source tree root.
 *
 * <p>Primary entry points while reading code:
 *
 * <ul>
 *   <li>{@code io.agentfarm.Main} bootstraps the CLI process.</li>
 *   <li>{@code io.agentfarm.cli.FarmCommand} maps commands to runtime APIs.</li>
 *   <li>{@code io.agentfarm.registry.PortRegistry} hands out machine-wide port blocks.</li>
 *   <li>{@code io.agentfarm.storage.StateStore} is the authoritative per-project record.</li>
 *   <li>{@code io.agentfarm.runtime.BuilderLifecycle} and {@code io.agentfarm.runtime.OrphanReconciler}
 *   keep that record and the running processes in step.</li>
 * </ul>
 */
package io.agentfarm;