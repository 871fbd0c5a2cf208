/**
 * AgentMesh source tree root.
 *
 * <p>Primary entry points while reading code:
 *
 * <ul>
 *   <li>{@code io.agentmesh.Main} bootstraps the CLI process.</li>
 *   <li>{@code io.agentmesh.coordinator.Coordinator} starts agents, issues commands and assigns tasks.</li>
 *   <li>{@code io.agentmesh.bus.MessageBus} routes, audits and correlates messages.</li>
 *   <li>{@code io.agentmesh.runtime.AgentRuntime} runs one agent's processing and heartbeat loops.</li>
 * </ul>
 */
package io.agentmesh;
