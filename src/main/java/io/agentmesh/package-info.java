/**
 * AgentMesh source tree root.
 *
 * <p>Primary entry points while reading code:
 *
 * <ul>
 *   <li>{@code io.agentmesh.Main} bootstraps the CLI process.</li>
 *   <li>{@code io.agentmesh.runtime.AgentMeshNode} wires bus, memory, orchestrator and agents.</li>
 *   <li>{@code io.agentmesh.orchestrator.Orchestrator} owns the registry, dispatch and retries.</li>
 *   <li>{@code io.agentmesh.agent.AgentRuntime} hosts one agent and its message loop.</li>
 * </ul>
 */
package io.agentmesh;
