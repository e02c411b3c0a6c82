/**
 * Process assembly.
 *
 * <p>{@link io.agentmesh.runtime.AgentMeshNode} builds one node from
 * {@link io.agentmesh.config.MeshSettings}: the broker transport, a bus client
 * per participant, the memory manager, the orchestrator and the configured
 * agent runtimes.
 */
package io.agentmesh.runtime;
