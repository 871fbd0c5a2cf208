/**
 * Per-agent execution.
 *
 * <p>{@link io.agentmesh.runtime.AgentRuntime} owns the inbox poll loop, the heartbeat
 * schedule and the {@link io.agentmesh.runtime.AgentDescriptor} counters. Nothing outside
 * this package mutates a descriptor.
 */
package io.agentmesh.runtime;
