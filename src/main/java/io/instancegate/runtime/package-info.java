/**
 * Request handling package.
 *
 * <p>{@link io.instancegate.runtime.InstanceGateRuntime} owns per-instance serialization,
 * storage retry and auditing; {@link io.instancegate.runtime.LifecycleStateMachine} decides
 * each transition; {@link io.instancegate.runtime.HttpGateway} maps results onto HTTP.
 */
package io.instancegate.runtime;
