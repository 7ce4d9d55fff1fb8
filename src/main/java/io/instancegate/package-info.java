/**
 * InstanceGate source tree root.
 *
 * <p>Primary entry points while reading code:
 *
 * <ul>
 *   <li>{@code io.instancegate.Main} bootstraps the CLI process.</li>
 *   <li>{@code io.instancegate.cli.InstanceGateCommand} maps commands to runtime APIs.</li>
 *   <li>{@code io.instancegate.runtime.InstanceGateRuntime} serializes lifecycle transitions per instance.</li>
 *   <li>{@code io.instancegate.runtime.LifecycleStateMachine} holds the transition rules.</li>
 *   <li>{@code io.instancegate.storage.LifecycleStore} is the authoritative persistence layer.</li>
 * </ul>
 */
package io.instancegate;
