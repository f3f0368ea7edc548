/**
 * Pool orchestration package.
 *
 * <p>{@link io.torotator.pool.ProxyPool} wires port leasing, the backend registry, the HAProxy
 * controller and the {@link io.torotator.pool.RotationScheduler}, which bounds live pairs with an
 * {@link io.torotator.pool.AdmissionGate} and stops on a {@link io.torotator.pool.ShutdownSignal}.
 */
package io.torotator.pool;
