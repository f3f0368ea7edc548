/**
 * Torotator source tree root.
 *
 * <p>Primary entry points while reading code:
 *
 * <ul>
 *   <li>{@code io.torotator.Main} bootstraps the CLI process.</li>
 *   <li>{@code io.torotator.cli.TorotatorCommand} maps commands to the pool.</li>
 *   <li>{@code io.torotator.pool.RotationScheduler} starts, watches and retires Tor/Privoxy pairs.</li>
 *   <li>{@code io.torotator.haproxy.ReverseProxyController} keeps HAProxy in line with the live backends.</li>
 * </ul>
 */
package io.torotator;
