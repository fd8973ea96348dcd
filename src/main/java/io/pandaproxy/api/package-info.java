/**
 * Command-line entry points.
 * <p>{@link io.pandaproxy.api.Main} dispatches to {@code run} and {@code detect}; each command
 * accepts {@code key=value} settings plus {@code --help}, {@code --verbose} and, for {@code run},
 * {@code --dry-run}. Exit codes are listed in {@link io.pandaproxy.api.ExitCode}.</p>
 *
 * @since 0.1.0
 */
package io.pandaproxy.api;
