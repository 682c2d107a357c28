/**
 * Airbrake error notifier.
 *
 * <p>{@link airbrake.Notifier} is the entry point: it builds {@link airbrake.Notice}s from
 * exceptions, refines them through a {@link airbrake.filter.FilterChain} and delivers them
 * with one of the senders in {@link airbrake.send}, reporting each outcome through a
 * {@link airbrake.Promise}.
 */
package airbrake;
