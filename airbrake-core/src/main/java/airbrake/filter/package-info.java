/**
 * Notice filter stages: the {@link airbrake.filter.FilterChain} and the key redaction filters
 * registered from configuration.
 */
package airbrake.filter;
