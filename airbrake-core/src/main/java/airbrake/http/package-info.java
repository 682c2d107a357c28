/**
 * Default HTTP transport based on {@code java.net.http}.
 */
package airbrake.http;
