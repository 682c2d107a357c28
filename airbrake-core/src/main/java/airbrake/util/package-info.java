/**
 * Internal helpers: JSON encoding and payload truncation.
 */
package airbrake.util;
