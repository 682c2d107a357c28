/**
 * Spring Boot auto-configuration for the Airbrake notifier.
 */
package airbrake.spring.boot;
