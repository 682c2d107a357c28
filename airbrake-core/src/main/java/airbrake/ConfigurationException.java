package airbrake;

/**
 * Thrown when a {@link Notifier} is created from an {@link AirbrakeConfig} that fails
 * validation. The message is {@link AirbrakeConfig#validationErrorMessage()}.
 */
public class ConfigurationException extends RuntimeException {

    public ConfigurationException(String message) {
        super(message);
    }
}
