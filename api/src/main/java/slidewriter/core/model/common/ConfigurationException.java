package slidewriter.core.model.common;

/**
 * Required configuration is missing or invalid.
 */
public final class ConfigurationException extends SlideWriterException {

    public ConfigurationException(String message) {
        super(ErrorCode.CONFIGURATION_ERROR, message);
    }
}
