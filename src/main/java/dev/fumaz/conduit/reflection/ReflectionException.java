package dev.fumaz.conduit.reflection;

import dev.fumaz.conduit.exception.ConfigurationException;

public class ReflectionException extends ConfigurationException {

    public ReflectionException(String message) {
        super(message);
    }

    public ReflectionException(String message, Throwable cause) {
        super(message, cause);
    }

}
