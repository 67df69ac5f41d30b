package io.github.riemr.pto.application.exception;

import java.util.NoSuchElementException;

public class ResourceNotFoundException extends NoSuchElementException {
    public ResourceNotFoundException(String what, Object id) {
        super(what + " not found: " + id);
    }
}
