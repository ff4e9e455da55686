package io.arrestx.extractor.strategy;

/**
 * Runtime exception used to report that an extraction strategy could not process a document.
 */
public class ExtractionException extends RuntimeException {

    public ExtractionException(String message) {
        super(message);
    }

    public ExtractionException(String message, Throwable cause) {
        super(message, cause);
    }
}
