package io.arrestx.extractor.output;

/**
 * Runtime exception used to propagate failures while writing extracted records.
 */
public class OutputException extends RuntimeException {

    public OutputException(String message, Throwable cause) {
        super(message, cause);
    }
}
