package io.arrestx.extractor.engine;

/**
 * States of the extraction state machine.
 */
public enum ParserState {
    SEEK_NAME,
    CAPTURE_ADDRESS,
    SEEK_ID_DATE,
    CAPTURE_CHARGES
}
