package com.kpAnalyzer.financeEngine.extraction.exception;

/**
 * Exception thrown when the extraction engine receives input that is not document text.
 */
public class InvalidInputException extends RuntimeException {
    
    public InvalidInputException(String message) {
        super(message);
    }
}
