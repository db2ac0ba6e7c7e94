package com.dcruver.anchorwatch.nlp;

/**
 * The vector store could not be reached. Callers abort the current batch and leave
 * the work for the next run.
 */
public class VectorStoreUnavailableException extends RuntimeException {

    public VectorStoreUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }
}
