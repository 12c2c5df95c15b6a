package com.example.reviewsearch.error;

/**
 * A single review container could not be read. Callers skip the container and keep going.
 */
public class MalformedElementException extends RuntimeException {

    private final int containerIndex;

    public MalformedElementException(int containerIndex, Throwable cause) {
        super("review container #" + containerIndex + " could not be parsed: " + cause.getMessage(), cause);
        this.containerIndex = containerIndex;
    }

    public int getContainerIndex() { return containerIndex; }
}
