package com.symmetryvaults.core.exception;

/**
 * Base class for errors in a level generation request.
 *
 * <p>Specification errors are reported immediately and abort the single
 * generation request that caused them. No partial output is written.
 *
 * @see UnknownGraphFamilyException
 * @see UnknownGroupFamilyException
 * @see InvalidSizeException
 * @see GraphTooLargeException
 * @see GroupTooLargeException
 * @see GroupGraphMismatchException
 */
public class LevelSpecificationException extends RuntimeException {

    public LevelSpecificationException(String message) {
        super(message);
    }

    public LevelSpecificationException(String message, Throwable cause) {
        super(message, cause);
    }
}
