package com.questrail.voice.registry;

/**
 * Two sources contributed the same command pattern, or conflicting
 * definitions of the same rule name.
 *
 * <p>Raised while assembling registries, before any connection is accepted.</p>
 */
public final class DuplicateDefinitionException extends RuntimeException
{
    public DuplicateDefinitionException(String message) {
        super(message);
    }
}
