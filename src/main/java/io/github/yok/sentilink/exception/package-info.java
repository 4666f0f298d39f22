/**
 * Exception hierarchy of SentiLink.
 *
 * <p>
 * All exceptions are unchecked and extend
 * {@link io.github.yok.sentilink.exception.SentiLinkException}, which exposes an {@link io.github.yok.sentilink.exception.ErrorKind}.
 * </p>
 */
package io.github.yok.sentilink.exception;
