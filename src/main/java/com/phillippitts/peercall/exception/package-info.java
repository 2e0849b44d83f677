/**
 * Application-specific exception hierarchy.
 *
 * <p>Exception Hierarchy:
 * <ul>
 *   <li>{@link com.phillippitts.peercall.exception.PeerCallException} - Base exception carrying an
 *       {@link com.phillippitts.peercall.exception.ErrorKind}</li>
 *   <li>{@link com.phillippitts.peercall.exception.SignalingException} - Channel offline or
 *       acknowledgement retries exhausted</li>
 *   <li>{@link com.phillippitts.peercall.exception.CallControlException} - Call intent refused
 *       (not authenticated, initiate failed, room full, invalid state)</li>
 * </ul>
 *
 * <p>All exceptions are unchecked and map to HTTP status codes via {@code GlobalExceptionHandler}.
 *
 * @see com.phillippitts.peercall.presentation.exception.GlobalExceptionHandler
 * @since 1.0
 */
package com.phillippitts.peercall.exception;
