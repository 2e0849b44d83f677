/**
 * Global exception handling for REST API responses.
 *
 * <p>Exception Mapping:
 * <ul>
 *   <li>OFFLINE, ACK_TIMEOUT → 503 Service Unavailable (retry)</li>
 *   <li>NOT_AUTHENTICATED → 401 Unauthorized</li>
 *   <li>ROOM_FULL, INVALID_STATE → 409 Conflict</li>
 *   <li>CALL_INITIATE_FAILED → 502 Bad Gateway</li>
 *   <li>Bean validation failures → 400 Bad Request</li>
 *   <li>{@code Exception} (catch-all) → 500 Internal Server Error</li>
 * </ul>
 *
 * <p>Response Format:
 * <pre>
 * {
 *   "errorCode": "ROOM_FULL",
 *   "message": "Call request refused",
 *   "details": "busy",
 *   "timestamp": "2025-10-17T15:42:32.529Z"
 * }
 * </pre>
 *
 * @see com.phillippitts.peercall.exception
 * @since 1.0
 */
package com.phillippitts.peercall.presentation.exception;
