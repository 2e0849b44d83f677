/**
 * REST API controllers for HTTP endpoints.
 *
 * <p>Endpoints:
 * <ul>
 *   <li>{@link com.phillippitts.peercall.presentation.controller.CallController}
 *       - Call control and missed-call counters under {@code /api/calls}</li>
 *   <li>{@link com.phillippitts.peercall.presentation.controller.ContinuityController}
 *       - Picture-in-picture controls under {@code /api/pip}</li>
 *   <li>{@link com.phillippitts.peercall.presentation.controller.IdentityController}
 *       - Identity attach and trust state under {@code /api/identity}</li>
 * </ul>
 *
 * <p>Controllers delegate to the call layer and let {@code GlobalExceptionHandler} map
 * failures to HTTP status codes.
 *
 * @see com.phillippitts.peercall.presentation.exception.GlobalExceptionHandler
 * @since 1.0
 */
package com.phillippitts.peercall.presentation.controller;
