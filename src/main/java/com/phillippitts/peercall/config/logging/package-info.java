/**
 * Logging infrastructure: request-scoped ThreadContext population for REST calls.
 */
package com.phillippitts.peercall.config.logging;
