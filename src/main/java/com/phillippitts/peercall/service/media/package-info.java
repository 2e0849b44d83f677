/**
 * Seams to the host's media stack: capture, transport factory and the opaque negotiation
 * types. Nothing in this package interprets SDP or ICE content.
 */
package com.phillippitts.peercall.service.media;
