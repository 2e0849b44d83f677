package com.phillippitts.peercall.service.media;

/**
 * Host-provided factory for {@link MediaTransport} instances.
 */
@FunctionalInterface
public interface MediaTransportFactory {

    /**
     * @param partnerId remote party the transport will connect to
     * @return a new, unconnected transport
     */
    MediaTransport create(String partnerId);
}
