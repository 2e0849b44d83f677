package com.phillippitts.peercall.service.session;

import com.phillippitts.peercall.service.signaling.message.DescriptionMessage;
import com.phillippitts.peercall.service.signaling.message.IceCandidateMessage;

/**
 * Receiver of the shared {@code offer}/{@code answer}/{@code ice-candidate} events while it holds
 * {@link SignalingOwnership}.
 */
public interface NegotiationHandler {

    void onOffer(DescriptionMessage message);

    void onAnswer(DescriptionMessage message);

    void onIceCandidate(IceCandidateMessage message);
}
