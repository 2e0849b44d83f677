package com.phillippitts.peercall.service.signaling;

import com.phillippitts.peercall.service.media.IceCandidate;
import com.phillippitts.peercall.service.media.SessionDescription;
import com.phillippitts.peercall.service.signaling.message.CallAccepted;
import com.phillippitts.peercall.service.signaling.message.CallBusy;
import com.phillippitts.peercall.service.signaling.message.CallCanceled;
import com.phillippitts.peercall.service.signaling.message.CallDeclined;
import com.phillippitts.peercall.service.signaling.message.CallEnd;
import com.phillippitts.peercall.service.signaling.message.CallIncoming;
import com.phillippitts.peercall.service.signaling.message.CallInitiateAck;
import com.phillippitts.peercall.service.signaling.message.CallInitiateRequest;
import com.phillippitts.peercall.service.signaling.message.CallRef;
import com.phillippitts.peercall.service.signaling.message.CallRoomFull;
import com.phillippitts.peercall.service.signaling.message.CallTimedOut;
import com.phillippitts.peercall.service.signaling.message.CameraToggle;
import com.phillippitts.peercall.service.signaling.message.DescriptionMessage;
import com.phillippitts.peercall.service.signaling.message.Empty;
import com.phillippitts.peercall.service.signaling.message.IceCandidateMessage;
import com.phillippitts.peercall.service.signaling.message.IdentityAck;
import com.phillippitts.peercall.service.signaling.message.IdentityAttachRequest;
import com.phillippitts.peercall.service.signaling.message.MatchFound;
import com.phillippitts.peercall.service.signaling.message.PipState;
import com.phillippitts.peercall.service.signaling.message.Reauth;
import org.json.JSONObject;

import static com.phillippitts.peercall.util.JsonSupport.optInteger;
import static com.phillippitts.peercall.util.JsonSupport.optObject;
import static com.phillippitts.peercall.util.JsonSupport.optString;

/**
 * The fixed set of relay events and their JSON shapes.
 *
 * <p>Outbound and inbound variants of the same wire name share one constant where the payload
 * shape is symmetric. {@code call:cancel} is asymmetric (outbound carries only callId) and has
 * two constants bound to the same name.
 */
public final class SignalingEvents {

    private SignalingEvents() {}

    // --- call control ---------------------------------------------------------------------

    public static final SignalingEvent<CallInitiateRequest> CALL_INITIATE_EVENT = SignalingEvent.of(
            "call:initiate",
            p -> new JSONObject().put("to", p.to()),
            j -> new CallInitiateRequest(optString(j, "to")));

    public static final SignalingRequest<CallInitiateRequest, CallInitiateAck> CALL_INITIATE =
            new SignalingRequest<>(CALL_INITIATE_EVENT,
                    j -> new CallInitiateAck(j.optBoolean("ok", false), optString(j, "callId"), optString(j, "error")));

    public static final SignalingEvent<CallRef> CALL_ACCEPT = callRef("call:accept");
    public static final SignalingEvent<CallRef> CALL_DECLINE = callRef("call:decline");
    public static final SignalingEvent<CallRef> CALL_CANCEL = callRef("call:cancel");

    public static final SignalingEvent<CallIncoming> CALL_INCOMING = SignalingEvent.of(
            "call:incoming",
            p -> new JSONObject().put("callId", p.callId()).put("from", p.from()).put("fromNick", p.fromNick()),
            j -> new CallIncoming(optString(j, "callId"), optString(j, "from"), optString(j, "fromNick")));

    public static final SignalingEvent<CallAccepted> CALL_ACCEPTED = SignalingEvent.of(
            "call:accepted",
            p -> new JSONObject().put("callId", p.callId()).put("from", p.from()).put("roomId", p.roomId()),
            j -> new CallAccepted(optString(j, "callId"), optString(j, "from"), optString(j, "roomId")));

    public static final SignalingEvent<CallDeclined> CALL_DECLINED = SignalingEvent.of(
            "call:declined",
            p -> new JSONObject().put("callId", p.callId()).put("from", p.from()),
            j -> new CallDeclined(optString(j, "callId"), optString(j, "from")));

    public static final SignalingEvent<CallTimedOut> CALL_TIMEOUT = SignalingEvent.of(
            "call:timeout",
            p -> new JSONObject().put("callId", p.callId()),
            j -> new CallTimedOut(optString(j, "callId")));

    public static final SignalingEvent<CallCanceled> CALL_CANCELED = SignalingEvent.of(
            "call:cancel",
            p -> new JSONObject().put("callId", p.callId()).put("from", p.from()),
            j -> new CallCanceled(optString(j, "callId"), optString(j, "from")));

    public static final SignalingEvent<CallBusy> CALL_BUSY = SignalingEvent.of(
            "call:busy",
            p -> new JSONObject().put("from", p.from()),
            j -> new CallBusy(optString(j, "from")));

    public static final SignalingEvent<CallRoomFull> CALL_ROOM_FULL = SignalingEvent.of(
            "call:room_full",
            p -> new JSONObject().put("userId", p.userId()),
            j -> new CallRoomFull(optString(j, "userId")));

    public static final SignalingEvent<CallEnd> CALL_END = callEnd("call:end");
    public static final SignalingEvent<CallEnd> CALL_ENDED = callEnd("call:ended");

    // --- negotiation ----------------------------------------------------------------------

    public static final SignalingEvent<DescriptionMessage> OFFER = description("offer");
    public static final SignalingEvent<DescriptionMessage> ANSWER = description("answer");

    public static final SignalingEvent<IceCandidateMessage> ICE_CANDIDATE = SignalingEvent.of(
            "ice-candidate",
            p -> new JSONObject().put("to", p.to()).put("from", p.from())
                    .put("candidate", encodeCandidate(p.candidate())),
            j -> new IceCandidateMessage(optString(j, "to"), optString(j, "from"),
                    decodeCandidate(optObject(j, "candidate"))));

    public static final SignalingEvent<CameraToggle> CAM_TOGGLE = SignalingEvent.of(
            "cam-toggle",
            p -> new JSONObject().put("roomId", p.roomId()).put("enabled", p.enabled())
                    .put("to", p.to()).put("from", p.from()),
            j -> new CameraToggle(optString(j, "roomId"), j.optBoolean("enabled", true),
                    optString(j, "to"), optString(j, "from")));

    public static final SignalingEvent<PipState> PIP_STATE = SignalingEvent.of(
            "pip:state",
            p -> new JSONObject().put("inPiP", p.inPiP()).put("roomId", p.roomId())
                    .put("to", p.to()).put("from", p.from()),
            j -> new PipState(j.optBoolean("inPiP", false), optString(j, "roomId"),
                    optString(j, "to"), optString(j, "from")));

    // --- identity -------------------------------------------------------------------------

    public static final SignalingRequest<IdentityAttachRequest, IdentityAck> IDENTITY_ATTACH =
            new SignalingRequest<>(SignalingEvent.of(
                    "identity:attach",
                    p -> new JSONObject().put("installId", p.installId())
                            .put("profile", new JSONObject().put("nick", p.nick()).put("avatarUrl", p.avatarUrl())),
                    j -> {
                        JSONObject profile = optObject(j, "profile");
                        return new IdentityAttachRequest(optString(j, "installId"),
                                optString(profile, "nick"), optString(profile, "avatarUrl"));
                    }),
                    SignalingEvents::decodeIdentityAck);

    public static final SignalingRequest<Reauth, IdentityAck> REAUTH =
            new SignalingRequest<>(SignalingEvent.of(
                    "reauth",
                    p -> new JSONObject().put("userId", p.userId()),
                    j -> new Reauth(optString(j, "userId"))),
                    SignalingEvents::decodeIdentityAck);

    // --- matchmaking ----------------------------------------------------------------------

    public static final SignalingEvent<Empty> MATCH_START = empty("start");
    public static final SignalingEvent<Empty> MATCH_NEXT = empty("next");
    public static final SignalingEvent<Empty> MATCH_STOP = empty("stop");
    public static final SignalingEvent<Empty> PEER_LEFT = empty("peer:left");
    public static final SignalingEvent<Empty> PEER_STOPPED = empty("peer:stopped");

    public static final SignalingEvent<MatchFound> MATCH_FOUND = SignalingEvent.of(
            "match_found",
            p -> new JSONObject().put("roomId", p.roomId()).put("id", p.partnerConnectionId())
                    .put("userId", p.partnerUserId()),
            j -> new MatchFound(optString(j, "roomId"), optString(j, "id"), optString(j, "userId")));

    // --- helpers --------------------------------------------------------------------------

    private static SignalingEvent<CallRef> callRef(String name) {
        return SignalingEvent.of(name,
                p -> new JSONObject().put("callId", p.callId()),
                j -> new CallRef(optString(j, "callId")));
    }

    private static SignalingEvent<CallEnd> callEnd(String name) {
        return SignalingEvent.of(name,
                p -> new JSONObject().put("callId", p.callId()).put("roomId", p.roomId()),
                j -> new CallEnd(optString(j, "callId"), optString(j, "roomId")));
    }

    private static SignalingEvent<DescriptionMessage> description(String name) {
        return SignalingEvent.of(name,
                p -> new JSONObject().put("to", p.to()).put("from", p.from())
                        .put(name, new JSONObject()
                                .put("type", p.description().type())
                                .put("sdp", p.description().sdp())),
                j -> {
                    JSONObject d = optObject(j, name);
                    SessionDescription description = d == null ? null
                            : new SessionDescription(
                                    optString(d, "type") == null ? name : optString(d, "type"),
                                    optString(d, "sdp") == null ? "" : optString(d, "sdp"));
                    return new DescriptionMessage(optString(j, "to"), optString(j, "from"), description);
                });
    }

    private static SignalingEvent<Empty> empty(String name) {
        return SignalingEvent.of(name, p -> new JSONObject(), j -> Empty.INSTANCE);
    }

    private static JSONObject encodeCandidate(IceCandidate c) {
        if (c == null) {
            return null;
        }
        return new JSONObject()
                .put("candidate", c.candidate())
                .put("sdpMid", c.sdpMid())
                .put("sdpMLineIndex", c.sdpMLineIndex());
    }

    private static IceCandidate decodeCandidate(JSONObject j) {
        if (j == null || optString(j, "candidate") == null) {
            return null;
        }
        return new IceCandidate(optString(j, "candidate"), optString(j, "sdpMid"), optInteger(j, "sdpMLineIndex"));
    }

    private static IdentityAck decodeIdentityAck(JSONObject j) {
        return new IdentityAck(j.optBoolean("ok", false), optString(j, "userId"), optString(j, "error"));
    }
}
