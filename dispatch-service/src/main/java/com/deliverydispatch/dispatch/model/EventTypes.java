package com.deliverydispatch.dispatch.model;

/**
 * Wire names of the events exchanged over the dispatch socket.
 */
public final class EventTypes {

    private EventTypes() {}

    // inbound
    public static final String AUTHENTICATE        = "authenticate";
    public static final String LOCATION_UPDATE     = "location_update";
    public static final String ASSIGNMENT_REQUEST  = "assignment_request";
    public static final String ACCEPT              = "accept";
    public static final String DECLINE             = "decline";
    public static final String NEXT_REQUEST        = "next_request";
    public static final String HEARTBEAT           = "heartbeat";
    public static final String PONG                = "pong";

    // outbound
    public static final String CONNECTED            = "connected";
    public static final String AUTHENTICATED        = "authenticated";
    public static final String AUTH_ERROR           = "auth_error";
    public static final String ASSIGNMENT_RESULT    = "assignment_result";
    public static final String ASSIGNMENT_UPDATE    = "assignment_update";
    public static final String PRESENCE_UPDATE      = "presence_update";
    public static final String NO_PENDING_REQUEST   = "no_pending_request";
    public static final String QUEUED_MESSAGE_FLUSH = "queued_message_flush";
    public static final String HEARTBEAT_ACK        = "heartbeat_ack";
    public static final String PING                 = "ping";
    public static final String ERROR                = "error";
}
