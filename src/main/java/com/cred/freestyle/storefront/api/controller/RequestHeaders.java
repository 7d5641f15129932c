package com.cred.freestyle.storefront.api.controller;

/**
 * Identity headers set by the chat front end. There is no authentication layer; the
 * adapter trusts these values.
 *
 * @author Storefront Team
 */
public final class RequestHeaders {

    public static final String USER_ID = "X-User-Id";
    public static final String STAFF_ID = "X-Staff-Id";

    private RequestHeaders() {
    }
}
