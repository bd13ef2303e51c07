package com.bastion.security;

/**
 * Who triggered a request: the user id supplied by upstream authentication
 * and the client IP. Both are null for actions the system performs itself.
 */
public final class RequestIdentity {

    public static final RequestIdentity SYSTEM = new RequestIdentity(null, null);

    private final Long userId;
    private final String ipAddress;

    public RequestIdentity(Long userId, String ipAddress) {
        this.userId = userId;
        this.ipAddress = ipAddress;
    }

    public Long getUserId() {
        return userId;
    }

    public String getIpAddress() {
        return ipAddress;
    }

    public boolean isAuthenticated() {
        return userId != null;
    }

    /**
     * @throws MissingIdentityException if no user id was supplied with the request
     */
    public Long requireUserId() {
        if (userId == null) {
            throw new MissingIdentityException();
        }
        return userId;
    }

    @Override
    public String toString() {
        return "RequestIdentity{userId=" + userId + ", ip=" + ipAddress + "}";
    }
}
