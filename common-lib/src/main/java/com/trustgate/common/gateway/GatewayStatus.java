package com.trustgate.common.gateway;

/**
 * <ul>
 *   <li>{@link #EXECUTED}     : the skill ran; see {@code result.success()} for its own outcome</li>
 *   <li>{@link #DENIED}       : the permission check failed; the skill did not run</li>
 *   <li>{@link #UNKNOWN_SKILL}: nothing is registered under the requested name</li>
 * </ul>
 */
public enum GatewayStatus {
    EXECUTED,
    DENIED,
    UNKNOWN_SKILL
}
