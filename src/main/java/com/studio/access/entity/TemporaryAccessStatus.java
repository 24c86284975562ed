package com.studio.access.entity;

/**
 * Lifecycle states for a {@link TemporaryAccess} grant.
 *
 * <ul>
 *   <li>{@link #ACTIVE}   : the grant can still be used once</li>
 *   <li>{@link #EXPIRED}  : the grant was consumed at the door</li>
 *   <li>{@link #CANCELLED}: the holder or an admin revoked it before use</li>
 * </ul>
 */
public enum TemporaryAccessStatus {
    ACTIVE,
    EXPIRED,
    CANCELLED
}
