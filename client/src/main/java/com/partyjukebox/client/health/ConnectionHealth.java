/*
 * Copyright © 2025-2030, All Rights Reserved
 * Ashutosh Sinha | Email: ajsinha@gmail.com
 * Proprietary and confidential.
 */
package com.partyjukebox.client.health;

/** Coarse health of the realtime connection, ordered from best to worst. */
public enum ConnectionHealth {
    HEALTHY,
    DEGRADED,
    UNHEALTHY
}
