package com.controlplane.core.model;

/**
 * Cloud providers a cluster can live on.
 */
public enum CloudProvider {
    AWS,
    DIGITALOCEAN,
    GCE,
    OPENSTACK,
    PACKET
}
