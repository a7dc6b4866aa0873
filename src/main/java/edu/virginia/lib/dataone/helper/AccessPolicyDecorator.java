package edu.virginia.lib.dataone.helper;

/**
 * The adjustments applied to every descriptor before it is sent to the node.
 */
public interface AccessPolicyDecorator {

    SystemMetadata applyAccessRules(SystemMetadata sysmeta);

    SystemMetadata clearReplicationPolicy(SystemMetadata sysmeta);
}
