package edu.virginia.lib.dataone.helper;

import java.util.ArrayList;
import java.util.List;

/**
 * Applies the access rules and replication setting from the {@link Environment}.
 */
public class ConfiguredAccessPolicy implements AccessPolicyDecorator {

    private List<AccessRule> rules;

    private boolean clearReplication;

    public ConfiguredAccessPolicy(Environment env) {
        this(env.getAccessRules(), env.isClearReplicationPolicy());
    }

    public ConfiguredAccessPolicy(List<AccessRule> rules, boolean clearReplication) {
        this.rules = new ArrayList<AccessRule>(rules);
        this.clearReplication = clearReplication;
    }

    @Override
    public SystemMetadata applyAccessRules(SystemMetadata sysmeta) {
        return sysmeta.withAccessRules(rules);
    }

    /**
     * Drops the replication policy unless clearing has been switched off in the
     * configuration, in which case the descriptor is returned as is.
     */
    @Override
    public SystemMetadata clearReplicationPolicy(SystemMetadata sysmeta) {
        if (clearReplication) {
            return sysmeta.withoutReplicationPolicy();
        }
        return sysmeta;
    }
}
