package edu.virginia.lib.dataone.helper;

public class ReplicationPolicy {

    private boolean replicationAllowed;

    private int numberReplicas;

    public ReplicationPolicy(boolean replicationAllowed, int numberReplicas) {
        this.replicationAllowed = replicationAllowed;
        this.numberReplicas = numberReplicas;
    }

    public boolean isReplicationAllowed() {
        return replicationAllowed;
    }

    public int getNumberReplicas() {
        return numberReplicas;
    }

    @Override
    public boolean equals(Object o) {
        if (!(o instanceof ReplicationPolicy)) {
            return false;
        }
        ReplicationPolicy other = (ReplicationPolicy) o;
        return replicationAllowed == other.replicationAllowed && numberReplicas == other.numberReplicas;
    }

    @Override
    public int hashCode() {
        return (replicationAllowed ? 1 : 0) * 31 + numberReplicas;
    }
}
