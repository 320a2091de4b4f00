/*
 * Copyright Debezium Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package io.pgmirror.connector.postgresql.connection;

import java.util.Objects;

import io.pgmirror.annotation.Immutable;

/**
 * The replica identity setting of a table, that is, which old column values the server logs for updates and deletes.
 */
@Immutable
public final class ReplicaIdentityInfo {

    public enum ReplicaIdentity {
        NOTHING('n', "UPDATE and DELETE events will not contain any old values"),
        FULL('f', "UPDATE and DELETE events will contain the previous values of all the columns"),
        DEFAULT('d', "UPDATE and DELETE events will contain previous values only for PK columns"),
        INDEX('i', "UPDATE and DELETE events will contain previous values only for columns present in the REPLICA IDENTITY index");

        private final char code;
        private final String description;

        ReplicaIdentity(char code, String description) {
            this.code = code;
            this.description = description;
        }

        public char code() {
            return code;
        }

        public String description() {
            return description;
        }

        /**
         * Map the {@code relreplident} catalog value, which is also what the relation message carries.
         *
         * @param code the single character code
         * @return the replica identity; never null
         * @throws IllegalArgumentException for an unknown code
         */
        public static ReplicaIdentity parse(char code) {
            for (ReplicaIdentity identity : values()) {
                if (identity.code == code) {
                    return identity;
                }
            }
            throw new IllegalArgumentException("Unknown replica identity '" + code + "'");
        }
    }

    private final ReplicaIdentity replicaIdentity;
    private final String indexName;

    public ReplicaIdentityInfo(ReplicaIdentity replicaIdentity) {
        this(replicaIdentity, null);
    }

    public ReplicaIdentityInfo(ReplicaIdentity replicaIdentity, String indexName) {
        this.replicaIdentity = Objects.requireNonNull(replicaIdentity);
        this.indexName = replicaIdentity == ReplicaIdentity.INDEX ? indexName : null;
    }

    public ReplicaIdentity getReplicaIdentity() {
        return replicaIdentity;
    }

    /**
     * @return the name of the index used as identity, or null unless the identity is {@link ReplicaIdentity#INDEX}
     */
    public String getIndexName() {
        return indexName;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof ReplicaIdentityInfo)) {
            return false;
        }
        ReplicaIdentityInfo that = (ReplicaIdentityInfo) o;
        return replicaIdentity == that.replicaIdentity && Objects.equals(indexName, that.indexName);
    }

    @Override
    public int hashCode() {
        return Objects.hash(replicaIdentity, indexName);
    }

    @Override
    public String toString() {
        return indexName == null ? replicaIdentity.name() : "USING INDEX " + indexName;
    }
}
